package tech.noetzold.waf_api.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory sliding window keyed by {@code bucket:identity}. Each bucket is independent,
 * so exhausting the agents bucket leaves classify calls untouched.
 */
@Slf4j
public class SlidingWindowRateLimiter {

    private final Map<String, RateLimitBucket> buckets;
    private final Clock clock;
    private static final int EVICTION_THRESHOLD = 10_000;

    private final Map<String, Deque<Instant>> hits = new HashMap<>();

    public SlidingWindowRateLimiter(Map<String, RateLimitBucket> buckets, Clock clock) {
        this.buckets = Map.copyOf(buckets);
        this.clock = clock;
    }

    public Optional<RateLimitBucket> bucket(String name) {
        return Optional.ofNullable(buckets.get(name));
    }

    /**
     * Records a hit or rejects it.
     *
     * @throws RateLimitExceededException when the caller already used the whole window
     * @throws IllegalArgumentException   for an unknown bucket name
     */
    public void acquire(String bucketName, String identity) {
        RateLimitBucket bucket = bucket(bucketName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown rate limit bucket: " + bucketName));
        if (!tryAcquire(bucket, identity)) {
            log.warn("Rate limited {} on bucket {}", identity, bucketName);
            throw new RateLimitExceededException(bucketName, bucket.retryAfterSeconds());
        }
    }

    synchronized boolean tryAcquire(RateLimitBucket bucket, String identity) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(bucket.window());
        String key = bucket.name() + ":" + identity;
        if (hits.size() > EVICTION_THRESHOLD) {
            evictIdle(now);
        }

        Deque<Instant> times = hits.computeIfAbsent(key, k -> new ArrayDeque<>());
        while (!times.isEmpty() && !times.peekFirst().isAfter(cutoff)) {
            times.pollFirst();
        }

        if (times.size() >= bucket.maxRequests()) {
            return false;
        }
        times.addLast(now);
        return true;
    }

    // keys whose whole history has aged out
    private void evictIdle(Instant now) {
        hits.entrySet().removeIf(e -> {
            String bucketName = e.getKey().substring(0, e.getKey().indexOf(':'));
            RateLimitBucket bucket = buckets.get(bucketName);
            Instant last = e.getValue().peekLast();
            return bucket == null || last == null || !last.isAfter(now.minus(bucket.window()));
        });
    }
}
