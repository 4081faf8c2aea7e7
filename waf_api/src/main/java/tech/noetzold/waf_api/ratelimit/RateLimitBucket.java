package tech.noetzold.waf_api.ratelimit;

import java.time.Duration;

public record RateLimitBucket(String name, int maxRequests, Duration window) {

    public long retryAfterSeconds() {
        return window.toSeconds();
    }
}
