package tech.noetzold.waf_api.ratelimit;

import lombok.Getter;

@Getter
public class RateLimitExceededException extends RuntimeException {

    private final String bucket;
    private final long retryAfterSeconds;

    public RateLimitExceededException(String bucket, long retryAfterSeconds) {
        super("Rate limit exceeded for " + bucket);
        this.bucket = bucket;
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
