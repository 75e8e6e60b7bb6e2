package com.khaounen.edgeguard.security.ratelimit;

import java.time.Instant;

public class CompositeRateLimiter implements RateLimiter {

    private final SlidingWindowRateLimiter window;
    private final TokenBucketRateLimiter bucket;

    public CompositeRateLimiter(SlidingWindowRateLimiter window, TokenBucketRateLimiter bucket) {
        this.window = window;
        this.bucket = bucket;
    }

    @Override
    public RateLimitDecision check(String address, Instant now) {
        RateLimitDecision windowDecision = window.registerAndCheck(address, now);
        if (!windowDecision.allowed()) {
            return windowDecision;
        }
        return bucket.tryConsume(address, now);
    }
}
