package com.khaounen.edgeguard.security.ratelimit;

import java.time.Instant;

public interface RateLimiter {

    RateLimitDecision check(String address, Instant now);
}
