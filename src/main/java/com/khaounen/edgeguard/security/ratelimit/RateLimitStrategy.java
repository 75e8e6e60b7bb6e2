package com.khaounen.edgeguard.security.ratelimit;

public enum RateLimitStrategy {
    TOKEN_BUCKET,
    SLIDING_WINDOW,
    BOTH
}
