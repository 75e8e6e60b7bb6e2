package com.khaounen.edgeguard.security.ratelimit;

import com.khaounen.edgeguard.store.CaffeineAddressStateStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SlidingWindowRateLimiterTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void deniesOnceTheWindowHoldsMoreThanTheLimit() {
        SlidingWindowRateLimiter limiter = limiter(10, 12);

        for (int i = 0; i < 12; i++) {
            assertTrue(limiter.registerAndCheck("10.0.0.1", T0).allowed(), "request " + (i + 1));
        }
        RateLimitDecision denied = limiter.registerAndCheck("10.0.0.1", T0);

        assertFalse(denied.allowed());
        assertEquals(10, denied.retryAfterSeconds());
    }

    @Test
    void retryHintIsTheTimeUntilTheOldestRequestLeaves() {
        SlidingWindowRateLimiter limiter = limiter(10, 2);
        limiter.registerAndCheck("10.0.0.1", T0);
        limiter.registerAndCheck("10.0.0.1", T0.plusSeconds(1));

        RateLimitDecision denied = limiter.registerAndCheck("10.0.0.1", T0.plusSeconds(5));

        assertFalse(denied.allowed());
        assertEquals(5, denied.retryAfterSeconds());
    }

    @Test
    void deniedRequestsKeepCountingUntilTheClientBacksOff() {
        SlidingWindowRateLimiter limiter = limiter(10, 2);
        limiter.registerAndCheck("10.0.0.1", T0);
        limiter.registerAndCheck("10.0.0.1", T0);
        assertFalse(limiter.registerAndCheck("10.0.0.1", T0.plusSeconds(6)).allowed());
        assertFalse(limiter.registerAndCheck("10.0.0.1", T0.plusSeconds(7)).allowed());

        // the t0 requests have left, the two denials have not
        assertFalse(limiter.registerAndCheck("10.0.0.1", T0.plusSeconds(11)).allowed());
        assertEquals(3, limiter.count("10.0.0.1"));

        assertTrue(limiter.registerAndCheck("10.0.0.1", T0.plusSeconds(22)).allowed());
        assertEquals(1, limiter.count("10.0.0.1"));
    }

    @Test
    void requestsOlderThanTheWindowAreForgotten() {
        SlidingWindowRateLimiter limiter = limiter(10, 3);
        for (int i = 0; i < 3; i++) {
            limiter.registerAndCheck("10.0.0.1", T0);
        }

        assertTrue(limiter.registerAndCheck("10.0.0.1", T0.plus(Duration.ofMillis(10_001))).allowed());
        assertEquals(1, limiter.count("10.0.0.1"));
    }

    @Test
    void evictIdleDropsWindowsWithNoRecentRequest() {
        SlidingWindowRateLimiter limiter = limiter(10, 3);
        limiter.registerAndCheck("10.0.0.1", T0);
        limiter.registerAndCheck("10.0.0.2", T0.plusSeconds(100));

        assertEquals(1, limiter.evictIdle(T0.plusSeconds(60)));
        assertEquals(0, limiter.count("10.0.0.1"));
        assertEquals(1, limiter.count("10.0.0.2"));
    }

    private static SlidingWindowRateLimiter limiter(int windowSeconds, int maxRequests) {
        return new SlidingWindowRateLimiter(
                Duration.ofSeconds(windowSeconds),
                maxRequests,
                new CaffeineAddressStateStore<>("windows")
        );
    }
}
