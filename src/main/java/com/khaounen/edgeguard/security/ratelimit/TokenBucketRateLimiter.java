package com.khaounen.edgeguard.security.ratelimit;

import com.khaounen.edgeguard.store.AddressStateStore;
import com.khaounen.edgeguard.store.IdleEvictable;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;

@Slf4j
public class TokenBucketRateLimiter implements RateLimiter, IdleEvictable {

    private final double ratePerSecond;
    private final double burst;
    private final AddressStateStore<BucketState> buckets;

    public TokenBucketRateLimiter(double ratePerSecond, int burst, AddressStateStore<BucketState> buckets) {
        if (ratePerSecond <= 0) {
            throw new IllegalArgumentException("rate must be positive: " + ratePerSecond);
        }
        if (burst < 1) {
            throw new IllegalArgumentException("burst must be at least 1: " + burst);
        }
        this.ratePerSecond = ratePerSecond;
        this.burst = burst;
        this.buckets = buckets;
    }

    @Override
    public RateLimitDecision check(String address, Instant now) {
        return tryConsume(address, now);
    }

    public RateLimitDecision tryConsume(String address, Instant now) {
        boolean[] admitted = new boolean[1];
        BucketState state = buckets.update(address, (key, existing) -> {
            double tokens = existing == null ? burst : refill(key, existing, now);
            if (tokens >= 1) {
                admitted[0] = true;
                tokens -= 1;
            }
            return new BucketState(tokens, now);
        });
        if (admitted[0]) {
            return RateLimitDecision.allow();
        }
        long retryAfter = (long) Math.ceil((1 - state.tokens()) / ratePerSecond);
        return RateLimitDecision.deny(retryAfter);
    }

    public double tokens(String address) {
        BucketState state = buckets.get(address);
        return state == null ? burst : state.tokens();
    }

    @Override
    public int evictIdle(Instant cutoff) {
        int evicted = 0;
        for (String address : buckets.snapshot().keySet()) {
            // only full buckets go: a fresh bucket starts full, so nothing is lost
            if (buckets.removeIf(address, state -> state.lastRefill().isBefore(cutoff)
                    && refill(address, state, cutoff) >= burst)) {
                evicted++;
            }
        }
        return evicted;
    }

    private double refill(String address, BucketState state, Instant now) {
        double tokens = state.tokens();
        if (Double.isNaN(tokens) || tokens < 0 || tokens > burst) {
            log.warn("token bucket for {} held {} tokens, clamping to [0, {}]", address, tokens, burst);
            tokens = Double.isNaN(tokens) ? 0 : Math.max(0, Math.min(burst, tokens));
        }
        Duration elapsed = Duration.between(state.lastRefill(), now);
        if (elapsed.isNegative()) {
            return tokens;
        }
        double elapsedSeconds = elapsed.toNanos() / 1_000_000_000d;
        return Math.min(burst, tokens + elapsedSeconds * ratePerSecond);
    }

    public record BucketState(double tokens, Instant lastRefill) {
    }
}
