package com.khaounen.edgeguard.security.ratelimit;

import com.khaounen.edgeguard.store.AddressStateStore;
import com.khaounen.edgeguard.store.IdleEvictable;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Denied requests are recorded too, so a client that keeps hammering stays limited until it backs off.
 */
public class SlidingWindowRateLimiter implements RateLimiter, IdleEvictable {

    private final Duration window;
    private final int maxRequests;
    private final AddressStateStore<WindowState> windows;

    public SlidingWindowRateLimiter(Duration window, int maxRequests, AddressStateStore<WindowState> windows) {
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be at least 1: " + maxRequests);
        }
        this.window = window;
        this.maxRequests = maxRequests;
        this.windows = windows;
    }

    @Override
    public RateLimitDecision check(String address, Instant now) {
        return registerAndCheck(address, now);
    }

    public RateLimitDecision registerAndCheck(String address, Instant now) {
        int[] count = new int[1];
        Instant[] oldest = new Instant[1];
        windows.update(address, (key, existing) -> {
            WindowState state = existing == null ? new WindowState() : existing;
            state.record(now, window);
            count[0] = state.size();
            oldest[0] = state.oldest();
            return state;
        });
        if (count[0] <= maxRequests) {
            return RateLimitDecision.allow();
        }
        Duration untilOldestLeaves = Duration.between(now, oldest[0].plus(window));
        long retryAfter = (long) Math.ceil(untilOldestLeaves.toMillis() / 1000d);
        return RateLimitDecision.deny(retryAfter);
    }

    public int count(String address) {
        WindowState state = windows.get(address);
        return state == null ? 0 : state.size();
    }

    @Override
    public int evictIdle(Instant cutoff) {
        // the sweep runs at or after cutoff, so anything older than cutoff - window has left the window
        Instant expired = cutoff.minus(window);
        int evicted = 0;
        for (String address : windows.snapshot().keySet()) {
            if (windows.removeIf(address, state -> state.isEmpty() || state.newest().isBefore(expired))) {
                evicted++;
            }
        }
        return evicted;
    }

    public static final class WindowState {
        private final Deque<Instant> timestamps = new ArrayDeque<>();

        void record(Instant now, Duration window) {
            timestamps.addLast(now);
            Instant horizon = now.minus(window);
            while (!timestamps.isEmpty() && timestamps.peekFirst().isBefore(horizon)) {
                timestamps.pollFirst();
            }
        }

        int size() {
            return timestamps.size();
        }

        boolean isEmpty() {
            return timestamps.isEmpty();
        }

        Instant oldest() {
            return timestamps.peekFirst();
        }

        Instant newest() {
            return timestamps.peekLast();
        }
    }
}
