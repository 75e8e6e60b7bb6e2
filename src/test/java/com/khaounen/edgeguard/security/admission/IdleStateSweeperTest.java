package com.khaounen.edgeguard.security.admission;

import com.khaounen.edgeguard.MutableClock;
import com.khaounen.edgeguard.security.exclusion.ExclusionEntry;
import com.khaounen.edgeguard.security.exclusion.ExclusionRegistry;
import com.khaounen.edgeguard.security.exclusion.ExclusionSource;
import com.khaounen.edgeguard.security.exclusion.ExclusionTier;
import com.khaounen.edgeguard.security.exclusion.InMemoryPacketFilterBackend;
import com.khaounen.edgeguard.security.exclusion.PacketFilterSynchronizer;
import com.khaounen.edgeguard.security.ratelimit.SlidingWindowRateLimiter;
import com.khaounen.edgeguard.store.CaffeineAddressStateStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdleStateSweeperTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final ExclusionRegistry registry = new ExclusionRegistry(
            new CaffeineAddressStateStore<>("exclusions"),
            new PacketFilterSynchronizer(new InMemoryPacketFilterBackend())
    );
    private final SlidingWindowRateLimiter window = new SlidingWindowRateLimiter(
            Duration.ofSeconds(10), 5, new CaffeineAddressStateStore<>("windows"));

    @Test
    void sweepReapsExpiredExclusionsAndIdleCounters() {
        MutableClock clock = new MutableClock(T0);
        registry.exclude(ExclusionEntry.temporary("10.0.0.1", T0, Duration.ofSeconds(30), ExclusionTier.SOFT,
                ExclusionSource.ESCALATION));
        window.registerAndCheck("10.0.0.2", T0);
        window.registerAndCheck("10.0.0.3", T0.plusSeconds(290));
        IdleStateSweeper sweeper = new IdleStateSweeper(registry, List.of(window), Duration.ofSeconds(60),
                Duration.ofSeconds(30), clock);

        clock.advance(Duration.ofSeconds(300));

        assertEquals(2, sweeper.sweep());
        assertEquals(0, registry.size());
        assertEquals(0, window.count("10.0.0.2"));
        assertEquals(1, window.count("10.0.0.3"));
    }

    @Test
    void idleTtlShorterThanTheWindowKeepsLiveWindows() {
        MutableClock clock = new MutableClock(T0);
        SlidingWindowRateLimiter strict = new SlidingWindowRateLimiter(
                Duration.ofSeconds(10), 12, new CaffeineAddressStateStore<>("windows"));
        for (int i = 0; i < 12; i++) {
            assertTrue(strict.registerAndCheck("10.0.0.2", T0).allowed());
        }
        IdleStateSweeper sweeper = new IdleStateSweeper(registry, List.of(strict), Duration.ofSeconds(5),
                Duration.ofSeconds(30), clock);

        clock.advance(Duration.ofSeconds(6));
        assertEquals(0, sweeper.sweep());

        int admitted = 0;
        for (int i = 0; i < 12; i++) {
            if (strict.registerAndCheck("10.0.0.2", clock.instant()).allowed()) {
                admitted++;
            }
        }
        assertEquals(0, admitted);

        clock.advance(Duration.ofSeconds(30));
        assertEquals(1, sweeper.sweep());
        assertEquals(0, strict.count("10.0.0.2"));
    }

    @Test
    void zeroIdleTtlKeepsCountersForever() {
        MutableClock clock = new MutableClock(T0);
        window.registerAndCheck("10.0.0.2", T0);
        IdleStateSweeper sweeper = new IdleStateSweeper(registry, List.of(window), Duration.ZERO,
                Duration.ofSeconds(30), clock);

        clock.advance(Duration.ofDays(1));

        assertEquals(0, sweeper.sweep());
        assertEquals(1, window.count("10.0.0.2"));
    }
}
