package com.khaounen.edgeguard.security.admission;

import com.khaounen.edgeguard.security.concurrency.ConcurrencyGate;
import com.khaounen.edgeguard.security.escalation.MitigationProfile;
import com.khaounen.edgeguard.security.escalation.ViolationEscalator;
import com.khaounen.edgeguard.security.exclusion.ExclusionEntry;
import com.khaounen.edgeguard.security.exclusion.ExclusionRegistry;
import com.khaounen.edgeguard.security.exclusion.ExclusionSource;
import com.khaounen.edgeguard.security.exclusion.ExclusionTier;
import com.khaounen.edgeguard.security.exclusion.InMemoryPacketFilterBackend;
import com.khaounen.edgeguard.security.exclusion.PacketFilterSynchronizer;
import com.khaounen.edgeguard.security.ratelimit.RateLimitDecision;
import com.khaounen.edgeguard.security.ratelimit.RateLimiter;
import com.khaounen.edgeguard.security.ratelimit.SlidingWindowRateLimiter;
import com.khaounen.edgeguard.security.ratelimit.TokenBucketRateLimiter;
import com.khaounen.edgeguard.store.CaffeineAddressStateStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdmissionEngineTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final EdgeGuardProperties properties = new EdgeGuardProperties();
    private final ExclusionRegistry registry = new ExclusionRegistry(
            new CaffeineAddressStateStore<>("exclusions"),
            new PacketFilterSynchronizer(new InMemoryPacketFilterBackend())
    );

    @Test
    void burstThenViolationsThenExclusion() {
        properties.getEscalation().setBanThreshold(5);
        TokenBucketRateLimiter bucket = new TokenBucketRateLimiter(5, 20, new CaffeineAddressStateStore<>("buckets"));
        ConcurrencyGate gate = gate(100, 1000);
        ViolationEscalator escalator = escalator();
        AdmissionEngine engine = new AdmissionEngine(registry, gate, bucket, escalator, properties);

        for (int i = 1; i <= 20; i++) {
            AdmissionDecision decision = engine.admit("10.0.0.1", "/", T0);
            assertTrue(decision.allowed(), "request " + i);
            decision.release();
        }
        for (int i = 21; i <= 24; i++) {
            AdmissionDecision decision = engine.admit("10.0.0.1", "/", T0);
            assertFalse(decision.allowed(), "request " + i);
            assertEquals(RejectReason.RATE_LIMITED, decision.reason());
            assertEquals(429, decision.status());
            assertEquals(1, decision.retryAfterSeconds());
        }
        assertEquals(4, escalator.violations("10.0.0.1"));

        AdmissionDecision fifthDenial = engine.admit("10.0.0.1", "/", T0);
        assertEquals(RejectReason.EXCLUDED, fifthDenial.reason());
        assertEquals(120, fifthDenial.retryAfterSeconds());

        // tokens are back by now, the exclusion still wins
        AdmissionDecision next = engine.admit("10.0.0.1", "/", T0.plusSeconds(10));
        assertFalse(next.allowed());
        assertEquals(RejectReason.EXCLUDED, next.reason());
        assertEquals(110, next.retryAfterSeconds());
        assertEquals(0, gate.globalActive());
    }

    @Test
    void concurrencyRejectionLeavesRateStateUntouched() {
        properties.getConcurrency().setPerAddressLimit(10);
        TokenBucketRateLimiter bucket = new TokenBucketRateLimiter(5, 20, new CaffeineAddressStateStore<>("buckets"));
        ConcurrencyGate gate = gate(10, 1000);
        ViolationEscalator escalator = escalator();
        AdmissionEngine engine = new AdmissionEngine(registry, gate, bucket, escalator, properties);

        List<AdmissionDecision> slow = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            AdmissionDecision decision = engine.admit("10.0.0.1", "/slow", T0);
            assertTrue(decision.allowed());
            slow.add(decision);
        }

        AdmissionDecision eleventh = engine.admit("10.0.0.1", "/slow", T0);

        assertFalse(eleventh.allowed());
        assertEquals(429, eleventh.status());
        assertEquals(RejectReason.ADDRESS_CONCURRENCY, eleventh.reason());
        assertEquals(10.0, bucket.tokens("10.0.0.1"));
        assertEquals(0, escalator.violations("10.0.0.1"));

        slow.get(0).release();
        assertTrue(engine.admit("10.0.0.1", "/slow", T0).allowed());
    }

    @Test
    void globalConcurrencyRejectionIsServiceUnavailable() {
        ConcurrencyGate gate = gate(5, 1);
        AdmissionEngine engine = new AdmissionEngine(registry, gate, allowAll(), escalator(), properties);

        assertTrue(engine.admit("10.0.0.1", "/", T0).allowed());
        AdmissionDecision decision = engine.admit("10.0.0.2", "/", T0);

        assertEquals(503, decision.status());
        assertEquals(RejectReason.GLOBAL_CONCURRENCY, decision.reason());
        assertFalse(decision.hasRetryHint());
    }

    @Test
    void rateRejectionGivesTheConcurrencySlotBack() {
        properties.getEscalation().setBanThreshold(100);
        ConcurrencyGate gate = gate(5, 10);
        RateLimiter denyAll = (address, now) -> RateLimitDecision.deny(3);
        AdmissionEngine engine = new AdmissionEngine(registry, gate, denyAll, escalator(), properties);

        for (int i = 0; i < 20; i++) {
            AdmissionDecision decision = engine.admit("10.0.0.1", "/", T0);
            assertEquals(RejectReason.RATE_LIMITED, decision.reason());
            assertEquals(3, decision.retryAfterSeconds());
        }

        assertEquals(0, gate.activeFor("10.0.0.1"));
        assertEquals(0, gate.globalActive());
    }

    @Test
    void temporaryExclusionHoldsUntilItsExpiry() {
        properties.getEscalation().setBanThreshold(1);
        properties.getEscalation().setBanSeconds(60);
        SlidingWindowRateLimiter window = new SlidingWindowRateLimiter(
                Duration.ofSeconds(10), 1, new CaffeineAddressStateStore<>("windows"));
        ViolationEscalator escalator = escalator();
        AdmissionEngine engine = new AdmissionEngine(registry, gate(5, 10), window, escalator, properties);

        engine.admit("10.0.0.1", "/", T0).release();
        assertEquals(RejectReason.EXCLUDED, engine.admit("10.0.0.1", "/", T0).reason());

        AdmissionDecision beforeExpiry = engine.admit("10.0.0.1", "/", T0.plusSeconds(59));
        assertEquals(RejectReason.EXCLUDED, beforeExpiry.reason());
        assertEquals(1, beforeExpiry.retryAfterSeconds());

        AdmissionDecision afterExpiry = engine.admit("10.0.0.1", "/", T0.plusSeconds(61));
        assertTrue(afterExpiry.allowed());
        assertEquals(0, escalator.violations("10.0.0.1"));
    }

    @Test
    void notFoundModeHidesTheExclusion() {
        properties.setExclusionStatus(EdgeGuardProperties.ExclusionStatus.NOT_FOUND);
        registry.exclude(ExclusionEntry.temporary("10.0.0.1", T0, Duration.ofSeconds(60), ExclusionTier.SOFT,
                ExclusionSource.ADMIN));
        AdmissionEngine engine = new AdmissionEngine(registry, gate(5, 10), allowAll(), escalator(), properties);

        AdmissionDecision decision = engine.admit("10.0.0.1", "/", T0);

        assertEquals(404, decision.status());
        assertEquals(RejectReason.EXCLUDED, decision.reason());
        assertFalse(decision.hasRetryHint());
    }

    @Test
    void permanentExclusionCarriesNoRetryHint() {
        registry.exclude(ExclusionEntry.permanent("10.0.0.1", T0, ExclusionTier.SOFT, ExclusionSource.ADMIN));
        AdmissionEngine engine = new AdmissionEngine(registry, gate(5, 10), allowAll(), escalator(), properties);

        AdmissionDecision decision = engine.admit("10.0.0.1", "/", T0);

        assertEquals(429, decision.status());
        assertFalse(decision.hasRetryHint());
    }

    @Test
    void bypassedPathsSkipLimitsButNotExclusions() {
        properties.setBypassPaths(List.of("/health/**"));
        ConcurrencyGate gate = gate(1, 10);
        RateLimiter denyAll = (address, now) -> RateLimitDecision.deny(1);
        AdmissionEngine engine = new AdmissionEngine(registry, gate, denyAll, escalator(), properties);

        assertTrue(engine.admit("10.0.0.1", "/health/live", T0).allowed());
        assertEquals(0, gate.globalActive());

        registry.exclude(ExclusionEntry.permanent("10.0.0.1", T0, ExclusionTier.SOFT, ExclusionSource.ADMIN));
        assertFalse(engine.admit("10.0.0.1", "/health/live", T0).allowed());
    }

    @Test
    void engineFailureFailsClosedByDefault() {
        ConcurrencyGate gate = gate(5, 10);
        RateLimiter broken = (address, now) -> {
            throw new IllegalStateException("state corrupted");
        };
        AdmissionEngine engine = new AdmissionEngine(registry, gate, broken, escalator(), properties);

        AdmissionDecision decision = engine.admit("10.0.0.1", "/", T0);

        assertFalse(decision.allowed());
        assertEquals(503, decision.status());
        assertEquals(RejectReason.ENGINE_FAILURE, decision.reason());
        assertEquals(0, gate.globalActive());
    }

    @Test
    void engineFailureFailsOpenWhenConfigured() {
        properties.setFailOpen(true);
        ConcurrencyGate gate = gate(5, 10);
        RateLimiter broken = (address, now) -> {
            throw new IllegalStateException("state corrupted");
        };
        AdmissionEngine engine = new AdmissionEngine(registry, gate, broken, escalator(), properties);

        AdmissionDecision decision = engine.admit("10.0.0.1", "/", T0);
        decision.release();

        assertTrue(decision.allowed());
        assertEquals(0, gate.globalActive());
    }

    private ViolationEscalator escalator() {
        EdgeGuardProperties.Escalation escalation = properties.getEscalation();
        ViolationEscalator escalator = new ViolationEscalator(
                new CaffeineAddressStateStore<>("violations"),
                registry,
                escalation.getBanThreshold(),
                Duration.ofSeconds(escalation.getBanSeconds()),
                escalation.isBanPermanent(),
                MitigationProfile.SOFT
        );
        registry.addListener(escalator);
        return escalator;
    }

    private static ConcurrencyGate gate(int perAddress, int global) {
        return new ConcurrencyGate(perAddress, global, new CaffeineAddressStateStore<>("concurrency"),
                Clock.fixed(T0, ZoneOffset.UTC));
    }

    private static RateLimiter allowAll() {
        return (address, now) -> RateLimitDecision.allow();
    }
}
