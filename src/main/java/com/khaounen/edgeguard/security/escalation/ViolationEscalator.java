package com.khaounen.edgeguard.security.escalation;

import com.khaounen.edgeguard.security.exclusion.ExclusionEntry;
import com.khaounen.edgeguard.security.exclusion.ExclusionListener;
import com.khaounen.edgeguard.security.exclusion.ExclusionRegistry;
import com.khaounen.edgeguard.security.exclusion.ExclusionResult;
import com.khaounen.edgeguard.security.exclusion.ExclusionSource;
import com.khaounen.edgeguard.store.AddressStateStore;
import com.khaounen.edgeguard.store.IdleEvictable;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;

@Slf4j
public class ViolationEscalator implements ExclusionListener, IdleEvictable {

    private final AddressStateStore<Violations> violations;
    private final ExclusionRegistry registry;
    private final int banThreshold;
    private final Duration banDuration;
    private final boolean banPermanent;
    private final MitigationProfile profile;

    public ViolationEscalator(
            AddressStateStore<Violations> violations,
            ExclusionRegistry registry,
            int banThreshold,
            Duration banDuration,
            boolean banPermanent,
            MitigationProfile profile
    ) {
        if (banThreshold < 1) {
            throw new IllegalArgumentException("banThreshold must be at least 1: " + banThreshold);
        }
        if (!banPermanent && (banDuration == null || banDuration.isZero() || banDuration.isNegative())) {
            throw new IllegalArgumentException("banDuration must be positive: " + banDuration);
        }
        this.violations = violations;
        this.registry = registry;
        this.banThreshold = banThreshold;
        this.banDuration = banDuration;
        this.banPermanent = banPermanent;
        this.profile = profile;
    }

    public EscalationOutcome recordViolation(String address, Instant now) {
        ExclusionEntry current = registry.find(address, now);
        if (current != null) {
            return EscalationOutcome.excluded(current, false);
        }
        boolean[] tripped = new boolean[1];
        Violations updated = violations.update(address, (key, existing) -> {
            int next = count(key, existing) + 1;
            if (next >= banThreshold) {
                tripped[0] = true;
                return null;
            }
            return new Violations(next, now);
        });
        if (!tripped[0]) {
            // another request may have tripped the threshold between the lookup and the update
            ExclusionEntry raced = registry.find(address, now);
            if (raced != null) {
                violations.removeIf(address, pending -> pending == updated);
                return EscalationOutcome.excluded(raced, false);
            }
            log.debug("violation {}/{} for {}", updated.count(), banThreshold, address);
            return EscalationOutcome.warned(updated.count());
        }
        ExclusionEntry candidate = banPermanent
                ? ExclusionEntry.permanent(address, now, profile.tier(), ExclusionSource.ESCALATION)
                : ExclusionEntry.temporary(address, now, banDuration, profile.tier(), ExclusionSource.ESCALATION);
        ExclusionResult result = registry.excludeIfAbsent(candidate);
        return EscalationOutcome.excluded(result.entry(), result.changed());
    }

    public EscalationState state(String address, Instant now) {
        if (registry.isExcluded(address, now)) {
            return EscalationState.EXCLUDED;
        }
        return violations(address) > 0 ? EscalationState.WARNED : EscalationState.CLEAN;
    }

    public int violations(String address) {
        Violations current = violations.get(address);
        return current == null ? 0 : Math.max(0, current.count());
    }

    @Override
    public void onExpired(ExclusionEntry entry) {
        violations.delete(entry.address());
    }

    @Override
    public void onReleased(ExclusionEntry entry) {
        violations.delete(entry.address());
    }

    @Override
    public int evictIdle(Instant cutoff) {
        int evicted = 0;
        for (String address : violations.snapshot().keySet()) {
            if (violations.removeIf(address, current -> current.lastViolation().isBefore(cutoff))) {
                evicted++;
            }
        }
        return evicted;
    }

    private static int count(String address, Violations existing) {
        if (existing == null) {
            return 0;
        }
        if (existing.count() < 0) {
            log.warn("violation count for {} was {}, reset to 0", address, existing.count());
            return 0;
        }
        return existing.count();
    }

    public record Violations(int count, Instant lastViolation) {
    }
}
