package com.khaounen.edgeguard.security.exclusion;

import java.time.Duration;
import java.time.Instant;

public record ExclusionEntry(
        String address,
        Instant createdAt,
        Instant expiresAt,
        ExclusionTier tier,
        ExclusionSource source
) {

    public static ExclusionEntry temporary(
            String address,
            Instant now,
            Duration duration,
            ExclusionTier tier,
            ExclusionSource source
    ) {
        return new ExclusionEntry(address, now, now.plus(duration), tier, source);
    }

    public static ExclusionEntry permanent(String address, Instant now, ExclusionTier tier, ExclusionSource source) {
        return new ExclusionEntry(address, now, null, tier, source);
    }

    public boolean isPermanent() {
        return expiresAt == null;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean isConsistent() {
        return createdAt != null && (expiresAt == null || expiresAt.isAfter(createdAt));
    }

    public long remainingSeconds(Instant now) {
        if (expiresAt == null) {
            return Long.MAX_VALUE;
        }
        long millis = Duration.between(now, expiresAt).toMillis();
        return Math.max(0, (millis + 999) / 1000);
    }
}
