package com.khaounen.edgeguard.security.exclusion;

import java.time.Instant;

public record ExclusionView(
        String address,
        Long remainingSeconds,
        boolean permanent,
        ExclusionTier tier,
        ExclusionSource source
) {

    public static ExclusionView of(ExclusionEntry entry, Instant now) {
        return new ExclusionView(
                entry.address(),
                entry.isPermanent() ? null : entry.remainingSeconds(now),
                entry.isPermanent(),
                entry.tier(),
                entry.source()
        );
    }
}
