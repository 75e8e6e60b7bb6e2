package com.khaounen.edgeguard.security.escalation;

import com.khaounen.edgeguard.security.exclusion.ExclusionTier;

public enum MitigationProfile {
    SOFT(ExclusionTier.SOFT),
    HARD(ExclusionTier.HARD);

    private final ExclusionTier tier;

    MitigationProfile(ExclusionTier tier) {
        this.tier = tier;
    }

    public ExclusionTier tier() {
        return tier;
    }
}
