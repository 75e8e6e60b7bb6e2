package com.khaounen.edgeguard.security.exclusion;

public enum ExclusionTier {
    SOFT,
    HARD
}
