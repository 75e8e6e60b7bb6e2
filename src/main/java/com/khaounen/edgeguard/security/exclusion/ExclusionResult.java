package com.khaounen.edgeguard.security.exclusion;

public record ExclusionResult(ExclusionEntry entry, boolean changed) {

    public static ExclusionResult unchanged(ExclusionEntry entry) {
        return new ExclusionResult(entry, false);
    }

    public static ExclusionResult changed(ExclusionEntry entry) {
        return new ExclusionResult(entry, true);
    }
}
