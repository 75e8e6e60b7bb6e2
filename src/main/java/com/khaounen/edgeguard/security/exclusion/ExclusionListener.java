package com.khaounen.edgeguard.security.exclusion;

public interface ExclusionListener {

    default void onExcluded(ExclusionEntry entry) {
    }

    default void onExpired(ExclusionEntry entry) {
    }

    default void onReleased(ExclusionEntry entry) {
    }
}
