package com.khaounen.edgeguard.security.exclusion;

public enum ExclusionSource {
    ESCALATION,
    ADMIN,
    BACKEND_IMPORT
}
