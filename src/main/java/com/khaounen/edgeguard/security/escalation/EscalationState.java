package com.khaounen.edgeguard.security.escalation;

public enum EscalationState {
    CLEAN,
    WARNED,
    EXCLUDED
}
