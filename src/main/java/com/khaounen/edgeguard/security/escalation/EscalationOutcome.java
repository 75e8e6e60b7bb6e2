package com.khaounen.edgeguard.security.escalation;

import com.khaounen.edgeguard.security.exclusion.ExclusionEntry;

public record EscalationOutcome(
        EscalationState state,
        int violations,
        ExclusionEntry exclusion,
        boolean newlyExcluded
) {

    public static EscalationOutcome warned(int violations) {
        return new EscalationOutcome(EscalationState.WARNED, violations, null, false);
    }

    public static EscalationOutcome excluded(ExclusionEntry exclusion, boolean newlyExcluded) {
        return new EscalationOutcome(EscalationState.EXCLUDED, 0, exclusion, newlyExcluded);
    }
}
