package com.khaounen.edgeguard.security.admission;

import com.khaounen.edgeguard.security.concurrency.ConcurrencyPermit;

/**
 * An allowed decision holds a concurrency slot until {@link #release()}.
 */
public record AdmissionDecision(
        boolean allowed,
        int status,
        long retryAfterSeconds,
        RejectReason reason,
        ConcurrencyPermit permit
) {

    public static AdmissionDecision allow(ConcurrencyPermit permit) {
        return new AdmissionDecision(true, 200, 0, null, permit);
    }

    public static AdmissionDecision reject(int status, RejectReason reason, long retryAfterSeconds) {
        return new AdmissionDecision(false, status, Math.max(0, retryAfterSeconds), reason,
                ConcurrencyPermit.untracked());
    }

    public boolean hasRetryHint() {
        return retryAfterSeconds > 0;
    }

    public void release() {
        permit.close();
    }
}
