package com.khaounen.edgeguard.security.admission;

public enum RejectReason {
    EXCLUDED,
    GLOBAL_CONCURRENCY,
    ADDRESS_CONCURRENCY,
    RATE_LIMITED,
    ENGINE_FAILURE
}
