package com.khaounen.edgeguard.security.admission;

import com.khaounen.edgeguard.security.concurrency.ConcurrencyGate;
import com.khaounen.edgeguard.security.concurrency.ConcurrencyPermit;
import com.khaounen.edgeguard.security.escalation.EscalationOutcome;
import com.khaounen.edgeguard.security.escalation.EscalationState;
import com.khaounen.edgeguard.security.escalation.ViolationEscalator;
import com.khaounen.edgeguard.security.exclusion.ExclusionEntry;
import com.khaounen.edgeguard.security.exclusion.ExclusionRegistry;
import com.khaounen.edgeguard.security.ratelimit.RateLimitDecision;
import com.khaounen.edgeguard.security.ratelimit.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

@Slf4j
public class AdmissionEngine {

    private final ExclusionRegistry registry;
    private final ConcurrencyGate concurrencyGate;
    private final RateLimiter rateLimiter;
    private final ViolationEscalator escalator;
    private final EdgeGuardProperties properties;

    public AdmissionEngine(
            ExclusionRegistry registry,
            ConcurrencyGate concurrencyGate,
            RateLimiter rateLimiter,
            ViolationEscalator escalator,
            EdgeGuardProperties properties
    ) {
        this.registry = registry;
        this.concurrencyGate = concurrencyGate;
        this.rateLimiter = rateLimiter;
        this.escalator = escalator;
        this.properties = properties;
    }

    public AdmissionDecision admit(String address, String path, Instant now) {
        ConcurrencyPermit permit = null;
        try {
            ExclusionEntry exclusion = registry.find(address, now);
            if (exclusion != null) {
                return excluded(address, exclusion, now);
            }
            if (properties.isBypassed(path)) {
                return AdmissionDecision.allow(ConcurrencyPermit.untracked());
            }

            permit = concurrencyGate.acquire(address);
            if (!permit.isGranted()) {
                if (permit.getDeniedScope() == ConcurrencyPermit.Scope.GLOBAL) {
                    log.debug("global concurrency limit reached, rejecting {}", address);
                    return AdmissionDecision.reject(503, RejectReason.GLOBAL_CONCURRENCY, 0);
                }
                log.debug("concurrency limit reached for {}", address);
                return AdmissionDecision.reject(429, RejectReason.ADDRESS_CONCURRENCY, 0);
            }

            RateLimitDecision rate = rateLimiter.check(address, now);
            if (!rate.allowed()) {
                permit.close();
                EscalationOutcome outcome = escalator.recordViolation(address, now);
                if (outcome.state() == EscalationState.EXCLUDED) {
                    return AdmissionDecision.reject(429, RejectReason.EXCLUDED,
                            retryAfter(outcome.exclusion(), now));
                }
                log.debug("rate limit exceeded for {} on {}", address, path);
                return AdmissionDecision.reject(429, RejectReason.RATE_LIMITED, rate.retryAfterSeconds());
            }
            return AdmissionDecision.allow(permit);
        } catch (RuntimeException ex) {
            if (permit != null) {
                permit.close();
            }
            log.error("admission check failed for {}", address, ex);
            if (properties.isFailOpen()) {
                return AdmissionDecision.allow(ConcurrencyPermit.untracked());
            }
            return AdmissionDecision.reject(503, RejectReason.ENGINE_FAILURE, 0);
        }
    }

    private AdmissionDecision excluded(String address, ExclusionEntry exclusion, Instant now) {
        log.debug("rejecting excluded address {}", address);
        EdgeGuardProperties.ExclusionStatus status = properties.getExclusionStatus();
        long retryAfter = status == EdgeGuardProperties.ExclusionStatus.NOT_FOUND ? 0 : retryAfter(exclusion, now);
        return AdmissionDecision.reject(status.code(), RejectReason.EXCLUDED, retryAfter);
    }

    private static long retryAfter(ExclusionEntry exclusion, Instant now) {
        if (exclusion == null || exclusion.isPermanent()) {
            return 0;
        }
        return exclusion.remainingSeconds(now);
    }
}
