package com.khaounen.edgeguard.security.filters;

import com.khaounen.edgeguard.config.RequestContext;
import com.khaounen.edgeguard.config.RequestContextFilter;
import com.khaounen.edgeguard.security.admission.AdmissionDecision;
import com.khaounen.edgeguard.security.admission.AdmissionEngine;
import com.khaounen.edgeguard.security.admission.EdgeGuardProperties;
import com.khaounen.edgeguard.utils.IpUtils;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;

public class AdmissionFilter extends OncePerRequestFilter implements Ordered {

    public static final int ORDER = RequestContextFilter.ORDER + 10;

    private final EdgeGuardProperties properties;
    private final AdmissionEngine engine;
    private final Clock clock;

    public AdmissionFilter(EdgeGuardProperties properties, AdmissionEngine engine, Clock clock) {
        this.properties = properties;
        this.engine = engine;
        this.clock = clock;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        if (!properties.isEnabled()) {
            filterChain.doFilter(request, response);
            return;
        }

        String address = RequestContext.getIp();
        if (address == null) {
            address = IpUtils.resolveIp(request, properties.isTrustForwardedHeaders());
        }
        AdmissionDecision decision = engine.admit(address, request.getRequestURI(), clock.instant());
        if (!decision.allowed()) {
            reject(response, decision);
            return;
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            decision.release();
        }
    }

    private static void reject(HttpServletResponse response, AdmissionDecision decision) throws IOException {
        response.setStatus(decision.status());
        response.setContentType("text/plain");
        if (decision.hasRetryHint()) {
            response.setHeader("Retry-After", String.valueOf(decision.retryAfterSeconds()));
        }
        response.getWriter().write(message(decision));
    }

    private static String message(AdmissionDecision decision) {
        if (decision.status() == 404) {
            return "Not Found";
        }
        if (decision.status() == 503) {
            return "Service Unavailable. Try again later.";
        }
        if (decision.hasRetryHint()) {
            return "Too Many Requests. Try again in " + decision.retryAfterSeconds() + " second(s).";
        }
        return "Too Many Requests.";
    }

    @Override
    public int getOrder() {
        return ORDER;
    }
}
