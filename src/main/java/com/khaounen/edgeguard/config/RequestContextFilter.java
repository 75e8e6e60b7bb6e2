package com.khaounen.edgeguard.config;

import com.khaounen.edgeguard.utils.IpUtils;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

public class RequestContextFilter extends OncePerRequestFilter implements Ordered {

    public static final int ORDER = Ordered.HIGHEST_PRECEDENCE;

    private final boolean trustForwardedHeaders;

    public RequestContextFilter(boolean trustForwardedHeaders) {
        this.trustForwardedHeaders = trustForwardedHeaders;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        try {
            RequestContext.set(new RequestContext.Client(
                    IpUtils.resolveIp(request, trustForwardedHeaders),
                    request.getHeader("User-Agent")
            ));
            filterChain.doFilter(request, response);
        } finally {
            RequestContext.clear();
        }
    }

    @Override
    public int getOrder() {
        return ORDER;
    }
}
