package com.eden.gateway.filter;

import com.eden.gateway.config.GatewayProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Adds the configured security headers to every response the gateway sends.
 * The proxy drops upstream copies of these headers so each appears once.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class SecurityHeadersFilter extends OncePerRequestFilter {

    private final GatewayProperties.SecurityHeaders securityHeaders;

    public SecurityHeadersFilter(GatewayProperties properties) {
        this.securityHeaders = properties.getSecurityHeaders();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        if (securityHeaders.isEnabled()) {
            securityHeaders.getHeaders().forEach(response::setHeader);
        }
        filterChain.doFilter(request, response);
    }
}
