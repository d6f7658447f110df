package com.eden.gateway.proxy;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Answers CORS preflight requests for every path before Spring MVC sees them.
 * MVC would otherwise handle a preflight with its own (unconfigured) CORS processor
 * and never reach the proxy.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class CorsPreflightFilter extends OncePerRequestFilter {

    private final ProxyDispatcher dispatcher;
    private final GatewayRequestFactory requestFactory;

    public CorsPreflightFilter(ProxyDispatcher dispatcher, GatewayRequestFactory requestFactory) {
        this.dispatcher = dispatcher;
        this.requestFactory = requestFactory;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        if (!CorsUtils.isPreFlightRequest(request)) {
            filterChain.doFilter(request, response);
            return;
        }

        ProxyResponse preflight = dispatcher.dispatch(requestFactory.from(request));
        response.setStatus(preflight.getStatus());
        preflight.getHeaders().forEach((name, values) -> values.forEach(value -> response.addHeader(name, value)));
        response.setContentLength(0);
    }
}
