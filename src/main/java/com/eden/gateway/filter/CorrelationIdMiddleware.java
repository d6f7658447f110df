package com.eden.gateway.filter;

import com.eden.gateway.middleware.MiddlewareContext;
import com.eden.gateway.middleware.MiddlewareHandler;
import com.eden.gateway.proxy.GatewayRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Middleware for adding correlation IDs to all proxied requests.
 * Enables distributed tracing across multiple services.
 */
@Slf4j
@Component
public class CorrelationIdMiddleware implements MiddlewareHandler {

    public static final String NAME = "correlation-id";
    public static final int PRIORITY = 10;
    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_ATTRIBUTE = "correlationId";

    @Override
    public GatewayRequest handle(MiddlewareContext context, GatewayRequest request) {
        String correlationId = request.header(CORRELATION_ID_HEADER);

        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }

        context.setAttribute(CORRELATION_ID_ATTRIBUTE, correlationId);

        log.debug("Correlation ID: {} for request: {} {}", correlationId, request.getMethod(), request.getPath());
        return request.withHeader(CORRELATION_ID_HEADER, correlationId);
    }

    public static String getCorrelationId(MiddlewareContext context) {
        return context.getAttribute(CORRELATION_ID_ATTRIBUTE, String.class);
    }
}
