package com.eden.gateway.filter;

import com.eden.gateway.middleware.MiddlewareContext;
import com.eden.gateway.middleware.MiddlewareHandler;
import com.eden.gateway.proxy.GatewayRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Logs every request that made it past routing, before it is rate limited and forwarded
 */
@Slf4j
@Component
public class RequestLoggingMiddleware implements MiddlewareHandler {

    public static final String NAME = "request-logging";
    public static final int PRIORITY = 20;

    @Override
    public GatewayRequest handle(MiddlewareContext context, GatewayRequest request) {
        log.debug("Incoming request: {} {} - Service: {} - CorrelationId: {} - Client: {}",
                request.getMethod(),
                request.getPath(),
                context.getRoute().getServiceName(),
                CorrelationIdMiddleware.getCorrelationId(context),
                request.getClientIp());
        return request;
    }
}
