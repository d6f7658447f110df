package com.eden.gateway.middleware;

import com.eden.gateway.proxy.GatewayRequest;

/**
 * Request interceptor run before dispatch.
 * Returns the (possibly transformed) request, or throws
 * {@link com.eden.gateway.exception.MiddlewareRejectedException} to abort the chain.
 */
@FunctionalInterface
public interface MiddlewareHandler {

    GatewayRequest handle(MiddlewareContext context, GatewayRequest request);
}
