package com.eden.gateway.middleware;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A named interceptor in the middleware chain. Lower priority runs earlier.
 */
@Value
@Builder
public class Middleware {
    @NonNull
    String name;
    int priority;
    @NonNull
    MiddlewareHandler handler;
}
