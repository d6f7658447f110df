package com.eden.gateway.middleware;

import com.eden.gateway.router.Route;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-request context shared by the middlewares of one chain run
 */
@Value
public class MiddlewareContext {
    Route route;
    Instant startedAt;
    Map<String, Object> attributes = new ConcurrentHashMap<>();

    public static MiddlewareContext forRoute(Route route) {
        return new MiddlewareContext(route, Instant.now());
    }

    public void setAttribute(String name, Object value) {
        attributes.put(name, value);
    }

    public <T> T getAttribute(String name, Class<T> type) {
        return type.cast(attributes.get(name));
    }
}
