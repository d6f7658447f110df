package com.eden.gateway.middleware;

import com.eden.gateway.proxy.GatewayRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ordered pipeline of middlewares run before every proxied request.
 *
 * Writers publish a new sorted snapshot; dispatch reads the current snapshot
 * without locking.
 */
@Slf4j
@Component
public class MiddlewareChain {

    private volatile List<Middleware> middlewares = List.of();

    /**
     * Append a middleware and re-sort the chain by priority.
     * Equal priorities keep their insertion order.
     */
    public synchronized void addMiddleware(Middleware middleware) {
        List<Middleware> next = new ArrayList<>(middlewares);
        next.add(middleware);
        next.sort(Comparator.comparingInt(Middleware::getPriority));
        middlewares = List.copyOf(next);
        log.info("Added middleware: {} (priority {})", middleware.getName(), middleware.getPriority());
    }

    /**
     * Get the middlewares in execution order
     */
    public List<Middleware> getMiddlewares() {
        return middlewares;
    }

    /**
     * Run every middleware in order, feeding each one's output to the next.
     * The first rejection aborts the run and propagates to the caller.
     */
    public GatewayRequest runChain(MiddlewareContext context, GatewayRequest request) {
        GatewayRequest current = request;
        for (Middleware middleware : middlewares) {
            current = middleware.getHandler().handle(context, current);
            if (current == null) {
                throw new IllegalStateException("middleware '" + middleware.getName() + "' returned no request");
            }
        }
        return current;
    }
}
