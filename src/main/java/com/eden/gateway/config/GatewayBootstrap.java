package com.eden.gateway.config;

import com.eden.gateway.filter.CorrelationIdMiddleware;
import com.eden.gateway.filter.HeaderTransformationMiddleware;
import com.eden.gateway.filter.RequestLoggingMiddleware;
import com.eden.gateway.middleware.Middleware;
import com.eden.gateway.middleware.MiddlewareChain;
import com.eden.gateway.router.Route;
import com.eden.gateway.router.RouteRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Populates the route registry and middleware chain from configuration at startup.
 * Registries are in-memory only, so this runs on every boot.
 */
@Slf4j
@Component
public class GatewayBootstrap {

    static final String DEFAULT_ROUTE_PREFIX = "/api/v1/";

    private final GatewayProperties properties;
    private final RouteRegistry routeRegistry;
    private final MiddlewareChain middlewareChain;
    private final CorrelationIdMiddleware correlationIdMiddleware;
    private final RequestLoggingMiddleware requestLoggingMiddleware;
    private final HeaderTransformationMiddleware headerTransformationMiddleware;

    public GatewayBootstrap(GatewayProperties properties,
                            RouteRegistry routeRegistry,
                            MiddlewareChain middlewareChain,
                            CorrelationIdMiddleware correlationIdMiddleware,
                            RequestLoggingMiddleware requestLoggingMiddleware,
                            HeaderTransformationMiddleware headerTransformationMiddleware) {
        this.properties = properties;
        this.routeRegistry = routeRegistry;
        this.middlewareChain = middlewareChain;
        this.correlationIdMiddleware = correlationIdMiddleware;
        this.requestLoggingMiddleware = requestLoggingMiddleware;
        this.headerTransformationMiddleware = headerTransformationMiddleware;
    }

    @PostConstruct
    public void init() {
        registerRoutes();
        registerMiddlewares();
        log.info("Initialized {} routes and {} middlewares", routeRegistry.getRoutes().size(),
                middlewareChain.getMiddlewares().size());
    }

    private void registerRoutes() {
        // Explicit routes first so they win over a generated default with the same prefix
        for (GatewayProperties.RouteDefinition definition : properties.getRoutes()) {
            routeRegistry.registerRoute(Route.builder()
                    .serviceName(definition.getServiceName())
                    .pathPrefix(definition.getPathPrefix())
                    .target(definition.getTarget())
                    .methods(definition.getMethods())
                    .stripPrefix(definition.isStripPrefix())
                    .build());
        }

        properties.getServices().forEach((name, service) -> {
            String prefix = DEFAULT_ROUTE_PREFIX + name;
            if (routeRegistry.getRoute(prefix).isPresent()) {
                log.debug("Default route {} overridden by explicit configuration", prefix);
                return;
            }
            routeRegistry.registerRoute(Route.builder()
                    .serviceName(name)
                    .pathPrefix(prefix)
                    .target(service.getUrl())
                    .build());
        });
    }

    private void registerMiddlewares() {
        middlewareChain.addMiddleware(Middleware.builder()
                .name(CorrelationIdMiddleware.NAME)
                .priority(CorrelationIdMiddleware.PRIORITY)
                .handler(correlationIdMiddleware)
                .build());
        middlewareChain.addMiddleware(Middleware.builder()
                .name(RequestLoggingMiddleware.NAME)
                .priority(RequestLoggingMiddleware.PRIORITY)
                .handler(requestLoggingMiddleware)
                .build());
        if (headerTransformationMiddleware.hasTransformations()) {
            middlewareChain.addMiddleware(Middleware.builder()
                    .name(HeaderTransformationMiddleware.NAME)
                    .priority(HeaderTransformationMiddleware.PRIORITY)
                    .handler(headerTransformationMiddleware)
                    .build());
        }
    }
}
