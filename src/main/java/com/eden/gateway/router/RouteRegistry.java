package com.eden.gateway.router;

import com.eden.gateway.exception.ConflictException;
import com.eden.gateway.exception.ValidationException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Route registry for API Gateway.
 * Holds routes keyed by path prefix and resolves request paths by longest prefix.
 */
@Slf4j
@Component
public class RouteRegistry {

    private final Map<String, Entry> routes = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * Register a route. The path prefix must not already be registered.
     *
     * @return the route as stored, with normalized methods and registration time
     */
    public Route registerRoute(Route route) {
        validateRoute(route);

        Route normalized = route.toBuilder()
                .clearMethods()
                .methods(route.getMethods().stream()
                        .map(m -> m.trim().toUpperCase(Locale.ROOT))
                        .collect(Collectors.toSet()))
                .registeredAt(Instant.now())
                .build();

        Entry previous = routes.putIfAbsent(normalized.getPathPrefix(),
                new Entry(sequence.incrementAndGet(), normalized));
        if (previous != null) {
            throw new ConflictException("route with path '" + route.getPathPrefix() + "' already registered");
        }
        log.info("Registered route: {} -> {} ({})", normalized.getPathPrefix(), normalized.getServiceName(),
                normalized.getTarget());
        return normalized;
    }

    /**
     * Remove the route registered under the given prefix
     *
     * @return true if a route was removed
     */
    public boolean deregisterRoute(String pathPrefix) {
        Entry removed = pathPrefix != null ? routes.remove(pathPrefix) : null;
        if (removed != null) {
            log.info("Removed route: {}", pathPrefix);
        }
        return removed != null;
    }

    /**
     * Get all routes, in registration order
     */
    public List<Route> getRoutes() {
        return routes.values().stream()
                .sorted(Comparator.comparingLong(Entry::getOrder))
                .map(Entry::getRoute)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Get the route registered under exactly this prefix
     */
    public Optional<Route> getRoute(String pathPrefix) {
        return Optional.ofNullable(pathPrefix != null ? routes.get(pathPrefix) : null).map(Entry::getRoute);
    }

    /**
     * Find the route whose prefix is the longest match for the given path
     */
    public Optional<Route> findRoute(String path) {
        return routes.values().stream()
                .map(Entry::getRoute)
                .filter(route -> route.matches(path))
                .max(Comparator.comparingInt(route -> route.getPathPrefix().length()));
    }

    private void validateRoute(Route route) {
        if (isBlank(route.getServiceName())) {
            throw new ValidationException("service name is required");
        }
        if (isBlank(route.getPathPrefix())) {
            throw new ValidationException("path is required");
        }
        if (isBlank(route.getTarget())) {
            throw new ValidationException("target is required");
        }
        if (!route.getPathPrefix().startsWith("/")) {
            throw new ValidationException("path must start with '/'");
        }
        if (!isAbsoluteHttpUrl(route.getTarget())) {
            throw new ValidationException("target must be an absolute http(s) URL");
        }
    }

    private static boolean isAbsoluteHttpUrl(String target) {
        URI uri;
        try {
            uri = new URI(target.trim());
        } catch (URISyntaxException e) {
            return false;
        }
        String scheme = uri.getScheme();
        return ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme)) && uri.getHost() != null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Value
    private static class Entry {
        long order;
        Route route;
    }
}
