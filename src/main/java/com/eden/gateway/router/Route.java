package com.eden.gateway.router;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Locale;
import java.util.Set;

/**
 * Route definition for API Gateway.
 * Immutable once registered; maps a path prefix to a logical backend service.
 */
@Value
@Builder(toBuilder = true)
public class Route {
    String serviceName;           // e.g., "vault"
    String pathPrefix;            // e.g., "/api/v1/vault"
    String target;                // static fallback, e.g., "http://vault:8080"
    @Singular
    Set<String> methods;          // empty = every method allowed
    boolean stripPrefix;          // Remove matching prefix from forwarded path
    Instant registeredAt;

    public boolean allowsMethod(String method) {
        return methods.isEmpty() || methods.contains(method.toUpperCase(Locale.ROOT));
    }

    /**
     * Whether this route's prefix covers the given request path.
     * The match must end on a path segment boundary, so {@code /api/v1/vault}
     * covers {@code /api/v1/vault/secrets} but not {@code /api/v1/vaultx}.
     */
    public boolean matches(String path) {
        if (path == null || !path.startsWith(pathPrefix)) {
            return false;
        }
        return path.length() == pathPrefix.length()
                || pathPrefix.endsWith("/")
                || path.charAt(pathPrefix.length()) == '/';
    }

    /**
     * Path to forward to the backend for the given request path
     */
    public String forwardPath(String path) {
        if (!stripPrefix) {
            return path;
        }
        String remainder = path.substring(Math.min(pathPrefix.length(), path.length()));
        return remainder.startsWith("/") ? remainder : "/" + remainder;
    }
}
