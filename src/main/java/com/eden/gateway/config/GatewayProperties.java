package com.eden.gateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway settings bound from the {@code gateway} prefix
 */
@Data
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /**
     * Static backend per service name; each gets a default {@code /api/v1/<name>} route
     */
    private Map<String, StaticService> services = new LinkedHashMap<>();

    /**
     * Additional routes registered at startup
     */
    private List<RouteDefinition> routes = new ArrayList<>();

    private RateLimit rateLimit = new RateLimit();

    private Proxy proxy = new Proxy();

    private Cors cors = new Cors();

    private SecurityHeaders securityHeaders = new SecurityHeaders();

    /**
     * Request header rewrites applied by path prefix
     */
    private List<HeaderTransformation> transformations = new ArrayList<>();

    @Data
    public static class StaticService {
        private String url;
    }

    @Data
    public static class RouteDefinition {
        private String serviceName;
        private String pathPrefix;
        private String target;
        private List<String> methods = new ArrayList<>();
        private boolean stripPrefix;
    }

    @Data
    public static class RateLimit {
        private boolean enabled = true;
        private int limit = 100;
        private Duration window = Duration.ofMinutes(1);
        private String keyHeader = "X-User-ID";
        private Backend backend = Backend.MEMORY;

        public enum Backend {
            MEMORY,
            REDIS
        }
    }

    @Data
    public static class Proxy {
        private Duration timeout = Duration.ofSeconds(30);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private List<String> hopByHopHeaders = new ArrayList<>(
                List.of("Host", "Connection", "Upgrade", "Proxy-Connection"));
    }

    @Data
    public static class Cors {
        private List<String> allowedMethods = new ArrayList<>(
                List.of("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS"));
        private List<String> allowedHeaders = new ArrayList<>(
                List.of("Authorization", "Content-Type", "X-Organization-Id", "X-User-ID", "X-Correlation-ID"));
        private Duration maxAge = Duration.ofHours(1);
    }

    /**
     * Headers set on every gateway response; upstream values for the same names are dropped
     */
    @Data
    public static class SecurityHeaders {
        private boolean enabled = true;
        private Map<String, String> headers = new LinkedHashMap<>(Map.of(
                "X-Content-Type-Options", "nosniff",
                "X-Frame-Options", "DENY",
                "X-XSS-Protection", "1; mode=block",
                "Referrer-Policy", "strict-origin-when-cross-origin",
                "Permissions-Policy", "camera=(), microphone=(), geolocation=()"));
    }

    @Data
    public static class HeaderTransformation {
        private String pathPrefix;
        private Map<String, String> headerAdditions = new LinkedHashMap<>();
        private List<String> headerRemovals = new ArrayList<>();
    }
}
