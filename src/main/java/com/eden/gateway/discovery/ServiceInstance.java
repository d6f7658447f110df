package com.eden.gateway.discovery;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.Singular;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;

/**
 * One addressable deployment of a backend service.
 * Identity and location are fixed; health and last-seen change in place.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class ServiceInstance {

    private final String id;
    private final String serviceName;
    private final String address;
    private final int port;
    @Singular("metadataEntry")
    private final Map<String, String> metadata;
    private final Instant registeredAt;

    @Setter(AccessLevel.PACKAGE)
    private volatile HealthStatus health;

    @Setter(AccessLevel.PACKAGE)
    private volatile Instant lastSeen;

    public boolean isHealthy() {
        return health == HealthStatus.HEALTHY;
    }

    /**
     * Base URL requests are forwarded to, e.g. {@code http://10.0.0.5:8080}.
     * Metadata key {@code scheme} overrides the default {@code http}.
     */
    public String baseUrl() {
        String scheme = metadata.getOrDefault("scheme", "http");
        return scheme + "://" + address + ":" + port;
    }
}
