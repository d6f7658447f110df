package com.eden.gateway.dto;

import com.eden.gateway.discovery.HealthStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Admin payload for registering a service instance; the service name comes from the path
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstanceRequest {
    private String id;
    private String address;
    private int port;
    private HealthStatus health;
    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();
}
