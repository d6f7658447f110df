package com.eden.gateway.discovery;

/**
 * Health of a registered service instance
 */
public enum HealthStatus {
    HEALTHY,
    UNHEALTHY,
    UNKNOWN
}
