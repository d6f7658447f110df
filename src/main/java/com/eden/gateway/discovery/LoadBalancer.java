package com.eden.gateway.discovery;

import com.eden.gateway.router.Route;

import java.util.Optional;

/**
 * Picks the backend a request is forwarded to
 */
public interface LoadBalancer {

    /**
     * Select one healthy instance of a service
     *
     * @param serviceName logical service name
     * @return a healthy instance, empty if none is healthy
     */
    Optional<ServiceInstance> selectInstance(String serviceName);

    /**
     * Resolve the base URL for a route: a selected instance when the service has
     * registered instances, the route's static target when it has none.
     *
     * @throws com.eden.gateway.exception.ServiceUnavailableException if instances
     *         are registered but none is healthy
     */
    String resolveTarget(Route route);
}
