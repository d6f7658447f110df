package com.eden.gateway.discovery;

import com.eden.gateway.exception.ServiceUnavailableException;
import com.eden.gateway.router.Route;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Health-aware round-robin over the instances in the {@link ServiceRegistry}.
 * Keeps one cursor per service; unhealthy and unknown instances are never chosen.
 */
@Slf4j
@Component
public class RoundRobinLoadBalancer implements LoadBalancer {

    private final ServiceRegistry serviceRegistry;
    private final Map<String, AtomicInteger> cursors = new ConcurrentHashMap<>();

    public RoundRobinLoadBalancer(ServiceRegistry serviceRegistry) {
        this.serviceRegistry = serviceRegistry;
    }

    @Override
    public Optional<ServiceInstance> selectInstance(String serviceName) {
        return select(serviceName, serviceRegistry.getInstances(serviceName));
    }

    @Override
    public String resolveTarget(Route route) {
        List<ServiceInstance> instances = serviceRegistry.getInstances(route.getServiceName());
        if (instances.isEmpty()) {
            log.debug("No registered instances for {}, using static target {}", route.getServiceName(),
                    route.getTarget());
            return route.getTarget();
        }
        return select(route.getServiceName(), instances)
                .map(ServiceInstance::baseUrl)
                .orElseThrow(() -> {
                    log.warn("No healthy instance among {} registered for service {}", instances.size(),
                            route.getServiceName());
                    return new ServiceUnavailableException(route.getServiceName());
                });
    }

    private Optional<ServiceInstance> select(String serviceName, List<ServiceInstance> instances) {
        List<ServiceInstance> healthy = instances.stream()
                .filter(ServiceInstance::isHealthy)
                .toList();
        if (healthy.isEmpty()) {
            return Optional.empty();
        }
        int next = cursors.computeIfAbsent(serviceName, name -> new AtomicInteger())
                .getAndUpdate(i -> i == Integer.MAX_VALUE ? 0 : i + 1);
        return Optional.of(healthy.get(next % healthy.size()));
    }
}
