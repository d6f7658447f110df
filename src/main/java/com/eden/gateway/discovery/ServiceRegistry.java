package com.eden.gateway.discovery;

import com.eden.gateway.exception.ConflictException;
import com.eden.gateway.exception.NotFoundException;
import com.eden.gateway.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory registry of live backend instances.
 *
 * Instances are indexed by id for health updates and grouped per service name
 * for selection. Each map is concurrent and mutated per key, so registrations
 * for different services never contend.
 */
@Slf4j
@Component
public class ServiceRegistry {

    private final Map<String, ServiceInstance> instancesById = new ConcurrentHashMap<>();
    private final Map<String, List<ServiceInstance>> instancesByService = new ConcurrentHashMap<>();

    /**
     * Register an instance. A blank id is replaced by a generated one.
     *
     * @return the registered instance
     */
    public ServiceInstance registerInstance(ServiceInstance instance) {
        validateInstance(instance);

        Instant now = Instant.now();
        String id = instance.getId() == null || instance.getId().isBlank()
                ? UUID.randomUUID().toString()
                : instance.getId();
        ServiceInstance registered = instance.toBuilder()
                .id(id)
                .registeredAt(now)
                .build();
        registered.setHealth(instance.getHealth() != null ? instance.getHealth() : HealthStatus.UNKNOWN);
        registered.setLastSeen(now);

        instancesById.compute(id, (key, existing) -> {
            if (existing != null) {
                throw new ConflictException("instance '" + key + "' already registered");
            }
            instancesByService.compute(registered.getServiceName(), (name, instances) -> {
                List<ServiceInstance> list = instances != null ? instances : new CopyOnWriteArrayList<>();
                list.add(registered);
                return list;
            });
            return registered;
        });

        log.info("Registered instance {} for service {} at {} ({})", id, registered.getServiceName(),
                registered.baseUrl(), registered.getHealth());
        return registered;
    }

    /**
     * Remove an instance. Unknown ids are ignored.
     */
    public void deregisterInstance(String instanceId) {
        if (!instancesById.containsKey(instanceId)) {
            log.debug("Deregistration of unknown instance {} ignored", instanceId);
            return;
        }
        instancesById.computeIfPresent(instanceId, (id, instance) -> {
            instancesByService.computeIfPresent(instance.getServiceName(), (name, instances) -> {
                instances.removeIf(i -> i.getId().equals(id));
                return instances.isEmpty() ? null : instances;
            });
            log.info("Deregistered instance {} of service {}", id, instance.getServiceName());
            return null;
        });
    }

    /**
     * Record the health reported for an instance by an external health checker
     */
    public ServiceInstance updateInstanceHealth(String instanceId, HealthStatus health) {
        ServiceInstance updated = instancesById.computeIfPresent(instanceId, (id, instance) -> {
            HealthStatus previous = instance.getHealth();
            instance.setHealth(health);
            instance.setLastSeen(Instant.now());
            if (previous != health) {
                log.info("Instance {} of service {} is now {} (was {})", id, instance.getServiceName(),
                        health, previous);
            }
            return instance;
        });
        if (updated == null) {
            throw new NotFoundException("instance '" + instanceId + "' not found");
        }
        return updated;
    }

    /**
     * All instances of a service, whatever their health, in registration order
     */
    public List<ServiceInstance> getInstances(String serviceName) {
        List<ServiceInstance> instances = instancesByService.get(serviceName);
        return instances == null ? List.of() : List.copyOf(instances);
    }

    public Optional<ServiceInstance> findInstance(String instanceId) {
        return Optional.ofNullable(instancesById.get(instanceId));
    }

    public Set<String> getServiceNames() {
        return Set.copyOf(instancesByService.keySet());
    }

    private void validateInstance(ServiceInstance instance) {
        if (instance.getServiceName() == null || instance.getServiceName().isBlank()) {
            throw new ValidationException("service name is required");
        }
        if (instance.getAddress() == null || instance.getAddress().isBlank()) {
            throw new ValidationException("address is required");
        }
        if (instance.getPort() <= 0 || instance.getPort() > 65535) {
            throw new ValidationException("port must be between 1 and 65535");
        }
    }
}
