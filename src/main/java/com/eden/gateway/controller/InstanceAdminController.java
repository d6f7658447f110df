package com.eden.gateway.controller;

import com.eden.gateway.discovery.ServiceInstance;
import com.eden.gateway.discovery.ServiceRegistry;
import com.eden.gateway.dto.HealthUpdateRequest;
import com.eden.gateway.dto.InstanceRequest;
import com.eden.gateway.exception.ValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Service discovery endpoints used by backends and by the external health checker
 */
@RestController
public class InstanceAdminController {

    private final ServiceRegistry serviceRegistry;

    public InstanceAdminController(ServiceRegistry serviceRegistry) {
        this.serviceRegistry = serviceRegistry;
    }

    /**
     * POST /services/{service}/instances
     */
    @PostMapping("/services/{service}/instances")
    public ResponseEntity<ServiceInstance> registerInstance(@PathVariable("service") String service,
                                                            @RequestBody InstanceRequest request) {
        ServiceInstance registered = serviceRegistry.registerInstance(ServiceInstance.builder()
                .id(request.getId())
                .serviceName(service)
                .address(request.getAddress())
                .port(request.getPort())
                .health(request.getHealth())
                .metadata(request.getMetadata() != null ? request.getMetadata() : Map.of())
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(registered);
    }

    /**
     * GET /services/{service}/instances
     */
    @GetMapping("/services/{service}/instances")
    public ResponseEntity<Map<String, Object>> getInstances(@PathVariable("service") String service) {
        List<ServiceInstance> instances = serviceRegistry.getInstances(service);
        return ResponseEntity.ok(Map.of(
                "service", service,
                "instances", instances,
                "total", instances.size()
        ));
    }

    /**
     * PUT /instances/{id}/health
     */
    @PutMapping("/instances/{id}/health")
    public ResponseEntity<ServiceInstance> updateHealth(@PathVariable("id") String id,
                                                        @RequestBody HealthUpdateRequest request) {
        if (request.getHealth() == null) {
            throw new ValidationException("health is required");
        }
        return ResponseEntity.ok(serviceRegistry.updateInstanceHealth(id, request.getHealth()));
    }

    /**
     * DELETE /instances/{id}
     */
    @DeleteMapping("/instances/{id}")
    public ResponseEntity<Void> deregisterInstance(@PathVariable("id") String id) {
        serviceRegistry.deregisterInstance(id);
        return ResponseEntity.noContent().build();
    }
}
