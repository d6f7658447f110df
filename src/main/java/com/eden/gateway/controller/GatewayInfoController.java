package com.eden.gateway.controller;

import com.eden.gateway.discovery.ServiceInstance;
import com.eden.gateway.discovery.ServiceRegistry;
import com.eden.gateway.monitoring.GatewayMetrics;
import com.eden.gateway.ratelimit.RateLimiter;
import com.eden.gateway.router.Route;
import com.eden.gateway.router.RouteRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway Information Controller.
 * Self health, service listing and registry-derived service health.
 */
@RestController
public class GatewayInfoController {

    static final String VERSION = "1.0.0";

    private final RouteRegistry routeRegistry;
    private final ServiceRegistry serviceRegistry;
    private final RateLimiter rateLimiter;
    private final GatewayMetrics metrics;

    public GatewayInfoController(RouteRegistry routeRegistry, ServiceRegistry serviceRegistry,
                                 RateLimiter rateLimiter, GatewayMetrics metrics) {
        this.routeRegistry = routeRegistry;
        this.serviceRegistry = serviceRegistry;
        this.rateLimiter = rateLimiter;
        this.metrics = metrics;
    }

    /**
     * GET /health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("service", "api-gateway");
        status.put("status", "healthy");
        status.put("timestamp", System.currentTimeMillis());
        status.put("version", VERSION);
        return ResponseEntity.ok(status);
    }

    /**
     * GET /health/details
     */
    @GetMapping("/health/details")
    public ResponseEntity<Map<String, Object>> healthDetails() {
        Map<String, Object> runtime = new LinkedHashMap<>();
        runtime.put("activeRequests", metrics.getActiveRequests());
        runtime.put("uptime", metrics.getUptime().toMillis());
        runtime.put("routes", routeRegistry.getRoutes().size());

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("service", "api-gateway");
        status.put("status", "healthy");
        status.put("version", VERSION);
        status.put("timestamp", System.currentTimeMillis());
        status.put("metrics", runtime);
        return ResponseEntity.ok(status);
    }

    /**
     * GET /services
     */
    @GetMapping("/services")
    public ResponseEntity<Map<String, Object>> services() {
        List<Map<String, Object>> services = new ArrayList<>();
        for (Route route : routeRegistry.getRoutes()) {
            List<ServiceInstance> instances = serviceRegistry.getInstances(route.getServiceName());
            Map<String, Object> service = new LinkedHashMap<>();
            service.put("name", route.getServiceName());
            service.put("target", route.getTarget());
            service.put("api_prefix", route.getPathPrefix());
            service.put("methods", route.getMethods());
            service.put("instances", instances.size());
            service.put("healthy_instances", instances.stream().filter(ServiceInstance::isHealthy).count());
            services.add(service);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("services", services);
        response.put("total", services.size());
        return ResponseEntity.ok(response);
    }

    /**
     * GET /services/health
     *
     * Derived from the service registry only. A service without registered
     * instances is served by its static target and reported as "static".
     */
    @GetMapping("/services/health")
    public ResponseEntity<Map<String, Object>> servicesHealth() {
        List<Map<String, Object>> checks = new ArrayList<>();
        routeRegistry.getRoutes().stream()
                .map(Route::getServiceName)
                .distinct()
                .forEach(name -> checks.add(serviceHealth(name)));

        long healthy = checks.stream()
                .filter(c -> !"unhealthy".equals(c.get("status")))
                .count();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("overall_status", healthy == checks.size() ? "healthy" : "degraded");
        response.put("healthy_services", healthy);
        response.put("total_services", checks.size());
        response.put("services", checks);
        response.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(response);
    }

    /**
     * GET /rate-limits/{key}
     */
    @GetMapping("/rate-limits/{key}")
    public ResponseEntity<Object> rateLimitStatus(@PathVariable("key") String key) {
        return ResponseEntity.ok(rateLimiter.getStatus(key));
    }

    private Map<String, Object> serviceHealth(String serviceName) {
        List<ServiceInstance> instances = serviceRegistry.getInstances(serviceName);
        long healthyInstances = instances.stream().filter(ServiceInstance::isHealthy).count();

        String status;
        if (instances.isEmpty()) {
            status = "static";
        } else {
            status = healthyInstances > 0 ? "healthy" : "unhealthy";
        }

        Map<String, Object> check = new LinkedHashMap<>();
        check.put("service", serviceName);
        check.put("status", status);
        check.put("instances", instances.size());
        check.put("healthy_instances", healthyInstances);
        return check;
    }
}
