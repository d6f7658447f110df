package com.eden.gateway.controller;

import com.eden.gateway.dto.RouteRequest;
import com.eden.gateway.exception.NotFoundException;
import com.eden.gateway.router.Route;
import com.eden.gateway.router.RouteRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Runtime route administration.
 * GET /routes, POST /routes, DELETE /routes?prefix=...
 */
@RestController
@RequestMapping("/routes")
public class RouteAdminController {

    private final RouteRegistry routeRegistry;

    public RouteAdminController(RouteRegistry routeRegistry) {
        this.routeRegistry = routeRegistry;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> getRoutes() {
        List<Route> routes = routeRegistry.getRoutes();
        return ResponseEntity.ok(Map.of(
                "routes", routes,
                "total", routes.size()
        ));
    }

    @PostMapping
    public ResponseEntity<Route> registerRoute(@RequestBody RouteRequest request) {
        Route registered = routeRegistry.registerRoute(Route.builder()
                .serviceName(request.getServiceName())
                .pathPrefix(request.getPathPrefix())
                .target(request.getTarget())
                .methods(request.getMethods() != null ? request.getMethods() : List.of())
                .stripPrefix(request.isStripPrefix())
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(registered);
    }

    @DeleteMapping
    public ResponseEntity<Void> deregisterRoute(@RequestParam("prefix") String prefix) {
        if (!routeRegistry.deregisterRoute(prefix)) {
            throw new NotFoundException("route '" + prefix + "' not found");
        }
        return ResponseEntity.noContent().build();
    }
}
