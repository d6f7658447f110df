package com.eden.gateway.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Admin payload for registering a route
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteRequest {
    private String serviceName;
    private String pathPrefix;
    private String target;
    @Builder.Default
    private List<String> methods = new ArrayList<>();
    private boolean stripPrefix;
}
