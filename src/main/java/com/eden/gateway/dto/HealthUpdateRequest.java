package com.eden.gateway.dto;

import com.eden.gateway.discovery.HealthStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HealthUpdateRequest {
    private HealthStatus health;
}
