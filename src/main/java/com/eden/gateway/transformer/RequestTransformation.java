package com.eden.gateway.transformer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request transformation configuration
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequestTransformation {
    private String pathPrefix;                   // Requests this applies to
    private Map<String, String> headerAdditions; // Headers to add
    private List<String> headerRemovals;         // Headers to remove

    public boolean appliesTo(String path) {
        return pathPrefix == null || pathPrefix.isBlank() || path.startsWith(pathPrefix);
    }
}
