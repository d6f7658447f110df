package com.eden.gateway.transformer;

import com.eden.gateway.proxy.GatewayRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

import java.util.List;

/**
 * Request transformer for modifying headers before a request is forwarded
 */
@Slf4j
public class RequestTransformer {

    private final List<RequestTransformation> transformations;

    public RequestTransformer(List<RequestTransformation> transformations) {
        this.transformations = List.copyOf(transformations);
    }

    /**
     * Apply every transformation whose prefix covers the request path, in declaration order.
     * Removals are applied before additions.
     */
    public GatewayRequest transform(GatewayRequest request) {
        HttpHeaders headers = null;
        for (RequestTransformation transformation : transformations) {
            if (!transformation.appliesTo(request.getPath())) {
                continue;
            }
            if (headers == null) {
                headers = new HttpHeaders();
                headers.addAll(request.getHeaders());
            }
            if (transformation.getHeaderRemovals() != null) {
                transformation.getHeaderRemovals().forEach(headers::remove);
            }
            if (transformation.getHeaderAdditions() != null) {
                transformation.getHeaderAdditions().forEach(headers::set);
            }
            log.debug("Applied header transformation for prefix {} to {}", transformation.getPathPrefix(),
                    request.getPath());
        }
        if (headers == null) {
            return request;
        }
        return request.toBuilder().headers(HttpHeaders.readOnlyHttpHeaders(headers)).build();
    }

    public boolean isEmpty() {
        return transformations.isEmpty();
    }
}
