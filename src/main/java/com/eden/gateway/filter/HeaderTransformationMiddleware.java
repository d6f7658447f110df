package com.eden.gateway.filter;

import com.eden.gateway.config.GatewayProperties;
import com.eden.gateway.middleware.MiddlewareContext;
import com.eden.gateway.middleware.MiddlewareHandler;
import com.eden.gateway.proxy.GatewayRequest;
import com.eden.gateway.transformer.RequestTransformation;
import com.eden.gateway.transformer.RequestTransformer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Applies the configured header additions and removals to matching requests
 */
@Component
public class HeaderTransformationMiddleware implements MiddlewareHandler {

    public static final String NAME = "header-transformation";
    public static final int PRIORITY = 50;

    private final RequestTransformer transformer;

    @Autowired
    public HeaderTransformationMiddleware(GatewayProperties properties) {
        this(properties.getTransformations().stream()
                .map(t -> RequestTransformation.builder()
                        .pathPrefix(t.getPathPrefix())
                        .headerAdditions(t.getHeaderAdditions())
                        .headerRemovals(t.getHeaderRemovals())
                        .build())
                .toList());
    }

    public HeaderTransformationMiddleware(List<RequestTransformation> transformations) {
        this.transformer = new RequestTransformer(transformations);
    }

    @Override
    public GatewayRequest handle(MiddlewareContext context, GatewayRequest request) {
        return transformer.transform(request);
    }

    public boolean hasTransformations() {
        return !transformer.isEmpty();
    }
}
