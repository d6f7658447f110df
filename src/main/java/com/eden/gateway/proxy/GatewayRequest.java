package com.eden.gateway.proxy;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import org.springframework.http.HttpHeaders;

/**
 * An inbound request as seen by the middleware chain and the dispatcher.
 * Immutable; middlewares return modified copies.
 */
@Value
@Builder(toBuilder = true)
public class GatewayRequest {
    String id;
    String method;
    String path;
    String query;
    HttpHeaders headers;
    @With
    byte[] body;
    String callerKey;
    String clientIp;
    String remoteAddress;
    String scheme;
    String host;

    public String header(String name) {
        return headers.getFirst(name);
    }

    /**
     * Copy of this request with one header set, replacing any previous values
     */
    public GatewayRequest withHeader(String name, String value) {
        HttpHeaders copy = copyHeaders();
        copy.set(name, value);
        return toBuilder().headers(HttpHeaders.readOnlyHttpHeaders(copy)).build();
    }

    /**
     * Copy of this request without the named header
     */
    public GatewayRequest withoutHeader(String name) {
        HttpHeaders copy = copyHeaders();
        copy.remove(name);
        return toBuilder().headers(HttpHeaders.readOnlyHttpHeaders(copy)).build();
    }

    private HttpHeaders copyHeaders() {
        HttpHeaders copy = new HttpHeaders();
        copy.addAll(headers);
        return copy;
    }
}
