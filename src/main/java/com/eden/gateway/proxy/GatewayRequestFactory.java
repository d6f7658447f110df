package com.eden.gateway.proxy;

import com.eden.gateway.config.GatewayProperties;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.util.Collections;
import java.util.Locale;
import java.util.UUID;

/**
 * Builds the immutable {@link GatewayRequest} view of a servlet request
 */
@Component
public class GatewayRequestFactory {

    private final GatewayProperties properties;

    public GatewayRequestFactory(GatewayProperties properties) {
        this.properties = properties;
    }

    public GatewayRequest from(HttpServletRequest request) throws IOException {
        HttpHeaders headers = new HttpHeaders();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.addAll(name, Collections.list(request.getHeaders(name)));
        }

        String clientIp = extractClientIp(request);
        return GatewayRequest.builder()
                .id(UUID.randomUUID().toString())
                .method(request.getMethod().toUpperCase(Locale.ROOT))
                .path(request.getRequestURI())
                .query(request.getQueryString())
                .headers(HttpHeaders.readOnlyHttpHeaders(headers))
                .body(StreamUtils.copyToByteArray(request.getInputStream()))
                .clientIp(clientIp)
                .remoteAddress(request.getRemoteAddr())
                .callerKey(extractLimitKey(request, clientIp))
                .scheme(request.getScheme())
                .host(request.getHeader(HttpHeaders.HOST))
                .build();
    }

    private String extractLimitKey(HttpServletRequest request, String clientIp) {
        String keyHeader = properties.getRateLimit().getKeyHeader();
        String key = keyHeader != null ? request.getHeader(keyHeader) : null;
        return key != null && !key.isBlank() ? key : clientIp;
    }

    /**
     * First entry of X-Forwarded-For when the gateway sits behind another proxy,
     * otherwise the TCP peer address
     */
    private String extractClientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
