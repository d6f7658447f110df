package com.eden.gateway.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base type for every failure the gateway reports to a client.
 * Carries the HTTP status it maps to and, for backend-scoped failures, the service name.
 */
@Getter
public class GatewayException extends RuntimeException {

    private final HttpStatus status;
    private final String service;

    public GatewayException(HttpStatus status, String message) {
        this(status, message, null, null);
    }

    public GatewayException(HttpStatus status, String message, String service) {
        this(status, message, service, null);
    }

    public GatewayException(HttpStatus status, String message, String service, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.service = service;
    }
}
