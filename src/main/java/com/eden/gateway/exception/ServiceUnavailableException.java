package com.eden.gateway.exception;

import org.springframework.http.HttpStatus;

/**
 * No healthy instance is available for a service
 */
public class ServiceUnavailableException extends GatewayException {

    public ServiceUnavailableException(String service) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "Service not available", service);
    }
}
