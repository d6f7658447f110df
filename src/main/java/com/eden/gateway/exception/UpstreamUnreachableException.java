package com.eden.gateway.exception;

import org.springframework.http.HttpStatus;

/**
 * Connection refused, DNS failure or any other transport error talking to a backend
 */
public class UpstreamUnreachableException extends GatewayException {

    public UpstreamUnreachableException(String service, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, "Service error", service, cause);
    }
}
