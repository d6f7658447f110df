package com.eden.gateway.exception;

import org.springframework.http.HttpStatus;

public class UpstreamTimeoutException extends GatewayException {

    public UpstreamTimeoutException(String service, Throwable cause) {
        super(HttpStatus.GATEWAY_TIMEOUT, "Service timeout", service, cause);
    }
}
