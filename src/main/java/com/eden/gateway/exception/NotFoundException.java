package com.eden.gateway.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends GatewayException {

    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}
