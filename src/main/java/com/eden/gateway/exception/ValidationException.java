package com.eden.gateway.exception;

import org.springframework.http.HttpStatus;

/**
 * Missing or malformed registration input
 */
public class ValidationException extends GatewayException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
