package com.eden.gateway.exception;

import org.springframework.http.HttpStatus;

/**
 * Duplicate route prefix or instance id
 */
public class ConflictException extends GatewayException {

    public ConflictException(String message) {
        super(HttpStatus.CONFLICT, message);
    }
}
