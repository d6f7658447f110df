package com.eden.gateway.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Thrown by a middleware handler to abort the chain.
 * The dispatcher answers with the status carried here.
 */
@Getter
public class MiddlewareRejectedException extends GatewayException {

    private final String middleware;

    public MiddlewareRejectedException(String middleware, HttpStatus status, String message) {
        super(status, message);
        this.middleware = middleware;
    }

    public MiddlewareRejectedException(String middleware, String message) {
        this(middleware, HttpStatus.FORBIDDEN, message);
    }
}
