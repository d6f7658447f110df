package com.eden.gateway.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class MethodNotAllowedException extends GatewayException {

    private final String method;

    public MethodNotAllowedException(String method) {
        super(HttpStatus.METHOD_NOT_ALLOWED, "Method not allowed");
        this.method = method;
    }
}
