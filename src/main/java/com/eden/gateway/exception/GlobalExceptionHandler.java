package com.eden.gateway.exception;

import com.eden.gateway.ratelimit.RateLimitStatus;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler for the gateway.
 *
 * Renders every {@link GatewayException} as an {@link ErrorResponse}; anything else
 * becomes a bare 500 so no internal detail reaches the client.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<ErrorResponse> handleRateLimited(RateLimitedException ex) {
        RateLimitStatus status = ex.getRateLimitStatus();
        long retryAfterSeconds = Math.max(1, (status.getResetInMillis() + 999) / 1000);

        HttpHeaders headers = new HttpHeaders();
        headers.set("X-RateLimit-Limit", String.valueOf(status.getLimit()));
        headers.set("X-RateLimit-Remaining", String.valueOf(status.getRemaining()));
        headers.set("X-RateLimit-Reset", String.valueOf(status.getResetInMillis()));
        headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds));

        ErrorResponse body = ErrorResponse.builder()
                .error(ex.getMessage())
                .message("Too many requests, please try again later")
                .retryAfter(retryAfterSeconds)
                .build();
        return respond(ex.getStatus(), headers, body);
    }

    @ExceptionHandler(MethodNotAllowedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotAllowed(MethodNotAllowedException ex) {
        ErrorResponse body = ErrorResponse.builder()
                .error(ex.getMessage())
                .method(ex.getMethod())
                .build();
        return respond(ex.getStatus(), new HttpHeaders(), body);
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ErrorResponse> handleGatewayException(GatewayException ex, HttpServletRequest request) {
        if (ex.getStatus().is5xxServerError()) {
            log.warn("{} {} failed with {}: {}", request.getMethod(), request.getRequestURI(),
                    ex.getStatus().value(), ex.getCause() != null ? ex.getCause().toString() : ex.getMessage());
        } else {
            log.debug("{} {} rejected with {}: {}", request.getMethod(), request.getRequestURI(),
                    ex.getStatus().value(), ex.getMessage());
        }

        ErrorResponse body = ErrorResponse.builder()
                .error(ex.getMessage())
                .service(ex.getService())
                .build();
        if (ex instanceof NotFoundException && ex.getService() == null) {
            body.setPath(request.getRequestURI());
        }
        return respond(ex.getStatus(), new HttpHeaders(), body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.debug("Malformed request body: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, new HttpHeaders(), ErrorResponse.of("Malformed request body"));
    }

    /**
     * MVC binding and negotiation failures (missing parameter, unsupported media type, ...)
     * keep the status Spring assigns them
     */
    @ExceptionHandler({ServletException.class, ErrorResponseException.class})
    public ResponseEntity<ErrorResponse> handleFrameworkException(Exception ex, HttpServletRequest request) {
        if (!(ex instanceof org.springframework.web.ErrorResponse)) {
            return handleUnexpected(ex, request);
        }
        org.springframework.web.ErrorResponse frameworkError = (org.springframework.web.ErrorResponse) ex;
        HttpStatusCode status = frameworkError.getStatusCode();
        log.debug("{} {} rejected with {}: {}", request.getMethod(), request.getRequestURI(), status.value(),
                ex.getMessage());

        HttpStatus resolved = HttpStatus.resolve(status.value());
        HttpHeaders headers = new HttpHeaders();
        headers.addAll(frameworkError.getHeaders());
        ErrorResponse body = ErrorResponse.builder()
                .error(resolved != null ? resolved.getReasonPhrase() : "Request failed")
                .message(frameworkError.getBody().getDetail())
                .build();
        return respond(status, headers, body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception for {} {}", request.getMethod(), request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, new HttpHeaders(), ErrorResponse.of("Internal server error"));
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatusCode status, HttpHeaders headers, ErrorResponse body) {
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new ResponseEntity<>(body, headers, status);
    }
}
