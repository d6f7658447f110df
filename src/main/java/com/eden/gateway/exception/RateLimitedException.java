package com.eden.gateway.exception;

import com.eden.gateway.ratelimit.RateLimitStatus;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Caller exhausted its quota for the current window
 */
@Getter
public class RateLimitedException extends GatewayException {

    private final String key;
    private final RateLimitStatus rateLimitStatus;

    public RateLimitedException(String key, RateLimitStatus rateLimitStatus) {
        super(HttpStatus.TOO_MANY_REQUESTS, "Rate limit exceeded");
        this.key = key;
        this.rateLimitStatus = rateLimitStatus;
    }
}
