package com.eden.gateway.ratelimit;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Snapshot of one caller's window
 */
@Value
@Builder
public class RateLimitStatus {
    long limit;
    long remaining;
    @JsonProperty("reset_at")
    Instant resetAt;
    @JsonProperty("reset_in_ms")
    long resetInMillis;
}
