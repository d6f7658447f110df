package com.eden.gateway.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON body of every gateway-generated error.
 * Only {@code error} is always present.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private String error;
    private String message;
    private String service;
    private String method;
    private String path;

    @JsonProperty("retry_after")
    private Long retryAfter;

    public static ErrorResponse of(String error) {
        return ErrorResponse.builder().error(error).build();
    }
}
