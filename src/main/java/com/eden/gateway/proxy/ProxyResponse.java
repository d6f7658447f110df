package com.eden.gateway.proxy;

import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpHeaders;

/**
 * What the dispatcher hands back to the client: relayed backend output or a CORS preflight answer
 */
@Value
@Builder
public class ProxyResponse {
    int status;
    HttpHeaders headers;
    byte[] body;
}
