package com.eden.gateway.proxy;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;

/**
 * Catch-all entry point.
 *
 * Every request that doesn't match a more specific mapping (health, service
 * listing, admin endpoints) is turned into a {@link GatewayRequest} and handed to
 * the {@link ProxyDispatcher}. Failures surface as gateway exceptions and are
 * rendered by the global exception handler.
 */
@RestController
@Order(Ordered.LOWEST_PRECEDENCE)
public class ProxyController {

    private final ProxyDispatcher dispatcher;
    private final GatewayRequestFactory requestFactory;

    public ProxyController(ProxyDispatcher dispatcher, GatewayRequestFactory requestFactory) {
        this.dispatcher = dispatcher;
        this.requestFactory = requestFactory;
    }

    @RequestMapping(value = "/**", method = {
            RequestMethod.GET, RequestMethod.HEAD, RequestMethod.POST, RequestMethod.PUT,
            RequestMethod.PATCH, RequestMethod.DELETE, RequestMethod.OPTIONS
    })
    public ResponseEntity<byte[]> proxy(HttpServletRequest request) throws IOException {
        ProxyResponse response = dispatcher.dispatch(requestFactory.from(request));
        return ResponseEntity.status(response.getStatus())
                .headers(response.getHeaders())
                .body(response.getBody());
    }
}
