package com.eden.gateway.proxy;

import com.eden.gateway.config.GatewayProperties;
import com.eden.gateway.discovery.LoadBalancer;
import com.eden.gateway.exception.GatewayException;
import com.eden.gateway.exception.MethodNotAllowedException;
import com.eden.gateway.exception.NotFoundException;
import com.eden.gateway.exception.RateLimitedException;
import com.eden.gateway.exception.UpstreamTimeoutException;
import com.eden.gateway.exception.UpstreamUnreachableException;
import com.eden.gateway.filter.CorrelationIdMiddleware;
import com.eden.gateway.middleware.MiddlewareChain;
import com.eden.gateway.middleware.MiddlewareContext;
import com.eden.gateway.monitoring.GatewayMetrics;
import com.eden.gateway.ratelimit.RateLimitStatus;
import com.eden.gateway.ratelimit.RateLimiter;
import com.eden.gateway.router.Route;
import com.eden.gateway.router.RouteRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Reverse proxy for every request not handled by an explicit controller.
 *
 * Steps: CORS preflight short-circuit, route lookup, method guard, middleware chain,
 * rate limit, target selection, forward, response header filtering. Each request
 * gets exactly one backend attempt.
 */
@Slf4j
@Component
public class ProxyDispatcher {

    /**
     * Framing headers the JDK client sets itself or refuses to accept
     */
    private static final Set<String> CLIENT_MANAGED_HEADERS = Set.of(
            "content-length", "expect", "transfer-encoding", "keep-alive", "te", "trailer"
    );

    private static final String TRANSFER_ENCODING = "transfer-encoding";

    private final RouteRegistry routeRegistry;
    private final MiddlewareChain middlewareChain;
    private final RateLimiter rateLimiter;
    private final LoadBalancer loadBalancer;
    private final HttpClient httpClient;
    private final GatewayMetrics metrics;
    private final GatewayProperties properties;
    private final Set<String> hopByHopHeaders;
    private final Set<String> gatewayOwnedHeaders;

    public ProxyDispatcher(RouteRegistry routeRegistry,
                           MiddlewareChain middlewareChain,
                           RateLimiter rateLimiter,
                           LoadBalancer loadBalancer,
                           HttpClient proxyHttpClient,
                           GatewayMetrics metrics,
                           GatewayProperties properties) {
        this.routeRegistry = routeRegistry;
        this.middlewareChain = middlewareChain;
        this.rateLimiter = rateLimiter;
        this.loadBalancer = loadBalancer;
        this.httpClient = proxyHttpClient;
        this.metrics = metrics;
        this.properties = properties;
        this.hopByHopHeaders = lowerCased(properties.getProxy().getHopByHopHeaders());
        this.gatewayOwnedHeaders = properties.getSecurityHeaders().isEnabled()
                ? lowerCased(properties.getSecurityHeaders().getHeaders().keySet())
                : Set.of();
    }

    public ProxyResponse dispatch(GatewayRequest request) {
        if (isPreflight(request)) {
            return preflightResponse(request);
        }

        Route route = routeRegistry.findRoute(request.getPath())
                .orElseThrow(() -> new NotFoundException("Endpoint not found"));

        if (!route.allowsMethod(request.getMethod())) {
            log.debug("Method {} not allowed on {}", request.getMethod(), route.getPathPrefix());
            throw new MethodNotAllowedException(request.getMethod());
        }

        metrics.requestStarted();
        long started = System.nanoTime();
        int status = HttpStatus.INTERNAL_SERVER_ERROR.value();
        try {
            ProxyResponse response = proxy(route, request);
            status = response.getStatus();
            return response;
        } catch (GatewayException e) {
            status = e.getStatus().value();
            throw e;
        } finally {
            metrics.requestFinished();
            metrics.recordProxyRequest(route.getServiceName(), request.getMethod(), status,
                    System.nanoTime() - started);
        }
    }

    private ProxyResponse proxy(Route route, GatewayRequest request) {
        MiddlewareContext context = MiddlewareContext.forRoute(route);
        GatewayRequest processed = middlewareChain.runChain(context, request);

        RateLimitStatus quota = null;
        if (properties.getRateLimit().isEnabled()) {
            String limitKey = processed.getCallerKey();
            if (!rateLimiter.allowRequest(limitKey)) {
                log.warn("Rate limit exceeded for key: {}", limitKey);
                metrics.recordRateLimited(route.getServiceName());
                throw new RateLimitedException(limitKey, rateLimiter.getStatus(limitKey));
            }
            quota = rateLimiter.getStatus(limitKey);
        }

        String baseUrl = loadBalancer.resolveTarget(route);
        ProxyResponse upstream = forward(route, baseUrl, processed);

        HttpHeaders headers = new HttpHeaders();
        headers.addAll(upstream.getHeaders());
        if (quota != null) {
            headers.set("X-RateLimit-Limit", String.valueOf(quota.getLimit()));
            headers.set("X-RateLimit-Remaining", String.valueOf(quota.getRemaining()));
            headers.set("X-RateLimit-Reset", String.valueOf(quota.getResetInMillis()));
        }
        String correlationId = CorrelationIdMiddleware.getCorrelationId(context);
        if (correlationId != null) {
            headers.set(CorrelationIdMiddleware.CORRELATION_ID_HEADER, correlationId);
        }
        String origin = request.header(HttpHeaders.ORIGIN);
        if (origin != null && !headers.containsKey(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN)) {
            headers.set(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, origin);
            headers.add(HttpHeaders.VARY, HttpHeaders.ORIGIN);
        }
        return ProxyResponse.builder()
                .status(upstream.getStatus())
                .headers(headers)
                .body(upstream.getBody())
                .build();
    }

    private ProxyResponse forward(Route route, String baseUrl, GatewayRequest request) {
        URI uri;
        HttpRequest outbound;
        try {
            uri = targetUri(route, baseUrl, request);
            outbound = buildOutboundRequest(uri, request);
        } catch (IllegalArgumentException e) {
            log.warn("Cannot build upstream request for service {} from {}: {}", route.getServiceName(), baseUrl,
                    e.getMessage());
            throw new UpstreamUnreachableException(route.getServiceName(), e);
        }
        Duration timeout = properties.getProxy().getTimeout();

        log.debug("Proxying {} {} -> {}", request.getMethod(), request.getPath(), uri);

        CompletableFuture<HttpResponse<byte[]>> pending =
                httpClient.sendAsync(outbound, HttpResponse.BodyHandlers.ofByteArray());
        try {
            HttpResponse<byte[]> response = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return ProxyResponse.builder()
                    .status(response.statusCode())
                    .headers(filterResponseHeaders(response.headers()))
                    .body(response.body())
                    .build();
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new UpstreamTimeoutException(route.getServiceName(), e);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new GatewayException(HttpStatus.SERVICE_UNAVAILABLE, "Request cancelled", route.getServiceName(), e);
        } catch (ExecutionException e) {
            throw mapFailure(route, e.getCause() != null ? e.getCause() : e);
        }
    }

    private GatewayException mapFailure(Route route, Throwable failure) {
        if (failure instanceof HttpConnectTimeoutException) {
            return new UpstreamUnreachableException(route.getServiceName(), failure);
        }
        if (failure instanceof HttpTimeoutException) {
            return new UpstreamTimeoutException(route.getServiceName(), failure);
        }
        if (failure instanceof IOException) {
            return new UpstreamUnreachableException(route.getServiceName(), failure);
        }
        log.error("Unexpected proxy failure for service {}", route.getServiceName(), failure);
        return new UpstreamUnreachableException(route.getServiceName(), failure);
    }

    private URI targetUri(Route route, String baseUrl, GatewayRequest request) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String query = request.getQuery();
        return URI.create(base + route.forwardPath(request.getPath())
                + (query != null && !query.isEmpty() ? "?" + query : ""));
    }

    private HttpRequest buildOutboundRequest(URI uri, GatewayRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(properties.getProxy().getTimeout());

        request.getHeaders().forEach((name, values) -> {
            if (shouldForwardRequestHeader(name)) {
                values.forEach(value -> builder.header(name, value));
            }
        });

        String forwardedFor = request.header("X-Forwarded-For");
        if (request.getRemoteAddress() != null) {
            builder.setHeader("X-Forwarded-For", forwardedFor != null
                    ? forwardedFor + ", " + request.getRemoteAddress()
                    : request.getRemoteAddress());
        } else if (forwardedFor != null) {
            builder.setHeader("X-Forwarded-For", forwardedFor);
        }
        if (request.getHost() != null && request.header("X-Forwarded-Host") == null) {
            builder.setHeader("X-Forwarded-Host", request.getHost());
        }
        if (request.getScheme() != null && request.header("X-Forwarded-Proto") == null) {
            builder.setHeader("X-Forwarded-Proto", request.getScheme());
        }

        byte[] body = request.getBody();
        HttpRequest.BodyPublisher publisher = body == null || body.length == 0
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(body);
        return builder.method(request.getMethod(), publisher).build();
    }

    private boolean shouldForwardRequestHeader(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return !hopByHopHeaders.contains(lower)
                && !CLIENT_MANAGED_HEADERS.contains(lower)
                && !lower.equals("x-forwarded-for");
    }

    private HttpHeaders filterResponseHeaders(java.net.http.HttpHeaders upstreamHeaders) {
        HttpHeaders headers = new HttpHeaders();
        upstreamHeaders.map().forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            // HTTP/2 pseudo-headers never go back to an HTTP/1.1 client
            if (lower.startsWith(":") || lower.equals(TRANSFER_ENCODING) || hopByHopHeaders.contains(lower)
                    || gatewayOwnedHeaders.contains(lower)) {
                return;
            }
            headers.addAll(name, values);
        });
        return headers;
    }

    private static Set<String> lowerCased(Collection<String> names) {
        return names.stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    private boolean isPreflight(GatewayRequest request) {
        return HttpMethod.OPTIONS.matches(request.getMethod())
                && request.header(HttpHeaders.ORIGIN) != null
                && request.header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD) != null;
    }

    private ProxyResponse preflightResponse(GatewayRequest request) {
        GatewayProperties.Cors cors = properties.getCors();
        String requestedHeaders = request.header(HttpHeaders.ACCESS_CONTROL_REQUEST_HEADERS);

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, request.header(HttpHeaders.ORIGIN));
        headers.set(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, String.join(", ", cors.getAllowedMethods()));
        headers.set(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS,
                requestedHeaders != null && !requestedHeaders.isBlank()
                        ? requestedHeaders
                        : String.join(", ", cors.getAllowedHeaders()));
        headers.set(HttpHeaders.ACCESS_CONTROL_MAX_AGE, String.valueOf(cors.getMaxAge().toSeconds()));
        headers.add(HttpHeaders.VARY, HttpHeaders.ORIGIN);

        log.debug("Answered CORS preflight for {} from {}", request.getPath(), request.header(HttpHeaders.ORIGIN));
        return ProxyResponse.builder()
                .status(HttpStatus.OK.value())
                .headers(headers)
                .body(new byte[0])
                .build();
    }
}
