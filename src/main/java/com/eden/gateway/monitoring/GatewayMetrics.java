package com.eden.gateway.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Proxy metrics: request latency per backend service and status, rate limit
 * rejections and the number of requests currently being proxied.
 */
@Component
public class GatewayMetrics {

    public static final String PROXY_TIMER = "gateway.proxy.requests";
    public static final String RATE_LIMIT_COUNTER = "gateway.ratelimit.exceeded";
    public static final String ACTIVE_REQUESTS_GAUGE = "gateway.requests.active";

    private final MeterRegistry meterRegistry;
    private final AtomicInteger activeRequests = new AtomicInteger();
    private final Instant startedAt = Instant.now();

    public GatewayMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        Gauge.builder(ACTIVE_REQUESTS_GAUGE, activeRequests, AtomicInteger::get)
                .description("Requests currently being proxied")
                .register(meterRegistry);
    }

    public void requestStarted() {
        activeRequests.incrementAndGet();
    }

    public void requestFinished() {
        activeRequests.decrementAndGet();
    }

    public void recordProxyRequest(String service, String method, int status, long durationNanos) {
        Timer.builder(PROXY_TIMER)
                .description("Proxied requests by backend service and response status")
                .tag("service", service)
                .tag("method", method)
                .tag("status", String.valueOf(status))
                .register(meterRegistry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordRateLimited(String service) {
        Counter.builder(RATE_LIMIT_COUNTER)
                .description("Requests rejected by the rate limiter")
                .tag("service", service)
                .register(meterRegistry)
                .increment();
    }

    public int getActiveRequests() {
        return activeRequests.get();
    }

    public Duration getUptime() {
        return Duration.between(startedAt, Instant.now());
    }
}
