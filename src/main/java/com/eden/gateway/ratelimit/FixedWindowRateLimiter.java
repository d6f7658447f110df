package com.eden.gateway.ratelimit;

import com.eden.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process fixed window rate limiter.
 * One window per key, created on first use; the whole window resets once its period elapses.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "gateway.rate-limit.backend", havingValue = "memory", matchIfMissing = true)
public class FixedWindowRateLimiter implements RateLimiter {

    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final int limit;
    private final Duration windowLength;
    private final Clock clock;

    @Autowired
    public FixedWindowRateLimiter(GatewayProperties properties) {
        this(properties.getRateLimit().getLimit(), properties.getRateLimit().getWindow(), Clock.systemUTC());
    }

    public FixedWindowRateLimiter(int limit, Duration windowLength, Clock clock) {
        if (limit <= 0) {
            throw new IllegalArgumentException("rate limit must be positive, got " + limit);
        }
        if (windowLength.isZero() || windowLength.isNegative()) {
            throw new IllegalArgumentException("rate limit window must be positive, got " + windowLength);
        }
        this.limit = limit;
        this.windowLength = windowLength;
        this.clock = clock;
    }

    /**
     * Get or create the window for a key
     */
    public Window getRateLimiter(String key) {
        return windows.computeIfAbsent(key, k -> new Window(k, limit, windowLength, clock));
    }

    @Override
    public boolean allowRequest(String key) {
        boolean allowed = getRateLimiter(key).allow();
        if (!allowed) {
            log.debug("Rate limit exceeded for key: {}", key);
        }
        return allowed;
    }

    @Override
    public RateLimitStatus getStatus(String key) {
        return getRateLimiter(key).status();
    }

    /**
     * Counting state for one key. All access is synchronized on the window itself.
     */
    public static final class Window {
        private final String key;
        private final int limit;
        private final Duration length;
        private final Clock clock;
        private int requests;
        private Instant resetAt;

        Window(String key, int limit, Duration length, Clock clock) {
            this.key = key;
            this.limit = limit;
            this.length = length;
            this.clock = clock;
            this.resetAt = clock.instant().plus(length);
        }

        public synchronized boolean allow() {
            Instant now = clock.instant();
            rollIfExpired(now);
            if (requests >= limit) {
                return false;
            }
            requests++;
            return true;
        }

        public synchronized RateLimitStatus status() {
            Instant now = clock.instant();
            boolean expired = !now.isBefore(resetAt);
            long remaining = expired ? limit : Math.max(0, limit - requests);
            Instant windowEnd = expired ? now.plus(length) : resetAt;
            return RateLimitStatus.builder()
                    .limit(limit)
                    .remaining(remaining)
                    .resetAt(windowEnd)
                    .resetInMillis(Duration.between(now, windowEnd).toMillis())
                    .build();
        }

        public String getKey() {
            return key;
        }

        private void rollIfExpired(Instant now) {
            if (!now.isBefore(resetAt)) {
                requests = 0;
                resetAt = now.plus(length);
            }
        }
    }
}
