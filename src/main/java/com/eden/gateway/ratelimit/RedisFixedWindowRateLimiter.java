package com.eden.gateway.ratelimit;

import com.eden.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Fixed window rate limiter with state shared through Redis, so several gateway
 * replicas enforce one quota per key.
 * The counter is incremented and given its expiry by a single Lua script, so the
 * check and the decrement are atomic on the Redis side.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "gateway.rate-limit.backend", havingValue = "redis")
public class RedisFixedWindowRateLimiter implements RateLimiter {

    static final String KEY_PREFIX = "rate_limit:";

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> fixedWindowScript;
    private final long limit;
    private final Duration window;

    public RedisFixedWindowRateLimiter(StringRedisTemplate redisTemplate, GatewayProperties properties) {
        this.redisTemplate = redisTemplate;
        this.limit = properties.getRateLimit().getLimit();
        this.window = properties.getRateLimit().getWindow();
        // Returns the post-increment count, or -1 when the window is already full.
        // A rejected call leaves the counter untouched.
        this.fixedWindowScript = RedisScript.of(
                "local key = KEYS[1]\n" +
                "local limit = tonumber(ARGV[1])\n" +
                "local window_ms = tonumber(ARGV[2])\n" +
                "\n" +
                "local current = tonumber(redis.call('GET', key) or '0')\n" +
                "if current >= limit then\n" +
                "  return -1\n" +
                "end\n" +
                "\n" +
                "current = redis.call('INCR', key)\n" +
                "if current == 1 then\n" +
                "  redis.call('PEXPIRE', key, window_ms)\n" +
                "end\n" +
                "return current\n",
                Long.class
        );
    }

    @Override
    public boolean allowRequest(String key) {
        try {
            Long count = redisTemplate.execute(
                    fixedWindowScript,
                    List.of(KEY_PREFIX + key),
                    String.valueOf(limit),
                    String.valueOf(window.toMillis())
            );
            return count == null || count >= 0;
        } catch (Exception e) {
            log.error("Error in fixed window rate limiting for key: {}", key, e);
            // Fail open - allow request if Redis fails
            return true;
        }
    }

    @Override
    public RateLimitStatus getStatus(String key) {
        String redisKey = KEY_PREFIX + key;
        long used = 0;
        long resetInMillis = window.toMillis();
        try {
            String value = redisTemplate.opsForValue().get(redisKey);
            used = value != null ? Long.parseLong(value) : 0;
            Long ttl = redisTemplate.getExpire(redisKey, TimeUnit.MILLISECONDS);
            if (ttl != null && ttl > 0) {
                resetInMillis = ttl;
            }
        } catch (Exception e) {
            log.warn("Error getting rate limit status for key: {}", key, e);
        }
        return RateLimitStatus.builder()
                .limit(limit)
                .remaining(Math.max(0, limit - used))
                .resetAt(Instant.now().plusMillis(resetInMillis))
                .resetInMillis(resetInMillis)
                .build();
    }
}
