package com.eden.gateway.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis configuration for distributed rate limiting.
 * Only active when the Redis rate limit backend is selected.
 */
@Configuration
@ConditionalOnProperty(name = "gateway.rate-limit.backend", havingValue = "redis")
public class RedisConfig {

    /**
     * Counters are plain strings so INCR works and keys stay readable in redis-cli
     */
    @Bean
    public StringRedisTemplate rateLimitRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }
}
