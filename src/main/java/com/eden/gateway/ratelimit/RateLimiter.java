package com.eden.gateway.ratelimit;

/**
 * Interface for rate limiting implementations
 */
public interface RateLimiter {
    /**
     * Check if a request is allowed and consume one unit of quota if it is
     * @param key unique identifier (user ID, API key, IP)
     * @return true if request is allowed, false if rate limit is exceeded
     */
    boolean allowRequest(String key);

    /**
     * Current quota for a key, without consuming any
     * @param key unique identifier
     * @return limit, remaining requests and reset time of the current window
     */
    RateLimitStatus getStatus(String key);

    /**
     * Get the remaining quota for a key
     * @param key unique identifier
     * @return remaining requests allowed
     */
    default long getRemainingQuota(String key) {
        return getStatus(key).getRemaining();
    }

    /**
     * Get the time until quota reset in milliseconds
     * @param key unique identifier
     * @return milliseconds until reset, 0 if no reset scheduled
     */
    default long getResetTime(String key) {
        return getStatus(key).getResetInMillis();
    }
}
