package com.aegis.resilience.fallback;

import java.time.Duration;

/**
 * Settings shared by every fallback handler kind.
 *
 * @param type       the handler kind
 * @param priority   activation order, lower is tried first
 * @param timeout    time budget for serving one request (used by proxy handlers)
 * @param retryAfter how long a handler that failed to activate is skipped
 */
public record FallbackConfig(FallbackType type, int priority, Duration timeout, Duration retryAfter) {

    public static final int DEFAULT_PRIORITY = 1;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(300);

    public FallbackConfig {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (retryAfter == null || retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must not be negative");
        }
    }

    /** Default settings for the given kind (priority 1, 30 s timeout, retry after 300 s). */
    public static FallbackConfig of(FallbackType type) {
        return of(type, DEFAULT_PRIORITY);
    }

    /** Default settings for the given kind with an explicit priority. */
    public static FallbackConfig of(FallbackType type, int priority) {
        return new FallbackConfig(type, priority, DEFAULT_TIMEOUT, DEFAULT_RETRY_AFTER);
    }
}
