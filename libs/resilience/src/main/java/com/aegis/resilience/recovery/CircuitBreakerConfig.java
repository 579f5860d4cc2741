package com.aegis.resilience.recovery;

import java.time.Duration;

/**
 * Process-wide circuit breaker settings shared by every service.
 *
 * @param failureThreshold failures (without intervening success) that open the circuit
 * @param recoveryTimeout  how long an open circuit rejects calls before going half-open
 * @param halfOpenMaxCalls calls let through while half-open; at least {@code successThreshold}
 * @param successThreshold successes while half-open required to close the circuit
 */
public record CircuitBreakerConfig(
        int failureThreshold,
        Duration recoveryTimeout,
        int halfOpenMaxCalls,
        int successThreshold
) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_HALF_OPEN_MAX_CALLS = 3;
    public static final int DEFAULT_SUCCESS_THRESHOLD = 2;

    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative() || recoveryTimeout.isZero()) {
            throw new IllegalArgumentException("recoveryTimeout must be positive");
        }
        if (halfOpenMaxCalls <= 0) {
            throw new IllegalArgumentException("halfOpenMaxCalls must be positive");
        }
        if (successThreshold <= 0) {
            throw new IllegalArgumentException("successThreshold must be positive");
        }
        if (successThreshold > halfOpenMaxCalls) {
            throw new IllegalArgumentException("successThreshold must not exceed halfOpenMaxCalls");
        }
    }

    /** The default settings: 5 failures, 60 s timeout, 3 half-open calls, 2 successes. */
    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(DEFAULT_FAILURE_THRESHOLD, DEFAULT_RECOVERY_TIMEOUT,
                DEFAULT_HALF_OPEN_MAX_CALLS, DEFAULT_SUCCESS_THRESHOLD);
    }

    /** Returns a copy with a different failure threshold. */
    public CircuitBreakerConfig withFailureThreshold(int threshold) {
        return new CircuitBreakerConfig(threshold, recoveryTimeout, halfOpenMaxCalls, successThreshold);
    }

    /** Returns a copy with a different recovery timeout. */
    public CircuitBreakerConfig withRecoveryTimeout(Duration timeout) {
        return new CircuitBreakerConfig(failureThreshold, timeout, halfOpenMaxCalls, successThreshold);
    }
}
