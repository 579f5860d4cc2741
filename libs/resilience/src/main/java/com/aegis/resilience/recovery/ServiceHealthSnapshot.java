package com.aegis.resilience.recovery;

import java.time.Instant;
import java.util.List;

/**
 * Immutable view of a service's health at a point in time.
 *
 * @param name              service name
 * @param status            current status
 * @param circuitState      circuit breaker state
 * @param failureCount      failures counted toward the threshold
 * @param recoveryAttempts  successes recorded while half-open
 * @param totalFailures     failures reported since registration
 * @param totalRecoveries   times the circuit closed after being open
 * @param lastFailure       time of the last failure, or null
 * @param lastSuccess       time of the last success, or null
 * @param circuitOpenedAt   when the circuit last opened, or null while closed
 * @param essential         whether the service is essential
 * @param fallbackAvailable whether a fallback can be activated for the service
 * @param recentErrors      the most recent error messages, oldest first (at most 10)
 */
public record ServiceHealthSnapshot(
        String name,
        ServiceStatus status,
        CircuitState circuitState,
        int failureCount,
        int recoveryAttempts,
        long totalFailures,
        long totalRecoveries,
        Instant lastFailure,
        Instant lastSuccess,
        Instant circuitOpenedAt,
        boolean essential,
        boolean fallbackAvailable,
        List<String> recentErrors
) {

    public ServiceHealthSnapshot {
        recentErrors = List.copyOf(recentErrors);
    }
}
