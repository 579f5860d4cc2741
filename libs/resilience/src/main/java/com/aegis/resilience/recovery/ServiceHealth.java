package com.aegis.resilience.recovery;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Mutable per-service health and circuit state. Owned by {@link ErrorRecoveryManager} and only
 * touched while holding its lock; everything outside the package sees
 * {@link ServiceHealthSnapshot}s.
 */
final class ServiceHealth {

    static final int MAX_RECENT_ERRORS = 10;

    final String name;
    boolean essential;
    boolean fallbackAvailable;

    ServiceStatus status = ServiceStatus.HEALTHY;
    CircuitState circuitState = CircuitState.CLOSED;
    int failureCount;
    int recoveryAttempts;
    int halfOpenCalls;
    long totalFailures;
    long totalRecoveries;
    Instant lastFailure;
    Instant lastSuccess;
    Instant circuitOpenedAt;
    Instant halfOpenedAt;
    private final Deque<String> recentErrors = new ArrayDeque<>();

    ServiceHealth(String name, boolean essential, boolean fallbackAvailable) {
        this.name = name;
        this.essential = essential;
        this.fallbackAvailable = fallbackAvailable;
    }

    void recordFailure(String message, Instant now) {
        failureCount++;
        totalFailures++;
        lastFailure = now;
        recentErrors.addLast(message);
        while (recentErrors.size() > MAX_RECENT_ERRORS) {
            recentErrors.removeFirst();
        }
    }

    void open(Instant now) {
        circuitState = CircuitState.OPEN;
        circuitOpenedAt = now;
        halfOpenedAt = null;
        status = ServiceStatus.CIRCUIT_OPEN;
        recoveryAttempts = 0;
        halfOpenCalls = 0;
    }

    void halfOpen(Instant now) {
        circuitState = CircuitState.HALF_OPEN;
        halfOpenedAt = now;
        status = ServiceStatus.RECOVERING;
        recoveryAttempts = 0;
        halfOpenCalls = 0;
    }

    void close() {
        circuitState = CircuitState.CLOSED;
        circuitOpenedAt = null;
        halfOpenedAt = null;
        status = ServiceStatus.HEALTHY;
        failureCount = 0;
        recoveryAttempts = 0;
        halfOpenCalls = 0;
        totalRecoveries++;
    }

    ServiceHealthSnapshot snapshot() {
        return new ServiceHealthSnapshot(name, status, circuitState, failureCount, recoveryAttempts,
                totalFailures, totalRecoveries, lastFailure, lastSuccess, circuitOpenedAt, essential,
                fallbackAvailable, List.copyOf(recentErrors));
    }
}
