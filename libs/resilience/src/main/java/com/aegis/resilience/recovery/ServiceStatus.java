package com.aegis.resilience.recovery;

/**
 * Health status of a registered service as tracked by the {@link ErrorRecoveryManager}.
 */
public enum ServiceStatus {

    /** Serving normally. */
    HEALTHY,

    /** Failing, but a fallback is serving in its place. */
    DEGRADED,

    /** Failing with nothing substituting for it. */
    FAILED,

    /** A recovery attempt is in progress or awaiting confirmation. */
    RECOVERING,

    /** The circuit breaker is open; calls fail fast. */
    CIRCUIT_OPEN
}
