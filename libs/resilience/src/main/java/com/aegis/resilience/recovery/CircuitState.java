package com.aegis.resilience.recovery;

/**
 * Circuit breaker state.
 */
public enum CircuitState {

    /** Calls flow normally; failures are counted. */
    CLOSED,

    /** Failure threshold crossed; calls are rejected until the recovery timeout elapses. */
    OPEN,

    /** Recovery is being probed with a bounded number of calls. */
    HALF_OPEN
}
