package com.aegis.resilience.service;

/**
 * Best-effort control over service lifecycles. The resilience core tolerates its absence:
 * recovery then falls back to re-probing the service's health.
 */
public interface ServiceLifecycleManager {

    /**
     * Restarts the named service.
     *
     * @return true if the service came back up
     */
    boolean restartService(String name);

    /**
     * Suspends a background service while the system runs in emergency mode.
     *
     * @return true if the service was suspended
     */
    default boolean suspendService(String name) {
        return false;
    }
}
