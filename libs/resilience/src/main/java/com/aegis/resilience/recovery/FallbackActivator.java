package com.aegis.resilience.recovery;

/**
 * Callback the {@link ErrorRecoveryManager} invokes to substitute a failing optional service.
 */
@FunctionalInterface
public interface FallbackActivator {

    /**
     * Activates a fallback for the service.
     *
     * @param serviceName the failing service
     * @return true if a fallback is now serving in its place
     */
    boolean activate(String serviceName);
}
