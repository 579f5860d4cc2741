package com.aegis.resilience.service;

import com.aegis.resilience.fallback.FallbackRequest;

/**
 * A service protected by the resilience core, as seen through a {@link ServiceRegistry}.
 * <p>
 * Only {@link #healthCheck()} is mandatory. Ping probes call {@link #ping()}, which defaults
 * to the health check. Services that can stand in for another one (proxy fallbacks) override
 * {@link #handleRequest(FallbackRequest)}.
 */
public interface ManagedService {

    /**
     * Performs a lightweight health check.
     *
     * @return true if the service is able to serve requests
     */
    boolean healthCheck();

    /** Liveness ping. */
    default boolean ping() {
        return healthCheck();
    }

    /**
     * Serves a request on behalf of another service.
     *
     * @throws UnsupportedOperationException if this service cannot proxy requests
     */
    default Object handleRequest(FallbackRequest request) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not handle proxied requests");
    }
}
