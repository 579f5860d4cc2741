package com.aegis.resilience.fallback;

/**
 * A substitute for a failing service. Adding a new kind of fallback only requires a new
 * implementation; {@link FallbackManager} works against this interface alone.
 */
public interface FallbackHandler {

    /** Name of the service this handler substitutes. */
    String serviceName();

    /** Priority, type and timeouts. */
    FallbackConfig config();

    /**
     * Prepares the handler to serve requests.
     *
     * @return true if the handler is now active
     */
    boolean activate();

    /**
     * Stops serving requests and releases resources.
     *
     * @return true if the handler shut down cleanly
     */
    boolean deactivate();

    /**
     * Serves one request.
     *
     * @throws FallbackException if the handler cannot produce a response
     */
    Object handleRequest(FallbackRequest request);

    /** Whether the handler is currently active. */
    boolean isActive();

    /** Whether the handler has what it needs to activate. */
    boolean isReady();
}
