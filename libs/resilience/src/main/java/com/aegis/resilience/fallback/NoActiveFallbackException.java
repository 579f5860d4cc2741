package com.aegis.resilience.fallback;

/**
 * A fallback request was made for a service with no active fallback.
 */
public class NoActiveFallbackException extends FallbackException {

    public NoActiveFallbackException(String serviceName) {
        super(serviceName, "No active fallback for service '%s'".formatted(serviceName));
    }
}
