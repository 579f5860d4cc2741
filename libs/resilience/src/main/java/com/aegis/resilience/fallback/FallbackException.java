package com.aegis.resilience.fallback;

/**
 * A fallback could not serve a request.
 */
public class FallbackException extends RuntimeException {

    private final String serviceName;

    public FallbackException(String serviceName, String message) {
        super(message);
        this.serviceName = serviceName;
    }

    public FallbackException(String serviceName, String message, Throwable cause) {
        super(message, cause);
        this.serviceName = serviceName;
    }

    public String serviceName() {
        return serviceName;
    }
}
