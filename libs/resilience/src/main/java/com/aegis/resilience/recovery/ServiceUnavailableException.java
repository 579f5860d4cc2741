package com.aegis.resilience.recovery;

/**
 * Failure cause reported when a service is found unhealthy without an exception of its own,
 * e.g. a probe that answered "unhealthy" or a status reconciliation.
 */
public class ServiceUnavailableException extends RuntimeException {

    private final String serviceName;

    public ServiceUnavailableException(String serviceName, String message) {
        super(message);
        this.serviceName = serviceName;
    }

    public ServiceUnavailableException(String serviceName, String message, Throwable cause) {
        super(message, cause);
        this.serviceName = serviceName;
    }

    public String serviceName() {
        return serviceName;
    }
}
