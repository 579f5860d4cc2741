package com.aegis.resilience.monitor;

/**
 * Outcome of one health probe.
 *
 * @param healthy true if the service answered as healthy
 * @param message failure detail, or null when healthy
 */
public record ProbeResult(boolean healthy, String message) {

    private static final ProbeResult HEALTHY = new ProbeResult(true, null);

    public static ProbeResult ok() {
        return HEALTHY;
    }

    public static ProbeResult failed(String message) {
        return new ProbeResult(false, message == null ? "Health check failed" : message);
    }
}
