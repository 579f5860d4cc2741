package com.aegis.resilience.monitor;

import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

/**
 * A pluggable health check. The monitor invokes probes on its probe threads and bounds the
 * returned future with the check's timeout, so a probe may block or return an incomplete future.
 * <p>
 * Example usage:
 * <pre>{@code
 * HealthProbe probe = HealthProbe.of(() -> dataSource.getConnection().isValid(2));
 * monitor.registerCheck("postgres", HealthCheckConfig.custom(probe));
 * }</pre>
 */
@FunctionalInterface
public interface HealthProbe {

    /**
     * Probes the service.
     *
     * @return a future completing with the probe result, or exceptionally if the probe failed
     */
    CompletableFuture<ProbeResult> probe();

    /** Adapts a synchronous boolean check; an exception counts as an unhealthy result. */
    static HealthProbe of(BooleanSupplier check) {
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        return () -> {
            try {
                return CompletableFuture.completedFuture(check.getAsBoolean()
                        ? ProbeResult.ok()
                        : ProbeResult.failed("Health check returned false"));
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }
}
