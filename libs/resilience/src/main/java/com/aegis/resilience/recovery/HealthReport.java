package com.aegis.resilience.recovery;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Structured export of every registered service's health, suitable for serialization by the
 * embedding application.
 *
 * @param generatedAt    when the report was produced
 * @param circuitBreaker the circuit breaker settings in force
 * @param services       per-service snapshots keyed by service name
 * @param statusCounts   number of services in each status
 */
public record HealthReport(
        Instant generatedAt,
        CircuitBreakerConfig circuitBreaker,
        Map<String, ServiceHealthSnapshot> services,
        Map<ServiceStatus, Integer> statusCounts
) {

    public HealthReport {
        services = Map.copyOf(services);
        statusCounts = Map.copyOf(statusCounts);
    }

    static HealthReport of(Instant now, CircuitBreakerConfig config, Map<String, ServiceHealthSnapshot> services) {
        Map<ServiceStatus, Integer> counts = new EnumMap<>(ServiceStatus.class);
        for (ServiceStatus status : ServiceStatus.values()) {
            counts.put(status, 0);
        }
        services.values().forEach(s -> counts.merge(s.status(), 1, Integer::sum));
        return new HealthReport(now, config, services, counts);
    }

    /** Number of registered services. */
    public int totalServices() {
        return services.size();
    }
}
