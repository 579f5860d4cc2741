package com.aegis.resilience.monitor;

import com.aegis.resilience.recovery.ServiceHealthSnapshot;
import com.aegis.resilience.recovery.ServiceStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * System-wide health summary produced by the monitor.
 *
 * @param generatedAt   generation time
 * @param uptime        time since the monitor was created
 * @param monitoring    whether the polling loops are running
 * @param statusCounts  number of services per status
 * @param services      per-service recovery state
 * @param latestMetrics most recent metrics of each polled service
 */
public record SystemHealthReport(
        Instant generatedAt,
        Duration uptime,
        boolean monitoring,
        Map<ServiceStatus, Integer> statusCounts,
        Map<String, ServiceHealthSnapshot> services,
        Map<String, HealthMetrics> latestMetrics
) {

    public SystemHealthReport {
        statusCounts = Map.copyOf(statusCounts);
        services = Map.copyOf(services);
        latestMetrics = Map.copyOf(latestMetrics);
    }

    public int totalServices() {
        return services.size();
    }
}
