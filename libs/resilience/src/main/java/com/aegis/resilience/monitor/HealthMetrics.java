package com.aegis.resilience.monitor;

import com.aegis.resilience.recovery.ServiceStatus;

import java.time.Duration;
import java.time.Instant;

/**
 * Metrics captured by one poll of a service.
 *
 * @param serviceName   the polled service
 * @param timestamp     when the poll completed
 * @param status        the service's status after the poll was reported
 * @param responseTime  probe latency
 * @param cpuUsage      CPU usage in percent
 * @param memoryUsageMb used memory in megabytes
 * @param errorRate     failed polls over all polls in the trailing 10 minutes
 * @param uptime        time since the check was registered
 */
public record HealthMetrics(
        String serviceName,
        Instant timestamp,
        ServiceStatus status,
        Duration responseTime,
        double cpuUsage,
        double memoryUsageMb,
        double errorRate,
        Duration uptime
) {
}
