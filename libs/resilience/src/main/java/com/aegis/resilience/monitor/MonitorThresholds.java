package com.aegis.resilience.monitor;

import java.time.Duration;

/**
 * Limits above which the monitor raises warning alerts, and the system-wide failure
 * fractions that raise system health alerts.
 *
 * @param responseTime      probe latency limit
 * @param errorRate         error rate limit (0 to 1)
 * @param cpuPercent        CPU usage limit in percent
 * @param memoryMb          memory usage limit in megabytes
 * @param failedFraction    fraction of failed services above which a critical alert is raised
 * @param unhealthyFraction fraction of failed or degraded services above which a warning is raised
 */
public record MonitorThresholds(
        Duration responseTime,
        double errorRate,
        double cpuPercent,
        double memoryMb,
        double failedFraction,
        double unhealthyFraction
) {

    public MonitorThresholds {
        if (responseTime == null || responseTime.isNegative() || responseTime.isZero()) {
            throw new IllegalArgumentException("responseTime must be positive");
        }
        requireFraction("errorRate", errorRate);
        requireFraction("failedFraction", failedFraction);
        requireFraction("unhealthyFraction", unhealthyFraction);
        if (cpuPercent <= 0 || cpuPercent > 100) {
            throw new IllegalArgumentException("cpuPercent must be in (0, 100]");
        }
        if (memoryMb <= 0) {
            throw new IllegalArgumentException("memoryMb must be positive");
        }
    }

    /** 500 ms, 5 % errors, 70 % CPU, 1024 MB, 30 % failed, 50 % unhealthy. */
    public static MonitorThresholds defaults() {
        return new MonitorThresholds(Duration.ofMillis(500), 0.05, 70.0, 1024.0, 0.3, 0.5);
    }

    private static void requireFraction(String name, double value) {
        if (value < 0 || value > 1) {
            throw new IllegalArgumentException(name + " must be between 0 and 1");
        }
    }
}
