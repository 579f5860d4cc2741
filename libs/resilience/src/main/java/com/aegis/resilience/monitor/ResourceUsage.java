package com.aegis.resilience.monitor;

/**
 * A reading of process resource usage.
 *
 * @param cpuPercent CPU usage in percent (0 to 100), or 0 when unavailable
 * @param memoryMb   used memory in megabytes
 */
public record ResourceUsage(double cpuPercent, double memoryMb) {
}
