package com.aegis.resilience.monitor;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Samples the CPU load and heap usage of the running JVM.
 */
public final class JvmResourceSampler implements ResourceSampler {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
    private final Runtime runtime = Runtime.getRuntime();

    @Override
    public ResourceUsage sample() {
        double usedMb = (runtime.totalMemory() - runtime.freeMemory()) / BYTES_PER_MB;
        return new ResourceUsage(cpuPercent(), usedMb);
    }

    private double cpuPercent() {
        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            double load = sunOs.getProcessCpuLoad();
            return load < 0 ? 0 : load * 100.0;
        }
        double loadAverage = os.getSystemLoadAverage();
        if (loadAverage < 0) {
            return 0;
        }
        return Math.min(100.0, loadAverage / os.getAvailableProcessors() * 100.0);
    }
}
