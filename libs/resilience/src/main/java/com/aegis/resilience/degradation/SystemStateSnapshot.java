package com.aegis.resilience.degradation;

import java.time.Instant;
import java.util.Set;

/**
 * Copy of the system state taken after a failure or recovery was handled.
 */
public record SystemStateSnapshot(
        Instant lastUpdate,
        DegradationLevel degradationLevel,
        String degradationReason,
        Set<String> failedServices,
        Set<String> degradedServices,
        Set<String> activeFallbacks,
        Set<String> disabledFeatures,
        boolean emergencyMode
) {

    public SystemStateSnapshot {
        failedServices = Set.copyOf(failedServices);
        degradedServices = Set.copyOf(degradedServices);
        activeFallbacks = Set.copyOf(activeFallbacks);
        disabledFeatures = Set.copyOf(disabledFeatures);
    }
}
