package com.aegis.resilience.degradation;

import java.time.Instant;
import java.util.Set;

/**
 * Current degradation posture of the system.
 *
 * @param degradationLevel  current level
 * @param degradationReason trigger and service of the last escalation, or null when normal
 * @param failedServices    services currently failed
 * @param degradedServices  failed services running on a fallback
 * @param activeFallbacks   services with an active fallback
 * @param disabledFeatures  features currently unavailable
 * @param lastUpdate        time of the last state change
 * @param emergencyMode     whether emergency mode is active
 * @param monitoringActive  whether the reconciliation loop is running
 */
public record SystemStatus(
        DegradationLevel degradationLevel,
        String degradationReason,
        Set<String> failedServices,
        Set<String> degradedServices,
        Set<String> activeFallbacks,
        Set<String> disabledFeatures,
        Instant lastUpdate,
        boolean emergencyMode,
        boolean monitoringActive
) {

    public SystemStatus {
        failedServices = Set.copyOf(failedServices);
        degradedServices = Set.copyOf(degradedServices);
        activeFallbacks = Set.copyOf(activeFallbacks);
        disabledFeatures = Set.copyOf(disabledFeatures);
    }
}
