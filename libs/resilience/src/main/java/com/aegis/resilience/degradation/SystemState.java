package com.aegis.resilience.degradation;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mutable system state owned by {@link GracefulDegradationController}, guarded by its lock.
 */
final class SystemState {

    DegradationLevel degradationLevel = DegradationLevel.NORMAL;
    String degradationReason;
    final Set<String> failedServices = new LinkedHashSet<>();
    final Set<String> degradedServices = new LinkedHashSet<>();
    final Set<String> activeFallbacks = new LinkedHashSet<>();
    final Set<String> disabledFeatures = new LinkedHashSet<>();
    Instant lastUpdate;
    boolean emergencyMode;

    SystemState(Instant now) {
        this.lastUpdate = now;
    }

    /** A failed service whose features are unavailable. */
    boolean isUnavailable(String service) {
        return failedServices.contains(service) && !activeFallbacks.contains(service);
    }

    SystemStateSnapshot snapshot() {
        return new SystemStateSnapshot(lastUpdate, degradationLevel, degradationReason, failedServices,
                degradedServices, activeFallbacks, disabledFeatures, emergencyMode);
    }
}
