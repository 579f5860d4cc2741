package com.aegis.resilience.degradation;

import java.util.Locale;

/**
 * Named predicate a {@link DegradationRule} reacts to.
 */
public enum TriggerCondition {

    /** An essential service failed. */
    ESSENTIAL_SERVICE_FAILED,

    /** At least {@link GracefulDegradationController#MULTIPLE_FAILURE_THRESHOLD} services are failed. */
    MULTIPLE_SERVICES_FAILED,

    /** An optional service failed. */
    OPTIONAL_SERVICE_FAILED;

    /** Lower-case name used in degradation reasons, e.g. {@code essential_service_failed}. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
