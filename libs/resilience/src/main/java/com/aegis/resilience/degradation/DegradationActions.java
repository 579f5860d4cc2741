package com.aegis.resilience.degradation;

/**
 * Names of the built-in degradation actions. A custom action registered under one of these
 * names replaces the built-in behavior.
 */
public final class DegradationActions {

    /** Sets emergency mode, disables unavailable features and suspends background services. */
    public static final String ACTIVATE_EMERGENCY_MODE = "activate_emergency_mode";

    /** Raises a critical administrator alert. */
    public static final String NOTIFY_ADMINISTRATORS = "notify_administrators";

    /** Activates fallbacks for every failed service that has none active. */
    public static final String ACTIVATE_FALLBACKS = "activate_fallbacks";

    /** Disables every feature that depends on a failed service without a fallback. */
    public static final String DISABLE_NON_ESSENTIAL_FEATURES = "disable_non_essential_features";

    /** Activates the failed service's fallback. */
    public static final String ACTIVATE_FALLBACK = "activate_fallback";

    /** Logs the degradation. */
    public static final String LOG_DEGRADATION = "log_degradation";

    private DegradationActions() {
        // constants
    }
}
