package com.aegis.resilience.degradation;

/**
 * How much the system depends on a service.
 */
public enum ServiceClassification {

    /** Failure drives the system to at least {@link DegradationLevel#SEVERE}. */
    ESSENTIAL,

    /** Failure is tolerated with a fallback or disabled features. */
    OPTIONAL,

    /** Failure does not change the degradation level; suspended in emergency mode. */
    BACKGROUND
}
