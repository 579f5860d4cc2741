package com.aegis.resilience.degradation;

/**
 * System-wide severity, ordered from {@link #NORMAL} to {@link #CRITICAL}.
 */
public enum DegradationLevel {
    NORMAL,
    MINOR,
    MODERATE,
    SEVERE,
    CRITICAL;

    public boolean isWorseThan(DegradationLevel other) {
        return compareTo(other) > 0;
    }
}
