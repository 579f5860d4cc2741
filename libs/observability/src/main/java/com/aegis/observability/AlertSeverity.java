package com.aegis.observability;

import java.util.Locale;

/**
 * Severity attached to every {@link Alert}.
 */
public enum AlertSeverity {

    /** Informational, e.g. a service returned to normal. */
    INFO,

    /** Something is impaired but the system keeps serving requests. */
    WARNING,

    /** An essential capability is down or at risk. */
    CRITICAL;

    /** Lower-case name used by alert sinks ("info", "warning", "critical"). */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
