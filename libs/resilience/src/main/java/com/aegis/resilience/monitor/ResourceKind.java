package com.aegis.resilience.monitor;

/**
 * Resource compared against the threshold of a {@link CheckType#RESOURCE} check.
 */
public enum ResourceKind {

    /** Process CPU usage in percent. */
    CPU,

    /** Used heap in megabytes. */
    MEMORY
}
