package com.aegis.observability;

/**
 * What kind of event produced an {@link Alert}. Sinks that only care about the message and
 * severity can ignore it; components that react to alerts (fallback activation) switch on it.
 */
public enum AlertType {
    CIRCUIT_OPENED,
    CIRCUIT_HALF_OPEN,
    CIRCUIT_REOPENED,
    SERVICE_RECOVERED,
    THRESHOLD_EXCEEDED,
    SYSTEM_HEALTH,
    ADMIN_NOTIFICATION
}
