package com.aegis.observability;

import java.time.Instant;

/**
 * A single alert raised by a resilience component.
 *
 * @param type        event that raised the alert
 * @param serviceName service the alert is about, or {@code null} for system-wide alerts
 * @param message     human-readable message
 * @param severity    alert severity
 * @param timestamp   when the alert was raised
 */
public record Alert(
        AlertType type,
        String serviceName,
        String message,
        AlertSeverity severity,
        Instant timestamp
) {

    public Alert {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be null or blank");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity must not be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
    }

    /** Creates a system-wide alert (no service attached). */
    public static Alert system(AlertType type, String message, AlertSeverity severity, Instant timestamp) {
        return new Alert(type, null, message, severity, timestamp);
    }

    /** Returns true if the alert concerns a specific service. */
    public boolean hasService() {
        return serviceName != null;
    }
}
