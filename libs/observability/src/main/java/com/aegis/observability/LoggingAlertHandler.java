package com.aegis.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Alert sink that writes every alert to SLF4J, mapping severity to log level.
 */
public final class LoggingAlertHandler implements AlertHandler {

    private static final Logger log = LoggerFactory.getLogger("com.aegis.alerts");

    @Override
    public void onAlert(Alert alert) {
        String service = alert.hasService() ? alert.serviceName() : "system";
        switch (alert.severity()) {
            case CRITICAL -> log.error("[{}] {} ({}): {}", alert.severity().wireName(), alert.type(), service,
                    alert.message());
            case WARNING -> log.warn("[{}] {} ({}): {}", alert.severity().wireName(), alert.type(), service,
                    alert.message());
            default -> log.info("[{}] {} ({}): {}", alert.severity().wireName(), alert.type(), service,
                    alert.message());
        }
    }

    @Override
    public String toString() {
        return "LoggingAlertHandler";
    }
}
