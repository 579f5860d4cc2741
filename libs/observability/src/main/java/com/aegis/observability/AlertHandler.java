package com.aegis.observability;

/**
 * Sink for {@link Alert}s: logging, paging, chat notifications, or another component that
 * reacts to state changes.
 * <p>
 * Handlers are invoked on the thread that raised the alert and should return quickly.
 */
@FunctionalInterface
public interface AlertHandler {

    /**
     * Receives an alert.
     *
     * @param alert the alert (never null)
     */
    void onAlert(Alert alert);
}
