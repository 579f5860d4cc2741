package com.aegis.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans an {@link Alert} out to every registered {@link AlertHandler}.
 * <p>
 * Delivery is sequential, in registration order. A handler that throws is logged and
 * skipped; the remaining handlers still receive the alert. Independent alerts may be
 * dispatched concurrently from different threads.
 */
public final class AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

    private final CopyOnWriteArrayList<AlertHandler> handlers = new CopyOnWriteArrayList<>();

    /**
     * Registers a handler. The same handler instance may be registered only once.
     *
     * @param handler the handler to add
     * @return true if the handler was added, false if it was already registered
     */
    public boolean register(AlertHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        return handlers.addIfAbsent(handler);
    }

    /**
     * Removes a previously registered handler.
     *
     * @return true if a handler was removed
     */
    public boolean deregister(AlertHandler handler) {
        return handlers.remove(handler);
    }

    /**
     * Delivers the alert to every handler.
     *
     * @param alert the alert to deliver
     * @return number of handlers that accepted the alert without throwing
     */
    public int dispatch(Alert alert) {
        if (alert == null) {
            throw new IllegalArgumentException("alert must not be null");
        }
        int delivered = 0;
        for (AlertHandler handler : handlers) {
            try {
                handler.onAlert(alert);
                delivered++;
            } catch (RuntimeException e) {
                log.error("Alert handler {} failed for alert '{}'", handler, alert.message(), e);
            }
        }
        return delivered;
    }

    /** Returns the number of registered handlers. */
    public int size() {
        return handlers.size();
    }
}
