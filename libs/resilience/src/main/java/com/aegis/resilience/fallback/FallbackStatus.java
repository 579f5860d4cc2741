package com.aegis.resilience.fallback;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Active and registered fallbacks per service.
 *
 * @param active     the active fallback of each service that has one
 * @param registered every registered handler per service, in priority order
 */
public record FallbackStatus(Map<String, ActiveFallback> active, Map<String, List<RegisteredFallback>> registered) {

    public FallbackStatus {
        active = Map.copyOf(active);
        registered = Map.copyOf(registered);
    }

    public record ActiveFallback(FallbackType type, int priority, Instant activatedAt) {
    }

    public record RegisteredFallback(FallbackType type, int priority, boolean active, boolean ready) {
    }
}
