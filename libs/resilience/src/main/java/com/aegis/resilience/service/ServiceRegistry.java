package com.aegis.resilience.service;

import java.util.Map;
import java.util.Optional;

/**
 * Lookup of live service instances by name. Owned by the embedding application.
 */
@FunctionalInterface
public interface ServiceRegistry {

    /**
     * Returns the service registered under the given name, if any.
     */
    Optional<ManagedService> getService(String name);

    /** A registry with no services. */
    static ServiceRegistry empty() {
        return name -> Optional.empty();
    }

    /** A registry backed by a fixed map of services. */
    static ServiceRegistry of(Map<String, ? extends ManagedService> services) {
        Map<String, ManagedService> copy = Map.copyOf(services);
        return name -> Optional.ofNullable(copy.get(name));
    }
}
