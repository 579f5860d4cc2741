package com.aegis.resilience.fallback;

import java.util.Map;

/**
 * Serves a fixed response per request type, else a default response.
 */
public final class StaticFallbackHandler extends AbstractFallbackHandler {

    private final Map<String, Object> staticResponses;
    private final Object defaultResponse;

    /**
     * @param staticResponses responses keyed by request type
     * @param defaultResponse response for any other request type, or null to reject them
     */
    public StaticFallbackHandler(String serviceName, FallbackConfig config,
                                 Map<String, Object> staticResponses, Object defaultResponse) {
        super(serviceName, config, FallbackType.STATIC);
        this.staticResponses = staticResponses == null ? Map.of() : Map.copyOf(staticResponses);
        this.defaultResponse = defaultResponse;
    }

    @Override
    protected Object serve(FallbackRequest request) {
        Object response = staticResponses.get(request.requestType());
        if (response != null) {
            return response;
        }
        if (defaultResponse != null) {
            return defaultResponse;
        }
        throw new FallbackException(serviceName(),
                "No static response available for request type '%s'".formatted(request.requestType()));
    }
}
