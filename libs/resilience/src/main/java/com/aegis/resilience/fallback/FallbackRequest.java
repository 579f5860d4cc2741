package com.aegis.resilience.fallback;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * A request served by a fallback in place of the failing service.
 *
 * @param requestType what is being asked for (e.g. "user_info", "status")
 * @param params      request parameters
 */
public record FallbackRequest(String requestType, Map<String, Object> params) {

    public FallbackRequest {
        if (requestType == null || requestType.isBlank()) {
            throw new IllegalArgumentException("requestType must not be null or blank");
        }
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static FallbackRequest of(String requestType) {
        return new FallbackRequest(requestType, Map.of());
    }

    public static FallbackRequest of(String requestType, Map<String, Object> params) {
        return new FallbackRequest(requestType, params);
    }

    /**
     * Identity used to key cached responses: the request type, followed by the parameters in
     * key order, e.g. {@code user_info?id=42&locale=en}.
     */
    public String identity() {
        if (params.isEmpty()) {
            return requestType;
        }
        return requestType + "?" + new TreeMap<>(params).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("&"));
    }
}
