package com.aegis.resilience.fallback;

import java.util.Map;
import java.util.function.Function;

/**
 * Synthesizes responses: from a generator if one is given, else from a table keyed by
 * request type, else {@link #DEFAULT_RESPONSE}.
 */
public final class MockFallbackHandler extends AbstractFallbackHandler {

    public static final Map<String, Object> DEFAULT_RESPONSE = Map.of("status", "mock_response");

    private final Function<FallbackRequest, Object> generator;
    private final Map<String, Object> mockData;

    public MockFallbackHandler(String serviceName, FallbackConfig config,
                               Function<FallbackRequest, Object> generator, Map<String, Object> mockData) {
        super(serviceName, config, FallbackType.MOCK);
        this.generator = generator;
        this.mockData = mockData == null ? Map.of() : Map.copyOf(mockData);
    }

    public MockFallbackHandler(String serviceName, FallbackConfig config) {
        this(serviceName, config, null, null);
    }

    @Override
    protected Object serve(FallbackRequest request) {
        if (generator != null) {
            try {
                return generator.apply(request);
            } catch (RuntimeException e) {
                throw new FallbackException(serviceName(), "Mock generator failed: " + e.getMessage(), e);
            }
        }
        Object data = mockData.get(request.requestType());
        return data != null ? data : DEFAULT_RESPONSE;
    }
}
