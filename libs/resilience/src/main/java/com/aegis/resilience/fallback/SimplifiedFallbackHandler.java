package com.aegis.resilience.fallback;

import java.util.function.Function;

/**
 * Delegates to a reduced-functionality implementation of the service.
 */
public final class SimplifiedFallbackHandler extends AbstractFallbackHandler {

    private final Function<FallbackRequest, Object> handler;

    /**
     * @param handler the simplified implementation; without one the handler cannot activate
     */
    public SimplifiedFallbackHandler(String serviceName, FallbackConfig config,
                                     Function<FallbackRequest, Object> handler) {
        super(serviceName, config, FallbackType.SIMPLIFIED);
        this.handler = handler;
    }

    @Override
    public boolean isReady() {
        return handler != null;
    }

    @Override
    protected Object serve(FallbackRequest request) {
        try {
            return handler.apply(request);
        } catch (FallbackException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FallbackException(serviceName(),
                    "Simplified handler failed for '%s': %s".formatted(request.requestType(), e.getMessage()), e);
        }
    }
}
