package com.aegis.resilience.fallback;

/**
 * Outcome of {@link FallbackManager#handleFallbackRequest(String, FallbackRequest)}.
 *
 * @param serviceName the substituted service
 * @param success     true if the payload was produced
 * @param payload     the response (null on failure)
 * @param errorKind   why no payload was produced (null on success)
 * @param message     error detail (null on success)
 */
public record FallbackResult(
        String serviceName,
        boolean success,
        Object payload,
        FallbackErrorKind errorKind,
        String message
) {

    public static FallbackResult success(String serviceName, Object payload) {
        return new FallbackResult(serviceName, true, payload, null, null);
    }

    public static FallbackResult noActiveFallback(String serviceName) {
        return new FallbackResult(serviceName, false, null, FallbackErrorKind.NO_ACTIVE_FALLBACK,
                "No active fallback for service '%s'".formatted(serviceName));
    }

    public static FallbackResult handlerError(String serviceName, String message) {
        return new FallbackResult(serviceName, false, null, FallbackErrorKind.HANDLER_ERROR, message);
    }

    /**
     * Returns the payload, or throws the typed exception matching the error kind.
     *
     * @throws NoActiveFallbackException if no fallback was active
     * @throws FallbackException         if the handler failed
     */
    public Object orThrow() {
        if (success) {
            return payload;
        }
        if (errorKind == FallbackErrorKind.NO_ACTIVE_FALLBACK) {
            throw new NoActiveFallbackException(serviceName);
        }
        throw new FallbackException(serviceName, message);
    }
}
