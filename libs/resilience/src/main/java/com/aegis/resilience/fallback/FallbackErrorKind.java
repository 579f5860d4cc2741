package com.aegis.resilience.fallback;

/**
 * Why a fallback request produced no payload.
 */
public enum FallbackErrorKind {

    /** No fallback is active for the service. */
    NO_ACTIVE_FALLBACK,

    /** The active handler could not serve the request. */
    HANDLER_ERROR
}
