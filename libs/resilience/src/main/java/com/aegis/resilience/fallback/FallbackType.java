package com.aegis.resilience.fallback;

/**
 * Kind of substitute behavior a {@link FallbackHandler} provides.
 */
public enum FallbackType {

    /** Serves responses captured while the service was healthy. */
    CACHE,

    /** Serves fixed responses per request type. */
    STATIC,

    /** Delegates to a reduced-functionality implementation. */
    SIMPLIFIED,

    /** Forwards to another service or an external endpoint. */
    PROXY,

    /** Synthesizes responses. */
    MOCK
}
