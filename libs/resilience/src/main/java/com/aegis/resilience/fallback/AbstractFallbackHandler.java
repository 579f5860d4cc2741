package com.aegis.resilience.fallback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class handling the active flag and argument checks; subclasses supply the
 * kind-specific behavior through {@link #onActivate()}, {@link #onDeactivate()} and
 * {@link #serve(FallbackRequest)}.
 */
public abstract class AbstractFallbackHandler implements FallbackHandler {

    private static final Logger log = LoggerFactory.getLogger(AbstractFallbackHandler.class);

    private final String serviceName;
    private final FallbackConfig config;
    private volatile boolean active;

    protected AbstractFallbackHandler(String serviceName, FallbackConfig config, FallbackType expectedType) {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        if (config.type() != expectedType) {
            throw new IllegalArgumentException(
                    "config type %s does not match handler type %s".formatted(config.type(), expectedType));
        }
        this.serviceName = serviceName;
        this.config = config;
    }

    @Override
    public final boolean activate() {
        if (!isReady()) {
            log.warn("{} fallback for {} is not configured and cannot activate", config.type(), serviceName);
            return false;
        }
        boolean activated = onActivate();
        active = activated;
        return activated;
    }

    @Override
    public final boolean deactivate() {
        try {
            return onDeactivate();
        } finally {
            active = false;
        }
    }

    @Override
    public final Object handleRequest(FallbackRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request must not be null");
        }
        if (!active) {
            throw new FallbackException(serviceName,
                    "%s fallback for %s is not active".formatted(config.type(), serviceName));
        }
        return serve(request);
    }

    /** Kind-specific activation. */
    protected boolean onActivate() {
        return true;
    }

    /** Kind-specific deactivation. */
    protected boolean onDeactivate() {
        return true;
    }

    /** Produces the response for an active handler. */
    protected abstract Object serve(FallbackRequest request);

    @Override
    public boolean isReady() {
        return true;
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public String serviceName() {
        return serviceName;
    }

    @Override
    public FallbackConfig config() {
        return config;
    }

    @Override
    public String toString() {
        return "%s[service=%s, priority=%d]".formatted(getClass().getSimpleName(), serviceName, config.priority());
    }
}
