package com.aegis.resilience.monitor;

import java.net.URI;
import java.time.Duration;

/**
 * Health check registration for one service.
 *
 * @param type      how the service is probed
 * @param interval  delay between polls
 * @param timeout   time budget of one probe
 * @param endpoint  URL polled by {@link CheckType#HTTP} checks
 * @param resource  resource compared by {@link CheckType#RESOURCE} checks
 * @param threshold limit for the resource reading (percent for CPU, MB for memory)
 * @param probe     probe for {@link CheckType#CUSTOM} checks; optional for {@link CheckType#PING}
 */
public record HealthCheckConfig(
        CheckType type,
        Duration interval,
        Duration timeout,
        URI endpoint,
        ResourceKind resource,
        double threshold,
        HealthProbe probe
) {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    public HealthCheckConfig {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        switch (type) {
            case HTTP -> {
                if (endpoint == null) {
                    throw new IllegalArgumentException("endpoint must not be null for HTTP checks");
                }
            }
            case RESOURCE -> {
                if (resource == null) {
                    throw new IllegalArgumentException("resource must not be null for RESOURCE checks");
                }
                if (threshold <= 0) {
                    throw new IllegalArgumentException("threshold must be positive");
                }
            }
            case CUSTOM -> {
                if (probe == null) {
                    throw new IllegalArgumentException("probe must not be null for CUSTOM checks");
                }
            }
            case PING -> {
                // probe is optional, the service registry is pinged otherwise
            }
        }
    }

    /** Pings the service through the service registry. */
    public static HealthCheckConfig ping() {
        return ping(null);
    }

    /** Pings the service with the given probe. */
    public static HealthCheckConfig ping(HealthProbe probe) {
        return new HealthCheckConfig(CheckType.PING, DEFAULT_INTERVAL, DEFAULT_TIMEOUT, null, null, 0, probe);
    }

    public static HealthCheckConfig http(URI endpoint) {
        return new HealthCheckConfig(CheckType.HTTP, DEFAULT_INTERVAL, DEFAULT_TIMEOUT, endpoint, null, 0, null);
    }

    public static HealthCheckConfig resource(ResourceKind resource, double threshold) {
        return new HealthCheckConfig(CheckType.RESOURCE, DEFAULT_INTERVAL, DEFAULT_TIMEOUT, null, resource, threshold, null);
    }

    public static HealthCheckConfig custom(HealthProbe probe) {
        return new HealthCheckConfig(CheckType.CUSTOM, DEFAULT_INTERVAL, DEFAULT_TIMEOUT, null, null, 0, probe);
    }

    public HealthCheckConfig withInterval(Duration interval) {
        return new HealthCheckConfig(type, interval, timeout, endpoint, resource, threshold, probe);
    }

    public HealthCheckConfig withTimeout(Duration timeout) {
        return new HealthCheckConfig(type, interval, timeout, endpoint, resource, threshold, probe);
    }
}
