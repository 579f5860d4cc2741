package com.aegis.resilience;

import com.aegis.resilience.degradation.DegradationLevel;
import com.aegis.resilience.fallback.FallbackType;
import com.aegis.resilience.recovery.CircuitState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Micrometer meters published by the resilience components.
 * <p>
 * Every meter carries a {@code service} tag naming the protected service; the degradation
 * gauge is system-wide.
 */
public final class ResilienceMetrics {

    public static final String SERVICE_FAILURES = "resilience.service.failures";
    public static final String CIRCUIT_TRANSITIONS = "resilience.circuit.transitions";
    public static final String PROBE_DURATION = "resilience.probe.duration";
    public static final String FALLBACK_ACTIVATIONS = "resilience.fallback.activations";
    public static final String DEGRADATION_LEVEL = "resilience.degradation.level";

    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;

    /**
     * Creates metrics bound to the given registry.
     *
     * @param registry the Micrometer registry (e.g., the application's Prometheus registry)
     */
    public ResilienceMetrics(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    /** Metrics recorded into a private in-memory registry. */
    public static ResilienceMetrics inMemory() {
        return new ResilienceMetrics(new SimpleMeterRegistry());
    }

    /** Counts a failure reported for a service. */
    public void recordServiceFailure(String service) {
        Counter.builder(SERVICE_FAILURES)
                .description("Failures reported to the recovery manager")
                .tag(TAG_SERVICE, service)
                .register(registry)
                .increment();
    }

    /** Counts a circuit breaker transition into the given state. */
    public void recordCircuitTransition(String service, CircuitState state) {
        Counter.builder(CIRCUIT_TRANSITIONS)
                .description("Circuit breaker state transitions")
                .tag(TAG_SERVICE, service)
                .tag("state", state.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /** Records the duration and outcome of one health probe. */
    public void recordProbe(String service, Duration elapsed, boolean success) {
        Timer.builder(PROBE_DURATION)
                .description("Health probe latency")
                .tag(TAG_SERVICE, service)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(elapsed);
    }

    /** Counts one fallback activation attempt. */
    public void recordFallbackActivation(String service, FallbackType type, boolean activated) {
        Counter.builder(FALLBACK_ACTIVATIONS)
                .description("Fallback handler activation attempts")
                .tag(TAG_SERVICE, service)
                .tag("type", type.name().toLowerCase(Locale.ROOT))
                .tag("outcome", activated ? "activated" : "failed")
                .register(registry)
                .increment();
    }

    /**
     * Publishes the current degradation level as a gauge (its ordinal: 0 = normal,
     * 4 = critical).
     */
    public void bindDegradationLevel(Supplier<DegradationLevel> level) {
        Gauge.builder(DEGRADATION_LEVEL, level, s -> s.get().ordinal())
                .description("System degradation level (0 = normal, 4 = critical)")
                .strongReference(true)
                .register(registry);
    }

    /** Returns the underlying registry. */
    public MeterRegistry registry() {
        return registry;
    }
}
