package com.aegis.resilience;

import com.aegis.observability.AlertHandler;
import com.aegis.observability.LoggingAlertHandler;
import com.aegis.resilience.degradation.GracefulDegradationController;
import com.aegis.resilience.degradation.ServiceClassification;
import com.aegis.resilience.fallback.FallbackManager;
import com.aegis.resilience.monitor.HealthCheckConfig;
import com.aegis.resilience.monitor.JvmResourceSampler;
import com.aegis.resilience.monitor.MonitorThresholds;
import com.aegis.resilience.monitor.ResourceSampler;
import com.aegis.resilience.monitor.ServiceHealthMonitor;
import com.aegis.resilience.recovery.CircuitBreakerConfig;
import com.aegis.resilience.recovery.ErrorRecoveryManager;
import com.aegis.resilience.service.ServiceLifecycleManager;
import com.aegis.resilience.service.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Explicitly constructed holder of the four resilience components, wired together:
 * failures and recoveries reported to the {@link ErrorRecoveryManager} drive the
 * {@link GracefulDegradationController}; its alerts drive the {@link FallbackManager}.
 * <p>
 * Example usage:
 * <pre>{@code
 * try (ResilienceContext resilience = ResilienceContext.builder()
 *         .circuitBreaker(CircuitBreakerConfig.defaults())
 *         .serviceRegistry(registry)
 *         .build()) {
 *     resilience.registerService("db", ServiceClassification.ESSENTIAL);
 *     resilience.healthMonitor().registerCheck("db", HealthCheckConfig.ping());
 *     resilience.start();
 *     ...
 * }
 * }</pre>
 */
public final class ResilienceContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResilienceContext.class);

    private final ErrorRecoveryManager recoveryManager;
    private final ServiceHealthMonitor healthMonitor;
    private final FallbackManager fallbackManager;
    private final GracefulDegradationController degradationController;
    private final ResilienceMetrics metrics;
    private final AtomicBoolean closed = new AtomicBoolean();

    private ResilienceContext(Builder builder) {
        this.metrics = builder.metrics;
        this.recoveryManager = new ErrorRecoveryManager(builder.circuitBreaker, builder.clock,
                builder.serviceRegistry, builder.lifecycleManager, metrics);
        builder.alertHandlers.forEach(recoveryManager::registerAlertHandler);
        this.fallbackManager = new FallbackManager(recoveryManager, builder.serviceRegistry, builder.clock,
                metrics, builder.cacheDirectory);
        this.degradationController = new GracefulDegradationController(recoveryManager, fallbackManager,
                builder.lifecycleManager, builder.clock, metrics, builder.degradationInterval);
        recoveryManager.addServiceEventListener(degradationController);
        this.healthMonitor = new ServiceHealthMonitor(recoveryManager, builder.serviceRegistry,
                builder.resourceSampler, builder.thresholds, builder.systemCheckInterval, metrics);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers a service with the recovery manager (essential iff
     * {@link ServiceClassification#ESSENTIAL}) and classifies it for degradation.
     */
    public void registerService(String name, ServiceClassification classification) {
        if (classification == null) {
            throw new IllegalArgumentException("classification must not be null");
        }
        recoveryManager.registerService(name, classification == ServiceClassification.ESSENTIAL, false);
        degradationController.registerServiceClassification(name, classification);
    }

    /** Registers a service and its health check. */
    public void registerService(String name, ServiceClassification classification, HealthCheckConfig check) {
        registerService(name, classification);
        healthMonitor.registerCheck(name, check);
    }

    /** Starts health monitoring and degradation reconciliation. */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("ResilienceContext is shut down");
        }
        healthMonitor.startMonitoring();
        degradationController.startMonitoring();
    }

    /** Stops the loops, cancels pending recoveries and releases every thread. Idempotent. */
    public void shutdown() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        degradationController.stopMonitoring();
        healthMonitor.shutdown();
        recoveryManager.shutdown();
        log.info("Resilience context shut down");
    }

    @Override
    public void close() {
        shutdown();
    }

    public ErrorRecoveryManager recoveryManager() {
        return recoveryManager;
    }

    public ServiceHealthMonitor healthMonitor() {
        return healthMonitor;
    }

    public FallbackManager fallbackManager() {
        return fallbackManager;
    }

    public GracefulDegradationController degradationController() {
        return degradationController;
    }

    public ResilienceMetrics metrics() {
        return metrics;
    }

    /**
     * Builder for {@link ResilienceContext}. Every setting has a default; a
     * {@link LoggingAlertHandler} is registered unless {@link #withoutLoggingAlerts()} is called.
     */
    public static final class Builder {

        private CircuitBreakerConfig circuitBreaker = CircuitBreakerConfig.defaults();
        private MonitorThresholds thresholds = MonitorThresholds.defaults();
        private Clock clock = Clock.systemUTC();
        private ServiceRegistry serviceRegistry = ServiceRegistry.empty();
        private ServiceLifecycleManager lifecycleManager;
        private ResourceSampler resourceSampler = new JvmResourceSampler();
        private ResilienceMetrics metrics;
        private Path cacheDirectory = Path.of("cache");
        private Duration systemCheckInterval = ServiceHealthMonitor.DEFAULT_SYSTEM_CHECK_INTERVAL;
        private Duration degradationInterval = GracefulDegradationController.DEFAULT_MONITORING_INTERVAL;
        private final List<AlertHandler> alertHandlers = new ArrayList<>();
        private boolean loggingAlerts = true;

        private Builder() {
        }

        public Builder circuitBreaker(CircuitBreakerConfig circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        public Builder thresholds(MonitorThresholds thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder serviceRegistry(ServiceRegistry serviceRegistry) {
            this.serviceRegistry = serviceRegistry;
            return this;
        }

        public Builder lifecycleManager(ServiceLifecycleManager lifecycleManager) {
            this.lifecycleManager = lifecycleManager;
            return this;
        }

        public Builder resourceSampler(ResourceSampler resourceSampler) {
            this.resourceSampler = resourceSampler;
            return this;
        }

        public Builder metrics(ResilienceMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder cacheDirectory(Path cacheDirectory) {
            this.cacheDirectory = cacheDirectory;
            return this;
        }

        public Builder systemCheckInterval(Duration systemCheckInterval) {
            this.systemCheckInterval = systemCheckInterval;
            return this;
        }

        public Builder degradationInterval(Duration degradationInterval) {
            this.degradationInterval = degradationInterval;
            return this;
        }

        public Builder alertHandler(AlertHandler handler) {
            if (handler == null) {
                throw new IllegalArgumentException("handler must not be null");
            }
            alertHandlers.add(handler);
            return this;
        }

        public Builder withoutLoggingAlerts() {
            this.loggingAlerts = false;
            return this;
        }

        public ResilienceContext build() {
            if (metrics == null) {
                metrics = ResilienceMetrics.inMemory();
            }
            if (loggingAlerts) {
                alertHandlers.add(0, new LoggingAlertHandler());
            }
            return new ResilienceContext(this);
        }
    }
}
