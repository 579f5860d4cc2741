package com.aegis.resilienceservice.config;

import com.aegis.resilience.degradation.ServiceClassification;
import com.aegis.resilience.monitor.CheckType;
import com.aegis.resilience.monitor.HealthCheckConfig;
import com.aegis.resilience.monitor.MonitorThresholds;
import com.aegis.resilience.monitor.ResourceKind;
import com.aegis.resilience.recovery.CircuitBreakerConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration of the embedded resilience core.
 *
 * <p>Properties are bound from the {@code aegis.resilience.*} prefix:
 *
 * <pre>
 * aegis:
 *   resilience:
 *     circuit-breaker:
 *       failure-threshold: 5
 *       recovery-timeout: 60s
 *     monitor:
 *       auto-start: true
 *       thresholds:
 *         response-time: 500ms
 *     services:
 *       - name: orders-db
 *         classification: essential
 *         check: http
 *         endpoint: http://orders-db:8080/health
 *     features:
 *       checkout: [orders-db, payments]
 * </pre>
 *
 * <p>Every section is optional; the compact constructors apply the library defaults.
 *
 * @param circuitBreaker circuit breaker settings shared by all services
 * @param monitor health monitor and degradation loop settings
 * @param services services to protect, with their classification and optional health check
 * @param features feature name to the services it requires
 * @param cacheDirectory where cache fallbacks persist their responses
 */
@ConfigurationProperties(prefix = "aegis.resilience")
@Validated
public record ResilienceProperties(
        @Valid CircuitBreaker circuitBreaker,
        @Valid Monitor monitor,
        @Valid List<ServiceDefinition> services,
        Map<String, List<String>> features,
        String cacheDirectory) {

    public ResilienceProperties {
        if (circuitBreaker == null) {
            circuitBreaker = new CircuitBreaker(0, null, 0, 0);
        }
        if (monitor == null) {
            monitor = new Monitor(null, null, null, null);
        }
        services = services == null ? List.of() : List.copyOf(services);
        features = features == null ? Map.of() : Map.copyOf(features);
        if (cacheDirectory == null || cacheDirectory.isBlank()) {
            cacheDirectory = "cache";
        }
    }

    public Path cacheDirectoryPath() {
        return Path.of(cacheDirectory);
    }

    /** Circuit breaker settings; zero or missing values fall back to the library defaults. */
    public record CircuitBreaker(
            int failureThreshold, Duration recoveryTimeout, int halfOpenMaxCalls, int successThreshold) {

        public CircuitBreaker {
            if (failureThreshold <= 0) {
                failureThreshold = CircuitBreakerConfig.DEFAULT_FAILURE_THRESHOLD;
            }
            if (recoveryTimeout == null) {
                recoveryTimeout = CircuitBreakerConfig.DEFAULT_RECOVERY_TIMEOUT;
            }
            if (halfOpenMaxCalls <= 0) {
                halfOpenMaxCalls = CircuitBreakerConfig.DEFAULT_HALF_OPEN_MAX_CALLS;
            }
            if (successThreshold <= 0) {
                successThreshold = CircuitBreakerConfig.DEFAULT_SUCCESS_THRESHOLD;
            }
        }

        public CircuitBreakerConfig toConfig() {
            return new CircuitBreakerConfig(
                    failureThreshold, recoveryTimeout, halfOpenMaxCalls, successThreshold);
        }
    }

    /**
     * Monitoring settings.
     *
     * @param thresholds alert thresholds
     * @param systemCheckInterval period of the system-wide health evaluation
     * @param degradationInterval period of the degradation reconciliation loop
     * @param autoStart start monitoring once the context is built (default true)
     */
    public record Monitor(
            Thresholds thresholds,
            Duration systemCheckInterval,
            Duration degradationInterval,
            Boolean autoStart) {

        public Monitor {
            if (thresholds == null) {
                thresholds = new Thresholds(null, null, null, null, null, null);
            }
            if (systemCheckInterval == null) {
                systemCheckInterval = Duration.ofSeconds(60);
            }
            if (degradationInterval == null) {
                degradationInterval = Duration.ofSeconds(30);
            }
            if (autoStart == null) {
                autoStart = Boolean.TRUE;
            }
        }
    }

    /** Alert thresholds; missing values take {@link MonitorThresholds#defaults()}. */
    public record Thresholds(
            Duration responseTime,
            Double errorRate,
            Double cpuPercent,
            Double memoryMb,
            Double failedFraction,
            Double unhealthyFraction) {

        public Thresholds {
            MonitorThresholds defaults = MonitorThresholds.defaults();
            responseTime = responseTime == null ? defaults.responseTime() : responseTime;
            errorRate = errorRate == null ? defaults.errorRate() : errorRate;
            cpuPercent = cpuPercent == null ? defaults.cpuPercent() : cpuPercent;
            memoryMb = memoryMb == null ? defaults.memoryMb() : memoryMb;
            failedFraction = failedFraction == null ? defaults.failedFraction() : failedFraction;
            unhealthyFraction =
                    unhealthyFraction == null ? defaults.unhealthyFraction() : unhealthyFraction;
        }

        public MonitorThresholds toThresholds() {
            return new MonitorThresholds(
                    responseTime, errorRate, cpuPercent, memoryMb, failedFraction, unhealthyFraction);
        }
    }

    /**
     * A protected service. {@code check} may be omitted for services reported to the recovery
     * manager by the application itself.
     *
     * @param name service name
     * @param classification essential, optional or background (default optional)
     * @param check health check type, or null for none
     * @param endpoint URL probed by {@code http} checks
     * @param resource resource measured by {@code resource} checks
     * @param threshold resource limit (percent for CPU, megabytes for memory)
     * @param interval time between checks
     * @param timeout time allowed for one check
     */
    public record ServiceDefinition(
            @NotBlank String name,
            ServiceClassification classification,
            CheckType check,
            URI endpoint,
            ResourceKind resource,
            double threshold,
            Duration interval,
            Duration timeout) {

        public ServiceDefinition {
            if (classification == null) {
                classification = ServiceClassification.OPTIONAL;
            }
            if (interval == null) {
                interval = HealthCheckConfig.DEFAULT_INTERVAL;
            }
            if (timeout == null) {
                timeout = HealthCheckConfig.DEFAULT_TIMEOUT;
            }
        }

        /**
         * Builds the health check, if one is declared.
         *
         * @throws IllegalArgumentException for {@code custom} checks, which need a probe in code
         */
        public Optional<HealthCheckConfig> toHealthCheck() {
            if (check == null) {
                return Optional.empty();
            }
            HealthCheckConfig config = switch (check) {
                case PING -> HealthCheckConfig.ping();
                case HTTP -> HealthCheckConfig.http(endpoint);
                case RESOURCE -> HealthCheckConfig.resource(resource, threshold);
                case CUSTOM -> throw new IllegalArgumentException(
                        "custom check for service '" + name + "' cannot be declared in configuration");
            };
            return Optional.of(config.withInterval(interval).withTimeout(timeout));
        }
    }
}
