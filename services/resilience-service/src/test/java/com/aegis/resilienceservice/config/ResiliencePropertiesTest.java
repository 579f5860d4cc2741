package com.aegis.resilienceservice.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aegis.resilience.degradation.ServiceClassification;
import com.aegis.resilience.monitor.CheckType;
import com.aegis.resilience.monitor.MonitorThresholds;
import com.aegis.resilience.monitor.ResourceKind;
import com.aegis.resilience.recovery.CircuitBreakerConfig;
import java.net.URI;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ResilienceProperties} defaults and conversions, without Spring. */
@DisplayName("ResilienceProperties")
class ResiliencePropertiesTest {

    private static ResilienceProperties.ServiceDefinition service(
            CheckType check, URI endpoint, ResourceKind resource, double threshold) {
        return new ResilienceProperties.ServiceDefinition(
                "svc", null, check, endpoint, resource, threshold, null, null);
    }

    @Test
    @DisplayName("applies library defaults when every section is missing")
    void appliesDefaults() {
        var props = new ResilienceProperties(null, null, null, null, null);

        assertThat(props.circuitBreaker().toConfig()).isEqualTo(CircuitBreakerConfig.defaults());
        assertThat(props.monitor().thresholds().toThresholds()).isEqualTo(MonitorThresholds.defaults());
        assertThat(props.monitor().autoStart()).isTrue();
        assertThat(props.monitor().systemCheckInterval()).isEqualTo(Duration.ofSeconds(60));
        assertThat(props.services()).isEmpty();
        assertThat(props.features()).isEmpty();
        assertThat(props.cacheDirectory()).isEqualTo("cache");
    }

    @Test
    @DisplayName("keeps explicit circuit breaker settings")
    void keepsCircuitBreakerSettings() {
        var breaker = new ResilienceProperties.CircuitBreaker(3, Duration.ofSeconds(10), 1, 1);

        var config = breaker.toConfig();

        assertThat(config.failureThreshold()).isEqualTo(3);
        assertThat(config.recoveryTimeout()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    @DisplayName("overrides only the thresholds that are set")
    void overridesPartialThresholds() {
        var thresholds =
                new ResilienceProperties.Thresholds(Duration.ofSeconds(2), null, 90.0, null, null, null);

        var converted = thresholds.toThresholds();

        assertThat(converted.responseTime()).isEqualTo(Duration.ofSeconds(2));
        assertThat(converted.cpuPercent()).isEqualTo(90.0);
        assertThat(converted.errorRate()).isEqualTo(MonitorThresholds.defaults().errorRate());
    }

    @Test
    @DisplayName("defaults a service to optional without a health check")
    void defaultsServiceDefinition() {
        var definition = service(null, null, null, 0);

        assertThat(definition.classification()).isEqualTo(ServiceClassification.OPTIONAL);
        assertThat(definition.toHealthCheck()).isEmpty();
    }

    @Test
    @DisplayName("builds http and resource checks with the declared timing")
    void buildsHealthChecks() {
        var http =
                new ResilienceProperties.ServiceDefinition(
                        "api",
                        ServiceClassification.ESSENTIAL,
                        CheckType.HTTP,
                        URI.create("http://localhost:9000/health"),
                        null,
                        0,
                        Duration.ofSeconds(5),
                        Duration.ofSeconds(2));

        var check = http.toHealthCheck().orElseThrow();

        assertThat(check.type()).isEqualTo(CheckType.HTTP);
        assertThat(check.interval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(check.timeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(service(CheckType.RESOURCE, null, ResourceKind.CPU, 80).toHealthCheck())
                .hasValueSatisfying(c -> assertThat(c.threshold()).isEqualTo(80.0));
    }

    @Test
    @DisplayName("rejects checks that cannot be built from configuration")
    void rejectsInvalidChecks() {
        assertThatThrownBy(() -> service(CheckType.CUSTOM, null, null, 0).toHealthCheck())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("custom check");
        assertThatThrownBy(() -> service(CheckType.HTTP, null, null, 0).toHealthCheck())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
