package com.aegis.resilience.recovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CircuitBreakerConfig")
class CircuitBreakerConfigTest {

    @Test
    @DisplayName("should provide documented defaults")
    void shouldProvideDefaults() {
        var config = CircuitBreakerConfig.defaults();

        assertThat(config.failureThreshold()).isEqualTo(5);
        assertThat(config.recoveryTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.halfOpenMaxCalls()).isEqualTo(3);
        assertThat(config.successThreshold()).isEqualTo(2);
    }

    @Test
    @DisplayName("should reject non-positive values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new CircuitBreakerConfig(0, Duration.ofSeconds(1), 1, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("failureThreshold");
        assertThatThrownBy(() -> new CircuitBreakerConfig(1, Duration.ZERO, 1, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("recoveryTimeout");
        assertThatThrownBy(() -> new CircuitBreakerConfig(1, Duration.ofSeconds(1), 0, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CircuitBreakerConfig(1, Duration.ofSeconds(1), 1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should reject a success threshold above the half-open call limit")
    void shouldRejectUnreachableSuccessThreshold() {
        assertThatThrownBy(() -> new CircuitBreakerConfig(1, Duration.ofSeconds(60), 1, 2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("successThreshold must not exceed halfOpenMaxCalls");
    }

    @Test
    @DisplayName("should copy with changed threshold and timeout")
    void shouldCopyWithChanges() {
        var config = CircuitBreakerConfig.defaults()
                .withFailureThreshold(2)
                .withRecoveryTimeout(Duration.ofMillis(50));

        assertThat(config.failureThreshold()).isEqualTo(2);
        assertThat(config.recoveryTimeout()).isEqualTo(Duration.ofMillis(50));
        assertThat(config.successThreshold()).isEqualTo(CircuitBreakerConfig.DEFAULT_SUCCESS_THRESHOLD);
    }
}
