package com.aegis.resilience.fallback;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.aegis.observability.Alert;
import com.aegis.observability.AlertSeverity;
import com.aegis.observability.AlertType;
import com.aegis.resilience.ResilienceMetrics;
import com.aegis.resilience.recovery.CircuitBreakerConfig;
import com.aegis.resilience.recovery.ErrorRecoveryManager;
import com.aegis.resilience.recovery.ServiceStatus;
import com.aegis.resilience.service.ServiceRegistry;
import com.aegis.resilience.testing.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link FallbackManager}: prioritized activation, request routing, retry windows and
 * the integration with {@link ErrorRecoveryManager} alerts.
 */
@DisplayName("FallbackManager")
class FallbackManagerTest {

    @TempDir
    Path cacheDirectory;

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private FallbackManager manager;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAtEpochOf2024();
        meterRegistry = new SimpleMeterRegistry();
        manager = new FallbackManager(null, ServiceRegistry.empty(), clock, new ResilienceMetrics(meterRegistry),
                cacheDirectory);
    }

    private static FallbackHandler handler(FallbackType type, int priority, boolean activates) {
        var handler = mock(FallbackHandler.class);
        when(handler.config()).thenReturn(FallbackConfig.of(type, priority));
        when(handler.activate()).thenReturn(activates);
        when(handler.isReady()).thenReturn(true);
        return handler;
    }

    @Nested
    @DisplayName("Activation")
    class Activation {

        @Test
        @DisplayName("should try handlers in ascending priority order")
        void shouldTryInPriorityOrder() {
            var second = handler(FallbackType.STATIC, 2, true);
            var first = handler(FallbackType.CACHE, 1, false);
            manager.registerFallback("users", second);
            manager.registerFallback("users", first);

            assertThat(manager.activateFallback("users")).isTrue();

            verify(first, times(1)).activate();
            verify(second, times(1)).activate();
            assertThat(manager.getActiveFallbackType("users")).contains(FallbackType.STATIC);
        }

        @Test
        @DisplayName("should stop at the first handler that activates")
        void shouldStopAtFirstSuccess() {
            var first = handler(FallbackType.CACHE, 1, true);
            var second = handler(FallbackType.STATIC, 2, true);
            manager.registerFallback("users", first);
            manager.registerFallback("users", second);

            manager.activateFallback("users");

            verify(second, never()).activate();
            assertThat(manager.getActiveFallbackType("users")).contains(FallbackType.CACHE);
        }

        @Test
        @DisplayName("should report failure when every handler fails")
        void shouldFailWhenAllFail() {
            manager.registerFallback("users", handler(FallbackType.CACHE, 1, false));
            manager.registerSimplifiedFallback("users", null, 2);

            assertThat(manager.activateFallback("users")).isFalse();
            assertThat(manager.isFallbackActive("users")).isFalse();
        }

        @Test
        @DisplayName("should report failure for services without fallbacks")
        void shouldFailWithoutHandlers() {
            assertThat(manager.activateFallback("unknown")).isFalse();
        }

        @Test
        @DisplayName("should treat a throwing handler as failed and try the next")
        void shouldSurviveThrowingHandler() {
            var broken = handler(FallbackType.CACHE, 1, false);
            when(broken.activate()).thenThrow(new IllegalStateException("disk gone"));
            manager.registerFallback("users", broken);
            manager.registerMockFallback("users", 2);

            assertThat(manager.activateFallback("users")).isTrue();
            assertThat(manager.getActiveFallbackType("users")).contains(FallbackType.MOCK);
        }

        @Test
        @DisplayName("should skip a failed handler until its retry window elapses")
        void shouldHonorRetryAfter() {
            var flaky = handler(FallbackType.CACHE, 1, false);
            manager.registerFallback("users", flaky);

            manager.activateFallback("users");
            manager.activateFallback("users");
            verify(flaky, times(1)).activate();

            clock.advance(FallbackConfig.DEFAULT_RETRY_AFTER);
            manager.activateFallback("users");
            verify(flaky, times(2)).activate();
        }

        @Test
        @DisplayName("should count activation attempts per outcome")
        void shouldRecordMetrics() {
            manager.registerFallback("users", handler(FallbackType.CACHE, 1, false));
            manager.registerMockFallback("users", 2);

            manager.activateFallback("users");

            assertThat(meterRegistry.get(ResilienceMetrics.FALLBACK_ACTIVATIONS)
                    .tag("type", "cache").tag("outcome", "failed").counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get(ResilienceMetrics.FALLBACK_ACTIVATIONS)
                    .tag("type", "mock").tag("outcome", "activated").counter().count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Requests")
    class Requests {

        @Test
        @DisplayName("should report NO_ACTIVE_FALLBACK when nothing is active")
        void shouldReportNoActiveFallback() {
            manager.registerMockFallback("users", 1);

            var result = manager.handleFallbackRequest("users", FallbackRequest.of("user_info"));

            assertThat(result.success()).isFalse();
            assertThat(result.errorKind()).isEqualTo(FallbackErrorKind.NO_ACTIVE_FALLBACK);
            assertThatThrownBy(result::orThrow).isInstanceOf(NoActiveFallbackException.class);
        }

        @Test
        @DisplayName("should route requests to the active handler")
        void shouldRouteToActive() {
            manager.registerStaticFallback("weather", Map.of("forecast", "sunny"), null, 1);
            manager.activateFallback("weather");

            var result = manager.handleFallbackRequest("weather", FallbackRequest.of("forecast"));

            assertThat(result.success()).isTrue();
            assertThat(result.payload()).isEqualTo("sunny");
        }

        @Test
        @DisplayName("should report handler errors without throwing")
        void shouldReportHandlerErrors() {
            manager.registerStaticFallback("weather", Map.of("forecast", "sunny"), null, 1);
            manager.activateFallback("weather");

            var result = manager.handleFallbackRequest("weather", FallbackRequest.of("radar"));

            assertThat(result.errorKind()).isEqualTo(FallbackErrorKind.HANDLER_ERROR);
            assertThat(result.message()).contains("No static response available");
        }

        @Test
        @DisplayName("should stop routing after deactivation")
        void shouldStopAfterDeactivation() {
            manager.registerMockFallback("users", 1);
            manager.activateFallback("users");

            assertThat(manager.deactivateFallback("users")).isTrue();
            assertThat(manager.deactivateFallback("users")).isFalse();
            assertThat(manager.handleFallbackRequest("users", FallbackRequest.of("x")).errorKind())
                    .isEqualTo(FallbackErrorKind.NO_ACTIVE_FALLBACK);
        }

        @Test
        @DisplayName("should feed captured responses to cache fallbacks")
        void shouldFeedCacheFallbacks() {
            var cache = manager.registerCacheFallback("users", 1);
            manager.registerMockFallback("users", 2);
            var request = FallbackRequest.of("user_info", Map.of("id", 7));

            assertThat(manager.cacheResponse("users", request, Map.of("name", "Grace"))).isEqualTo(1);
            manager.activateFallback("users");

            assertThat(cache.cacheFile()).isEqualTo(cacheDirectory.resolve("fallback_users.json"));
            assertThat(manager.handleFallbackRequest("users", request).orThrow())
                    .isEqualTo(Map.of("name", "Grace"));
        }
    }

    @Test
    @DisplayName("should report active and registered fallbacks")
    void shouldReportStatus() {
        manager.registerMockFallback("users", 2);
        manager.registerStaticFallback("users", Map.of(), "default", 1);
        manager.registerSimplifiedFallback("search", r -> "basic", 1);
        manager.activateFallback("users");

        var status = manager.getFallbackStatus();

        assertThat(status.active()).containsOnlyKeys("users");
        assertThat(status.active().get("users").type()).isEqualTo(FallbackType.STATIC);
        assertThat(status.active().get("users").activatedAt()).isEqualTo(clock.instant());
        assertThat(status.registered().get("users"))
                .extracting(FallbackStatus.RegisteredFallback::type)
                .containsExactly(FallbackType.STATIC, FallbackType.MOCK);
        assertThat(status.registered().get("search")).singleElement()
                .satisfies(r -> assertThat(r.active()).isFalse());
    }

    @Nested
    @DisplayName("Recovery manager integration")
    class RecoveryIntegration {

        private ErrorRecoveryManager recoveryManager;

        @BeforeEach
        void setUp() {
            recoveryManager = new ErrorRecoveryManager(CircuitBreakerConfig.defaults(), clock,
                    ServiceRegistry.empty(), null, ResilienceMetrics.inMemory());
            manager = new FallbackManager(recoveryManager, ServiceRegistry.empty(), clock,
                    ResilienceMetrics.inMemory(), cacheDirectory);
        }

        @AfterEach
        void tearDown() {
            recoveryManager.shutdown();
        }

        @Test
        @DisplayName("should serve the mock payload after an optional service fails once")
        void shouldDegradeOptionalService() {
            recoveryManager.registerService("cache");
            manager.registerMockFallback("cache", r -> Map.of("cached", false), Map.of(), 1);

            assertThat(recoveryManager.handleServiceFailure("cache", new RuntimeException("down"))).isTrue();

            assertThat(recoveryManager.getServiceHealth("cache").orElseThrow().status())
                    .isEqualTo(ServiceStatus.DEGRADED);
            assertThat(manager.handleFallbackRequest("cache", FallbackRequest.of("get")).orThrow())
                    .isEqualTo(Map.of("cached", false));
        }

        @Test
        @DisplayName("should mark services with a registered fallback")
        void shouldRegisterActivator() {
            recoveryManager.registerService("cache");
            manager.registerMockFallback("cache", 1);

            assertThat(recoveryManager.getServiceHealth("cache").orElseThrow().fallbackAvailable()).isTrue();
        }

        @Test
        @DisplayName("should activate on circuit opened and deactivate on recovery")
        void shouldFollowAlerts() {
            manager.registerMockFallback("search", 1);

            manager.onAlert(new Alert(AlertType.CIRCUIT_OPENED, "search", "Circuit breaker opened for service search",
                    AlertSeverity.WARNING, clock.instant()));
            assertThat(manager.isFallbackActive("search")).isTrue();

            manager.onAlert(new Alert(AlertType.SERVICE_RECOVERED, "search", "recovered",
                    AlertSeverity.INFO, clock.instant()));
            assertThat(manager.isFallbackActive("search")).isFalse();
        }

        @Test
        @DisplayName("should ignore system-wide alerts")
        void shouldIgnoreSystemAlerts() {
            manager.registerMockFallback("search", 1);

            manager.onAlert(Alert.system(AlertType.SYSTEM_HEALTH, "degraded", AlertSeverity.WARNING, clock.instant()));

            assertThat(manager.isFallbackActive("search")).isFalse();
        }

        @Test
        @DisplayName("should deactivate the fallback when the circuit closes again")
        void shouldDeactivateOnCircuitClose() {
            recoveryManager.registerService("search");
            manager.registerMockFallback("search", 1);
            for (int i = 0; i < 5; i++) {
                recoveryManager.handleServiceFailure("search", new RuntimeException("down"));
            }
            assertThat(manager.isFallbackActive("search")).isTrue();

            clock.advance(Duration.ofSeconds(61));
            recoveryManager.checkCircuitBreaker("search");
            recoveryManager.recordServiceSuccess("search");
            recoveryManager.recordServiceSuccess("search");

            assertThat(manager.isFallbackActive("search")).isFalse();
        }
    }
}
