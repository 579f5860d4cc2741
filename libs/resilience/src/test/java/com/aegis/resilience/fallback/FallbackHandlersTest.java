package com.aegis.resilience.fallback;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.aegis.resilience.service.ManagedService;
import com.aegis.resilience.service.ServiceRegistry;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for the built-in {@link FallbackHandler} kinds.
 */
@DisplayName("Fallback handlers")
class FallbackHandlersTest {

    private static final FallbackRequest USER_INFO = FallbackRequest.of("user_info", Map.of("id", 42));

    @Test
    @DisplayName("should refuse requests while inactive")
    void shouldRefuseWhileInactive() {
        var handler = new MockFallbackHandler("svc", FallbackConfig.of(FallbackType.MOCK));

        assertThatThrownBy(() -> handler.handleRequest(USER_INFO))
                .isInstanceOf(FallbackException.class)
                .hasMessageContaining("not active");
    }

    @Test
    @DisplayName("should reject a config of another kind")
    void shouldRejectMismatchedConfig() {
        assertThatThrownBy(() -> new MockFallbackHandler("svc", FallbackConfig.of(FallbackType.CACHE)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("Cache")
    class Cache {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("should serve captured responses by request identity")
        void shouldServeCaptured() {
            var handler = new CacheFallbackHandler("users", FallbackConfig.of(FallbackType.CACHE));
            handler.cacheResponse(USER_INFO, Map.of("name", "Ada"));
            handler.activate();

            assertThat(handler.handleRequest(FallbackRequest.of("user_info", Map.of("id", 42))))
                    .isEqualTo(Map.of("name", "Ada"));
        }

        @Test
        @DisplayName("should fail on a cache miss")
        void shouldFailOnMiss() {
            var handler = new CacheFallbackHandler("users", FallbackConfig.of(FallbackType.CACHE));
            handler.activate();

            assertThatThrownBy(() -> handler.handleRequest(USER_INFO))
                    .isInstanceOf(FallbackException.class)
                    .hasMessageContaining("No cached response available");
        }

        @Test
        @DisplayName("should persist on deactivate and reload on activate")
        void shouldPersistAndReload() {
            Path file = tempDir.resolve("nested").resolve("fallback_users.json");
            var first = new CacheFallbackHandler("users", FallbackConfig.of(FallbackType.CACHE), file);
            first.activate();
            first.cacheResponse(USER_INFO, Map.of("name", "Ada"));

            assertThat(first.deactivate()).isTrue();
            assertThat(Files.exists(file)).isTrue();

            var second = new CacheFallbackHandler("users", FallbackConfig.of(FallbackType.CACHE), file);
            assertThat(second.activate()).isTrue();
            assertThat(second.size()).isEqualTo(1);
            assertThat(second.handleRequest(USER_INFO)).isEqualTo(Map.of("name", "Ada"));
        }

        @Test
        @DisplayName("should activate with an unreadable cache file")
        void shouldActivateWithCorruptFile() throws Exception {
            Path file = tempDir.resolve("fallback_users.json");
            Files.writeString(file, "not json");
            var handler = new CacheFallbackHandler("users", FallbackConfig.of(FallbackType.CACHE), file);

            assertThat(handler.activate()).isTrue();
            assertThat(handler.size()).isZero();
        }
    }

    @Nested
    @DisplayName("Static")
    class Static {

        @Test
        @DisplayName("should serve per-type response, else the default")
        void shouldServeStaticResponses() {
            var handler = new StaticFallbackHandler("weather", FallbackConfig.of(FallbackType.STATIC),
                    Map.of("forecast", "sunny"), "unavailable");
            handler.activate();

            assertThat(handler.handleRequest(FallbackRequest.of("forecast"))).isEqualTo("sunny");
            assertThat(handler.handleRequest(FallbackRequest.of("radar"))).isEqualTo("unavailable");
        }

        @Test
        @DisplayName("should fail for unknown types without a default")
        void shouldFailWithoutDefault() {
            var handler = new StaticFallbackHandler("weather", FallbackConfig.of(FallbackType.STATIC),
                    Map.of("forecast", "sunny"), null);
            handler.activate();

            assertThatThrownBy(() -> handler.handleRequest(FallbackRequest.of("radar")))
                    .isInstanceOf(FallbackException.class)
                    .hasMessageContaining("No static response available");
        }
    }

    @Nested
    @DisplayName("Simplified")
    class Simplified {

        @Test
        @DisplayName("should not activate without a callback")
        void shouldNotActivateWithoutCallback() {
            var handler = new SimplifiedFallbackHandler("search", FallbackConfig.of(FallbackType.SIMPLIFIED), null);

            assertThat(handler.isReady()).isFalse();
            assertThat(handler.activate()).isFalse();
            assertThat(handler.isActive()).isFalse();
        }

        @Test
        @DisplayName("should delegate to the callback and wrap its failures")
        void shouldDelegate() {
            var handler = new SimplifiedFallbackHandler("search", FallbackConfig.of(FallbackType.SIMPLIFIED),
                    request -> {
                        if (request.requestType().equals("broken")) {
                            throw new IllegalStateException("nope");
                        }
                        return "basic results for " + request.requestType();
                    });
            handler.activate();

            assertThat(handler.handleRequest(FallbackRequest.of("query"))).isEqualTo("basic results for query");
            assertThatThrownBy(() -> handler.handleRequest(FallbackRequest.of("broken")))
                    .isInstanceOf(FallbackException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Proxy")
    class Proxy {

        @Test
        @DisplayName("should forward to another registered service")
        void shouldForwardToService() {
            var replica = mock(ManagedService.class);
            when(replica.handleRequest(USER_INFO)).thenReturn("from replica");
            var handler = ProxyFallbackHandler.toService("users", FallbackConfig.of(FallbackType.PROXY),
                    ServiceRegistry.of(Map.of("users-replica", replica)), "users-replica");

            assertThat(handler.activate()).isTrue();
            assertThat(handler.handleRequest(USER_INFO)).isEqualTo("from replica");
        }

        @Test
        @DisplayName("should not activate when the target service is not registered")
        void shouldNotActivateWithoutTarget() {
            var handler = ProxyFallbackHandler.toService("users", FallbackConfig.of(FallbackType.PROXY),
                    ServiceRegistry.empty(), "users-replica");

            assertThat(handler.activate()).isFalse();
        }

        @Test
        @DisplayName("should not activate without a target")
        void shouldNotActivateUnconfigured() {
            var handler = ProxyFallbackHandler.toService("users", FallbackConfig.of(FallbackType.PROXY),
                    ServiceRegistry.empty(), null);

            assertThat(handler.isReady()).isFalse();
            assertThat(handler.activate()).isFalse();
        }

        @Test
        @DisplayName("should be ready with an endpoint")
        void shouldBeReadyWithEndpoint() {
            var handler = ProxyFallbackHandler.toEndpoint("users", FallbackConfig.of(FallbackType.PROXY),
                    URI.create("http://localhost:1/users"), HttpClient.newHttpClient());

            assertThat(handler.isReady()).isTrue();
            assertThat(handler.activate()).isTrue();
            assertThat(handler.proxyEndpoint()).contains(URI.create("http://localhost:1/users"));
        }
    }

    @Nested
    @DisplayName("Mock")
    class Mock {

        @Test
        @DisplayName("should prefer the generator")
        void shouldUseGenerator() {
            var handler = new MockFallbackHandler("users", FallbackConfig.of(FallbackType.MOCK),
                    request -> Map.of("mock", request.requestType()), Map.of("user_info", "table"));
            handler.activate();

            assertThat(handler.handleRequest(USER_INFO)).isEqualTo(Map.of("mock", "user_info"));
        }

        @Test
        @DisplayName("should fall back to the table, then the default response")
        void shouldUseTableThenDefault() {
            var handler = new MockFallbackHandler("users", FallbackConfig.of(FallbackType.MOCK),
                    null, Map.of("user_info", "table"));
            handler.activate();

            assertThat(handler.handleRequest(USER_INFO)).isEqualTo("table");
            assertThat(handler.handleRequest(FallbackRequest.of("other")))
                    .isEqualTo(Map.of("status", "mock_response"));
        }
    }
}
