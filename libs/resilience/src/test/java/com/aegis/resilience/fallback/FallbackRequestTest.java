package com.aegis.resilience.fallback;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FallbackRequest")
class FallbackRequestTest {

    @Test
    @DisplayName("should identify a request without parameters by its type")
    void shouldIdentifyByType() {
        assertThat(FallbackRequest.of("status").identity()).isEqualTo("status");
    }

    @Test
    @DisplayName("should identify a request independently of parameter order")
    void shouldSortParameters() {
        var first = new LinkedHashMap<String, Object>();
        first.put("locale", "en");
        first.put("id", 42);
        var second = new LinkedHashMap<String, Object>();
        second.put("id", 42);
        second.put("locale", "en");

        assertThat(FallbackRequest.of("user_info", first).identity())
                .isEqualTo(FallbackRequest.of("user_info", second).identity())
                .isEqualTo("user_info?id=42&locale=en");
    }

    @Test
    @DisplayName("should treat null parameters as empty")
    void shouldDefaultParams() {
        assertThat(new FallbackRequest("status", null).params()).isEmpty();
    }

    @Test
    @DisplayName("should reject blank request type")
    void shouldRejectBlankType() {
        assertThatThrownBy(() -> FallbackRequest.of(" ", Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requestType");
    }
}
