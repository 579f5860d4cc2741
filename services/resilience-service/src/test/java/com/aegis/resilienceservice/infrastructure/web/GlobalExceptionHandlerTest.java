package com.aegis.resilienceservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.aegis.resilience.fallback.FallbackException;
import com.aegis.resilience.fallback.NoActiveFallbackException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("maps NoActiveFallbackException to 503 Service Unavailable")
    void handlesNoActiveFallbackAsUnavailable() {
        ProblemDetail result = handler.handleNoActiveFallback(new NoActiveFallbackException("orders-db"));

        assertThat(result.getStatus()).isEqualTo(503);
        assertThat(result.getDetail()).isEqualTo("No active fallback for service 'orders-db'");
        assertThat(result.getProperties()).containsEntry("service", "orders-db");
    }

    @Test
    @DisplayName("maps IllegalArgumentException to 400 Bad Request")
    void handlesIllegalArgumentAsBadRequest() {
        ProblemDetail result =
                handler.handleIllegalArgument(new IllegalArgumentException("hours must not be negative"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getTitle()).isEqualTo("Bad Request");
    }

    @Test
    @DisplayName("maps a failing fallback handler to 500 without leaking its message")
    void handlesFallbackFailureAsInternalError() {
        ProblemDetail result = handler.handleGeneric(new FallbackException("cache", "disk full"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getDetail()).isEqualTo("An unexpected error occurred");
        assertThat(result.getProperties()).containsKey("timestamp");
    }
}
