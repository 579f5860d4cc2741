package com.aegis.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aegis.observability.testing.RecordingAlertHandler;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link AlertDispatcher}: registration, ordered delivery, and isolation of failing
 * handlers.
 */
@DisplayName("AlertDispatcher")
class AlertDispatcherTest {

    private AlertDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new AlertDispatcher();
    }

    private static Alert alert(String message) {
        return new Alert(AlertType.THRESHOLD_EXCEEDED, "svc", message, AlertSeverity.WARNING, Instant.now());
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("should register each handler only once")
        void shouldRegisterOnce() {
            var handler = new RecordingAlertHandler();

            assertThat(dispatcher.register(handler)).isTrue();
            assertThat(dispatcher.register(handler)).isFalse();
            assertThat(dispatcher.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("should reject null handler")
        void shouldRejectNull() {
            assertThatThrownBy(() -> dispatcher.register(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should deregister handler")
        void shouldDeregister() {
            var handler = new RecordingAlertHandler();
            dispatcher.register(handler);

            assertThat(dispatcher.deregister(handler)).isTrue();
            assertThat(dispatcher.size()).isZero();
        }
    }

    @Nested
    @DisplayName("Dispatch")
    class Dispatch {

        @Test
        @DisplayName("should deliver to handlers in registration order")
        void shouldDeliverInOrder() {
            List<String> order = new ArrayList<>();
            dispatcher.register(a -> order.add("first"));
            dispatcher.register(a -> order.add("second"));

            int delivered = dispatcher.dispatch(alert("slow"));

            assertThat(delivered).isEqualTo(2);
            assertThat(order).containsExactly("first", "second");
        }

        @Test
        @DisplayName("should keep delivering when one handler throws")
        void shouldIsolateFailingHandler() {
            var recorder = new RecordingAlertHandler();
            dispatcher.register(a -> {
                throw new IllegalStateException("pager down");
            });
            dispatcher.register(recorder);

            int delivered = dispatcher.dispatch(alert("cpu high"));

            assertThat(delivered).isEqualTo(1);
            assertThat(recorder.alerts()).extracting(Alert::message).containsExactly("cpu high");
        }

        @Test
        @DisplayName("should accept alerts with no handlers registered")
        void shouldAcceptWithNoHandlers() {
            assertThat(dispatcher.dispatch(alert("nobody listens"))).isZero();
        }
    }
}
