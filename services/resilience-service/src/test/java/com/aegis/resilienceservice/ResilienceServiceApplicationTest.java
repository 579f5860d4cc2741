package com.aegis.resilienceservice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.aegis.resilience.ResilienceContext;
import com.aegis.resilience.degradation.ServiceClassification;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Integration tests for the resilience service. The 'test' profile declares services and
 * features but does not start the monitoring loops.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
@DisplayName("Resilience Service Application")
class ResilienceServiceApplicationTest {

    @Autowired private ResilienceContext resilience;
    @Autowired private MockMvc mockMvc;

    @Test
    @DisplayName("registers the declared services and features")
    void registersDeclaredServices() {
        assertThat(resilience.recoveryManager().isRegistered("orders-db")).isTrue();
        assertThat(resilience.degradationController().getServiceClassification("reporting"))
                .contains(ServiceClassification.BACKGROUND);
        assertThat(resilience.healthMonitor().registeredChecks()).containsExactly("recommendations");
        assertThat(resilience.degradationController().getFeatureDependencies())
                .containsKeys("checkout", "personalized-home");
        assertThat(resilience.healthMonitor().isMonitoring()).isFalse();
    }

    @Test
    @DisplayName("reports a normal system on startup")
    void reportsNormalStatus() throws Exception {
        mockMvc.perform(get("/api/v1/resilience/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.degradationLevel").value("NORMAL"))
                .andExpect(jsonPath("$.emergencyMode").value(false));
    }

    @Test
    @DisplayName("reports degradation after an essential service fails")
    void reportsDegradation() throws Exception {
        resilience.recoveryManager().handleServiceFailure("orders-db", new RuntimeException("down"));

        mockMvc.perform(get("/api/v1/resilience/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.degradationLevel").value("SEVERE"))
                .andExpect(jsonPath("$.failedServices[0]").value("orders-db"));
        mockMvc.perform(get("/api/v1/resilience/features/checkout"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.available").value(false));
        mockMvc.perform(get("/api/v1/resilience/history").param("hours", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    @DisplayName("serves requests from an active fallback")
    void servesFromFallback() throws Exception {
        resilience.fallbackManager().registerMockFallback("recommendations", 1);
        resilience.recoveryManager().handleServiceFailure("recommendations", new RuntimeException("timeout"));

        mockMvc.perform(post("/api/v1/resilience/fallbacks/recommendations/requests/top")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user\":\"u-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("mock_response"));
        mockMvc.perform(get("/api/v1/resilience/fallbacks"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active.recommendations.type").value("MOCK"));
    }

    @Test
    @DisplayName("answers 503 when no fallback is active")
    void rejectsWithoutActiveFallback() throws Exception {
        mockMvc.perform(post("/api/v1/resilience/fallbacks/orders-db/requests/query"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.title").value("Service Unavailable"));
    }

    @Test
    @DisplayName("answers 400 for a negative history window")
    void rejectsNegativeHistoryWindow() throws Exception {
        mockMvc.perform(get("/api/v1/resilience/history").param("hours", "-1"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("exposes the health report and actuator health")
    void exposesReports() throws Exception {
        mockMvc.perform(get("/api/v1/resilience/report"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.monitoring").value(false));
        mockMvc.perform(get("/api/v1/resilience/services")).andExpect(status().isOk());
        mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
    }
}
