package com.aegis.resilienceservice.api;

import com.aegis.resilience.ResilienceContext;
import com.aegis.resilience.degradation.SystemStateSnapshot;
import com.aegis.resilience.degradation.SystemStatus;
import com.aegis.resilience.fallback.FallbackRequest;
import com.aegis.resilience.fallback.FallbackStatus;
import com.aegis.resilience.monitor.SystemHealthReport;
import com.aegis.resilience.recovery.HealthReport;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of the resilience core, plus a passthrough for serving requests from an
 * active fallback.
 */
@RestController
@RequestMapping("/api/v1/resilience")
public class ResilienceStatusController {

    private final ResilienceContext resilience;

    public ResilienceStatusController(ResilienceContext resilience) {
        this.resilience = resilience;
    }

    @GetMapping("/status")
    public SystemStatus status() {
        return resilience.degradationController().getSystemStatus();
    }

    @GetMapping("/report")
    public SystemHealthReport report() {
        return resilience.healthMonitor().generateHealthReport();
    }

    @GetMapping("/services")
    public HealthReport services() {
        return resilience.recoveryManager().exportHealthReport();
    }

    @GetMapping("/fallbacks")
    public FallbackStatus fallbacks() {
        return resilience.fallbackManager().getFallbackStatus();
    }

    @GetMapping("/features/{feature}")
    public Map<String, Object> feature(@PathVariable String feature) {
        return Map.of(
                "feature", feature,
                "available", resilience.degradationController().isFeatureAvailable(feature));
    }

    @GetMapping("/history")
    public List<SystemStateSnapshot> history(@RequestParam(defaultValue = "24") int hours) {
        if (hours < 0) {
            throw new IllegalArgumentException("hours must not be negative");
        }
        return resilience.degradationController().getDegradationHistory(hours);
    }

    /**
     * Serves a request from the service's active fallback.
     *
     * <p>Responds 503 when the service has no active fallback.
     */
    @PostMapping("/fallbacks/{service}/requests/{requestType}")
    public Object fallbackRequest(
            @PathVariable String service,
            @PathVariable String requestType,
            @RequestBody(required = false) Map<String, Object> params) {
        return resilience
                .fallbackManager()
                .handleFallbackRequest(service, FallbackRequest.of(requestType, params))
                .orThrow();
    }
}
