package com.aegis.resilienceservice;

import com.aegis.resilienceservice.config.ResilienceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Aegis resilience service: embeds the resilience core in a Spring Boot application.
 *
 * <p>Services, health checks and feature dependencies are declared under {@code
 * aegis.resilience} in application.yml. The service exposes:
 *
 * <ul>
 *   <li>the degradation status, health report, fallback status and history under {@code
 *       /api/v1/resilience}
 *   <li>Actuator health, metrics and Prometheus endpoints, including the {@code resilience.*}
 *       meters
 *   <li>RFC 7807 ProblemDetail error responses
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(ResilienceProperties.class)
public class ResilienceServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(ResilienceServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ResilienceServiceApplication.class, args);
        log.info("Aegis Resilience Service started successfully");
    }
}
