package com.aegis.resilienceservice.infrastructure.web;

import com.aegis.resilience.fallback.FallbackException;
import com.aegis.resilience.fallback.NoActiveFallbackException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 ProblemDetail responses.
 *
 * <pre>
 * {
 *   "type": "https://aegis.dev/errors/no-active-fallback",
 *   "title": "Service Unavailable",
 *   "status": 503,
 *   "detail": "No active fallback for service 'orders-db'",
 *   "service": "orders-db",
 *   "timestamp": "2025-07-12T10:30:00Z"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(NoActiveFallbackException.class)
    public ProblemDetail handleNoActiveFallback(NoActiveFallbackException ex) {
        log.warn("Fallback request rejected: {}", ex.getMessage());
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
        problem.setTitle("Service Unavailable");
        problem.setType(URI.create("https://aegis.dev/errors/no-active-fallback"));
        problem.setProperty("service", ex.serviceName());
        enrich(problem);
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        problem.setType(URI.create("https://aegis.dev/errors/bad-request"));
        enrich(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof FallbackException fallback) {
            log.error("Fallback for {} failed", fallback.serviceName(), ex);
        } else {
            log.error("Internal server error", ex);
        }
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(
                        HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create("https://aegis.dev/errors/internal"));
        enrich(problem);
        return problem;
    }

    private void enrich(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
    }
}
