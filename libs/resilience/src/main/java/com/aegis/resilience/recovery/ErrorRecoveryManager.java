package com.aegis.resilience.recovery;

import com.aegis.observability.Alert;
import com.aegis.observability.AlertDispatcher;
import com.aegis.observability.AlertHandler;
import com.aegis.observability.AlertSeverity;
import com.aegis.observability.AlertType;
import com.aegis.resilience.ResilienceMetrics;
import com.aegis.resilience.service.ManagedService;
import com.aegis.resilience.service.ServiceLifecycleManager;
import com.aegis.resilience.service.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns the per-service health state and the circuit breaker state machine.
 * <p>
 * Failures and successes are reported by the health monitor (or by callers directly).
 * The manager counts failures, opens the circuit once {@link CircuitBreakerConfig#failureThreshold()}
 * is reached, schedules a recovery attempt after {@link CircuitBreakerConfig#recoveryTimeout()},
 * and closes the circuit again after {@link CircuitBreakerConfig#successThreshold()} successes
 * while half-open:
 *
 * <pre>
 * CLOSED --threshold failures--&gt; OPEN --timeout--&gt; HALF_OPEN --successes--&gt; CLOSED
 *                                   ^                  |
 *                                   +--failure/expiry--+
 * </pre>
 *
 * A half-open circuit that has not closed within another recovery timeout re-opens, so a
 * stalled probe period never leaves a service half-open.
 *
 * Essential services are never abandoned: each failure triggers an immediate recovery attempt
 * and recovery keeps being retried after every timeout. Optional services are substituted by
 * a fallback when one is registered, and are considered stopped otherwise.
 * <p>
 * Every transition raises an {@link Alert}: {@link AlertSeverity#CRITICAL} for essential
 * services, {@link AlertSeverity#WARNING} otherwise, {@link AlertSeverity#INFO} for recovery.
 * Alerts, fallback callbacks and listeners always run outside the internal lock.
 */
public final class ErrorRecoveryManager {

    private static final Logger log = LoggerFactory.getLogger(ErrorRecoveryManager.class);

    private final Object lock = new Object();
    private final Map<String, ServiceHealth> services = new LinkedHashMap<>();
    private final Map<String, FallbackActivator> fallbackActivators = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> scheduledRecoveries = new ConcurrentHashMap<>();
    private final List<ServiceEventListener> listeners = new CopyOnWriteArrayList<>();
    private final AlertDispatcher alerts = new AlertDispatcher();

    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ServiceRegistry serviceRegistry;
    private final ServiceLifecycleManager lifecycleManager;
    private final ResilienceMetrics metrics;
    private final ScheduledExecutorService scheduler;

    private volatile boolean shutdown;

    /**
     * Creates a manager with the system clock, no service registry and no lifecycle manager.
     */
    public ErrorRecoveryManager(CircuitBreakerConfig config) {
        this(config, Clock.systemUTC(), ServiceRegistry.empty(), null, ResilienceMetrics.inMemory());
    }

    /**
     * Creates a manager.
     *
     * @param config           circuit breaker settings
     * @param clock            time source for failure/success timestamps and timeouts
     * @param serviceRegistry  used to re-probe a service when no lifecycle manager is available
     * @param lifecycleManager restart hook, or null if services cannot be restarted
     * @param metrics          meters for failures and circuit transitions
     */
    public ErrorRecoveryManager(CircuitBreakerConfig config, Clock clock, ServiceRegistry serviceRegistry,
                                ServiceLifecycleManager lifecycleManager, ResilienceMetrics metrics) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (serviceRegistry == null) {
            throw new IllegalArgumentException("serviceRegistry must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.config = config;
        this.clock = clock;
        this.serviceRegistry = serviceRegistry;
        this.lifecycleManager = lifecycleManager;
        this.metrics = metrics;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "aegis-recovery-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /** Registers an optional service without a fallback. */
    public void registerService(String name) {
        registerService(name, false, false);
    }

    /**
     * Registers a service. Registering an already known service changes nothing.
     *
     * @param name              service name
     * @param essential         essential services are retried indefinitely instead of substituted
     * @param fallbackAvailable whether a fallback can substitute the service
     */
    public void registerService(String name, boolean essential, boolean fallbackAvailable) {
        requireName(name);
        synchronized (lock) {
            if (services.containsKey(name)) {
                log.debug("Service {} already registered", name);
                return;
            }
            boolean hasFallback = fallbackAvailable || fallbackActivators.containsKey(name);
            services.put(name, new ServiceHealth(name, essential, hasFallback));
        }
        log.info("Registered service {} (essential={}, fallbackAvailable={})", name, essential, fallbackAvailable);
    }

    /**
     * Registers the callback that substitutes the service when it fails. Marks the service as
     * having a fallback available.
     */
    public void registerFallbackHandler(String name, FallbackActivator activator) {
        requireName(name);
        if (activator == null) {
            throw new IllegalArgumentException("activator must not be null");
        }
        fallbackActivators.put(name, activator);
        synchronized (lock) {
            ServiceHealth health = services.get(name);
            if (health != null) {
                health.fallbackAvailable = true;
            }
        }
        log.debug("Registered fallback activator for {}", name);
    }

    /** Adds an alert sink. */
    public void registerAlertHandler(AlertHandler handler) {
        alerts.register(handler);
    }

    /** Adds an observer of failures and recoveries. */
    public void addServiceEventListener(ServiceEventListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        listeners.add(listener);
    }

    /**
     * Handles a failure of the named service.
     * <p>
     * Never throws for a failing service: the outcome is the returned decision.
     *
     * @param name  failing service (auto-registered as optional if unknown)
     * @param error the cause, may be null
     * @return true if the system should keep using the service (essential services always, or
     *         an optional service whose fallback activated); false if the service is stopped
     */
    public boolean handleServiceFailure(String name, Throwable error) {
        requireName(name);
        String message = describe(error);
        Instant now = clock.instant();
        List<Alert> raised = new ArrayList<>();
        boolean essential;
        boolean opened = false;
        int failures;

        synchronized (lock) {
            ServiceHealth health = services.computeIfAbsent(name, this::autoRegister);
            health.recordFailure(message, now);
            if (health.circuitState == CircuitState.HALF_OPEN) {
                health.open(now);
                opened = true;
                raised.add(alert(health, AlertType.CIRCUIT_REOPENED,
                        "Circuit breaker re-opened for service %s: failure while half-open (%s)"
                                .formatted(name, message), now));
            } else if (health.circuitState == CircuitState.CLOSED
                    && health.failureCount >= config.failureThreshold()) {
                health.open(now);
                opened = true;
                raised.add(alert(health, AlertType.CIRCUIT_OPENED,
                        "Circuit breaker opened for service %s after %d failures (last: %s)"
                                .formatted(name, health.failureCount, message), now));
            } else if (health.circuitState == CircuitState.CLOSED) {
                health.status = ServiceStatus.FAILED;
            }
            essential = health.essential;
            failures = health.failureCount;
        }

        log.warn("Service {} failed ({} consecutive): {}", name, failures, message);
        metrics.recordServiceFailure(name);
        if (opened) {
            metrics.recordCircuitTransition(name, CircuitState.OPEN);
            scheduleRecovery(name, now);
        }
        publish(raised);

        boolean continueOperating;
        if (essential) {
            boolean recovered = attemptRecovery(name);
            updateClosedStatus(name, recovered ? ServiceStatus.RECOVERING : ServiceStatus.FAILED);
            continueOperating = true;
        } else {
            boolean substituted = activateFallback(name);
            updateClosedStatus(name, substituted ? ServiceStatus.DEGRADED : ServiceStatus.FAILED);
            continueOperating = substituted;
            if (!substituted) {
                log.warn("Optional service {} has no working fallback and is considered stopped", name);
            }
        }

        for (ServiceEventListener listener : listeners) {
            try {
                listener.onServiceFailure(name, error);
            } catch (RuntimeException e) {
                log.error("Service event listener failed handling failure of {}", name, e);
            }
        }
        return continueOperating;
    }

    /**
     * Decides whether a call to the service may proceed.
     * <p>
     * Closed: always. Open: only once the recovery timeout has elapsed, which moves the circuit
     * to half-open. Half-open: at most {@link CircuitBreakerConfig#halfOpenMaxCalls()} calls; if
     * they are used up and the circuit has not closed within another recovery timeout, it
     * re-opens so that recovery is retried. Unknown services are always allowed.
     */
    public boolean checkCircuitBreaker(String name) {
        Instant now = clock.instant();
        Alert raised = null;
        CircuitState transition = null;
        boolean allowed;
        synchronized (lock) {
            ServiceHealth health = services.get(name);
            if (health == null || health.circuitState == CircuitState.CLOSED) {
                return true;
            }
            if (health.circuitState == CircuitState.OPEN) {
                Duration elapsed = Duration.between(health.circuitOpenedAt, now);
                if (elapsed.compareTo(config.recoveryTimeout()) > 0) {
                    health.halfOpen(now);
                    health.halfOpenCalls = 1;
                    transition = CircuitState.HALF_OPEN;
                    raised = alert(health, AlertType.CIRCUIT_HALF_OPEN,
                            "Circuit breaker half-open for service %s; probing recovery".formatted(name), now);
                    allowed = true;
                } else {
                    allowed = false;
                }
            } else if (health.halfOpenCalls < config.halfOpenMaxCalls()) {
                health.halfOpenCalls++;
                allowed = true;
            } else {
                if (halfOpenExpired(health, now)) {
                    health.open(now);
                    transition = CircuitState.OPEN;
                    raised = alert(health, AlertType.CIRCUIT_REOPENED,
                            "Circuit breaker re-opened for service %s: half-open calls exhausted without recovery"
                                    .formatted(name), now);
                }
                allowed = false;
            }
        }
        if (transition == CircuitState.HALF_OPEN) {
            log.info("Circuit for {} moved to HALF_OPEN", name);
            metrics.recordCircuitTransition(name, CircuitState.HALF_OPEN);
            scheduleHalfOpenExpiry(name, now);
        } else if (transition == CircuitState.OPEN) {
            log.warn("Circuit for {} re-opened: half-open calls exhausted", name);
            metrics.recordCircuitTransition(name, CircuitState.OPEN);
            scheduleRecovery(name, now);
        }
        if (raised != null) {
            publish(List.of(raised));
        }
        return allowed;
    }

    private boolean halfOpenExpired(ServiceHealth health, Instant now) {
        return health.halfOpenedAt != null
                && Duration.between(health.halfOpenedAt, now).compareTo(config.recoveryTimeout()) > 0;
    }

    /**
     * Records a successful call or probe.
     * <p>
     * Half-open: counts toward {@link CircuitBreakerConfig#successThreshold()} and closes the
     * circuit once reached. Closed: decrements the failure count (floor 0) and marks the service
     * healthy. Open: only the timestamp is updated.
     */
    public void recordServiceSuccess(String name) {
        Instant now = clock.instant();
        Alert raised = null;
        boolean closed = false;
        synchronized (lock) {
            ServiceHealth health = services.get(name);
            if (health == null) {
                log.debug("Ignoring success for unregistered service {}", name);
                return;
            }
            health.lastSuccess = now;
            if (health.circuitState == CircuitState.HALF_OPEN) {
                health.recoveryAttempts++;
                if (health.recoveryAttempts >= config.successThreshold()) {
                    health.close();
                    closed = true;
                    raised = new Alert(AlertType.SERVICE_RECOVERED, name,
                            "Service %s recovered; circuit breaker closed".formatted(name), AlertSeverity.INFO, now);
                } else {
                    log.info("Service {} succeeded while half-open ({}/{})", name, health.recoveryAttempts,
                            config.successThreshold());
                }
            } else if (health.circuitState == CircuitState.CLOSED) {
                health.failureCount = Math.max(0, health.failureCount - 1);
                if (health.status != ServiceStatus.HEALTHY) {
                    health.status = ServiceStatus.HEALTHY;
                    raised = new Alert(AlertType.SERVICE_RECOVERED, name,
                            "Service %s recovered".formatted(name), AlertSeverity.INFO, now);
                }
            }
        }
        if (closed) {
            cancelScheduledRecovery(name);
            log.info("Circuit for {} closed", name);
            metrics.recordCircuitTransition(name, CircuitState.CLOSED);
        }
        if (raised != null) {
            publish(List.of(raised));
            for (ServiceEventListener listener : listeners) {
                try {
                    listener.onServiceRecovered(name);
                } catch (RuntimeException e) {
                    log.error("Service event listener failed handling recovery of {}", name, e);
                }
            }
        }
    }

    /**
     * Delivers an alert to every registered sink. Used by the health monitor and the
     * degradation controller so that all alerts share one path.
     */
    public void publishAlert(Alert alert) {
        publish(List.of(alert));
    }

    private void publish(List<Alert> raised) {
        for (Alert alert : raised) {
            alerts.dispatch(alert);
        }
    }

    private Alert alert(ServiceHealth health, AlertType type, String message, Instant now) {
        AlertSeverity severity = health.essential ? AlertSeverity.CRITICAL : AlertSeverity.WARNING;
        return new Alert(type, health.name, message, severity, now);
    }

    /**
     * Tries to bring the service back: restart through the lifecycle manager when one is
     * configured, otherwise re-probe the service's health through the registry.
     *
     * @return true if the service appears to be back
     */
    boolean attemptRecovery(String name) {
        try {
            if (lifecycleManager != null) {
                boolean restarted = lifecycleManager.restartService(name);
                log.info("Restart of {} {}", name, restarted ? "succeeded" : "failed");
                return restarted;
            }
            boolean healthy = serviceRegistry.getService(name)
                    .map(ManagedService::healthCheck)
                    .orElse(false);
            log.info("Health re-probe of {} {}", name, healthy ? "succeeded" : "failed");
            return healthy;
        } catch (RuntimeException e) {
            log.warn("Recovery attempt for {} failed", name, e);
            return false;
        }
    }

    private boolean activateFallback(String name) {
        FallbackActivator activator = fallbackActivators.get(name);
        if (activator == null) {
            log.info("No fallback registered for optional service {}", name);
            return false;
        }
        try {
            return activator.activate(name);
        } catch (RuntimeException e) {
            log.error("Fallback activation for {} failed", name, e);
            return false;
        }
    }

    private void updateClosedStatus(String name, ServiceStatus status) {
        synchronized (lock) {
            ServiceHealth health = services.get(name);
            if (health != null && health.circuitState == CircuitState.CLOSED) {
                health.status = status;
            }
        }
    }

    private void scheduleRecovery(String name, Instant openedAt) {
        if (shutdown) {
            return;
        }
        try {
            ScheduledFuture<?> future = scheduler.schedule(() -> runScheduledRecovery(name, openedAt),
                    config.recoveryTimeout().toMillis(), TimeUnit.MILLISECONDS);
            ScheduledFuture<?> previous = scheduledRecoveries.put(name, future);
            if (previous != null) {
                previous.cancel(false);
            }
            log.info("Recovery attempt for {} scheduled in {}", name, config.recoveryTimeout());
        } catch (RejectedExecutionException e) {
            log.debug("Recovery scheduler stopped; not scheduling recovery for {}", name);
        }
    }

    private void runScheduledRecovery(String name, Instant openedAt) {
        Instant now = clock.instant();
        Alert raised;
        synchronized (lock) {
            ServiceHealth health = services.get(name);
            if (health == null || health.circuitState != CircuitState.OPEN
                    || !openedAt.equals(health.circuitOpenedAt)) {
                return;
            }
            health.halfOpen(now);
            health.halfOpenCalls = 1;
            raised = alert(health, AlertType.CIRCUIT_HALF_OPEN,
                    "Circuit breaker half-open for service %s; attempting recovery".formatted(name), now);
        }
        scheduledRecoveries.remove(name);
        metrics.recordCircuitTransition(name, CircuitState.HALF_OPEN);
        scheduleHalfOpenExpiry(name, now);
        publish(List.of(raised));

        // keep attempting until the circuit closes, re-opens or runs out of half-open calls
        while (!shutdown) {
            if (!attemptRecovery(name)) {
                reopen(name, now, "recovery attempt failed", true);
                return;
            }
            recordServiceSuccess(name);
            synchronized (lock) {
                ServiceHealth health = services.get(name);
                if (health == null || health.circuitState != CircuitState.HALF_OPEN
                        || !now.equals(health.halfOpenedAt)
                        || health.halfOpenCalls >= config.halfOpenMaxCalls()) {
                    return;
                }
                health.halfOpenCalls++;
            }
        }
    }

    /**
     * Re-opens a circuit that is still in the half-open period started at {@code halfOpenedAt}
     * once another recovery timeout has passed, so that a half-open circuit never stalls.
     */
    private void scheduleHalfOpenExpiry(String name, Instant halfOpenedAt) {
        if (shutdown) {
            return;
        }
        try {
            ScheduledFuture<?> future = scheduler.schedule(
                    () -> reopen(name, halfOpenedAt, "half-open period expired without recovery", false),
                    config.recoveryTimeout().toMillis(), TimeUnit.MILLISECONDS);
            ScheduledFuture<?> previous = scheduledRecoveries.put(name, future);
            if (previous != null) {
                previous.cancel(false);
            }
        } catch (RejectedExecutionException e) {
            log.debug("Recovery scheduler stopped; not watching half-open circuit of {}", name);
        }
    }

    private void reopen(String name, Instant halfOpenedAt, String reason, boolean countFailure) {
        Instant now = clock.instant();
        Alert raised;
        synchronized (lock) {
            ServiceHealth health = services.get(name);
            if (health == null || health.circuitState != CircuitState.HALF_OPEN
                    || !halfOpenedAt.equals(health.halfOpenedAt)) {
                return;
            }
            if (countFailure) {
                health.recordFailure("Recovery attempt failed", now);
            }
            health.open(now);
            raised = alert(health, AlertType.CIRCUIT_REOPENED,
                    "Circuit breaker re-opened for service %s: %s".formatted(name, reason), now);
        }
        log.warn("Circuit for {} re-opened: {}", name, reason);
        metrics.recordCircuitTransition(name, CircuitState.OPEN);
        scheduleRecovery(name, now);
        publish(List.of(raised));
    }

    private void cancelScheduledRecovery(String name) {
        ScheduledFuture<?> future = scheduledRecoveries.remove(name);
        if (future != null) {
            future.cancel(false);
        }
    }

    /** Cancels every pending recovery attempt. */
    public void cancelScheduledRecoveries() {
        scheduledRecoveries.values().forEach(f -> f.cancel(false));
        scheduledRecoveries.clear();
    }

    /** Returns the number of recovery attempts waiting for their timeout. */
    public int pendingRecoveries() {
        return (int) scheduledRecoveries.values().stream().filter(f -> !f.isDone()).count();
    }

    /**
     * Cancels pending recoveries and stops the recovery scheduler, waiting briefly for a
     * running attempt to finish.
     */
    public void shutdown() {
        shutdown = true;
        cancelScheduledRecoveries();
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Recovery scheduler did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Returns the health of one service. */
    public Optional<ServiceHealthSnapshot> getServiceHealth(String name) {
        synchronized (lock) {
            return Optional.ofNullable(services.get(name)).map(ServiceHealth::snapshot);
        }
    }

    /** Returns the health of every registered service, in registration order. */
    public Map<String, ServiceHealthSnapshot> getAllServiceHealth() {
        Map<String, ServiceHealthSnapshot> result = new LinkedHashMap<>();
        synchronized (lock) {
            services.forEach((name, health) -> result.put(name, health.snapshot()));
        }
        return Collections.unmodifiableMap(result);
    }

    /** Exports a structured report of every service's health. */
    public HealthReport exportHealthReport() {
        return HealthReport.of(clock.instant(), config, getAllServiceHealth());
    }

    /** Returns true if the service is registered. */
    public boolean isRegistered(String name) {
        synchronized (lock) {
            return services.containsKey(name);
        }
    }

    public CircuitBreakerConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    private ServiceHealth autoRegister(String name) {
        log.warn("Failure reported for unregistered service {}; registering it as optional", name);
        return new ServiceHealth(name, false, fallbackActivators.containsKey(name));
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
    }
}
