package com.aegis.resilience.degradation;

import com.aegis.observability.Alert;
import com.aegis.observability.AlertSeverity;
import com.aegis.observability.AlertType;
import com.aegis.resilience.ResilienceMetrics;
import com.aegis.resilience.fallback.FallbackManager;
import com.aegis.resilience.recovery.ErrorRecoveryManager;
import com.aegis.resilience.recovery.ServiceEventListener;
import com.aegis.resilience.recovery.ServiceHealthSnapshot;
import com.aegis.resilience.recovery.ServiceStatus;
import com.aegis.resilience.recovery.ServiceUnavailableException;
import com.aegis.resilience.service.ServiceLifecycleManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Aggregates individual service failures into a system-wide degradation level and keeps
 * feature availability in line with the services each feature requires.
 * <p>
 * On a failure the first matching trigger decides the rule: an essential service failed,
 * else at least {@value #MULTIPLE_FAILURE_THRESHOLD} services are failed, else an optional
 * service failed; background failures never change the level. The level only escalates
 * while handling a failure. On a recovery it is recomputed from the remaining failures and
 * may only improve, possibly by several steps at once.
 * <p>
 * A feature is available iff none of its required services is failed without an active
 * fallback.
 */
public final class GracefulDegradationController implements ServiceEventListener {

    private static final Logger log = LoggerFactory.getLogger(GracefulDegradationController.class);

    public static final int MULTIPLE_FAILURE_THRESHOLD = 3;

    public static final int MAX_HISTORY = 100;

    public static final Duration DEFAULT_MONITORING_INTERVAL = Duration.ofSeconds(30);

    private final Object lock = new Object();
    private final Map<String, ServiceClassification> classifications = new LinkedHashMap<>();
    private final Map<String, Set<String>> featureDependencies = new LinkedHashMap<>();
    private final Map<String, Set<String>> serviceFeatures = new LinkedHashMap<>();
    private final List<DegradationRule> rules = new ArrayList<>();
    private final Map<String, DegradationAction> degradationActions = new LinkedHashMap<>();
    private final Map<String, DegradationAction> recoveryActions = new LinkedHashMap<>();
    private final Deque<SystemStateSnapshot> history = new ArrayDeque<>();
    private final SystemState state;

    private final ErrorRecoveryManager recoveryManager;
    private final FallbackManager fallbackManager;
    private final ServiceLifecycleManager lifecycleManager;
    private final Clock clock;
    private final Duration monitoringInterval;

    private ScheduledExecutorService scheduler;
    private volatile boolean monitoringActive;

    /**
     * Creates a controller sharing the recovery manager's clock, without lifecycle control.
     */
    public GracefulDegradationController(ErrorRecoveryManager recoveryManager, FallbackManager fallbackManager) {
        this(recoveryManager, fallbackManager, null, recoveryManager.clock(), ResilienceMetrics.inMemory(),
                DEFAULT_MONITORING_INTERVAL);
    }

    /**
     * Creates a controller. The controller does not subscribe itself to the recovery manager;
     * register it with {@link ErrorRecoveryManager#addServiceEventListener} to have failures
     * and recoveries drive it.
     *
     * @param recoveryManager    alert path and reconciliation source, or null
     * @param fallbackManager    activates fallbacks for failed services, or null
     * @param lifecycleManager   suspends background services in emergency mode, or null
     * @param clock              time source for state updates and history
     * @param metrics            publishes the degradation level gauge
     * @param monitoringInterval period of the reconciliation loop
     */
    public GracefulDegradationController(ErrorRecoveryManager recoveryManager, FallbackManager fallbackManager,
                                         ServiceLifecycleManager lifecycleManager, Clock clock,
                                         ResilienceMetrics metrics, Duration monitoringInterval) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        if (monitoringInterval == null || monitoringInterval.isNegative() || monitoringInterval.isZero()) {
            throw new IllegalArgumentException("monitoringInterval must be positive");
        }
        this.recoveryManager = recoveryManager;
        this.fallbackManager = fallbackManager;
        this.lifecycleManager = lifecycleManager;
        this.clock = clock;
        this.monitoringInterval = monitoringInterval;
        this.state = new SystemState(clock.instant());
        DegradationRule.defaults().forEach(this::addDegradationRule);
        metrics.bindDegradationLevel(this::getDegradationLevel);
    }

    /** Classifies a service, replacing any earlier classification. */
    public void registerServiceClassification(String serviceName, ServiceClassification classification) {
        requireName(serviceName, "serviceName");
        if (classification == null) {
            throw new IllegalArgumentException("classification must not be null");
        }
        synchronized (lock) {
            classifications.put(serviceName, classification);
        }
        log.info("Registered {} as {}", serviceName, classification);
    }

    /** Declares the services a feature requires. */
    public void registerFeatureDependency(String featureName, Collection<String> requiredServices) {
        requireName(featureName, "featureName");
        if (requiredServices == null) {
            throw new IllegalArgumentException("requiredServices must not be null");
        }
        synchronized (lock) {
            Set<String> required = featureDependencies.computeIfAbsent(featureName, k -> new LinkedHashSet<>());
            for (String service : requiredServices) {
                requireName(service, "requiredServices entry");
                required.add(service);
                serviceFeatures.computeIfAbsent(service, k -> new LinkedHashSet<>()).add(featureName);
            }
            updateFeatureAvailability();
        }
        log.debug("Feature {} requires {}", featureName, requiredServices);
    }

    /** Adds a rule; rules are kept in ascending priority, ties in insertion order. */
    public void addDegradationRule(DegradationRule rule) {
        if (rule == null) {
            throw new IllegalArgumentException("rule must not be null");
        }
        synchronized (lock) {
            rules.add(rule);
            rules.sort(Comparator.comparingInt(DegradationRule::priority));
        }
    }

    /** Registers a custom action, taking precedence over a built-in action of the same name. */
    public void registerDegradationAction(String actionName, DegradationAction action) {
        requireName(actionName, "actionName");
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        synchronized (lock) {
            degradationActions.put(actionName, action);
        }
    }

    /**
     * Registers a custom recovery action. Recovery actions run, in registration order, for
     * every recovered service; rules may also name them.
     */
    public void registerRecoveryAction(String actionName, DegradationAction action) {
        requireName(actionName, "actionName");
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        synchronized (lock) {
            recoveryActions.put(actionName, action);
        }
    }

    @Override
    public void onServiceFailure(String serviceName, Throwable error) {
        handleServiceFailure(serviceName, error);
    }

    @Override
    public void onServiceRecovered(String serviceName) {
        handleServiceRecovery(serviceName);
    }

    /**
     * Records a failure, escalates the level by the matching rule, activates the service's
     * fallback where possible and recomputes feature availability.
     */
    public void handleServiceFailure(String serviceName, Throwable error) {
        requireName(serviceName, "serviceName");
        log.warn("Handling failure of {}: {}", serviceName, error == null ? "unknown error" : error.getMessage());
        List<Runnable> deferred = new ArrayList<>();
        synchronized (lock) {
            state.failedServices.add(serviceName);
            state.lastUpdate = clock.instant();
            evaluateDegradationRules(serviceName, deferred);
            if (!state.activeFallbacks.contains(serviceName) && !tryActivateFallback(serviceName)) {
                log.warn("No fallback available for {}", serviceName);
            }
            updateFeatureAvailability();
            saveSnapshot();
        }
        deferred.forEach(Runnable::run);
    }

    /**
     * Clears a service's failure, lets the level improve, deactivates its fallback and
     * recomputes feature availability.
     */
    public void handleServiceRecovery(String serviceName) {
        requireName(serviceName, "serviceName");
        log.info("Handling recovery of {}", serviceName);
        synchronized (lock) {
            state.failedServices.remove(serviceName);
            state.degradedServices.remove(serviceName);
            state.lastUpdate = clock.instant();
            evaluateRecoveryPotential();
            recoveryActions.forEach((actionName, action) -> runCustom(actionName, serviceName, action));
            if (state.activeFallbacks.remove(serviceName) && fallbackManager != null) {
                try {
                    fallbackManager.deactivateFallback(serviceName);
                    log.info("Deactivated fallback for {}", serviceName);
                } catch (RuntimeException e) {
                    log.error("Failed to deactivate fallback for {}", serviceName, e);
                }
            }
            updateFeatureAvailability();
            if (state.emergencyMode && !state.degradationLevel.isWorseThan(DegradationLevel.MODERATE)) {
                state.emergencyMode = false;
                log.info("Emergency mode cleared at level {}", state.degradationLevel);
            }
            saveSnapshot();
        }
    }

    private void evaluateDegradationRules(String serviceName, List<Runnable> deferred) {
        DegradationLevel previous = state.degradationLevel;
        ServiceClassification classification =
                classifications.getOrDefault(serviceName, ServiceClassification.OPTIONAL);
        TriggerCondition condition;
        if (classification == ServiceClassification.ESSENTIAL) {
            condition = TriggerCondition.ESSENTIAL_SERVICE_FAILED;
        } else if (state.failedServices.size() >= MULTIPLE_FAILURE_THRESHOLD) {
            condition = TriggerCondition.MULTIPLE_SERVICES_FAILED;
        } else if (classification == ServiceClassification.OPTIONAL) {
            condition = TriggerCondition.OPTIONAL_SERVICE_FAILED;
        } else {
            log.info("Background service {} failed, no degradation needed", serviceName);
            return;
        }
        for (DegradationRule rule : rules) {
            if (rule.triggerCondition() == condition) {
                applyRule(rule, serviceName, deferred);
                break;
            }
        }
        if (state.degradationLevel != previous) {
            log.warn("System degradation level changed: {} -> {}", previous, state.degradationLevel);
        }
    }

    private void applyRule(DegradationRule rule, String serviceName, List<Runnable> deferred) {
        if (rule.degradationLevel().isWorseThan(state.degradationLevel)) {
            state.degradationLevel = rule.degradationLevel();
            state.degradationReason = rule.triggerCondition().wireName() + ": " + serviceName;
        }
        for (String action : rule.actions()) {
            executeAction(action, serviceName, deferred);
        }
    }

    private void executeAction(String actionName, String serviceName, List<Runnable> deferred) {
        DegradationAction custom = degradationActions.get(actionName);
        if (custom == null) {
            custom = recoveryActions.get(actionName);
        }
        if (custom != null) {
            runCustom(actionName, serviceName, custom);
            return;
        }
        switch (actionName) {
            case DegradationActions.ACTIVATE_EMERGENCY_MODE -> activateEmergencyMode(deferred);
            case DegradationActions.NOTIFY_ADMINISTRATORS ->
                    notifyAdministrators("Critical service failure: " + serviceName, deferred);
            case DegradationActions.ACTIVATE_FALLBACKS -> activateAllAvailableFallbacks();
            case DegradationActions.DISABLE_NON_ESSENTIAL_FEATURES -> updateFeatureAvailability();
            case DegradationActions.ACTIVATE_FALLBACK -> tryActivateFallback(serviceName);
            case DegradationActions.LOG_DEGRADATION -> log.warn("Service degradation: {}", serviceName);
            default -> log.warn("Unknown degradation action {} for {}", actionName, serviceName);
        }
    }

    private void runCustom(String actionName, String serviceName, DegradationAction action) {
        try {
            action.execute(serviceName);
        } catch (RuntimeException e) {
            log.error("Action {} failed for {}", actionName, serviceName, e);
        }
    }

    private void activateEmergencyMode(List<Runnable> deferred) {
        if (!state.emergencyMode) {
            log.error("Activating emergency mode");
            state.emergencyMode = true;
        }
        updateFeatureAvailability();
        if (lifecycleManager == null) {
            return;
        }
        classifications.forEach((service, classification) -> {
            if (classification == ServiceClassification.BACKGROUND) {
                deferred.add(() -> suspend(service));
            }
        });
    }

    private void suspend(String service) {
        try {
            if (lifecycleManager.suspendService(service)) {
                log.info("Suspended background service {}", service);
            } else {
                log.warn("Background service {} could not be suspended", service);
            }
        } catch (RuntimeException e) {
            log.error("Failed to suspend background service {}", service, e);
        }
    }

    private void notifyAdministrators(String message, List<Runnable> deferred) {
        log.error("ADMIN ALERT: {}", message);
        if (recoveryManager != null) {
            Alert alert = Alert.system(AlertType.ADMIN_NOTIFICATION, message, AlertSeverity.CRITICAL, clock.instant());
            deferred.add(() -> recoveryManager.publishAlert(alert));
        }
    }

    private void activateAllAvailableFallbacks() {
        for (String service : List.copyOf(state.failedServices)) {
            if (!state.activeFallbacks.contains(service)) {
                tryActivateFallback(service);
            }
        }
    }

    private boolean tryActivateFallback(String serviceName) {
        if (fallbackManager == null) {
            return false;
        }
        try {
            if (fallbackManager.activateFallback(serviceName)) {
                boolean added = state.activeFallbacks.add(serviceName);
                state.degradedServices.add(serviceName);
                if (added) {
                    log.info("Activated fallback for {}", serviceName);
                }
                return true;
            }
        } catch (RuntimeException e) {
            log.error("Failed to activate fallback for {}", serviceName, e);
        }
        return false;
    }

    private void updateFeatureAvailability() {
        featureDependencies.forEach((feature, required) -> {
            boolean available = required.stream().noneMatch(state::isUnavailable);
            if (available) {
                if (state.disabledFeatures.remove(feature)) {
                    log.info("Re-enabled feature {}", feature);
                }
            } else if (state.disabledFeatures.add(feature)) {
                log.info("Disabled feature {}", feature);
            }
        });
    }

    private void evaluateRecoveryPotential() {
        long failedEssential = state.failedServices.stream()
                .filter(s -> classifications.get(s) == ServiceClassification.ESSENTIAL)
                .count();
        int totalFailed = state.failedServices.size();
        DegradationLevel level;
        if (failedEssential > 0) {
            level = DegradationLevel.SEVERE;
        } else if (totalFailed >= MULTIPLE_FAILURE_THRESHOLD) {
            level = DegradationLevel.MODERATE;
        } else if (totalFailed > 0) {
            level = DegradationLevel.MINOR;
        } else {
            level = DegradationLevel.NORMAL;
        }
        if (state.degradationLevel.isWorseThan(level)) {
            log.info("System degradation level improved: {} -> {}", state.degradationLevel, level);
            state.degradationLevel = level;
            if (level == DegradationLevel.NORMAL) {
                state.degradationReason = null;
            }
        }
    }

    private void saveSnapshot() {
        history.addLast(state.snapshot());
        while (history.size() > MAX_HISTORY) {
            history.removeFirst();
        }
    }

    /**
     * Reconciles with the recovery manager: failed services not yet known here are handled
     * as failures, healthy services still marked failed are handled as recoveries. The level
     * is then re-evaluated.
     */
    public void reconcile() {
        if (recoveryManager != null) {
            for (ServiceHealthSnapshot health : recoveryManager.getAllServiceHealth().values()) {
                String name = health.name();
                boolean knownFailed;
                synchronized (lock) {
                    knownFailed = state.failedServices.contains(name);
                }
                if ((health.status() == ServiceStatus.FAILED || health.status() == ServiceStatus.CIRCUIT_OPEN)
                        && !knownFailed) {
                    handleServiceFailure(name, new ServiceUnavailableException(name, "Health check failed"));
                } else if (health.status() == ServiceStatus.HEALTHY && knownFailed) {
                    handleServiceRecovery(name);
                }
            }
        }
        synchronized (lock) {
            evaluateRecoveryPotential();
        }
    }

    /** Starts the periodic reconciliation loop. No-op if running. */
    public void startMonitoring() {
        synchronized (lock) {
            if (monitoringActive) {
                return;
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "aegis-degradation-monitor");
                t.setDaemon(true);
                return t;
            });
            long periodMs = monitoringInterval.toMillis();
            scheduler.scheduleWithFixedDelay(this::runMonitoringLoop, periodMs, periodMs, TimeUnit.MILLISECONDS);
            monitoringActive = true;
        }
        log.info("Degradation monitoring started (every {})", monitoringInterval);
    }

    /** Stops the reconciliation loop and waits for a running pass to finish. */
    public void stopMonitoring() {
        ScheduledExecutorService stopping;
        synchronized (lock) {
            if (!monitoringActive) {
                return;
            }
            monitoringActive = false;
            stopping = scheduler;
            scheduler = null;
        }
        stopping.shutdown();
        try {
            if (!stopping.awaitTermination(5, TimeUnit.SECONDS)) {
                stopping.shutdownNow();
            }
        } catch (InterruptedException e) {
            stopping.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Degradation monitoring stopped");
    }

    private void runMonitoringLoop() {
        try {
            reconcile();
            SystemStatus status = getSystemStatus();
            log.debug("Degradation status: level={}, failed={}, disabled features={}",
                    status.degradationLevel(), status.failedServices(), status.disabledFeatures());
        } catch (RuntimeException e) {
            log.error("Degradation monitoring pass failed", e);
        }
    }

    public boolean isFeatureAvailable(String featureName) {
        synchronized (lock) {
            return !state.disabledFeatures.contains(featureName);
        }
    }

    public DegradationLevel getDegradationLevel() {
        synchronized (lock) {
            return state.degradationLevel;
        }
    }

    public boolean isEmergencyMode() {
        synchronized (lock) {
            return state.emergencyMode;
        }
    }

    public SystemStatus getSystemStatus() {
        synchronized (lock) {
            return new SystemStatus(state.degradationLevel, state.degradationReason, state.failedServices,
                    state.degradedServices, state.activeFallbacks, state.disabledFeatures, state.lastUpdate,
                    state.emergencyMode, monitoringActive);
        }
    }

    /** Snapshots taken within the trailing window, oldest first. */
    public List<SystemStateSnapshot> getDegradationHistory(Duration window) {
        if (window == null || window.isNegative()) {
            throw new IllegalArgumentException("window must not be null or negative");
        }
        Instant cutoff = clock.instant().minus(window);
        synchronized (lock) {
            return history.stream()
                    .filter(s -> !s.lastUpdate().isBefore(cutoff))
                    .toList();
        }
    }

    public List<SystemStateSnapshot> getDegradationHistory(int hours) {
        return getDegradationHistory(Duration.ofHours(hours));
    }

    public Optional<ServiceClassification> getServiceClassification(String serviceName) {
        synchronized (lock) {
            return Optional.ofNullable(classifications.get(serviceName));
        }
    }

    /** Required services per feature. */
    public Map<String, Set<String>> getFeatureDependencies() {
        synchronized (lock) {
            Map<String, Set<String>> copy = new LinkedHashMap<>();
            featureDependencies.forEach((feature, required) -> copy.put(feature, Set.copyOf(required)));
            return copy;
        }
    }

    public List<DegradationRule> getDegradationRules() {
        synchronized (lock) {
            return List.copyOf(rules);
        }
    }

    private static void requireName(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
    }
}
