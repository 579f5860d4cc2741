package com.aegis.resilience.monitor;

import com.aegis.observability.Alert;
import com.aegis.observability.AlertSeverity;
import com.aegis.observability.AlertType;
import com.aegis.resilience.ResilienceMetrics;
import com.aegis.resilience.recovery.ErrorRecoveryManager;
import com.aegis.resilience.recovery.HealthReport;
import com.aegis.resilience.recovery.ServiceHealthSnapshot;
import com.aegis.resilience.recovery.ServiceStatus;
import com.aegis.resilience.recovery.ServiceUnavailableException;
import com.aegis.resilience.service.ManagedService;
import com.aegis.resilience.service.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Polls registered services and reports the outcome of every poll to the
 * {@link ErrorRecoveryManager}.
 * <p>
 * Each registered service gets its own polling loop, plus one global loop that runs the
 * system-wide health check and produces a {@link SystemHealthReport}. A poll first asks the
 * recovery manager whether the circuit allows a call; a rejected poll is skipped and is not
 * counted as a failure. Probes are bounded by the check's timeout; a timeout counts as a
 * failure.
 * <p>
 * Threshold breaches (response time, error rate, CPU, memory) raise {@code WARNING} alerts
 * through the recovery manager's alert path and never change circuit state.
 */
public final class ServiceHealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(ServiceHealthMonitor.class);

    /** Window over which the error rate is computed. */
    public static final Duration ERROR_RATE_WINDOW = Duration.ofMinutes(10);

    /** Metrics entries kept per service. */
    public static final int MAX_HISTORY = 100;

    public static final Duration DEFAULT_SYSTEM_CHECK_INTERVAL = Duration.ofSeconds(60);

    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration INTERRUPT_TIMEOUT = Duration.ofSeconds(1);

    private final Object lock = new Object();
    private final Map<String, HealthCheckConfig> checks = new LinkedHashMap<>();
    private final Map<String, Instant> registeredAt = new HashMap<>();
    private final Map<String, Deque<Sample>> samples = new HashMap<>();
    private final Map<String, Deque<HealthMetrics>> history = new HashMap<>();
    private final Map<String, ScheduledFuture<?>> loops = new LinkedHashMap<>();

    private final ErrorRecoveryManager recoveryManager;
    private final ServiceRegistry serviceRegistry;
    private final ResourceSampler resourceSampler;
    private final MonitorThresholds thresholds;
    private final Duration systemCheckInterval;
    private final ResilienceMetrics metrics;
    private final Clock clock;
    private final Instant createdAt;
    private final ExecutorService probeExecutor;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> systemLoop;
    private volatile HttpClient httpClient;
    private volatile boolean monitoring;

    /**
     * Creates a monitor with default thresholds, the JVM resource sampler and an empty
     * service registry.
     */
    public ServiceHealthMonitor(ErrorRecoveryManager recoveryManager) {
        this(recoveryManager, ServiceRegistry.empty(), new JvmResourceSampler(), MonitorThresholds.defaults(),
                DEFAULT_SYSTEM_CHECK_INTERVAL, ResilienceMetrics.inMemory());
    }

    /**
     * Creates a monitor.
     *
     * @param recoveryManager     receives poll outcomes and alerts; its clock is used for timestamps
     * @param serviceRegistry     used by ping checks without a probe
     * @param resourceSampler     CPU and memory readings
     * @param thresholds          alerting thresholds
     * @param systemCheckInterval period of the global loop
     * @param metrics             probe latency meters
     */
    public ServiceHealthMonitor(ErrorRecoveryManager recoveryManager, ServiceRegistry serviceRegistry,
                                ResourceSampler resourceSampler, MonitorThresholds thresholds,
                                Duration systemCheckInterval, ResilienceMetrics metrics) {
        if (recoveryManager == null) {
            throw new IllegalArgumentException("recoveryManager must not be null");
        }
        if (serviceRegistry == null) {
            throw new IllegalArgumentException("serviceRegistry must not be null");
        }
        if (resourceSampler == null) {
            throw new IllegalArgumentException("resourceSampler must not be null");
        }
        if (thresholds == null) {
            throw new IllegalArgumentException("thresholds must not be null");
        }
        if (systemCheckInterval == null || systemCheckInterval.isNegative() || systemCheckInterval.isZero()) {
            throw new IllegalArgumentException("systemCheckInterval must be positive");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.recoveryManager = recoveryManager;
        this.serviceRegistry = serviceRegistry;
        this.resourceSampler = resourceSampler;
        this.thresholds = thresholds;
        this.systemCheckInterval = systemCheckInterval;
        this.metrics = metrics;
        this.clock = recoveryManager.clock();
        this.createdAt = clock.instant();
        this.probeExecutor = Executors.newCachedThreadPool(daemonThreads("aegis-health-probe"));
    }

    /**
     * Registers (or replaces) the health check of a service. The service is registered with
     * the recovery manager as optional if it is not known yet. While monitoring is running,
     * the service's polling loop starts immediately.
     */
    public void registerCheck(String name, HealthCheckConfig config) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        recoveryManager.registerService(name);
        synchronized (lock) {
            checks.put(name, config);
            registeredAt.putIfAbsent(name, clock.instant());
            if (monitoring) {
                startLoop(name, config);
            }
        }
        log.info("Registered {} health check for {} (interval {}, timeout {})",
                config.type(), name, config.interval(), config.timeout());
    }

    /** Starts one polling loop per registered service and the global loop. No-op if running. */
    public void startMonitoring() {
        synchronized (lock) {
            if (monitoring) {
                return;
            }
            scheduler = Executors.newScheduledThreadPool(Math.max(2, checks.size() + 1),
                    daemonThreads("aegis-health-monitor"));
            monitoring = true;
            checks.forEach(this::startLoop);
            long periodMs = systemCheckInterval.toMillis();
            systemLoop = scheduler.scheduleWithFixedDelay(this::runSystemLoop,
                    periodMs, periodMs, TimeUnit.MILLISECONDS);
        }
        log.info("Health monitoring started for {} services", checks.size());
    }

    /**
     * Cancels every polling loop, waits for running polls to finish and then cancels every
     * pending recovery attempt, including those scheduled by the final polls.
     */
    public void stopMonitoring() {
        ScheduledExecutorService stopping;
        synchronized (lock) {
            if (!monitoring) {
                recoveryManager.cancelScheduledRecoveries();
                return;
            }
            monitoring = false;
            loops.values().forEach(f -> f.cancel(false));
            loops.clear();
            systemLoop.cancel(false);
            systemLoop = null;
            stopping = scheduler;
            scheduler = null;
        }
        stopping.shutdown();
        try {
            if (!stopping.awaitTermination(STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Health monitor loops did not terminate within {}", STOP_TIMEOUT);
                stopping.shutdownNow();
                stopping.awaitTermination(INTERRUPT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            stopping.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            recoveryManager.cancelScheduledRecoveries();
        }
        log.info("Health monitoring stopped");
    }

    /** Stops monitoring and releases the probe threads. */
    public void shutdown() {
        stopMonitoring();
        probeExecutor.shutdownNow();
    }

    private void startLoop(String name, HealthCheckConfig config) {
        ScheduledFuture<?> previous = loops.put(name, scheduler.scheduleWithFixedDelay(() -> runPollLoop(name),
                0, config.interval().toMillis(), TimeUnit.MILLISECONDS));
        if (previous != null) {
            previous.cancel(false);
        }
    }

    private void runPollLoop(String name) {
        try {
            pollOnce(name);
        } catch (RuntimeException e) {
            log.error("Health poll of {} failed unexpectedly", name, e);
        }
    }

    private void runSystemLoop() {
        try {
            checkSystemHealth();
            SystemHealthReport report = generateHealthReport();
            log.debug("System health: {} services, status counts {}", report.totalServices(), report.statusCounts());
        } catch (RuntimeException e) {
            log.error("System health check failed unexpectedly", e);
        }
    }

    /**
     * Polls one service: probes it, reports the outcome to the recovery manager, records
     * metrics and checks the alerting thresholds.
     *
     * @return the recorded metrics, or empty if the circuit rejected the poll or the polling
     *         thread was interrupted
     * @throws IllegalArgumentException if no check is registered for the service
     */
    public Optional<HealthMetrics> pollOnce(String name) {
        HealthCheckConfig config;
        synchronized (lock) {
            config = checks.get(name);
        }
        if (config == null) {
            throw new IllegalArgumentException("No health check registered for service '%s'".formatted(name));
        }
        if (!recoveryManager.checkCircuitBreaker(name)) {
            log.debug("Circuit open for {}, skipping health poll", name);
            return Optional.empty();
        }

        long start = System.nanoTime();
        Throwable error = execute(name, config);
        if (Thread.currentThread().isInterrupted()) {
            log.debug("Health poll of {} interrupted, not reporting its outcome", name);
            return Optional.empty();
        }
        Duration responseTime = Duration.ofNanos(System.nanoTime() - start);
        boolean success = error == null;
        metrics.recordProbe(name, responseTime, success);

        if (success) {
            recoveryManager.recordServiceSuccess(name);
        } else {
            log.warn("Health check of {} failed: {}", name, error.getMessage());
            recoveryManager.handleServiceFailure(name, error);
        }

        Instant now = clock.instant();
        ResourceUsage usage = sampleResources();
        ServiceStatus status = recoveryManager.getServiceHealth(name)
                .map(ServiceHealthSnapshot::status)
                .orElse(success ? ServiceStatus.HEALTHY : ServiceStatus.FAILED);
        HealthMetrics recorded;
        synchronized (lock) {
            double errorRate = recordSample(name, now, success);
            recorded = new HealthMetrics(name, now, status, responseTime, usage.cpuPercent(), usage.memoryMb(),
                    errorRate, Duration.between(registeredAt.getOrDefault(name, createdAt), now));
            Deque<HealthMetrics> entries = history.computeIfAbsent(name, k -> new ArrayDeque<>());
            entries.addLast(recorded);
            while (entries.size() > MAX_HISTORY) {
                entries.removeFirst();
            }
        }
        checkThresholds(recorded, success);
        return Optional.of(recorded);
    }

    /** Runs the probe within its timeout; returns the failure, or null on success. */
    private Throwable execute(String name, HealthCheckConfig config) {
        try {
            ProbeResult result = probe(name, config)
                    .orTimeout(config.timeout().toMillis(), TimeUnit.MILLISECONDS)
                    .get();
            if (result == null || !result.healthy()) {
                String message = result == null ? "Health check returned no result" : result.message();
                return new ServiceUnavailableException(name, message);
            }
            return null;
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                return new ServiceUnavailableException(name,
                        "Health check timed out after %d ms".formatted(config.timeout().toMillis()), cause);
            }
            return cause;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new ServiceUnavailableException(name, "Health check interrupted", e);
        } catch (RuntimeException e) {
            return e;
        }
    }

    private CompletableFuture<ProbeResult> probe(String name, HealthCheckConfig config) {
        return switch (config.type()) {
            case PING -> config.probe() != null ? runProbe(config.probe()) : pingRegistry(name);
            case HTTP -> probeHttp(config);
            case RESOURCE -> CompletableFuture.completedFuture(probeResource(config));
            case CUSTOM -> runProbe(config.probe());
        };
    }

    /** Invokes the probe on a probe thread so the timeout also bounds a probe that blocks. */
    private CompletableFuture<ProbeResult> runProbe(HealthProbe probe) {
        return CompletableFuture.supplyAsync(probe::probe, probeExecutor)
                .thenCompose(Function.identity());
    }

    private CompletableFuture<ProbeResult> pingRegistry(String name) {
        Optional<ManagedService> service = serviceRegistry.getService(name);
        if (service.isEmpty()) {
            return CompletableFuture.completedFuture(ProbeResult.failed("Service not found in registry"));
        }
        return CompletableFuture.supplyAsync(() -> service.get().ping()
                ? ProbeResult.ok()
                : ProbeResult.failed("Ping failed"), probeExecutor);
    }

    private CompletableFuture<ProbeResult> probeHttp(HealthCheckConfig config) {
        HttpRequest request = HttpRequest.newBuilder(config.endpoint())
                .timeout(config.timeout())
                .GET()
                .build();
        return httpClient().sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> response.statusCode() >= 200 && response.statusCode() < 300
                        ? ProbeResult.ok()
                        : ProbeResult.failed("HTTP " + response.statusCode()));
    }

    private ProbeResult probeResource(HealthCheckConfig config) {
        ResourceUsage usage = resourceSampler.sample();
        double value = config.resource() == ResourceKind.CPU ? usage.cpuPercent() : usage.memoryMb();
        if (value > config.threshold()) {
            return ProbeResult.failed(String.format(Locale.ROOT, "%s usage %.1f exceeds threshold %.1f",
                    config.resource().name().toLowerCase(Locale.ROOT), value, config.threshold()));
        }
        return ProbeResult.ok();
    }

    private ResourceUsage sampleResources() {
        try {
            return resourceSampler.sample();
        } catch (RuntimeException e) {
            log.debug("Resource sampling failed", e);
            return new ResourceUsage(0, 0);
        }
    }

    private double recordSample(String name, Instant now, boolean success) {
        Deque<Sample> window = samples.computeIfAbsent(name, k -> new ArrayDeque<>());
        window.addLast(new Sample(now, success));
        Instant cutoff = now.minus(ERROR_RATE_WINDOW);
        while (!window.isEmpty() && window.peekFirst().at().isBefore(cutoff)) {
            window.removeFirst();
        }
        long failures = window.stream().filter(s -> !s.success()).count();
        return (double) failures / window.size();
    }

    private void checkThresholds(HealthMetrics m, boolean success) {
        List<String> breaches = new ArrayList<>();
        if (success && m.responseTime().compareTo(thresholds.responseTime()) > 0) {
            breaches.add("response time %d ms exceeds %d ms"
                    .formatted(m.responseTime().toMillis(), thresholds.responseTime().toMillis()));
        }
        if (m.errorRate() > thresholds.errorRate()) {
            breaches.add(String.format(Locale.ROOT, "error rate %.2f exceeds %.2f", m.errorRate(),
                    thresholds.errorRate()));
        }
        if (m.cpuUsage() > thresholds.cpuPercent()) {
            breaches.add(String.format(Locale.ROOT, "CPU usage %.1f%% exceeds %.1f%%", m.cpuUsage(),
                    thresholds.cpuPercent()));
        }
        if (m.memoryUsageMb() > thresholds.memoryMb()) {
            breaches.add(String.format(Locale.ROOT, "memory usage %.1f MB exceeds %.1f MB", m.memoryUsageMb(),
                    thresholds.memoryMb()));
        }
        for (String breach : breaches) {
            log.warn("Threshold exceeded for {}: {}", m.serviceName(), breach);
            recoveryManager.publishAlert(new Alert(AlertType.THRESHOLD_EXCEEDED, m.serviceName(),
                    "Service %s: %s".formatted(m.serviceName(), breach), AlertSeverity.WARNING, m.timestamp()));
        }
    }

    /**
     * Applies the system-wide rule: more than {@code failedFraction} of the services failed
     * raises a critical alert; otherwise more than {@code unhealthyFraction} failed or
     * degraded raises a warning. Services with an open circuit count as failed.
     *
     * @return the alert raised, if any
     */
    public Optional<Alert> checkSystemHealth() {
        Map<String, ServiceHealthSnapshot> all = recoveryManager.getAllServiceHealth();
        if (all.isEmpty()) {
            return Optional.empty();
        }
        long failed = all.values().stream().filter(s -> isFailed(s.status())).count();
        long degraded = all.values().stream().filter(s -> s.status() == ServiceStatus.DEGRADED).count();
        double total = all.size();
        Alert alert = null;
        if (failed / total > thresholds.failedFraction()) {
            alert = Alert.system(AlertType.SYSTEM_HEALTH,
                    "System health critical: %d of %d services failed".formatted(failed, all.size()),
                    AlertSeverity.CRITICAL, clock.instant());
        } else if ((failed + degraded) / total > thresholds.unhealthyFraction()) {
            alert = Alert.system(AlertType.SYSTEM_HEALTH,
                    "System health degraded: %d of %d services failed or degraded"
                            .formatted(failed + degraded, all.size()),
                    AlertSeverity.WARNING, clock.instant());
        }
        if (alert != null) {
            recoveryManager.publishAlert(alert);
        }
        return Optional.ofNullable(alert);
    }

    private static boolean isFailed(ServiceStatus status) {
        return status == ServiceStatus.FAILED || status == ServiceStatus.CIRCUIT_OPEN;
    }

    /** Summarizes the current health of every service. */
    public SystemHealthReport generateHealthReport() {
        HealthReport recovery = recoveryManager.exportHealthReport();
        Map<String, HealthMetrics> latest = new LinkedHashMap<>();
        synchronized (lock) {
            history.forEach((name, entries) -> {
                if (!entries.isEmpty()) {
                    latest.put(name, entries.peekLast());
                }
            });
        }
        Instant now = clock.instant();
        return new SystemHealthReport(now, Duration.between(createdAt, now), monitoring,
                recovery.statusCounts(), recovery.services(), latest);
    }

    /** Returns the recorded metrics of a service, oldest first. */
    public List<HealthMetrics> getMetricsHistory(String name) {
        synchronized (lock) {
            Deque<HealthMetrics> entries = history.get(name);
            return entries == null ? List.of() : List.copyOf(entries);
        }
    }

    public Optional<HealthMetrics> getLatestMetrics(String name) {
        synchronized (lock) {
            Deque<HealthMetrics> entries = history.get(name);
            return entries == null ? Optional.empty() : Optional.ofNullable(entries.peekLast());
        }
    }

    public boolean isMonitoring() {
        return monitoring;
    }

    /** Names of services with a registered check, in registration order. */
    public List<String> registeredChecks() {
        synchronized (lock) {
            return List.copyOf(checks.keySet());
        }
    }

    private HttpClient httpClient() {
        HttpClient client = httpClient;
        if (client == null) {
            synchronized (lock) {
                if (httpClient == null) {
                    httpClient = HttpClient.newBuilder()
                            .connectTimeout(HealthCheckConfig.DEFAULT_TIMEOUT)
                            .executor(probeExecutor)
                            .build();
                }
                client = httpClient;
            }
        }
        return client;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private record Sample(Instant at, boolean success) {
    }
}
