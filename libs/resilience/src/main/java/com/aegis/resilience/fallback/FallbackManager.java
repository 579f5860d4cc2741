package com.aegis.resilience.fallback;

import com.aegis.observability.Alert;
import com.aegis.observability.AlertHandler;
import com.aegis.resilience.ResilienceMetrics;
import com.aegis.resilience.recovery.ErrorRecoveryManager;
import com.aegis.resilience.service.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Keeps prioritized fallback handlers per service and activates the best available one when
 * the service fails.
 * <p>
 * Handlers are tried in ascending priority; the first that activates serves all fallback
 * requests for the service until it is deactivated. A handler that fails to activate is
 * skipped for its {@link FallbackConfig#retryAfter()}.
 * <p>
 * When constructed with an {@link ErrorRecoveryManager}, the manager listens to its alerts:
 * a {@code CIRCUIT_OPENED} alert activates the service's fallback, a
 * {@code SERVICE_RECOVERED} alert deactivates it. Registering the first fallback for a service
 * also registers it as that service's fallback activator.
 */
public final class FallbackManager implements AlertHandler {

    private static final Logger log = LoggerFactory.getLogger(FallbackManager.class);

    private static final Duration HTTP_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final Object lock = new Object();
    private final Map<String, List<FallbackHandler>> handlers = new LinkedHashMap<>();
    private final Map<String, FallbackHandler> activeFallbacks = new HashMap<>();
    private final Map<String, Instant> activatedAt = new HashMap<>();
    private final Map<FallbackHandler, Instant> failedActivations = new HashMap<>();

    private final ErrorRecoveryManager recoveryManager;
    private final ServiceRegistry serviceRegistry;
    private final Clock clock;
    private final ResilienceMetrics metrics;
    private final Path cacheDirectory;
    private volatile HttpClient httpClient;

    /** A stand-alone manager with no recovery manager integration. */
    public FallbackManager() {
        this(null, ServiceRegistry.empty(), Clock.systemUTC(), ResilienceMetrics.inMemory(), Path.of("cache"));
    }

    /**
     * @param recoveryManager manager whose alerts drive activation, or null
     * @param serviceRegistry lookup used by proxy fallbacks
     * @param clock           time source for retry windows
     * @param metrics         activation metrics
     * @param cacheDirectory  directory holding the cache fallbacks' response files
     */
    public FallbackManager(ErrorRecoveryManager recoveryManager, ServiceRegistry serviceRegistry, Clock clock,
                           ResilienceMetrics metrics, Path cacheDirectory) {
        if (serviceRegistry == null) {
            throw new IllegalArgumentException("serviceRegistry must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        if (cacheDirectory == null) {
            throw new IllegalArgumentException("cacheDirectory must not be null");
        }
        this.recoveryManager = recoveryManager;
        this.serviceRegistry = serviceRegistry;
        this.clock = clock;
        this.metrics = metrics;
        this.cacheDirectory = cacheDirectory;
        if (recoveryManager != null) {
            recoveryManager.registerAlertHandler(this);
        }
    }

    /**
     * Registers a handler for a service. Handlers of one service are kept in ascending
     * priority order; equal priorities keep registration order.
     */
    public void registerFallback(String serviceName, FallbackHandler handler) {
        requireName(serviceName);
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        boolean first;
        synchronized (lock) {
            List<FallbackHandler> list = handlers.computeIfAbsent(serviceName, k -> new ArrayList<>());
            first = list.isEmpty();
            list.add(handler);
            list.sort(Comparator.comparingInt(h -> h.config().priority()));
        }
        log.info("Registered {} fallback for {} (priority {})",
                handler.config().type(), serviceName, handler.config().priority());
        if (first && recoveryManager != null) {
            recoveryManager.registerFallbackHandler(serviceName, this::activateFallback);
        }
    }

    public CacheFallbackHandler registerCacheFallback(String serviceName, int priority) {
        requireName(serviceName);
        CacheFallbackHandler handler = new CacheFallbackHandler(serviceName,
                FallbackConfig.of(FallbackType.CACHE, priority),
                cacheDirectory.resolve("fallback_" + serviceName + ".json"));
        registerFallback(serviceName, handler);
        return handler;
    }

    public StaticFallbackHandler registerStaticFallback(String serviceName, Map<String, Object> staticResponses,
                                                        Object defaultResponse, int priority) {
        StaticFallbackHandler handler = new StaticFallbackHandler(serviceName,
                FallbackConfig.of(FallbackType.STATIC, priority), staticResponses, defaultResponse);
        registerFallback(serviceName, handler);
        return handler;
    }

    public SimplifiedFallbackHandler registerSimplifiedFallback(String serviceName,
                                                                Function<FallbackRequest, Object> simplifiedHandler,
                                                                int priority) {
        SimplifiedFallbackHandler handler = new SimplifiedFallbackHandler(serviceName,
                FallbackConfig.of(FallbackType.SIMPLIFIED, priority), simplifiedHandler);
        registerFallback(serviceName, handler);
        return handler;
    }

    /** Registers a proxy to another service resolved through the service registry. */
    public ProxyFallbackHandler registerProxyFallback(String serviceName, String proxyService, int priority) {
        ProxyFallbackHandler handler = ProxyFallbackHandler.toService(serviceName,
                FallbackConfig.of(FallbackType.PROXY, priority), serviceRegistry, proxyService);
        registerFallback(serviceName, handler);
        return handler;
    }

    /** Registers a proxy to an HTTP endpoint. */
    public ProxyFallbackHandler registerProxyFallback(String serviceName, URI proxyEndpoint, int priority) {
        ProxyFallbackHandler handler = ProxyFallbackHandler.toEndpoint(serviceName,
                FallbackConfig.of(FallbackType.PROXY, priority), proxyEndpoint, httpClient());
        registerFallback(serviceName, handler);
        return handler;
    }

    public MockFallbackHandler registerMockFallback(String serviceName, int priority) {
        return registerMockFallback(serviceName, null, Map.of(), priority);
    }

    public MockFallbackHandler registerMockFallback(String serviceName, Function<FallbackRequest, Object> generator,
                                                    Map<String, Object> mockData, int priority) {
        MockFallbackHandler handler = new MockFallbackHandler(serviceName,
                FallbackConfig.of(FallbackType.MOCK, priority), generator, mockData);
        registerFallback(serviceName, handler);
        return handler;
    }

    /**
     * Activates the highest-priority handler that succeeds.
     *
     * @return true if a fallback is active for the service afterwards
     */
    public boolean activateFallback(String serviceName) {
        requireName(serviceName);
        synchronized (lock) {
            if (activeFallbacks.containsKey(serviceName)) {
                return true;
            }
            List<FallbackHandler> candidates = handlers.get(serviceName);
            if (candidates == null || candidates.isEmpty()) {
                log.debug("No fallbacks registered for {}", serviceName);
                return false;
            }
            Instant now = clock.instant();
            for (FallbackHandler handler : candidates) {
                Instant failedAt = failedActivations.get(handler);
                if (failedAt != null && now.isBefore(failedAt.plus(handler.config().retryAfter()))) {
                    log.debug("Skipping {} fallback for {} until its retry window elapses",
                            handler.config().type(), serviceName);
                    continue;
                }
                boolean activated;
                try {
                    activated = handler.activate();
                } catch (RuntimeException e) {
                    log.error("{} fallback for {} threw during activation", handler.config().type(), serviceName, e);
                    activated = false;
                }
                metrics.recordFallbackActivation(serviceName, handler.config().type(), activated);
                if (activated) {
                    failedActivations.remove(handler);
                    activeFallbacks.put(serviceName, handler);
                    activatedAt.put(serviceName, now);
                    log.info("Activated {} fallback for {} (priority {})",
                            handler.config().type(), serviceName, handler.config().priority());
                    return true;
                }
                failedActivations.put(handler, now);
                log.warn("{} fallback for {} failed to activate", handler.config().type(), serviceName);
            }
            log.warn("No fallback could be activated for {}", serviceName);
            return false;
        }
    }

    /**
     * Deactivates the service's active fallback.
     *
     * @return true if a fallback was active and shut down cleanly
     */
    public boolean deactivateFallback(String serviceName) {
        requireName(serviceName);
        synchronized (lock) {
            FallbackHandler handler = activeFallbacks.remove(serviceName);
            activatedAt.remove(serviceName);
            if (handler == null) {
                return false;
            }
            try {
                boolean clean = handler.deactivate();
                log.info("Deactivated {} fallback for {}", handler.config().type(), serviceName);
                return clean;
            } catch (RuntimeException e) {
                log.error("{} fallback for {} threw during deactivation", handler.config().type(), serviceName, e);
                return false;
            }
        }
    }

    /**
     * Serves a request through the service's active fallback. Never throws for handler
     * failures; the result carries the error kind instead.
     */
    public FallbackResult handleFallbackRequest(String serviceName, FallbackRequest request) {
        requireName(serviceName);
        if (request == null) {
            throw new IllegalArgumentException("request must not be null");
        }
        FallbackHandler handler;
        synchronized (lock) {
            handler = activeFallbacks.get(serviceName);
        }
        if (handler == null) {
            return FallbackResult.noActiveFallback(serviceName);
        }
        try {
            return FallbackResult.success(serviceName, handler.handleRequest(request));
        } catch (RuntimeException e) {
            log.warn("{} fallback for {} failed to serve '{}': {}",
                    handler.config().type(), serviceName, request.requestType(), e.getMessage());
            return FallbackResult.handlerError(serviceName, e.getMessage());
        }
    }

    /**
     * Captures a healthy response in every cache fallback of the service.
     *
     * @return the number of cache handlers that captured it
     */
    public int cacheResponse(String serviceName, FallbackRequest request, Object response) {
        requireName(serviceName);
        List<CacheFallbackHandler> caches = new ArrayList<>();
        synchronized (lock) {
            for (FallbackHandler handler : handlers.getOrDefault(serviceName, List.of())) {
                if (handler instanceof CacheFallbackHandler cache) {
                    caches.add(cache);
                }
            }
        }
        caches.forEach(cache -> cache.cacheResponse(request, response));
        return caches.size();
    }

    @Override
    public void onAlert(Alert alert) {
        if (!alert.hasService()) {
            return;
        }
        String serviceName = alert.serviceName();
        switch (alert.type()) {
            case CIRCUIT_OPENED -> {
                if (hasFallbacks(serviceName) && !isFallbackActive(serviceName)) {
                    log.info("Circuit opened for {}, activating fallback", serviceName);
                    activateFallback(serviceName);
                }
            }
            case SERVICE_RECOVERED -> {
                if (isFallbackActive(serviceName)) {
                    log.info("{} recovered, deactivating fallback", serviceName);
                    deactivateFallback(serviceName);
                }
            }
            default -> {
                // other alerts do not affect fallbacks
            }
        }
    }

    public boolean hasFallbacks(String serviceName) {
        synchronized (lock) {
            List<FallbackHandler> list = handlers.get(serviceName);
            return list != null && !list.isEmpty();
        }
    }

    public boolean isFallbackActive(String serviceName) {
        synchronized (lock) {
            return activeFallbacks.containsKey(serviceName);
        }
    }

    public Optional<FallbackType> getActiveFallbackType(String serviceName) {
        synchronized (lock) {
            FallbackHandler handler = activeFallbacks.get(serviceName);
            return handler == null ? Optional.empty() : Optional.of(handler.config().type());
        }
    }

    public FallbackStatus getFallbackStatus() {
        synchronized (lock) {
            Map<String, FallbackStatus.ActiveFallback> active = new LinkedHashMap<>();
            activeFallbacks.forEach((name, handler) -> active.put(name, new FallbackStatus.ActiveFallback(
                    handler.config().type(), handler.config().priority(), activatedAt.get(name))));
            Map<String, List<FallbackStatus.RegisteredFallback>> registered = new LinkedHashMap<>();
            handlers.forEach((name, list) -> registered.put(name, list.stream()
                    .map(h -> new FallbackStatus.RegisteredFallback(
                            h.config().type(), h.config().priority(), h.isActive(), h.isReady()))
                    .toList()));
            return new FallbackStatus(active, registered);
        }
    }

    private HttpClient httpClient() {
        HttpClient client = httpClient;
        if (client == null) {
            synchronized (lock) {
                if (httpClient == null) {
                    httpClient = HttpClient.newBuilder().connectTimeout(HTTP_CONNECT_TIMEOUT).build();
                }
                client = httpClient;
            }
        }
        return client;
    }

    private static void requireName(String serviceName) {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
    }
}
