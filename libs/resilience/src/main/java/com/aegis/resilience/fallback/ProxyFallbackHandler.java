package com.aegis.resilience.fallback;

import com.aegis.resilience.service.ManagedService;
import com.aegis.resilience.service.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Optional;

/**
 * Forwards requests to another registered service, or POSTs the request parameters as JSON
 * to an external endpoint and returns the decoded JSON response.
 */
public final class ProxyFallbackHandler extends AbstractFallbackHandler {

    private static final Logger log = LoggerFactory.getLogger(ProxyFallbackHandler.class);

    private final ServiceRegistry registry;
    private final String proxyService;
    private final URI proxyEndpoint;
    private final HttpClient httpClient;

    private ProxyFallbackHandler(String serviceName, FallbackConfig config, ServiceRegistry registry,
                                 String proxyService, URI proxyEndpoint, HttpClient httpClient) {
        super(serviceName, config, FallbackType.PROXY);
        this.registry = registry;
        this.proxyService = proxyService;
        this.proxyEndpoint = proxyEndpoint;
        this.httpClient = httpClient;
    }

    /** Proxies to another service looked up in the registry. */
    public static ProxyFallbackHandler toService(String serviceName, FallbackConfig config,
                                                 ServiceRegistry registry, String proxyService) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        return new ProxyFallbackHandler(serviceName, config, registry, proxyService, null, null);
    }

    /** Proxies to an HTTP endpoint. */
    public static ProxyFallbackHandler toEndpoint(String serviceName, FallbackConfig config,
                                                  URI proxyEndpoint, HttpClient httpClient) {
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient must not be null");
        }
        return new ProxyFallbackHandler(serviceName, config, null, null, proxyEndpoint, httpClient);
    }

    @Override
    public boolean isReady() {
        return (proxyService != null && !proxyService.isBlank()) || proxyEndpoint != null;
    }

    @Override
    protected boolean onActivate() {
        if (proxyService == null) {
            return true;
        }
        if (registry.getService(proxyService).isEmpty()) {
            log.warn("Proxy target {} for {} is not registered", proxyService, serviceName());
            return false;
        }
        return true;
    }

    @Override
    protected Object serve(FallbackRequest request) {
        return proxyService != null ? forwardToService(request) : forwardToEndpoint(request);
    }

    private Object forwardToService(FallbackRequest request) {
        Optional<ManagedService> target = registry.getService(proxyService);
        if (target.isEmpty()) {
            throw new FallbackException(serviceName(), "Proxy service '%s' is not available".formatted(proxyService));
        }
        try {
            return target.get().handleRequest(request);
        } catch (RuntimeException e) {
            throw new FallbackException(serviceName(),
                    "Proxy service '%s' failed: %s".formatted(proxyService, e.getMessage()), e);
        }
    }

    private Object forwardToEndpoint(FallbackRequest request) {
        try {
            HttpRequest httpRequest = HttpRequest.newBuilder(proxyEndpoint)
                    .timeout(config().timeout())
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(FallbackJson.MAPPER.writeValueAsString(request.params())))
                    .build();
            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new FallbackException(serviceName(),
                        "Proxy endpoint %s returned HTTP %d".formatted(proxyEndpoint, response.statusCode()));
            }
            String body = response.body();
            return body == null || body.isBlank() ? null : FallbackJson.MAPPER.readValue(body, Object.class);
        } catch (IOException e) {
            throw new FallbackException(serviceName(),
                    "Proxy endpoint %s failed: %s".formatted(proxyEndpoint, e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FallbackException(serviceName(), "Interrupted while calling proxy endpoint " + proxyEndpoint, e);
        }
    }

    public Optional<String> proxyService() {
        return Optional.ofNullable(proxyService);
    }

    public Optional<URI> proxyEndpoint() {
        return Optional.ofNullable(proxyEndpoint);
    }
}
