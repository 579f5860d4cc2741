package com.aegis.resilience.fallback;

import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves responses captured while the service was healthy.
 * <p>
 * Captured responses are keyed by {@link FallbackRequest#identity()}. When a cache file is
 * configured, it is loaded on activation and rewritten on deactivation, so the handler can
 * serve responses captured before a restart.
 */
public final class CacheFallbackHandler extends AbstractFallbackHandler {

    private static final Logger log = LoggerFactory.getLogger(CacheFallbackHandler.class);

    private static final TypeReference<Map<String, Object>> CACHE_TYPE = new TypeReference<>() {
    };

    private final Path cacheFile;
    private final Map<String, Object> cache = new ConcurrentHashMap<>();

    /**
     * @param cacheFile JSON file backing the cache, or null for an in-memory cache only
     */
    public CacheFallbackHandler(String serviceName, FallbackConfig config, Path cacheFile) {
        super(serviceName, config, FallbackType.CACHE);
        this.cacheFile = cacheFile;
    }

    public CacheFallbackHandler(String serviceName, FallbackConfig config) {
        this(serviceName, config, null);
    }

    /** Captures a response for later use. */
    public void cacheResponse(FallbackRequest request, Object response) {
        if (request == null) {
            throw new IllegalArgumentException("request must not be null");
        }
        if (response == null) {
            throw new IllegalArgumentException("response must not be null");
        }
        cache.put(request.identity(), response);
    }

    /** Number of captured responses. */
    public int size() {
        return cache.size();
    }

    @Override
    protected boolean onActivate() {
        if (cacheFile == null || !Files.exists(cacheFile)) {
            return true;
        }
        try {
            Map<String, Object> loaded = FallbackJson.MAPPER.readValue(cacheFile.toFile(), CACHE_TYPE);
            loaded.forEach(cache::putIfAbsent);
            log.info("Loaded {} cached responses for {} from {}", loaded.size(), serviceName(), cacheFile);
        } catch (IOException e) {
            log.warn("Could not read cache file {} for {}, serving in-memory entries only",
                    cacheFile, serviceName(), e);
        }
        return true;
    }

    @Override
    protected boolean onDeactivate() {
        if (cacheFile == null) {
            return true;
        }
        try {
            Path parent = cacheFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            FallbackJson.MAPPER.writeValue(cacheFile.toFile(), Map.copyOf(cache));
            return true;
        } catch (IOException e) {
            log.error("Failed to persist {} cached responses for {} to {}", cache.size(), serviceName(), cacheFile, e);
            return false;
        }
    }

    @Override
    protected Object serve(FallbackRequest request) {
        Object cached = cache.get(request.identity());
        if (cached == null) {
            throw new FallbackException(serviceName(),
                    "No cached response available for '%s'".formatted(request.identity()));
        }
        return cached;
    }

    public Path cacheFile() {
        return cacheFile;
    }
}
