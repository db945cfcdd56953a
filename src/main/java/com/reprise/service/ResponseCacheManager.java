package com.reprise.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.reprise.metrics.CacheMetrics;
import com.reprise.model.CacheRouteConfig;
import com.reprise.model.dto.CacheStatus;
import com.reprise.store.CacheStore;
import com.reprise.store.PassthroughCacheStore;
import com.reprise.web.CacheableRequest;
import com.reprise.web.ResponseCacheMiddleware;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.regex.Pattern;

/**
 * Owns the single {@link CacheStore} chosen at startup and everything built on it.
 *
 * Flow per request (see {@link ResponseCacheMiddleware}):
 * 1. Derive the key from the request and the route config
 * 2. Serve the stored payload on a hit
 * 3. On a miss, let the handler run and store its JSON payload without delaying the response
 *
 * Many routes share one manager; each route supplies its own {@link CacheRouteConfig}.
 */
@Slf4j
public class ResponseCacheManager {

    private final CacheStore store;
    private final CacheKeyGenerator keyGenerator;
    private final CacheMetrics metrics;
    private final CacheRouteConfig defaultConfig;

    public ResponseCacheManager(CacheStore store,
                                CacheKeyGenerator keyGenerator,
                                CacheMetrics metrics,
                                long defaultTtlSeconds) {
        this.store = store;
        this.keyGenerator = keyGenerator;
        this.metrics = metrics;
        this.defaultConfig = CacheRouteConfig.defaults(defaultTtlSeconds);
        log.info("Response cache using '{}' backend, default TTL {}s", store.name(), defaultTtlSeconds);
    }

    /**
     * Compute the cache key for a request under a route config.
     */
    public String deriveKey(CacheableRequest request, CacheRouteConfig config) {
        return keyGenerator.generate(request, config);
    }

    /**
     * Build the request-handling function for a route.
     *
     * @param config route overrides, merged over the manager defaults; may be null
     */
    public ResponseCacheMiddleware middleware(CacheRouteConfig config) {
        CacheRouteConfig routeConfig = config != null ? config : CacheRouteConfig.builder().build();
        return new ResponseCacheMiddleware(this, routeConfig, routeConfig.mergedOver(defaultConfig));
    }

    /**
     * Flush every entry in the store.
     */
    public Mono<Void> clearCache() {
        log.info("Clearing entire response cache ({})", store.name());
        return store.clear();
    }

    /**
     * Delete every key in which the pattern finds a match.
     *
     * @return number of deleted keys
     */
    public Mono<Long> clearCache(Pattern pattern) {
        if (pattern == null) {
            return clearCache().thenReturn(0L);
        }
        return store.keys()
                .filter(key -> pattern.matcher(key).find())
                .flatMap(key -> store.delete(key).thenReturn(key))
                .count()
                .doOnNext(count -> log.info("Cleared {} cache entries matching '{}'", count, pattern.pattern()));
    }

    public Flux<String> keys() {
        return store.keys();
    }

    public Mono<CacheStatus> status() {
        return store.status();
    }

    public boolean isDegraded() {
        return store instanceof PassthroughCacheStore;
    }

    public CacheRouteConfig getDefaultConfig() {
        return defaultConfig;
    }

    /**
     * Lookup used by the middleware. Never errors: a failing store reads as a miss.
     */
    public Mono<JsonNode> lookup(String key) {
        return Mono.defer(() -> store.get(key))
                .onErrorResume(e -> {
                    log.error("Error retrieving from cache: key={}", key, e);
                    metrics.storeError(store.name(), "get");
                    return Mono.empty();
                });
    }

    /**
     * Fire-and-forget write: the caller never waits on it and failures are only logged.
     */
    public void storeDetached(String key, JsonNode payload, long ttlSeconds) {
        store.set(key, payload, ttlSeconds)
                .subscribe(
                        null,
                        e -> {
                            log.error("Error setting cache: key={}", key, e);
                            metrics.storeError(store.name(), "set");
                        });
    }

    public void recordHit() {
        metrics.cacheHit(store.name());
    }

    public void recordMiss() {
        metrics.cacheMiss(store.name());
    }
}
