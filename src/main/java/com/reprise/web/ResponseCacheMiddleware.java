package com.reprise.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.reprise.model.CacheHeaders;
import com.reprise.model.CacheRouteConfig;
import com.reprise.service.ResponseCacheManager;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Per-route request lifecycle:
 *
 * START → KEY_DERIVED → HIT: respond with the stored payload
 *                     → MISS: wrap the response sink, run downstream, store the first JSON payload
 *
 * Only GET is cached unless the route itself supplies a custom key generator. Every cache
 * failure falls through to the downstream handler.
 */
@Slf4j
public class ResponseCacheMiddleware implements CacheMiddleware {

    private static final String GET = "GET";

    private final ResponseCacheManager manager;
    private final CacheRouteConfig routeConfig;
    private final CacheRouteConfig effectiveConfig;

    public ResponseCacheMiddleware(ResponseCacheManager manager,
                                   CacheRouteConfig routeConfig,
                                   CacheRouteConfig effectiveConfig) {
        this.manager = manager;
        this.routeConfig = routeConfig;
        this.effectiveConfig = effectiveConfig;
    }

    @Override
    public Mono<Void> handle(CacheableRequest request, JsonResponseSink response, NextStage next) {
        if (!isEligible(request)) {
            return next.proceed(response);
        }

        Optional<String> key = deriveKey(request);
        if (key.isEmpty()) {
            return next.proceed(response);
        }

        String cacheKey = key.get();
        return manager.lookup(cacheKey)
                .filter(ResponseCacheMiddleware::isServable)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(cached -> cached
                        .map(payload -> respondCached(cacheKey, payload, response))
                        .orElseGet(() -> passThrough(cacheKey, response, next)));
    }

    public CacheRouteConfig getEffectiveConfig() {
        return effectiveConfig;
    }

    /**
     * True when the route opts non-GET methods into caching through a custom key generator.
     */
    public boolean acceptsNonGet() {
        return routeConfig.hasCustomKeyGenerator();
    }

    private boolean isEligible(CacheableRequest request) {
        return GET.equalsIgnoreCase(request.getMethod()) || acceptsNonGet();
    }

    private Optional<String> deriveKey(CacheableRequest request) {
        try {
            return Optional.ofNullable(manager.deriveKey(request, effectiveConfig));
        } catch (RuntimeException e) {
            log.error("Error deriving cache key for {} {}", request.getMethod(), request.getPath(), e);
            return Optional.empty();
        }
    }

    private Mono<Void> respondCached(String key, JsonNode payload, JsonResponseSink response) {
        log.debug("Cache HIT: key={}", key);
        manager.recordHit();
        response.setHeader(CacheHeaders.CACHE_STATUS, CacheHeaders.HIT);
        return response.sendJson(payload);
    }

    private Mono<Void> passThrough(String key, JsonResponseSink response, NextStage next) {
        log.debug("Cache MISS: key={}", key);
        manager.recordMiss();
        response.setHeader(CacheHeaders.CACHE_STATUS, CacheHeaders.MISS);

        long ttl = effectiveConfig.getDuration();
        CapturingJsonResponseSink capturing = new CapturingJsonResponseSink(response,
                payload -> manager.storeDetached(key, payload, ttl));
        return next.proceed(capturing);
    }

    /**
     * Stored values that would read as "falsy" in JSON terms are not served.
     */
    static boolean isServable(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.doubleValue() != 0d;
        }
        if (value.isTextual()) {
            return !value.textValue().isEmpty();
        }
        return true;
    }
}
