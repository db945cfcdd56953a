package com.reprise.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reprise.metrics.CacheMetrics;
import com.reprise.service.CacheKeyGenerator;
import com.reprise.service.ResponseCacheManager;
import com.reprise.store.CacheStore;
import com.reprise.web.reactive.CacheRouteRegistry;
import com.reprise.web.reactive.ResponseCacheWebFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the cache manager and the routes declared under {@code reprise.routes}.
 */
@Slf4j
@Configuration
public class ResponseCacheConfiguration {

    @Bean
    public ResponseCacheManager responseCacheManager(CacheStore cacheStore,
                                                     CacheKeyGenerator keyGenerator,
                                                     CacheMetrics metrics,
                                                     RepriseProperties properties) {
        return new ResponseCacheManager(cacheStore, keyGenerator, metrics,
                properties.getCache().getDefaultTtl().toSeconds());
    }

    @Bean
    public CacheRouteRegistry cacheRouteRegistry(ResponseCacheManager manager, RepriseProperties properties) {
        CacheRouteRegistry registry = new CacheRouteRegistry(manager);
        for (RepriseProperties.RouteConfig route : properties.getRoutes()) {
            if (route.getPath() == null || route.getPath().isBlank()) {
                log.warn("Skipping cache route without a path");
                continue;
            }
            registry.register(route.getPath(), route.toRouteConfig());
        }
        return registry;
    }

    @Bean
    public ResponseCacheWebFilter responseCacheWebFilter(CacheRouteRegistry registry, ObjectMapper objectMapper) {
        return new ResponseCacheWebFilter(registry, objectMapper);
    }
}
