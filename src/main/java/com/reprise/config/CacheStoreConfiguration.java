package com.reprise.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reprise.metrics.CacheMetrics;
import com.reprise.store.CacheStore;
import com.reprise.store.InMemoryCacheStore;
import com.reprise.store.PassthroughCacheStore;
import com.reprise.store.redis.RedisCacheStore;
import com.reprise.store.redis.RedisConnectionSupervisor;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.codec.StringCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Schedulers;

/**
 * Chooses the one cache backend for the lifetime of the process.
 *
 * Redis disabled → in-process store. Redis enabled with a usable URL → Redis store.
 * Redis enabled without a usable URL → passthrough store, so the service still starts
 * and every request reaches its handler.
 */
@Slf4j
@Configuration
public class CacheStoreConfiguration {

    @Bean(destroyMethod = "close")
    public CacheStore cacheStore(RepriseProperties properties,
                                 ObjectProvider<RedisClient> redisClient,
                                 ObjectMapper objectMapper,
                                 CacheMetrics metrics) {
        RepriseProperties.RedisConfig redis = properties.getRedis();
        if (!redis.isEnabled()) {
            return new InMemoryCacheStore(properties.getCache().toOptions(), metrics);
        }

        if (redis.getUrl() == null || redis.getUrl().isBlank()) {
            log.error("Redis is enabled but reprise.redis.url (REDIS_URL) is not set");
            return new PassthroughCacheStore("redis url missing");
        }

        RedisURI uri;
        try {
            uri = RedisURI.create(redis.getUrl());
        } catch (IllegalArgumentException e) {
            log.error("Redis is enabled but the configured URL is malformed: {}", e.getMessage());
            return new PassthroughCacheStore("redis url malformed");
        }
        uri.setTimeout(redis.getCommandTimeout());

        RedisClient client = redisClient.getIfAvailable();
        if (client == null) {
            log.error("Redis is enabled but no Redis client is configured");
            return new PassthroughCacheStore("redis client unavailable");
        }

        RedisConnectionSupervisor supervisor = new RedisConnectionSupervisor(
                () -> client.connectAsync(StringCodec.UTF8, uri),
                redis.getMaxReconnectAttempts(),
                Schedulers.newSingle("reprise-redis-reconnect", true));
        client.addListener(supervisor);
        supervisor.start();

        log.info("Using Redis cache at {}:{} (maxReconnectAttempts={}, connectionPoolSize={})",
                uri.getHost(), uri.getPort(), redis.getMaxReconnectAttempts(), redis.getConnectionPoolSize());
        return new RedisCacheStore(supervisor, objectMapper, metrics, redis.getKeyPrefix());
    }
}
