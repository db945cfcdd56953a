package com.reprise.store.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reprise.metrics.CacheMetrics;
import com.reprise.model.dto.CacheStatus;
import com.reprise.store.CacheStore;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Redis-backed store using the Lettuce reactive API.
 *
 * Key pattern: {prefix}{cacheKey}
 * Values are JSON text written with SETEX, so value and TTL land atomically.
 * Every failure is logged and downgraded: get → miss, set/delete/clear → no-op, keys → none.
 */
@Slf4j
public class RedisCacheStore implements CacheStore {

    public static final String NAME = "redis";

    private final RedisConnectionSupervisor supervisor;
    private final ObjectMapper objectMapper;
    private final CacheMetrics metrics;
    private final String keyPrefix;

    public RedisCacheStore(RedisConnectionSupervisor supervisor,
                           ObjectMapper objectMapper,
                           CacheMetrics metrics,
                           String keyPrefix) {
        this.supervisor = supervisor;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.keyPrefix = keyPrefix != null ? keyPrefix : "";
    }

    @Override
    public Mono<JsonNode> get(String key) {
        return supervisor.commands()
                .flatMap(commands -> commands.get(buildKey(key)))
                .flatMap(json -> decode(key, json))
                .onErrorResume(e -> {
                    log.error("Redis get error: key={}: {}", key, e.getMessage());
                    metrics.storeError(NAME, "get");
                    return Mono.empty();
                });
    }

    @Override
    public Mono<Void> set(String key, JsonNode value, long ttlSeconds) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(value))
                .zipWith(supervisor.commands())
                .flatMap(tuple -> tuple.getT2().setex(buildKey(key), ttlSeconds, tuple.getT1()))
                .doOnNext(reply -> log.debug("Stored in Redis cache: key={}, ttl={}s", key, ttlSeconds))
                .then()
                .onErrorResume(e -> {
                    log.error("Redis set error: key={}: {}", key, e.getMessage());
                    metrics.storeError(NAME, "set");
                    return Mono.empty();
                });
    }

    @Override
    public Mono<Void> delete(String key) {
        return supervisor.commands()
                .flatMap(commands -> commands.del(buildKey(key)))
                .then()
                .onErrorResume(e -> {
                    log.error("Redis del error: key={}: {}", key, e.getMessage());
                    metrics.storeError(NAME, "delete");
                    return Mono.empty();
                });
    }

    @Override
    public Flux<String> keys() {
        return supervisor.commands()
                .flatMapMany(commands -> commands.keys(keyPrefix + "*"))
                .map(this::stripPrefix)
                .onErrorResume(e -> {
                    log.error("Redis keys error: {}", e.getMessage());
                    metrics.storeError(NAME, "keys");
                    return Flux.empty();
                });
    }

    @Override
    public Mono<Void> clear() {
        return supervisor.commands()
                .flatMap(this::clearWith)
                .doOnNext(cleared -> {
                    if (cleared < 0) {
                        log.info("Flushed Redis database");
                    } else {
                        log.info("Cleared {} entries from Redis cache", cleared);
                    }
                })
                .then()
                .onErrorResume(e -> {
                    log.error("Redis flushAll error: {}", e.getMessage());
                    metrics.storeError(NAME, "clear");
                    return Mono.empty();
                });
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<CacheStatus> status() {
        return keys().count()
                .map(count -> CacheStatus.builder()
                        .backend(NAME)
                        .connectionState(supervisor.getState().name())
                        .connected(supervisor.isConnected())
                        .degraded(supervisor.getState() == ConnectionState.FAILED)
                        .keyCount(count)
                        .build());
    }

    public boolean isConnected() {
        return supervisor.isConnected();
    }

    @Override
    public void close() {
        supervisor.close();
    }

    /**
     * Without a prefix the whole database belongs to the cache, so FLUSHALL is used.
     */
    private Mono<Long> clearWith(RedisReactiveCommands<String, String> commands) {
        if (keyPrefix.isEmpty()) {
            return commands.flushall().thenReturn(-1L);
        }
        return commands.keys(keyPrefix + "*")
                .collectList()
                .flatMap(keys -> keys.isEmpty()
                        ? Mono.just(0L)
                        : commands.del(keys.toArray(new String[0])));
    }

    private Mono<JsonNode> decode(String key, String json) {
        try {
            return Mono.just(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable Redis cache entry: key={}: {}", key, e.getOriginalMessage());
            metrics.storeError(NAME, "get");
            return Mono.empty();
        }
    }

    private String buildKey(String key) {
        return keyPrefix + key;
    }

    private String stripPrefix(String redisKey) {
        return redisKey.startsWith(keyPrefix) ? redisKey.substring(keyPrefix.length()) : redisKey;
    }
}
