package com.reprise.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.reprise.model.dto.CacheStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Uniform capability set shared by every cache backend.
 *
 * Implementations never signal errors: transport and serialization failures are
 * logged and downgraded to an empty result (absent, no-op, no keys). Synchronous
 * backends complete on subscription; asynchronous ones may suspend.
 */
public interface CacheStore extends AutoCloseable {

    /**
     * @param key composed cache key
     * @return stored payload, or empty when absent, expired or unreadable
     */
    Mono<JsonNode> get(String key);

    /**
     * Store a payload with the given TTL. Completes empty whether or not the write took effect.
     */
    Mono<Void> set(String key, JsonNode value, long ttlSeconds);

    Mono<Void> delete(String key);

    /**
     * Every live key held by this store.
     */
    Flux<String> keys();

    /**
     * Remove every entry held by this store.
     */
    Mono<Void> clear();

    /**
     * Short backend name used in logs and metrics.
     */
    String name();

    /**
     * Snapshot of backend health; the Redis backend counts keys over the wire.
     */
    Mono<CacheStatus> status();

    @Override
    default void close() {
    }
}
