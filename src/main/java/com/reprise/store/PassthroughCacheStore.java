package com.reprise.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.reprise.model.dto.CacheStatus;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Degraded store used when the configured backend cannot be built.
 *
 * Every lookup misses and every write is dropped, so requests always reach the real handler.
 */
@Slf4j
public class PassthroughCacheStore implements CacheStore {

    public static final String NAME = "passthrough";

    private final String reason;

    public PassthroughCacheStore(String reason) {
        this.reason = reason;
        log.warn("Response cache running in passthrough mode: {}", reason);
    }

    @Override
    public Mono<JsonNode> get(String key) {
        return Mono.empty();
    }

    @Override
    public Mono<Void> set(String key, JsonNode value, long ttlSeconds) {
        return Mono.empty();
    }

    @Override
    public Mono<Void> delete(String key) {
        return Mono.empty();
    }

    @Override
    public Flux<String> keys() {
        return Flux.empty();
    }

    @Override
    public Mono<Void> clear() {
        return Mono.empty();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<CacheStatus> status() {
        return Mono.just(CacheStatus.builder()
                .backend(NAME)
                .connectionState(reason)
                .connected(false)
                .degraded(true)
                .keyCount(0)
                .build());
    }

    public String getReason() {
        return reason;
    }
}
