package com.reprise.web;

import reactor.core.publisher.Mono;

/**
 * Continuation into the downstream handler chain.
 */
@FunctionalInterface
public interface NextStage {

    /**
     * Run the downstream handlers, which emit their JSON response through {@code response}.
     */
    Mono<Void> proceed(JsonResponseSink response);
}
