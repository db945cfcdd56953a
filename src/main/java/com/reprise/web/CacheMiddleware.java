package com.reprise.web;

import reactor.core.publisher.Mono;

/**
 * Request-handling function in continuation-passing style.
 */
@FunctionalInterface
public interface CacheMiddleware {

    Mono<Void> handle(CacheableRequest request, JsonResponseSink response, NextStage next);
}
