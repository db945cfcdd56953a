package com.reprise.web;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * The outgoing side of a request: the single "send JSON payload" operation the cache wraps.
 */
public interface JsonResponseSink {

    void setHeader(String name, String value);

    Mono<Void> sendJson(JsonNode payload);
}
