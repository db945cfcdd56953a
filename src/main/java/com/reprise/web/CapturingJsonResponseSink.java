package com.reprise.web;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Decorator around the real response sink that hands the first JSON payload to a
 * capture callback before forwarding it.
 *
 * The payload always reaches the delegate, whatever the callback does.
 */
@Slf4j
public class CapturingJsonResponseSink implements JsonResponseSink {

    private final JsonResponseSink delegate;
    private final Consumer<JsonNode> onCapture;
    private final AtomicBoolean captured = new AtomicBoolean(false);

    public CapturingJsonResponseSink(JsonResponseSink delegate, Consumer<JsonNode> onCapture) {
        this.delegate = delegate;
        this.onCapture = onCapture;
    }

    @Override
    public void setHeader(String name, String value) {
        delegate.setHeader(name, value);
    }

    @Override
    public Mono<Void> sendJson(JsonNode payload) {
        if (captured.compareAndSet(false, true)) {
            try {
                onCapture.accept(payload);
            } catch (RuntimeException e) {
                log.error("Error capturing response for cache", e);
            }
        }
        return delegate.sendJson(payload);
    }

    public boolean hasCaptured() {
        return captured.get();
    }
}
