package com.reprise.web.reactive;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reprise.web.JsonResponseSink;
import lombok.extern.slf4j.Slf4j;
import org.reactivestreams.Publisher;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.http.server.reactive.ServerHttpResponseDecorator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.Optional;

/**
 * Routes JSON bodies written by downstream handlers through a {@link JsonResponseSink}.
 *
 * Only bodies whose content type is JSON are intercepted; everything else, including
 * streamed responses, passes through untouched.
 */
@Slf4j
class JsonCapturingResponseDecorator extends ServerHttpResponseDecorator {

    private final JsonResponseSink sink;
    private final ObjectMapper objectMapper;

    JsonCapturingResponseDecorator(ServerHttpResponse delegate, JsonResponseSink sink, ObjectMapper objectMapper) {
        super(delegate);
        this.sink = sink;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> writeWith(Publisher<? extends DataBuffer> body) {
        if (!isJson(getHeaders().getContentType())) {
            return getDelegate().writeWith(body);
        }

        return DataBufferUtils.join(body)
                .map(JsonCapturingResponseDecorator::drain)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(bytes -> bytes
                        .map(this::emit)
                        .orElseGet(() -> getDelegate().writeWith(Flux.empty())));
    }

    private Mono<Void> emit(byte[] bytes) {
        JsonNode payload;
        try {
            payload = objectMapper.readTree(bytes);
        } catch (IOException e) {
            log.debug("Response declared JSON but did not parse, not caching: {}", e.getMessage());
            return writeRaw(bytes);
        }
        if (payload == null || payload.isMissingNode()) {
            return writeRaw(bytes);
        }
        return sink.sendJson(payload);
    }

    private Mono<Void> writeRaw(byte[] bytes) {
        return getDelegate().writeWith(Mono.just(bufferFactory().wrap(bytes)));
    }

    private static byte[] drain(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    static boolean isJson(MediaType contentType) {
        if (contentType == null) {
            return false;
        }
        return MediaType.APPLICATION_JSON.isCompatibleWith(contentType)
                || contentType.getSubtype().endsWith("+json");
    }
}
