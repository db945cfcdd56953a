package com.reprise.web.reactive;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reprise.web.JsonResponseSink;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import reactor.core.publisher.Mono;

/**
 * Writes JSON payloads straight to the underlying WebFlux response.
 */
class ExchangeJsonResponseSink implements JsonResponseSink {

    private final ServerHttpResponse response;
    private final ObjectMapper objectMapper;

    ExchangeJsonResponseSink(ServerHttpResponse response, ObjectMapper objectMapper) {
        this.response = response;
        this.objectMapper = objectMapper;
    }

    @Override
    public void setHeader(String name, String value) {
        if (!response.isCommitted()) {
            response.getHeaders().set(name, value);
        }
    }

    @Override
    public Mono<Void> sendJson(JsonNode payload) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsBytes(payload))
                .flatMap(bytes -> {
                    if (response.getHeaders().getContentType() == null) {
                        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
                    }
                    response.getHeaders().setContentLength(bytes.length);
                    return response.writeWith(Mono.just(response.bufferFactory().wrap(bytes)));
                });
    }
}
