package com.reprise.web.reactive;

import com.fasterxml.jackson.databind.JsonNode;
import com.reprise.web.CacheableRequest;
import org.springframework.http.server.reactive.ServerHttpRequest;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link CacheableRequest} view over a WebFlux request; the body is parsed up front by the filter.
 */
class ExchangeCacheableRequest implements CacheableRequest {

    private final ServerHttpRequest request;
    private final JsonNode body;

    ExchangeCacheableRequest(ServerHttpRequest request, JsonNode body) {
        this.request = request;
        this.body = body;
    }

    @Override
    public String getMethod() {
        return request.getMethod().name();
    }

    @Override
    public String getPath() {
        return request.getPath().pathWithinApplication().value();
    }

    @Override
    public Map<String, List<String>> getQueryParams() {
        return request.getQueryParams();
    }

    @Override
    public JsonNode getBody() {
        return body;
    }

    @Override
    public Optional<String> getHeader(String name) {
        return Optional.ofNullable(request.getHeaders().getFirst(name));
    }
}
