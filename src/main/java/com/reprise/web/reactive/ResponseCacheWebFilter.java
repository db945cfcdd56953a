package com.reprise.web.reactive;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reprise.web.CacheableRequest;
import com.reprise.web.JsonResponseSink;
import com.reprise.web.ResponseCacheMiddleware;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpMethod;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.Optional;

/**
 * Binds the response cache to the WebFlux filter chain.
 *
 * For requests on a registered route the exchange is adapted to the cache's request,
 * response-sink and next-stage abstractions; all other requests pass untouched. JSON
 * bodies of POST/PUT requests are buffered (and replayed downstream) only for routes
 * that accept non-GET methods.
 */
@Slf4j
public class ResponseCacheWebFilter implements WebFilter, Ordered {

    public static final int ORDER = Ordered.HIGHEST_PRECEDENCE + 100;

    private final CacheRouteRegistry routes;
    private final ObjectMapper objectMapper;

    public ResponseCacheWebFilter(CacheRouteRegistry routes, ObjectMapper objectMapper) {
        this.routes = routes;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        Optional<ResponseCacheMiddleware> route = routes.match(request.getPath().pathWithinApplication());
        if (route.isEmpty()) {
            return chain.filter(exchange);
        }

        ResponseCacheMiddleware middleware = route.get();
        if (middleware.acceptsNonGet() && hasJsonBody(request)) {
            return DataBufferUtils.join(request.getBody())
                    .map(ResponseCacheWebFilter::drain)
                    .defaultIfEmpty(new byte[0])
                    .flatMap(bytes -> {
                        ServerWebExchange replayable = exchange.mutate()
                                .request(new CachedBodyRequest(request, bytes))
                                .build();
                        return run(middleware, replayable, chain, parseBody(bytes));
                    });
        }
        return run(middleware, exchange, chain, null);
    }

    @Override
    public int getOrder() {
        return ORDER;
    }

    private Mono<Void> run(ResponseCacheMiddleware middleware,
                           ServerWebExchange exchange,
                           WebFilterChain chain,
                           JsonNode body) {
        CacheableRequest cacheable = new ExchangeCacheableRequest(exchange.getRequest(), body);
        JsonResponseSink sink = new ExchangeJsonResponseSink(exchange.getResponse(), objectMapper);

        return middleware.handle(cacheable, sink, downstream -> {
            if (downstream == sink) {
                return chain.filter(exchange);
            }
            JsonCapturingResponseDecorator decorated =
                    new JsonCapturingResponseDecorator(exchange.getResponse(), downstream, objectMapper);
            return chain.filter(exchange.mutate().response(decorated).build());
        });
    }

    private JsonNode parseBody(byte[] bytes) {
        if (bytes.length == 0) {
            return null;
        }
        try {
            return objectMapper.readTree(bytes);
        } catch (IOException e) {
            log.debug("Request body is not valid JSON, ignoring it for cache key: {}", e.getMessage());
            return null;
        }
    }

    private static boolean hasJsonBody(ServerHttpRequest request) {
        HttpMethod method = request.getMethod();
        boolean bodyMethod = HttpMethod.POST.equals(method) || HttpMethod.PUT.equals(method);
        return bodyMethod && JsonCapturingResponseDecorator.isJson(request.getHeaders().getContentType());
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
}
