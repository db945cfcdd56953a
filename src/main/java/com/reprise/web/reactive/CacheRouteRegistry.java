package com.reprise.web.reactive;

import com.reprise.model.CacheRouteConfig;
import com.reprise.service.ResponseCacheManager;
import com.reprise.web.ResponseCacheMiddleware;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.server.PathContainer;
import org.springframework.web.util.pattern.PathPattern;
import org.springframework.web.util.pattern.PathPatternParser;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered table of cached routes. The first registered pattern that matches a path wins.
 */
@Slf4j
public class CacheRouteRegistry {

    private final ResponseCacheManager manager;
    private final PathPatternParser parser = PathPatternParser.defaultInstance;
    private final List<Route> routes = new CopyOnWriteArrayList<>();

    public CacheRouteRegistry(ResponseCacheManager manager) {
        this.manager = manager;
    }

    /**
     * Cache responses of every path matching {@code pathPattern} under {@code config}.
     */
    public CacheRouteRegistry register(String pathPattern, CacheRouteConfig config) {
        PathPattern pattern = parser.parse(pathPattern);
        ResponseCacheMiddleware middleware = manager.middleware(config);
        routes.add(new Route(pattern, middleware));
        log.info("Caching route {} (ttl={}s)", pathPattern, middleware.getEffectiveConfig().getDuration());
        return this;
    }

    public Optional<ResponseCacheMiddleware> match(PathContainer path) {
        for (Route route : routes) {
            if (route.pattern().matches(path)) {
                return Optional.of(route.middleware());
            }
        }
        return Optional.empty();
    }

    public List<String> patterns() {
        return routes.stream().map(route -> route.pattern().getPatternString()).toList();
    }

    private record Route(PathPattern pattern, ResponseCacheMiddleware middleware) {
    }
}
