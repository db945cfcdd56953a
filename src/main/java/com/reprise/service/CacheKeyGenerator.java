package com.reprise.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.reprise.model.CacheRouteConfig;
import com.reprise.web.CacheableRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Derives cache keys from requests under a route's {@link CacheRouteConfig}.
 *
 * Key layout (joined by '|'):
 * 1. HTTP method
 * 2. request path
 * 3. canonical JSON of selected query parameters
 * 4. canonical JSON of selected body parameters (POST/PUT only, "{}" otherwise)
 * 5. canonical JSON of selected header values
 *
 * Canonical JSON sorts object keys recursively, so parameter order never changes the key.
 * A route's custom key generator replaces all of the above.
 */
@Slf4j
@Service
public class CacheKeyGenerator {

    public static final String DELIMITER = "|";

    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT");

    private final ObjectMapper canonicalMapper;

    public CacheKeyGenerator(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Generate the cache key for a request.
     *
     * @param request inbound request
     * @param config  merged route config
     * @return composed key; identical for semantically identical requests
     */
    public String generate(CacheableRequest request, CacheRouteConfig config) {
        if (config.hasCustomKeyGenerator()) {
            return config.getCustomKeyGenerator().generate(request);
        }

        String method = request.getMethod();

        return String.join(DELIMITER,
                method,
                request.getPath(),
                canonical(selectQueryParams(request, config)),
                canonical(selectBodyParams(request, config, method)),
                canonical(selectHeaders(request, config)));
    }

    private Map<String, Object> selectQueryParams(CacheableRequest request, CacheRouteConfig config) {
        Map<String, Object> selected = new TreeMap<>();
        Map<String, List<String>> query = request.getQueryParams();
        if (query == null) {
            return selected;
        }

        query.forEach((name, values) -> {
            if (isSelected(name, config) && values != null && !values.isEmpty()) {
                // single values as strings, repeated parameters as arrays; a valueless occurrence is ""
                List<String> normalized = values.stream()
                        .map(value -> value != null ? value : "")
                        .collect(Collectors.toList());
                selected.put(name, normalized.size() == 1 ? normalized.get(0) : normalized);
            }
        });
        return selected;
    }

    private Map<String, Object> selectBodyParams(CacheableRequest request, CacheRouteConfig config, String method) {
        Map<String, Object> selected = new TreeMap<>();
        JsonNode body = request.getBody();
        if (body == null || !body.isObject() || !BODY_METHODS.contains(method)) {
            return selected;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = body.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (isSelected(field.getKey(), config)) {
                // plain maps/lists so nested objects are key-sorted as well
                selected.put(field.getKey(), canonicalMapper.convertValue(field.getValue(), Object.class));
            }
        }
        return selected;
    }

    private Map<String, Object> selectHeaders(CacheableRequest request, CacheRouteConfig config) {
        Map<String, Object> selected = new TreeMap<>();
        List<String> varyBy = config.getVaryByHeaders();
        if (varyBy == null || varyBy.isEmpty()) {
            return selected;
        }

        for (String header : varyBy) {
            request.getHeader(header)
                    .filter(value -> !value.isEmpty())
                    .ifPresent(value -> selected.put(header, value));
        }
        return selected;
    }

    /**
     * Allow-list first (empty allows everything), then the deny-list.
     */
    private static boolean isSelected(String name, CacheRouteConfig config) {
        List<String> keyParams = config.getKeyParams();
        List<String> ignoreParams = config.getIgnoreParams();

        boolean allowed = keyParams == null || keyParams.isEmpty() || keyParams.contains(name);
        boolean ignored = ignoreParams != null && ignoreParams.contains(name);
        return allowed && !ignored;
    }

    private String canonical(Map<String, Object> values) {
        try {
            return canonicalMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            // only plain maps, lists and scalars reach here
            throw new IllegalStateException("Cannot serialize cache key component", e);
        }
    }
}
