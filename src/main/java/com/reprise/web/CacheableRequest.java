package com.reprise.web;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The view of an inbound HTTP request the response cache needs to derive keys.
 */
public interface CacheableRequest {

    /**
     * Upper-case HTTP method name.
     */
    String getMethod();

    String getPath();

    /**
     * Query parameters in arrival order; a parameter may repeat.
     */
    Map<String, List<String>> getQueryParams();

    /**
     * Parsed JSON body for POST/PUT requests, or {@code null} when absent or not JSON.
     */
    JsonNode getBody();

    /**
     * First value of the named header, matched case-insensitively.
     */
    Optional<String> getHeader(String name);
}
