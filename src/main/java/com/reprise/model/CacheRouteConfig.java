package com.reprise.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Per-route cache policy.
 *
 * Every field is optional on a route; {@link #mergedOver(CacheRouteConfig)} fills the
 * gaps from the manager defaults.
 */
@Value
@Builder(toBuilder = true)
public class CacheRouteConfig {

    /**
     * TTL in seconds.
     */
    Long duration;

    /**
     * Inclusion allow-list for query/body parameters. Empty includes everything.
     */
    List<String> keyParams;

    /**
     * Exclusion deny-list, applied after the allow-list.
     */
    List<String> ignoreParams;

    /**
     * Request headers folded into the key.
     */
    List<String> varyByHeaders;

    /**
     * When set, replaces the built-in key composition.
     */
    CustomKeyGenerator customKeyGenerator;

    public static CacheRouteConfig defaults(long defaultTtlSeconds) {
        return CacheRouteConfig.builder()
                .duration(defaultTtlSeconds)
                .keyParams(List.of())
                .ignoreParams(List.of())
                .varyByHeaders(List.of())
                .build();
    }

    public static CacheRouteConfig ofDuration(long seconds) {
        return CacheRouteConfig.builder().duration(seconds).build();
    }

    /**
     * Overlay this route config on top of the given defaults; values set here win.
     * A non-positive duration is not a usable TTL and falls back to the default.
     */
    public CacheRouteConfig mergedOver(CacheRouteConfig defaults) {
        return CacheRouteConfig.builder()
                .duration(duration != null && duration > 0 ? duration : defaults.getDuration())
                .keyParams(keyParams != null ? keyParams : defaults.getKeyParams())
                .ignoreParams(ignoreParams != null ? ignoreParams : defaults.getIgnoreParams())
                .varyByHeaders(varyByHeaders != null ? varyByHeaders : defaults.getVaryByHeaders())
                .customKeyGenerator(customKeyGenerator != null ? customKeyGenerator : defaults.getCustomKeyGenerator())
                .build();
    }

    public boolean hasCustomKeyGenerator() {
        return customKeyGenerator != null;
    }
}
