package com.reprise.model;

/**
 * HTTP headers written by the response cache.
 */
public class CacheHeaders {

    /**
     * Whether the response came from cache.
     * Values: "HIT" or "MISS"
     *
     * Absent when the route is not cached or the request was not cache-eligible.
     */
    public static final String CACHE_STATUS = "x-cache";

    public static final String HIT = "HIT";
    public static final String MISS = "MISS";

    private CacheHeaders() {
        // Utility class, no instantiation
    }
}
