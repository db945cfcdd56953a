package com.reprise.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.io.Serializable;

/**
 * A single stored response inside the in-process store.
 */
@Value
@Builder
public class CacheEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    String key;

    /**
     * The captured JSON payload.
     */
    JsonNode value;

    long ttlSeconds;

    /**
     * Monotonic insertion number, lower is older.
     */
    long sequence;
}
