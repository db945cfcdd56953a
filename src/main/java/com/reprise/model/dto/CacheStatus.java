package com.reprise.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Observability snapshot of the active cache backend.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatus {

    /**
     * Backend name ("memory", "redis", "passthrough").
     */
    private String backend;

    /**
     * Connection state name; in-process stores always report CONNECTED.
     */
    private String connectionState;

    private boolean connected;

    /**
     * True when the cache is not serving hits because of a configuration problem.
     */
    private boolean degraded;

    /**
     * Number of live keys visible to the backend.
     */
    private long keyCount;
}
