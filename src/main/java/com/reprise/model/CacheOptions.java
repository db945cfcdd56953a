package com.reprise.model;

import lombok.Builder;
import lombok.Value;

/**
 * Process-wide options for the in-process store, set once at startup.
 */
@Value
@Builder
public class CacheOptions {

    /**
     * TTL applied when a route does not specify its own duration.
     */
    long defaultTtlSeconds;

    /**
     * Interval between expired-entry sweeps. Zero or negative disables the sweep.
     */
    long checkPeriodSeconds;

    /**
     * Capacity ceiling. Zero or negative means unbounded.
     */
    int maxKeys;
}
