package com.reprise.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class CacheMetrics {

    private final MeterRegistry registry;

    public CacheMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Lookups ----
    public void cacheHit(String backend) {
        Counter.builder("reprise_cache_hits_total")
                .tag("backend", backend)
                .register(registry)
                .increment();
    }

    public void cacheMiss(String backend) {
        Counter.builder("reprise_cache_misses_total")
                .tag("backend", backend)
                .register(registry)
                .increment();
    }

    // ---- Capacity ----
    public void evicted(String backend, int count) {
        Counter.builder("reprise_cache_evictions_total")
                .tag("backend", backend)
                .register(registry)
                .increment(count);
    }

    public void droppedWrite(String backend) {
        Counter.builder("reprise_cache_dropped_writes_total")
                .tag("backend", backend)
                .register(registry)
                .increment();
    }

    // ---- Backend failures ----
    public void storeError(String backend, String operation) {
        Counter.builder("reprise_cache_store_errors_total")
                .tag("backend", backend)
                .tag("operation", operation) // get | set | delete | keys | clear
                .register(registry)
                .increment();
    }
}
