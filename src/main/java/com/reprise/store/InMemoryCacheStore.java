package com.reprise.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.reprise.metrics.CacheMetrics;
import com.reprise.model.CacheEntry;
import com.reprise.model.CacheOptions;
import com.reprise.model.dto.CacheStatus;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Bounded in-process store backed by Caffeine.
 *
 * Behaviour:
 * 1. Every entry carries its own TTL (variable expiry); reads never return an expired entry
 * 2. A sweep removes expired entries every {@code checkPeriod} seconds
 * 3. When {@code maxKeys} is reached, about 10% of the oldest-inserted keys are evicted
 *    and the write is retried once; a second failure is logged and counted, never thrown
 *
 * Capacity check, eviction and retry share one write lock. Reads are lock-free.
 */
@Slf4j
public class InMemoryCacheStore implements CacheStore {

    public static final String NAME = "memory";

    private static final double EVICTION_RATIO = 0.1;

    private final Cache<String, CacheEntry> cache;
    private final CacheOptions options;
    private final CacheMetrics metrics;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final Scheduler sweepScheduler;
    private final Disposable sweepTask;

    // guarded by writeLock
    private long sequence;

    public InMemoryCacheStore(CacheOptions options, CacheMetrics metrics) {
        this(options, metrics, Ticker.systemTicker(), Schedulers.newSingle("reprise-cache-sweep", true));
    }

    InMemoryCacheStore(CacheOptions options, CacheMetrics metrics, Ticker ticker, Scheduler sweepScheduler) {
        this.options = options;
        this.metrics = metrics;
        this.sweepScheduler = sweepScheduler;
        this.cache = Caffeine.newBuilder()
                .ticker(ticker)
                .executor(Runnable::run)
                .expireAfter(new EntryExpiry())
                .build();

        long period = options.getCheckPeriodSeconds();
        if (period > 0) {
            this.sweepTask = sweepScheduler.schedulePeriodically(this::sweep, period, period, TimeUnit.SECONDS);
        } else {
            this.sweepTask = Disposables.disposed();
        }

        log.info("Initialized in-process cache: defaultTtl={}s, checkPeriod={}s, maxKeys={}",
                options.getDefaultTtlSeconds(), period, options.getMaxKeys() > 0 ? options.getMaxKeys() : "unbounded");
    }

    @Override
    public Mono<JsonNode> get(String key) {
        return Mono.fromCallable(() -> {
            CacheEntry entry = cache.getIfPresent(key);
            // callers get their own tree, the stored one is never handed out
            return entry != null ? entry.getValue().deepCopy() : null;
        });
    }

    @Override
    public Mono<Void> set(String key, JsonNode value, long ttlSeconds) {
        return Mono.fromRunnable(() -> {
            try {
                put(key, value, ttlSeconds);
            } catch (RuntimeException e) {
                log.error("Cache error: key={}", key, e);
                metrics.storeError(NAME, "set");
            }
        });
    }

    @Override
    public Mono<Void> delete(String key) {
        return Mono.fromRunnable(() -> cache.invalidate(key));
    }

    @Override
    public Flux<String> keys() {
        return Flux.defer(() -> Flux.fromIterable(cache.asMap().keySet().stream().collect(Collectors.toList())));
    }

    @Override
    public Mono<Void> clear() {
        return Mono.fromRunnable(() -> {
            cache.invalidateAll();
            log.info("Flushed in-process cache");
        });
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<CacheStatus> status() {
        return Mono.fromSupplier(() -> CacheStatus.builder()
                .backend(NAME)
                .connectionState("CONNECTED")
                .connected(true)
                .degraded(false)
                .keyCount(cache.asMap().keySet().stream().count())
                .build());
    }

    /**
     * Number of entries currently held, including expired ones the sweep has not removed yet.
     */
    public long size() {
        return cache.estimatedSize();
    }

    @Override
    public void close() {
        sweepTask.dispose();
        sweepScheduler.dispose();
    }

    void sweep() {
        long before = cache.estimatedSize();
        cache.cleanUp();
        long removed = before - cache.estimatedSize();
        if (removed > 0) {
            log.debug("Swept {} expired entries", removed);
        }
    }

    private void put(String key, JsonNode value, long ttlSeconds) {
        long ttl = ttlSeconds > 0 ? ttlSeconds : options.getDefaultTtlSeconds();

        writeLock.lock();
        try {
            CacheEntry entry = CacheEntry.builder()
                    .key(key)
                    .value(value.deepCopy())
                    .ttlSeconds(ttl)
                    .sequence(++sequence)
                    .build();

            if (tryPut(entry)) {
                return;
            }

            int evicted = evictOldest();
            log.debug("Cache full (maxKeys={}), evicted {} entries", options.getMaxKeys(), evicted);

            if (!tryPut(entry)) {
                log.error("Failed to cache response after clearing space: key={}", key);
                metrics.droppedWrite(NAME);
            }
        } finally {
            writeLock.unlock();
        }
    }

    private boolean tryPut(CacheEntry entry) {
        if (isFull() && !cache.asMap().containsKey(entry.getKey())) {
            return false;
        }
        cache.put(entry.getKey(), entry);
        return true;
    }

    private boolean isFull() {
        return options.getMaxKeys() > 0 && cache.estimatedSize() >= options.getMaxKeys();
    }

    /**
     * Drop expired entries, then the oldest-inserted ceil(10%) of what is left.
     */
    private int evictOldest() {
        cache.cleanUp();
        long size = cache.estimatedSize();
        if (!isFull()) {
            return 0;
        }

        int target = (int) Math.max(1, Math.ceil(size * EVICTION_RATIO));
        List<String> victims = cache.asMap().values().stream()
                .sorted(Comparator.comparingLong(CacheEntry::getSequence))
                .limit(target)
                .map(CacheEntry::getKey)
                .collect(Collectors.toList());

        cache.invalidateAll(victims);
        metrics.evicted(NAME, victims.size());
        return victims.size();
    }

    private static final class EntryExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return TimeUnit.SECONDS.toNanos(entry.getTtlSeconds());
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return TimeUnit.SECONDS.toNanos(entry.getTtlSeconds());
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
