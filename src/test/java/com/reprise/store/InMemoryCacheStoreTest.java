package com.reprise.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.reprise.metrics.CacheMetrics;
import com.reprise.model.CacheOptions;
import com.reprise.model.dto.CacheStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InMemoryCacheStore.
 */
class InMemoryCacheStoreTest {

    private final AtomicLong nanos = new AtomicLong();
    private SimpleMeterRegistry registry;
    private VirtualTimeScheduler scheduler;
    private InMemoryCacheStore store;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        scheduler = VirtualTimeScheduler.create();
    }

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.close();
        }
    }

    private InMemoryCacheStore newStore(long defaultTtl, long checkPeriod, int maxKeys) {
        CacheOptions options = CacheOptions.builder()
                .defaultTtlSeconds(defaultTtl)
                .checkPeriodSeconds(checkPeriod)
                .maxKeys(maxKeys)
                .build();
        store = new InMemoryCacheStore(options, new CacheMetrics(registry), nanos::get, scheduler);
        return store;
    }

    private void advance(long seconds) {
        nanos.addAndGet(TimeUnit.SECONDS.toNanos(seconds));
    }

    private static JsonNode payload(int id) {
        return JsonNodeFactory.instance.objectNode().put("id", id);
    }

    private JsonNode read(String key) {
        return store.get(key).block();
    }

    private void write(String key, JsonNode value, long ttl) {
        store.set(key, value, ttl).block();
    }

    @Test
    void testSetThenGet() {
        newStore(60, 0, 10);

        write("k", payload(1), 60);

        StepVerifier.create(store.get("k"))
                .expectNext(payload(1))
                .verifyComplete();
    }

    @Test
    void testMissingKeyIsEmpty() {
        newStore(60, 0, 10);

        StepVerifier.create(store.get("absent"))
                .verifyComplete();
    }

    @Test
    void testStoredValueIsIsolatedFromCaller() {
        newStore(60, 0, 10);
        ObjectNode value = JsonNodeFactory.instance.objectNode().put("name", "a");

        write("k", value, 60);
        value.put("name", "changed");

        assertEquals("a", read("k").get("name").asText());

        ((ObjectNode) read("k")).put("name", "overwritten");

        assertEquals("a", read("k").get("name").asText());
    }

    @Test
    void testEntryExpiresAfterTtl() {
        newStore(60, 0, 10);
        write("k", payload(1), 10);

        advance(9);
        assertNotNull(read("k"));

        advance(2);
        assertNull(read("k"));
    }

    @Test
    void testNonPositiveTtlUsesDefault() {
        newStore(30, 0, 10);
        write("k", payload(1), 0);

        advance(29);
        assertNotNull(read("k"));

        advance(2);
        assertNull(read("k"));
    }

    @Test
    void testOverwriteReplacesValueAndTtl() {
        newStore(60, 0, 10);
        write("k", payload(1), 10);
        write("k", payload(2), 100);

        advance(50);

        assertEquals(payload(2), read("k"));
    }

    @Test
    void testTwoKeyCapacityScenario() {
        newStore(60, 0, 2);

        write("k1", payload(1), 60);
        write("k2", payload(2), 60);
        write("k3", payload(3), 60);

        assertEquals(2, store.size());
        assertNull(read("k1"));
        assertEquals(payload(2), read("k2"));
        assertEquals(payload(3), read("k3"));

        advance(61);

        assertNull(read("k2"));
        assertNull(read("k3"));
    }

    @Test
    void testFullStoreEvictsOldestTenPercent() {
        newStore(60, 0, 20);
        for (int i = 0; i < 20; i++) {
            write("k" + i, payload(i), 60);
        }

        write("k20", payload(20), 60);

        // ceil(20 * 0.1) = 2 oldest keys make room for the new one
        assertEquals(19, store.size());
        assertNull(read("k0"));
        assertNull(read("k1"));
        assertNotNull(read("k2"));
        assertNotNull(read("k20"));
        assertEquals(2.0, registry.get("reprise_cache_evictions_total").counter().count());
    }

    @Test
    void testCapacityNeverExceeded() {
        newStore(60, 0, 10);

        for (int i = 0; i < 11; i++) {
            write("k" + i, payload(i), 60);
        }

        assertTrue(store.size() <= 10);
        assertNotNull(read("k10"));
    }

    @Test
    void testOverwriteWhenFullDoesNotEvict() {
        newStore(60, 0, 2);
        write("k1", payload(1), 60);
        write("k2", payload(2), 60);

        write("k1", payload(10), 60);

        assertEquals(payload(10), read("k1"));
        assertEquals(payload(2), read("k2"));
    }

    @Test
    void testExpiredEntriesMakeRoomBeforeLiveOnes() {
        newStore(60, 0, 2);
        write("short", payload(1), 5);
        write("long", payload(2), 600);

        advance(120);
        write("new", payload(3), 600);

        assertNotNull(read("long"));
        assertNotNull(read("new"));
    }

    @Test
    void testConcurrentWritersRespectCapacity() throws Exception {
        newStore(600, 0, 10);
        int threads = 8;
        int writesPerThread = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> writers = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                String prefix = "t" + t + "-";
                writers.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < writesPerThread; i++) {
                        write(prefix + i, payload(i), 600);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> writer : writers) {
                writer.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        long keys = store.keys().count().block();
        assertTrue(keys <= 10, "keys=" + keys);
        assertEquals(keys, store.size());
        // every write landed and each full-store write evicted exactly ceil(10 * 0.1) = 1 key
        double evictions = registry.get("reprise_cache_evictions_total").counter().count();
        assertEquals(threads * writesPerThread - keys, (long) evictions);
        assertNull(registry.find("reprise_cache_dropped_writes_total").counter());
    }

    @Test
    void testUnboundedWhenMaxKeysIsZero() {
        newStore(60, 0, 0);

        for (int i = 0; i < 2000; i++) {
            write("k" + i, payload(i), 60);
        }

        assertEquals(2000, store.size());
    }

    @Test
    void testSweepRemovesExpiredEntries() {
        newStore(60, 5, 100);
        write("a", payload(1), 10);
        write("b", payload(2), 10);

        advance(120);
        scheduler.advanceTimeBy(Duration.ofSeconds(5));

        assertEquals(0, store.size());
    }

    @Test
    void testDeleteAndKeys() {
        newStore(60, 0, 10);
        write("a", payload(1), 60);
        write("b", payload(2), 60);

        store.delete("a").block();

        List<String> keys = store.keys().collectList().block();
        assertEquals(List.of("b"), keys);
    }

    @Test
    void testClearRemovesEverything() {
        newStore(60, 0, 10);
        write("a", payload(1), 60);
        write("b", payload(2), 60);

        store.clear().block();

        assertEquals(0, store.keys().count().block());
        assertNull(read("a"));
    }

    @Test
    void testStatus() {
        newStore(60, 0, 10);
        write("a", payload(1), 60);

        CacheStatus status = store.status().block();

        assertNotNull(status);
        assertEquals(InMemoryCacheStore.NAME, status.getBackend());
        assertTrue(status.isConnected());
        assertFalse(status.isDegraded());
        assertEquals(1, status.getKeyCount());
    }
}
