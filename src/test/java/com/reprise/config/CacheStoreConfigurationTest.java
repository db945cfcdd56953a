package com.reprise.config;

import com.reprise.metrics.CacheMetrics;
import com.reprise.store.CacheStore;
import com.reprise.store.InMemoryCacheStore;
import com.reprise.store.PassthroughCacheStore;
import io.lettuce.core.RedisClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the one-time cache backend selection.
 */
class CacheStoreConfigurationTest {

    private RepriseProperties properties;
    private ObjectProvider<RedisClient> redisClient;
    private CacheStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        properties = new RepriseProperties();
        redisClient = mock(ObjectProvider.class);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (store != null) {
            store.close();
        }
    }

    private CacheStore select() {
        store = new CacheStoreConfiguration().cacheStore(properties, redisClient,
                JacksonConfiguration.createObjectMapper(), new CacheMetrics(new SimpleMeterRegistry()));
        return store;
    }

    @Test
    void testRedisDisabledUsesInMemoryStore() {
        assertInstanceOf(InMemoryCacheStore.class, select());
        verifyNoInteractions(redisClient);
    }

    @Test
    void testMissingRedisUrlDegradesToPassthrough() {
        properties.getRedis().setEnabled(true);

        CacheStore selected = select();

        assertInstanceOf(PassthroughCacheStore.class, selected);
        assertTrue(selected.status().block().isDegraded());
    }

    @Test
    void testMalformedRedisUrlDegradesToPassthrough() {
        properties.getRedis().setEnabled(true);
        properties.getRedis().setUrl("not a redis url");

        CacheStore selected = select();

        assertInstanceOf(PassthroughCacheStore.class, selected);
        assertEquals("redis url malformed", ((PassthroughCacheStore) selected).getReason());
    }

    @Test
    void testMissingClientDegradesToPassthrough() {
        properties.getRedis().setEnabled(true);
        properties.getRedis().setUrl("redis://localhost:6379");

        assertInstanceOf(PassthroughCacheStore.class, select());
    }

    @Test
    void testDefaults() {
        assertEquals(86400, properties.getCache().getDefaultTtl().toSeconds());
        assertEquals(600, properties.getCache().getCheckPeriod().toSeconds());
        assertEquals(1000, properties.getCache().getMaxKeys());
        assertEquals(50, properties.getRedis().getMaxReconnectAttempts());
        assertEquals("reprise:", properties.getRedis().getKeyPrefix());
    }
}
