package com.reprise.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reprise.config.JacksonConfiguration;
import com.reprise.model.CacheRouteConfig;
import com.reprise.web.TestRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CacheKeyGenerator.
 */
class CacheKeyGeneratorTest {

    private ObjectMapper objectMapper;
    private CacheKeyGenerator keyGenerator;
    private CacheRouteConfig defaults;

    @BeforeEach
    void setUp() {
        objectMapper = JacksonConfiguration.createObjectMapper();
        keyGenerator = new CacheKeyGenerator(objectMapper);
        defaults = CacheRouteConfig.defaults(60);
    }

    @Test
    void testKeyLayout() {
        String key = keyGenerator.generate(TestRequest.get("/items"), defaults);

        assertEquals("GET|/items|{}|{}|{}", key);
    }

    @Test
    void testQueryOrderDoesNotChangeKey() {
        TestRequest first = TestRequest.get("/items").query("b", "2").query("a", "1");
        TestRequest second = TestRequest.get("/items").query("a", "1").query("b", "2");

        String key = keyGenerator.generate(first, defaults);

        assertEquals(key, keyGenerator.generate(second, defaults));
        assertEquals("GET|/items|{\"a\":\"1\",\"b\":\"2\"}|{}|{}", key);
    }

    @Test
    void testRepeatedQueryParameterBecomesArray() {
        TestRequest request = TestRequest.get("/items").query("tag", "x", "y");

        String key = keyGenerator.generate(request, defaults);

        assertEquals("GET|/items|{\"tag\":[\"x\",\"y\"]}|{}|{}", key);
    }

    @Test
    void testValuelessQueryParameters() {
        TestRequest repeated = TestRequest.get("/anime").query("flag", null, "1");
        TestRequest single = TestRequest.get("/anime").query("flag", (String) null);

        assertEquals("GET|/anime|{\"flag\":[\"\",\"1\"]}|{}|{}", keyGenerator.generate(repeated, defaults));
        assertEquals("GET|/anime|{\"flag\":\"\"}|{}|{}", keyGenerator.generate(single, defaults));
    }

    @Test
    void testKeyParamsAllowList() {
        CacheRouteConfig config = CacheRouteConfig.builder()
                .keyParams(List.of("page"))
                .build()
                .mergedOver(defaults);

        String withExtra = keyGenerator.generate(
                TestRequest.get("/items").query("page", "1").query("utm", "mail"), config);
        String without = keyGenerator.generate(TestRequest.get("/items").query("page", "1"), config);

        assertEquals(without, withExtra);
        assertNotEquals(without, keyGenerator.generate(TestRequest.get("/items").query("page", "2"), config));
    }

    @Test
    void testIgnoreParamsDenyList() {
        CacheRouteConfig config = CacheRouteConfig.builder()
                .ignoreParams(List.of("_"))
                .build()
                .mergedOver(defaults);

        String a = keyGenerator.generate(TestRequest.get("/items").query("q", "x").query("_", "123"), config);
        String b = keyGenerator.generate(TestRequest.get("/items").query("q", "x").query("_", "456"), config);

        assertEquals(a, b);
    }

    @Test
    void testDenyListAppliedAfterAllowList() {
        CacheRouteConfig config = CacheRouteConfig.builder()
                .keyParams(List.of("q", "page"))
                .ignoreParams(List.of("page"))
                .build()
                .mergedOver(defaults);

        String key = keyGenerator.generate(TestRequest.get("/s").query("q", "x").query("page", "3"), config);

        assertEquals("GET|/s|{\"q\":\"x\"}|{}|{}", key);
    }

    @Test
    void testVaryByHeaders() {
        CacheRouteConfig config = CacheRouteConfig.builder()
                .varyByHeaders(List.of("accept-language"))
                .build()
                .mergedOver(defaults);

        String en = keyGenerator.generate(TestRequest.get("/items").header("Accept-Language", "en"), config);
        String de = keyGenerator.generate(TestRequest.get("/items").header("Accept-Language", "de"), config);
        String none = keyGenerator.generate(TestRequest.get("/items"), config);

        assertNotEquals(en, de);
        assertEquals("GET|/items|{}|{}|{\"accept-language\":\"en\"}", en);
        assertEquals("GET|/items|{}|{}|{}", none);
    }

    @Test
    void testHeadersIgnoredUnlessConfigured() {
        String a = keyGenerator.generate(TestRequest.get("/items").header("Accept-Language", "en"), defaults);
        String b = keyGenerator.generate(TestRequest.get("/items").header("Accept-Language", "de"), defaults);

        assertEquals(a, b);
    }

    @Test
    void testPostBodyCanonicalized() throws Exception {
        JsonNode body = objectMapper.readTree("{\"b\":1,\"a\":{\"y\":2,\"x\":1}}");
        JsonNode reordered = objectMapper.readTree("{\"a\":{\"x\":1,\"y\":2},\"b\":1}");

        String key = keyGenerator.generate(TestRequest.post("/search", body), defaults);

        assertEquals(key, keyGenerator.generate(TestRequest.post("/search", reordered), defaults));
        assertEquals("POST|/search|{}|{\"a\":{\"x\":1,\"y\":2},\"b\":1}|{}", key);
    }

    @Test
    void testBodyIgnoredForGet() throws Exception {
        JsonNode body = objectMapper.readTree("{\"q\":\"x\"}");

        String key = keyGenerator.generate(TestRequest.get("/items").body(body), defaults);

        assertEquals("GET|/items|{}|{}|{}", key);
    }

    @Test
    void testBodyParamsFiltered() throws Exception {
        CacheRouteConfig config = CacheRouteConfig.builder()
                .ignoreParams(List.of("requestId"))
                .build()
                .mergedOver(defaults);
        JsonNode first = objectMapper.readTree("{\"q\":\"x\",\"requestId\":\"r1\"}");
        JsonNode second = objectMapper.readTree("{\"q\":\"x\",\"requestId\":\"r2\"}");

        assertEquals(
                keyGenerator.generate(TestRequest.post("/search", first), config),
                keyGenerator.generate(TestRequest.post("/search", second), config));
    }

    @Test
    void testMethodAndPathDistinguishKeys() {
        assertNotEquals(
                keyGenerator.generate(TestRequest.get("/a"), defaults),
                keyGenerator.generate(TestRequest.get("/b"), defaults));
        assertNotEquals(
                keyGenerator.generate(TestRequest.of("GET", "/a"), defaults),
                keyGenerator.generate(TestRequest.of("DELETE", "/a"), defaults));
    }

    @Test
    void testCustomKeyGeneratorOverridesEverything() {
        CacheRouteConfig config = CacheRouteConfig.builder()
                .customKeyGenerator(request -> "custom:" + request.getPath())
                .build()
                .mergedOver(defaults);

        String key = keyGenerator.generate(TestRequest.get("/items").query("page", "1"), config);

        assertEquals("custom:/items", key);
    }
}
