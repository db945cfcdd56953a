package com.reprise.model;

import com.reprise.web.CacheableRequest;

/**
 * Route-supplied cache key derivation that replaces the built-in composition entirely.
 */
@FunctionalInterface
public interface CustomKeyGenerator {

    String generate(CacheableRequest request);
}
