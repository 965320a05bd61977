package com.patent.linkage.cache;

import java.util.Optional;

/**
 * Cache of raw name to canonical key. Raw names repeat heavily across patent
 * records, so the aggregator and matcher look keys up here first.
 */
public interface NormalizationCache {

    Optional<String> get(String rawName);

    void put(String rawName, String canonicalKey);

    void invalidateAll();

    CacheStats getStats();
}
