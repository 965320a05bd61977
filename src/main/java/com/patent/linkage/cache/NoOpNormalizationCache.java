package com.patent.linkage.cache;

import java.util.Optional;

/**
 * Cache that never stores anything.
 */
public class NoOpNormalizationCache implements NormalizationCache {

    @Override
    public Optional<String> get(String rawName) {
        return Optional.empty();
    }

    @Override
    public void put(String rawName, String canonicalKey) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
