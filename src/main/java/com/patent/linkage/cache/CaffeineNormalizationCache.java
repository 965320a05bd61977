package com.patent.linkage.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Caffeine-backed normalization cache, bounded by entry count.
 * Keys are immutable functions of the raw name, so entries never expire.
 */
public class CaffeineNormalizationCache implements NormalizationCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineNormalizationCache.class);

    private final Cache<String, String> cache;

    public CaffeineNormalizationCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats()
                .build();
        log.info("CaffeineNormalizationCache initialized: maxSize={}", config.maxSize());
    }

    @Override
    public Optional<String> get(String rawName) {
        return Optional.ofNullable(cache.getIfPresent(rawName));
    }

    @Override
    public void put(String rawName, String canonicalKey) {
        cache.put(rawName, canonicalKey);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all normalization cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
