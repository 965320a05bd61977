package com.patent.linkage.cache;

/**
 * Configuration for the normalization cache.
 *
 * @param maxSize maximum number of raw names kept
 * @param enabled whether caching is enabled
 */
public record CacheConfig(int maxSize, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
    }

    /**
     * Default cache configuration: 100,000 entries, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(100_000, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, false);
    }
}
