package com.patent.linkage.cache;

import com.patent.linkage.metrics.MetricsService;
import com.patent.linkage.metrics.NoOpMetricsService;
import com.patent.linkage.rules.NameNormalizer;

/**
 * {@link NameNormalizer} decorator that memoizes keys in a {@link NormalizationCache}.
 */
public class CachingNameNormalizer implements NameNormalizer {

    private final NameNormalizer delegate;
    private final NormalizationCache cache;
    private final MetricsService metrics;

    public CachingNameNormalizer(NameNormalizer delegate, NormalizationCache cache) {
        this(delegate, cache, new NoOpMetricsService());
    }

    public CachingNameNormalizer(NameNormalizer delegate, NormalizationCache cache, MetricsService metrics) {
        this.delegate = delegate;
        this.cache = cache;
        this.metrics = metrics;
    }

    /**
     * Builds a caching normalizer for the given configuration, falling back to
     * a no-op cache when caching is disabled.
     */
    public static CachingNameNormalizer create(NameNormalizer delegate, CacheConfig config, MetricsService metrics) {
        NormalizationCache cache = config.enabled()
                ? new CaffeineNormalizationCache(config)
                : new NoOpNormalizationCache();
        return new CachingNameNormalizer(delegate, cache, metrics);
    }

    @Override
    public String normalize(String rawName) {
        if (rawName == null) {
            return EMPTY_KEY;
        }
        var cached = cache.get(rawName);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return cached.get();
        }
        metrics.recordCacheMiss();
        String key = delegate.normalize(rawName);
        cache.put(rawName, key);
        return key;
    }

    public CacheStats getStats() {
        return cache.getStats();
    }
}
