package com.patent.linkage.api;

import com.patent.linkage.cache.CacheConfig;
import com.patent.linkage.match.MatchOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Pipeline configuration read from a properties file.
 *
 * <pre>
 * linkage.fuzzy-threshold=90
 * linkage.reject-floor=80
 * linkage.worker-count=3
 * linkage.max-workers=4
 * linkage.min-parallel-sources=100
 * linkage.reference.fuzzy-threshold=90
 * linkage.reference.reject-floor=80
 * linkage.cache.max-size=100000
 * linkage.cache.enabled=true
 * </pre>
 *
 * <p>Missing keys fall back to defaults. A malformed value fails with an
 * {@link IllegalArgumentException} naming the key.</p>
 */
public final class LinkageConfig {
    private static final Logger log = LoggerFactory.getLogger(LinkageConfig.class);

    public static final String DEFAULT_RESOURCE = "linkage.properties";

    private final MatchOptions matchOptions;
    private final MatchOptions referenceOptions;
    private final CacheConfig cacheConfig;

    public LinkageConfig(MatchOptions matchOptions, MatchOptions referenceOptions, CacheConfig cacheConfig) {
        this.matchOptions = matchOptions;
        this.referenceOptions = referenceOptions;
        this.cacheConfig = cacheConfig;
    }

    public static LinkageConfig defaults() {
        return new LinkageConfig(MatchOptions.defaults(), MatchOptions.defaults(), CacheConfig.defaults());
    }

    /**
     * Loads configuration from a classpath resource; defaults when the resource is absent.
     */
    public static LinkageConfig load(String classpathResource) {
        try (InputStream in = LinkageConfig.class.getClassLoader().getResourceAsStream(classpathResource)) {
            if (in == null) {
                log.info("config.missing resource={}, using defaults", classpathResource);
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(in);
            LinkageConfig config = fromProperties(properties);
            log.info("config.loaded resource={} match={} reference={} cache={}",
                    classpathResource, config.matchOptions, config.referenceOptions, config.cacheConfig);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration " + classpathResource, e);
        }
    }

    public static LinkageConfig fromProperties(Properties properties) {
        MatchOptions.Builder match = MatchOptions.builder();
        MatchOptions matchOptions;
        int workerCount = getInt(properties, "linkage.worker-count", MatchOptions.defaultWorkerCount());
        int maxWorkers = getInt(properties, "linkage.max-workers", MatchOptions.DEFAULT_MAX_WORKERS);
        int minParallel = getInt(properties, "linkage.min-parallel-sources", MatchOptions.DEFAULT_MIN_PARALLEL_SOURCES);
        try {
            match.rejectFloor(getDouble(properties, "linkage.reject-floor", MatchOptions.DEFAULT_REJECT_FLOOR))
                    .fuzzyThreshold(getDouble(properties, "linkage.fuzzy-threshold", MatchOptions.DEFAULT_FUZZY_THRESHOLD))
                    .workerCount(workerCount)
                    .maxWorkers(maxWorkers)
                    .minParallelSources(minParallel);
            matchOptions = match.build();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid linkage match configuration: " + e.getMessage(), e);
        }

        MatchOptions referenceOptions;
        try {
            referenceOptions = matchOptions.toBuilder()
                    .rejectFloor(getDouble(properties, "linkage.reference.reject-floor", MatchOptions.DEFAULT_REJECT_FLOOR))
                    .fuzzyThreshold(getDouble(properties, "linkage.reference.fuzzy-threshold",
                            MatchOptions.DEFAULT_FUZZY_THRESHOLD))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid linkage.reference configuration: " + e.getMessage(), e);
        }

        int cacheSize = getInt(properties, "linkage.cache.max-size", CacheConfig.defaults().maxSize());
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("Property linkage.cache.max-size must be positive, got " + cacheSize);
        }
        CacheConfig cacheConfig = new CacheConfig(cacheSize, getBoolean(properties, "linkage.cache.enabled", true));

        return new LinkageConfig(matchOptions, referenceOptions, cacheConfig);
    }

    public MatchOptions getMatchOptions() {
        return matchOptions;
    }

    public MatchOptions getReferenceOptions() {
        return referenceOptions;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    private static int getInt(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static double getDouble(Properties properties, String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " must be a number, got '" + value + "'", e);
        }
    }

    private static boolean getBoolean(Properties properties, String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("true")) {
            return true;
        }
        if (trimmed.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException("Property " + key + " must be true or false, got '" + value + "'");
    }
}
