package com.patent.linkage.rules;

/**
 * Maps a raw company name to its canonical comparison key.
 * Implementations must be pure and total: every input, including null,
 * yields a key, and blank input yields {@link #EMPTY_KEY}.
 */
@FunctionalInterface
public interface NameNormalizer {

    /**
     * Reserved key for names with no comparable content.
     */
    String EMPTY_KEY = "";

    String normalize(String rawName);
}
