package com.patent.linkage.match;

/**
 * A distinct source name paired with its canonical key.
 */
public record SourceEntry(String name, String key) {
}
