package com.patent.linkage.aggregate;

import com.patent.linkage.core.model.FactRecord;

import java.util.Objects;

/**
 * A fact record whose name did not resolve to any entity.
 *
 * @param fact     the unresolved record, unchanged
 * @param aliasKey canonical key that was looked up; empty for blank names
 * @param reason   why resolution failed
 */
public record UnmatchedRecord(FactRecord fact, String aliasKey, Reason reason) {

    public enum Reason {
        /** The name normalized to the empty key. */
        BLANK_NAME,
        /** The dictionary has no entry for the key. */
        NO_DICTIONARY_ENTRY
    }

    public UnmatchedRecord {
        Objects.requireNonNull(fact, "fact is required");
        Objects.requireNonNull(reason, "reason is required");
        aliasKey = aliasKey != null ? aliasKey : "";
    }
}
