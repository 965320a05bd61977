package com.patent.linkage.dictionary;

import java.util.Objects;

/**
 * Two assertions that put the same alias under different entities.
 * The earlier assignment is kept here so the outcome can be audited and reversed.
 *
 * @param aliasKey           canonical key of the contested alias
 * @param rawAlias           raw alias of the winning assertion
 * @param previousEntityId   entity the alias was mapped to before
 * @param previousEntityName display name of that entity
 * @param previousBatchId    batch that made the earlier assertion
 * @param newEntityId        entity the alias maps to now
 * @param newEntityName      display name of that entity
 * @param newBatchId         batch that made the later assertion
 * @param resolution         policy applied
 */
public record ConflictRecord(
        String aliasKey,
        String rawAlias,
        String previousEntityId,
        String previousEntityName,
        String previousBatchId,
        String newEntityId,
        String newEntityName,
        String newBatchId,
        Resolution resolution
) {
    public enum Resolution {
        MOST_RECENT_WINS
    }

    public ConflictRecord {
        Objects.requireNonNull(aliasKey, "aliasKey is required");
        Objects.requireNonNull(previousEntityId, "previousEntityId is required");
        Objects.requireNonNull(newEntityId, "newEntityId is required");
        Objects.requireNonNull(resolution, "resolution is required");
    }

    @Override
    public String toString() {
        return "ConflictRecord{alias='" + aliasKey + "', " +
                previousEntityId + "@" + previousBatchId + " -> " +
                newEntityId + "@" + newBatchId + ", " + resolution + '}';
    }
}
