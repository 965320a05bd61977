package com.patent.linkage.dictionary;

import java.util.Objects;

/**
 * One ledger entry: "this alias belongs to this entity", as asserted by a batch.
 *
 * @param sequence   position in the ledger, starting at 0
 * @param batchId    batch that made the assertion
 * @param rawAlias   source name as it appeared in the matched data
 * @param aliasKey   canonical key of the source name
 * @param entityKey  canonical key of the target entity; identifies the entity
 * @param entityName target entity name as matched, trimmed; display only
 */
public record AliasAssertion(
        long sequence,
        String batchId,
        String rawAlias,
        String aliasKey,
        String entityKey,
        String entityName
) {
    public AliasAssertion {
        Objects.requireNonNull(batchId, "batchId is required");
        Objects.requireNonNull(rawAlias, "rawAlias is required");
        Objects.requireNonNull(aliasKey, "aliasKey is required");
        Objects.requireNonNull(entityKey, "entityKey is required");
        Objects.requireNonNull(entityName, "entityName is required");
        if (aliasKey.isEmpty()) {
            throw new IllegalArgumentException("aliasKey must not be empty");
        }
        if (entityKey.isEmpty()) {
            throw new IllegalArgumentException("entityKey must not be empty");
        }
        if (entityName.isEmpty()) {
            throw new IllegalArgumentException("entityName must not be empty");
        }
    }

    AliasAssertion withSequence(long newSequence) {
        return new AliasAssertion(newSequence, batchId, rawAlias, aliasKey, entityKey, entityName);
    }

    /**
     * True if both assert the same alias for the same entity, ignoring ledger position.
     */
    boolean sameContent(AliasAssertion other) {
        return batchId.equals(other.batchId)
                && rawAlias.equals(other.rawAlias)
                && aliasKey.equals(other.aliasKey)
                && entityKey.equals(other.entityKey)
                && entityName.equals(other.entityName);
    }
}
