package com.patent.linkage.reference;

import com.patent.linkage.core.model.IdentifierSet;

import java.util.Objects;

/**
 * Reference identifiers attached to a canonical entity.
 *
 * @param entityId    canonical entity
 * @param entityName  display name of the entity
 * @param identifiers identifiers filled so far
 * @param batchId     review batch that last filled a field
 */
public record IdentifierAssignment(String entityId, String entityName, IdentifierSet identifiers, String batchId) {

    public IdentifierAssignment {
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(identifiers, "identifiers is required");
    }
}
