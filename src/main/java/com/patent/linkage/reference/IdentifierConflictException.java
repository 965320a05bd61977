package com.patent.linkage.reference;

import com.patent.linkage.core.model.IdentifierSet;

/**
 * Thrown when an entity would receive two different reference identifier sets.
 * Aborts the merge; the operator resolves it by fixing one of the review batches.
 */
public class IdentifierConflictException extends RuntimeException {

    private final String entityId;
    private final IdentifierSet existing;
    private final String existingBatchId;
    private final IdentifierSet incoming;
    private final String incomingBatchId;

    public IdentifierConflictException(String entityId,
                                       IdentifierSet existing, String existingBatchId,
                                       IdentifierSet incoming, String incomingBatchId) {
        super("Conflicting identifiers for entity " + entityId + ": " +
                existing + " from batch " + existingBatchId + " vs " +
                incoming + " from batch " + incomingBatchId);
        this.entityId = entityId;
        this.existing = existing;
        this.existingBatchId = existingBatchId;
        this.incoming = incoming;
        this.incomingBatchId = incomingBatchId;
    }

    public String getEntityId() {
        return entityId;
    }

    public IdentifierSet getExisting() {
        return existing;
    }

    public String getExistingBatchId() {
        return existingBatchId;
    }

    public IdentifierSet getIncoming() {
        return incoming;
    }

    public String getIncomingBatchId() {
        return incomingBatchId;
    }
}
