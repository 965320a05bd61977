package com.patent.linkage.dictionary;

/**
 * What one batch contributed when the ledger was replayed.
 *
 * @param batchId    batch identifier
 * @param assertions assertions the batch holds in the ledger
 * @param newAliases assertions that registered a previously unseen alias
 * @param duplicates assertions that repeated an existing mapping
 * @param conflicts  assertions that moved an alias to a different entity
 */
public record BatchContribution(
        String batchId,
        long assertions,
        long newAliases,
        long duplicates,
        long conflicts
) {
}
