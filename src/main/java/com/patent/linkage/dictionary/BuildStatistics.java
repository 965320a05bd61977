package com.patent.linkage.dictionary;

import java.util.List;

/**
 * Summary of a dictionary build.
 *
 * @param totalAliases     alias keys in the resulting dictionary
 * @param totalEntities    entities with at least one alias
 * @param conflictCount    conflicts in the replayed ledger
 * @param contributions    per-batch contribution, in ledger order
 * @param appliedBatches   batches appended by this build
 * @param replacedBatches  batches whose earlier revision was replaced by this build
 * @param unchangedBatches batches skipped because an identical revision was already applied
 * @param skippedRows      candidates dropped for a blank alias key or entity name
 */
public record BuildStatistics(
        long totalAliases,
        long totalEntities,
        long conflictCount,
        List<BatchContribution> contributions,
        List<String> appliedBatches,
        List<String> replacedBatches,
        List<String> unchangedBatches,
        long skippedRows
) {
    public BuildStatistics {
        contributions = List.copyOf(contributions);
        appliedBatches = List.copyOf(appliedBatches);
        replacedBatches = List.copyOf(replacedBatches);
        unchangedBatches = List.copyOf(unchangedBatches);
    }

    @Override
    public String toString() {
        return "BuildStatistics{aliases=" + totalAliases +
                ", entities=" + totalEntities +
                ", conflicts=" + conflictCount +
                ", applied=" + appliedBatches.size() +
                ", replaced=" + replacedBatches.size() +
                ", unchanged=" + unchangedBatches.size() +
                ", skippedRows=" + skippedRows + '}';
    }
}
