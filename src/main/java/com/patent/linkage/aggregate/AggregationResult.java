package com.patent.linkage.aggregate;

import com.patent.linkage.core.model.AggregateRow;

import java.util.List;

/**
 * Output of an aggregation run.
 *
 * @param rows           one row per (entity, year), sorted by entity id then year
 * @param unmatched      facts that did not resolve, in input order
 * @param totalFacts     facts supplied
 * @param resolvedFacts  facts that resolved to an entity
 */
public record AggregationResult(
        List<AggregateRow> rows,
        List<UnmatchedRecord> unmatched,
        long totalFacts,
        long resolvedFacts
) {
    public AggregationResult {
        rows = List.copyOf(rows);
        unmatched = List.copyOf(unmatched);
    }

    public long totalPatentCount() {
        return rows.stream().mapToLong(AggregateRow::patentCount).sum();
    }

    public boolean hasUnmatched() {
        return !unmatched.isEmpty();
    }
}
