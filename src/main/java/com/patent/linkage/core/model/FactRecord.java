package com.patent.linkage.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One patent observation to aggregate.
 *
 * @param rawName               assignee name as recorded on the patent
 * @param year                  application year
 * @param inventorIds           named inventors (identifiers or names), may be empty
 * @param declaredInventorCount inventor count column of the record, null when absent
 */
public record FactRecord(
        String rawName,
        int year,
        List<String> inventorIds,
        Integer declaredInventorCount
) {
    public FactRecord {
        Objects.requireNonNull(rawName, "rawName is required");
        inventorIds = inventorIds != null ? List.copyOf(inventorIds) : List.of();
        if (declaredInventorCount != null && declaredInventorCount < 0) {
            throw new IllegalArgumentException("declaredInventorCount must be >= 0");
        }
    }

    public static FactRecord of(String rawName, int year, String... inventorIds) {
        return new FactRecord(rawName, year, List.of(inventorIds), null);
    }

    /**
     * Inventors on this patent: the larger of the declared count and the
     * number of named inventors.
     */
    public int effectiveInventorCount() {
        int declared = declaredInventorCount != null ? declaredInventorCount : 0;
        return Math.max(declared, inventorIds.size());
    }
}
