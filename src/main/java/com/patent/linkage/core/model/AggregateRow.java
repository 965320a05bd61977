package com.patent.linkage.core.model;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Patent activity of one canonical entity in one year.
 *
 * @param entityId              canonical entity
 * @param displayName           canonical display name of the entity
 * @param year                  application year
 * @param patentCount           number of resolved patent records
 * @param distinctInventorCount distinct named inventors across those records
 * @param inventorSum           sum of per-patent inventor counts
 * @param aliases               raw names observed for the entity across all years
 */
public record AggregateRow(
        String entityId,
        String displayName,
        int year,
        long patentCount,
        long distinctInventorCount,
        long inventorSum,
        List<String> aliases
) {
    public static final Comparator<AggregateRow> ENTITY_YEAR_ORDER =
            Comparator.comparing(AggregateRow::entityId).thenComparingInt(AggregateRow::year);

    public AggregateRow {
        Objects.requireNonNull(entityId, "entityId is required");
        aliases = aliases != null ? List.copyOf(aliases) : List.of();
    }
}
