package com.patent.linkage.bulk;

import com.patent.linkage.aggregate.UnmatchedRecord;
import com.patent.linkage.core.model.AggregateRow;
import com.patent.linkage.core.model.IdentifierSet;
import com.patent.linkage.reference.IdentifierAssignment;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Aggregation output as tables.
 */
public final class AggregateTables {

    public static final List<String> LONG_COLUMNS = List.of(
            "entity_id", "acquiror_name", "year", "patent_count", "distinct_inventors", "inventor_sum");

    public static final List<String> UNMATCHED_COLUMNS = List.of(
            "assignee", "alias_key", "reason", "record_count", "years");

    private record Key(String rawName, String aliasKey, UnmatchedRecord.Reason reason) {
    }

    private AggregateTables() {
    }

    /**
     * One line per (entity, year), in row order.
     */
    public static Table toLongTable(List<AggregateRow> rows) {
        Table.Builder builder = Table.builder(LONG_COLUMNS);
        for (AggregateRow row : rows) {
            builder.addRow(row.entityId(), row.displayName(), row.year(), row.patentCount(),
                    row.distinctInventorCount(), row.inventorSum());
        }
        return builder.build();
    }

    public static Table toWideTable(List<AggregateRow> rows) {
        return toWideTable(rows, List.of());
    }

    /**
     * One line per entity, sorted by entity id.
     *
     * <p>Columns: {@code acquiror_name}, {@code entity_id}, the reference
     * identifiers, then {@code patent_<year>} and {@code patent_inventor_<year>}
     * for every year present (zero where the entity has no patents that year),
     * then the aliases as {@code patent_name}, {@code patent_name_1}, ...</p>
     */
    public static Table toWideTable(List<AggregateRow> rows, List<IdentifierAssignment> assignments) {
        SortedSet<Integer> years = new TreeSet<>();
        Map<String, List<AggregateRow>> byEntity = new TreeMap<>();
        int maxAliases = 0;
        for (AggregateRow row : rows) {
            years.add(row.year());
            byEntity.computeIfAbsent(row.entityId(), k -> new ArrayList<>()).add(row);
            maxAliases = Math.max(maxAliases, row.aliases().size());
        }
        Map<String, IdentifierSet> identifiers = new LinkedHashMap<>();
        for (IdentifierAssignment assignment : assignments) {
            identifiers.put(assignment.entityId(), assignment.identifiers());
        }

        List<String> columns = new ArrayList<>(List.of("acquiror_name", "entity_id",
                ReferenceTables.GVKEY, ReferenceTables.CUSIP, ReferenceTables.CIK, "reference_name"));
        years.forEach(y -> columns.add("patent_" + y));
        years.forEach(y -> columns.add("patent_inventor_" + y));
        for (int i = 0; i < maxAliases; i++) {
            columns.add(i == 0 ? "patent_name" : "patent_name_" + i);
        }

        Table.Builder builder = Table.builder(columns);
        byEntity.forEach((entityId, entityRows) -> {
            Map<String, String> line = new LinkedHashMap<>();
            AggregateRow first = entityRows.get(0);
            line.put("acquiror_name", first.displayName());
            line.put("entity_id", entityId);
            IdentifierSet ids = identifiers.get(entityId);
            if (ids != null) {
                line.put(ReferenceTables.GVKEY, ids.gvkey());
                line.put(ReferenceTables.CUSIP, ids.cusip());
                line.put(ReferenceTables.CIK, ids.cik());
                line.put("reference_name", ids.referenceName());
            }
            for (Integer year : years) {
                line.put("patent_" + year, "0");
                line.put("patent_inventor_" + year, "0");
            }
            for (AggregateRow row : entityRows) {
                line.put("patent_" + row.year(), Long.toString(row.patentCount()));
                line.put("patent_inventor_" + row.year(), Long.toString(row.inventorSum()));
            }
            List<String> aliases = first.aliases();
            for (int i = 0; i < aliases.size(); i++) {
                line.put(i == 0 ? "patent_name" : "patent_name_" + i, aliases.get(i));
            }
            builder.addRow(line);
        });
        return builder.build();
    }

    /**
     * Unresolved records grouped by raw name and reason, most frequent first.
     */
    public static Table unmatchedTable(List<UnmatchedRecord> unmatched) {
        Map<Key, SortedSet<Integer>> years = new LinkedHashMap<>();
        Map<Key, Long> counts = new LinkedHashMap<>();
        for (UnmatchedRecord record : unmatched) {
            Key key = new Key(record.fact().rawName(), record.aliasKey(), record.reason());
            counts.merge(key, 1L, Long::sum);
            years.computeIfAbsent(key, k -> new TreeSet<>()).add(record.fact().year());
        }

        List<Key> keys = new ArrayList<>(counts.keySet());
        keys.sort(Comparator.comparing((Key k) -> counts.get(k)).reversed()
                .thenComparing(Key::rawName)
                .thenComparing(Key::reason));

        Table.Builder builder = Table.builder(UNMATCHED_COLUMNS);
        for (Key key : keys) {
            List<String> yearList = years.get(key).stream().map(String::valueOf).toList();
            builder.addRow(key.rawName(), key.aliasKey(), key.reason().name(), counts.get(key),
                    String.join(";", yearList));
        }
        return builder.build();
    }
}
