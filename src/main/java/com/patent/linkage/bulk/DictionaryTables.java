package com.patent.linkage.bulk;

import com.patent.linkage.dictionary.AliasAssertion;
import com.patent.linkage.dictionary.BatchContribution;
import com.patent.linkage.dictionary.BuildStatistics;
import com.patent.linkage.dictionary.CanonicalDictionary;
import com.patent.linkage.dictionary.CanonicalEntity;
import com.patent.linkage.dictionary.ConflictRecord;

import java.util.Comparator;
import java.util.List;

/**
 * Dictionary views and build reports as tables.
 */
public final class DictionaryTables {

    public static final List<String> VIEW_COLUMNS = List.of(
            "acquiror_name", "entity_id", "alias_key", "raw_alias", "batch_id");

    public static final List<String> STATISTICS_COLUMNS = List.of(
            "batch_id", "status", "assertions", "new_aliases", "duplicates", "conflicts");

    public static final List<String> CONFLICT_COLUMNS = List.of(
            "alias_key", "raw_alias", "previous_entity_id", "previous_entity_name", "previous_batch_id",
            "new_entity_id", "new_entity_name", "new_batch_id", "resolution");

    public static final List<String> TOP_ENTITY_COLUMNS = List.of(
            "rank", "entity_id", "acquiror_name", "alias_count");

    private DictionaryTables() {
    }

    /**
     * Every raw alias with its entity, sorted by entity name, then entity id,
     * alias key and raw alias.
     */
    public static Table viewTable(CanonicalDictionary dictionary) {
        List<CanonicalEntity> entities = dictionary.entities().stream()
                .sorted(Comparator.comparing(CanonicalEntity::displayName)
                        .thenComparing(CanonicalEntity::entityId))
                .toList();

        Table.Builder builder = Table.builder(VIEW_COLUMNS);
        for (CanonicalEntity entity : entities) {
            for (String key : entity.aliasKeys()) {
                String batchId = dictionary.provenance(key).map(AliasAssertion::batchId).orElse("");
                for (String raw : dictionary.rawAliases(key)) {
                    builder.addRow(entity.displayName(), entity.entityId(), key, raw, batchId);
                }
            }
        }
        return builder.build();
    }

    public static Table statisticsTable(BuildStatistics statistics) {
        Table.Builder builder = Table.builder(STATISTICS_COLUMNS);
        for (BatchContribution c : statistics.contributions()) {
            builder.addRow(c.batchId(), status(statistics, c.batchId()), c.assertions(), c.newAliases(),
                    c.duplicates(), c.conflicts());
        }
        return builder.build();
    }

    public static Table conflictTable(List<ConflictRecord> conflicts) {
        Table.Builder builder = Table.builder(CONFLICT_COLUMNS);
        for (ConflictRecord c : conflicts) {
            builder.addRow(c.aliasKey(), c.rawAlias(), c.previousEntityId(), c.previousEntityName(),
                    c.previousBatchId(), c.newEntityId(), c.newEntityName(), c.newBatchId(), c.resolution().name());
        }
        return builder.build();
    }

    public static Table topEntitiesTable(CanonicalDictionary dictionary, int limit) {
        Table.Builder builder = Table.builder(TOP_ENTITY_COLUMNS);
        int rank = 1;
        for (CanonicalEntity entity : dictionary.topEntitiesByAliasCount(limit)) {
            builder.addRow(rank++, entity.entityId(), entity.displayName(), entity.aliasCount());
        }
        return builder.build();
    }

    private static String status(BuildStatistics statistics, String batchId) {
        if (statistics.replacedBatches().contains(batchId)) {
            return "replaced";
        }
        if (statistics.appliedBatches().contains(batchId)) {
            return "applied";
        }
        if (statistics.unchangedBatches().contains(batchId)) {
            return "unchanged";
        }
        return "existing";
    }
}
