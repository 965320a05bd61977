package com.patent.linkage.aggregate;

import com.patent.linkage.core.model.AggregateRow;
import com.patent.linkage.core.model.FactRecord;
import com.patent.linkage.dictionary.CanonicalDictionary;
import com.patent.linkage.dictionary.CanonicalEntity;
import com.patent.linkage.logging.LogContext;
import com.patent.linkage.metrics.MetricsService;
import com.patent.linkage.metrics.NoOpMetricsService;
import com.patent.linkage.rules.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Resolves patent records to canonical entities and counts them per entity and year.
 *
 * <p>Records whose name does not resolve are reported in
 * {@link AggregationResult#unmatched()} and contribute to no row. The alias list
 * of a row holds every raw name seen for its entity across all years.</p>
 */
public class FactAggregator {
    private static final Logger log = LoggerFactory.getLogger(FactAggregator.class);

    private final NameNormalizer normalizer;
    private final MetricsService metrics;

    public FactAggregator(NameNormalizer normalizer) {
        this(normalizer, new NoOpMetricsService());
    }

    public FactAggregator(NameNormalizer normalizer, MetricsService metrics) {
        this.normalizer = normalizer;
        this.metrics = metrics;
    }

    public AggregationResult aggregate(CanonicalDictionary dictionary, List<FactRecord> facts) {
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forStage(runId, "aggregate")) {
            log.info("aggregate.started facts={} dictionaryAliases={}", facts.size(), dictionary.aliasCount());

            SortedMap<String, SortedMap<Integer, List<FactRecord>>> groups = new TreeMap<>();
            Map<String, SortedSet<String>> aliasesByEntity = new HashMap<>();
            List<UnmatchedRecord> unmatched = new ArrayList<>();
            long resolved = 0;

            for (FactRecord fact : facts) {
                String key = normalizer.normalize(fact.rawName());
                if (key.isEmpty()) {
                    unmatched.add(new UnmatchedRecord(fact, key, UnmatchedRecord.Reason.BLANK_NAME));
                    metrics.incrementFactUnmatched();
                    continue;
                }
                Optional<String> entityId = dictionary.resolve(key);
                if (entityId.isEmpty()) {
                    unmatched.add(new UnmatchedRecord(fact, key, UnmatchedRecord.Reason.NO_DICTIONARY_ENTRY));
                    metrics.incrementFactUnmatched();
                    continue;
                }
                String id = entityId.get();
                groups.computeIfAbsent(id, k -> new TreeMap<>())
                        .computeIfAbsent(fact.year(), k -> new ArrayList<>())
                        .add(fact);
                aliasesByEntity.computeIfAbsent(id, k -> new TreeSet<>()).add(fact.rawName());
                metrics.incrementFactResolved();
                resolved++;
            }

            List<AggregateRow> rows = new ArrayList<>();
            groups.forEach((entityId, byYear) -> {
                String displayName = dictionary.entity(entityId)
                        .map(CanonicalEntity::displayName)
                        .orElse(entityId);
                List<String> aliases = new ArrayList<>(aliasesByEntity.get(entityId));
                byYear.forEach((year, group) -> rows.add(new AggregateRow(
                        entityId,
                        displayName,
                        year,
                        group.size(),
                        InventorCounting.distinctInventors(group).size(),
                        InventorCounting.inventorSum(group),
                        aliases)));
            });

            if (!unmatched.isEmpty()) {
                log.warn("aggregate.unmatched count={} of facts={}", unmatched.size(), facts.size());
            }
            AggregationResult result = new AggregationResult(rows, unmatched, facts.size(), resolved);
            log.info("aggregate.completed rows={} resolved={} unmatched={}",
                    rows.size(), resolved, unmatched.size());
            return result;
        }
    }
}
