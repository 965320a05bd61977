package com.patent.linkage.dictionary;

import com.patent.linkage.core.model.MatchCandidate;
import com.patent.linkage.logging.LogContext;
import com.patent.linkage.metrics.MetricsService;
import com.patent.linkage.metrics.NoOpMetricsService;
import com.patent.linkage.review.AcceptedMatchSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the {@link CanonicalDictionary} from accepted match batches.
 *
 * <p>Each accepted candidate becomes an {@link AliasAssertion}: the source key
 * belongs to the entity identified by the target key. Target names that
 * normalize to the same key are one entity. Batches are applied in
 * the order given and the whole ledger is replayed, so an alias asserted for a
 * different entity by a later batch moves to that entity and a
 * {@link ConflictRecord} keeps the earlier mapping.</p>
 *
 * <p>Building on an existing dictionary extends it. A batch id already in the
 * ledger with identical content is skipped; with different content, its earlier
 * revision is replaced in place. Entity ids come from the existing registry, so
 * rebuilding never renumbers entities.</p>
 *
 * <p>Not thread-safe; a dictionary file has a single writer.</p>
 */
public class DictionaryBuilder {
    private static final Logger log = LoggerFactory.getLogger(DictionaryBuilder.class);

    private final MetricsService metrics;

    public DictionaryBuilder() {
        this(new NoOpMetricsService());
    }

    public DictionaryBuilder(MetricsService metrics) {
        this.metrics = metrics;
    }

    public BuildResult build(List<AcceptedMatchSet> batches) {
        return build(CanonicalDictionary.empty(), batches);
    }

    /**
     * Applies the batches, in order, on top of an existing dictionary.
     */
    public BuildResult build(CanonicalDictionary existing, List<AcceptedMatchSet> batches) {
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forStage(runId, "dictionary")) {
            log.info("dictionary.build.started batches={} existingAliases={} existingEntities={}",
                    batches.size(), existing.aliasCount(), existing.entityCount());

            AliasLedger ledger = existing.ledger();
            List<String> applied = new ArrayList<>();
            List<String> replaced = new ArrayList<>();
            List<String> unchanged = new ArrayList<>();
            long skippedRows = 0;

            for (AcceptedMatchSet batch : batches) {
                try (LogContext batchCtx = LogContext.forBatch(batch.batchId())) {
                    List<AliasAssertion> assertions = new ArrayList<>(batch.size());
                    for (MatchCandidate candidate : batch.candidates()) {
                        String entityName = candidate.targetName().trim();
                        if (candidate.sourceKey().isEmpty() || candidate.targetKey().isEmpty()
                                || entityName.isEmpty()) {
                            skippedRows++;
                            log.debug("dictionary.row.skipped source='{}' target='{}'",
                                    candidate.sourceName(), candidate.targetName());
                            continue;
                        }
                        assertions.add(new AliasAssertion(0, batch.batchId(), candidate.sourceName(),
                                candidate.sourceKey(), candidate.targetKey(), entityName));
                    }

                    if (ledger.containsBatch(batch.batchId())) {
                        if (ledger.hasSameContent(batch.batchId(), assertions)) {
                            unchanged.add(batch.batchId());
                            log.info("dictionary.batch.unchanged batchId={}", batch.batchId());
                        } else {
                            ledger = ledger.replace(batch.batchId(), assertions);
                            replaced.add(batch.batchId());
                            log.info("dictionary.batch.replaced batchId={} assertions={}",
                                    batch.batchId(), assertions.size());
                        }
                    } else {
                        ledger = ledger.append(assertions);
                        applied.add(batch.batchId());
                        log.debug("dictionary.batch.applied batchId={} assertions={}",
                                batch.batchId(), assertions.size());
                    }
                }
            }

            CanonicalDictionary dictionary = CanonicalDictionary.replay(ledger, existing.registry());

            Set<ConflictRecord> known = new HashSet<>(existing.conflicts());
            List<ConflictRecord> newConflicts = dictionary.conflicts().stream()
                    .filter(c -> !known.contains(c))
                    .toList();
            for (ConflictRecord conflict : newConflicts) {
                metrics.incrementConflict();
                log.warn("dictionary.conflict alias='{}' previous={}@{} new={}@{} resolution={}",
                        conflict.aliasKey(), conflict.previousEntityId(), conflict.previousBatchId(),
                        conflict.newEntityId(), conflict.newBatchId(), conflict.resolution());
            }

            BuildStatistics stats = new BuildStatistics(
                    dictionary.aliasCount(), dictionary.entityCount(), dictionary.conflicts().size(),
                    dictionary.contributions(), applied, replaced, unchanged, skippedRows);
            log.info("dictionary.build.completed stats={} newConflicts={}", stats, newConflicts.size());
            return new BuildResult(dictionary, dictionary.conflicts(), newConflicts, stats);
        }
    }
}
