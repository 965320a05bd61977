package com.patent.linkage.reference;

import com.patent.linkage.core.model.IdentifierSet;
import com.patent.linkage.core.model.MatchCandidate;
import com.patent.linkage.dictionary.CanonicalDictionary;
import com.patent.linkage.logging.LogContext;
import com.patent.linkage.metrics.MetricsService;
import com.patent.linkage.metrics.NoOpMetricsService;
import com.patent.linkage.review.AcceptedMatchSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Fills reference identifiers into canonical entities from reviewed reference matches.
 *
 * <p>An entity without identifiers takes the incoming set. An entity that already
 * holds identifiers only accepts more from the same reference row, and then only
 * into empty fields. A set from a different reference row, or a populated field
 * that differs, aborts the merge with an {@link IdentifierConflictException}:
 * identifiers are join keys and are never combined or overwritten automatically.</p>
 *
 * <p>Entities are found by the canonical key of the matched entity name.</p>
 */
public class IdentifierMerger {
    private static final Logger log = LoggerFactory.getLogger(IdentifierMerger.class);

    private final MetricsService metrics;

    public IdentifierMerger() {
        this(new NoOpMetricsService());
    }

    public IdentifierMerger(MetricsService metrics) {
        this.metrics = metrics;
    }

    /**
     * Applies the reviewed batches, in order, on top of the existing assignments.
     *
     * @return all assignments, sorted by entity id
     * @throws IdentifierConflictException on the first disagreeing identifier
     */
    public List<IdentifierAssignment> merge(List<IdentifierAssignment> existing,
                                            CanonicalDictionary dictionary,
                                            ReferenceIndex reference,
                                            List<AcceptedMatchSet> batches) {
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forStage(runId, "identifier-merge")) {
            Map<String, IdentifierAssignment> assignments = new TreeMap<>();
            for (IdentifierAssignment assignment : existing) {
                assignments.put(assignment.entityId(), assignment);
            }

            long filled = 0;
            long unchanged = 0;
            long skipped = 0;
            for (AcceptedMatchSet batch : batches) {
                for (MatchCandidate candidate : batch.candidates()) {
                    String entityName = candidate.sourceName().trim();
                    Optional<String> entityId = dictionary.entityIdFor(candidate.sourceKey());
                    Optional<IdentifierSet> incoming = reference.lookup(candidate.targetKey());
                    if (entityId.isEmpty() || incoming.isEmpty()) {
                        skipped++;
                        log.warn("identifier.skipped batchId={} entity='{}' reference='{}' knownEntity={} knownReference={}",
                                batch.batchId(), entityName, candidate.targetName(),
                                entityId.isPresent(), incoming.isPresent());
                        continue;
                    }

                    IdentifierAssignment current = assignments.get(entityId.get());
                    if (current == null || current.identifiers().isEmpty()) {
                        String name = current != null && current.entityName() != null
                                ? current.entityName() : entityName;
                        assignments.put(entityId.get(), new IdentifierAssignment(entityId.get(), name,
                                incoming.get(), batch.batchId()));
                        filled++;
                        metrics.incrementIdentifierFilled();
                        continue;
                    }

                    IdentifierSet merged = fill(current, incoming.get(), batch.batchId());
                    if (merged.sameIdentifiers(current.identifiers())) {
                        unchanged++;
                    } else {
                        assignments.put(entityId.get(), new IdentifierAssignment(entityId.get(),
                                current.entityName(), merged, batch.batchId()));
                        filled++;
                        metrics.incrementIdentifierFilled();
                    }
                }
            }

            log.info("identifier.merge.completed assignments={} filled={} unchanged={} skipped={}",
                    assignments.size(), filled, unchanged, skipped);
            return new ArrayList<>(assignments.values());
        }
    }

    /**
     * Fills the empty fields of the current set from the same reference row.
     * A different row with different identifiers, or a populated field that
     * differs, is a conflict.
     */
    static IdentifierSet fill(IdentifierAssignment current, IdentifierSet incoming, String batchId) {
        IdentifierSet have = current.identifiers();
        if (have.sameIdentifiers(incoming)) {
            return have;
        }
        if (!sameReferenceRow(have, incoming)
                || conflicts(have.gvkey(), incoming.gvkey())
                || conflicts(have.cusip(), incoming.cusip())
                || conflicts(have.cik(), incoming.cik())) {
            log.error("identifier.conflict entityId={} existing={} existingBatch={} incoming={} incomingBatch={}",
                    current.entityId(), have, current.batchId(), incoming, batchId);
            throw new IdentifierConflictException(current.entityId(), have, current.batchId(), incoming, batchId);
        }
        return new IdentifierSet(
                have.gvkey() != null ? have.gvkey() : incoming.gvkey(),
                have.cusip() != null ? have.cusip() : incoming.cusip(),
                have.cik() != null ? have.cik() : incoming.cik(),
                have.referenceName() != null ? have.referenceName() : incoming.referenceName());
    }

    private static boolean sameReferenceRow(IdentifierSet have, IdentifierSet incoming) {
        return have.referenceName() != null && have.referenceName().equals(incoming.referenceName());
    }

    private static boolean conflicts(String have, String incoming) {
        return have != null && incoming != null && !Objects.equals(have, incoming);
    }
}
