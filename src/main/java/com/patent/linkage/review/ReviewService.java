package com.patent.linkage.review;

import com.patent.linkage.core.model.MatchCandidate;
import com.patent.linkage.logging.LogContext;
import com.patent.linkage.match.MatchRunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Hands needs-review candidates to a {@link ReviewCollaborator} and turns a
 * matcher run into an {@link AcceptedMatchSet}.
 */
public class ReviewService {
    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    /**
     * Runs the review pass and combines its survivors with the auto-accepted candidates.
     *
     * @param batchId  identifier of the resulting batch
     * @param result   matcher output
     * @param reviewer external reviewer; not called when nothing needs review
     * @return the accepted set in canonical order
     * @throws ReviewContractException if the reviewer breaks the subset contract
     */
    public AcceptedMatchSet accept(String batchId, MatchRunResult result, ReviewCollaborator reviewer) {
        try (LogContext ctx = LogContext.forBatch(batchId)) {
            List<MatchCandidate> offered = result.needsReview();
            List<MatchCandidate> confirmed = offered.isEmpty()
                    ? List.of()
                    : verifySubset(offered, reviewer.review(offered));

            List<MatchCandidate> accepted = new ArrayList<>(result.autoAccepted());
            accepted.addAll(confirmed);
            accepted.sort(MatchCandidate.CANONICAL_ORDER);

            log.info("review.completed batchId={} autoAccepted={} offered={} confirmed={} rejected={}",
                    batchId, accepted.size() - confirmed.size(), offered.size(), confirmed.size(),
                    offered.size() - confirmed.size());
            return new AcceptedMatchSet(batchId, accepted);
        }
    }

    /**
     * Checks that {@code returned} is an order-preserving subsequence of {@code offered}.
     */
    static List<MatchCandidate> verifySubset(List<MatchCandidate> offered, List<MatchCandidate> returned) {
        if (returned == null) {
            throw new ReviewContractException("Reviewer returned no result");
        }
        int cursor = 0;
        for (MatchCandidate row : returned) {
            while (cursor < offered.size() && !offered.get(cursor).equals(row)) {
                cursor++;
            }
            if (cursor == offered.size()) {
                throw new ReviewContractException("Reviewer returned a row that was not offered or is out of order: "
                        + row.sourceName() + " -> " + row.targetName());
            }
            cursor++;
        }
        return List.copyOf(returned);
    }
}
