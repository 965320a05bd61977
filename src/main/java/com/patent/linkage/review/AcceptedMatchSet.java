package com.patent.linkage.review;

import com.patent.linkage.core.model.MatchCandidate;

import java.util.List;
import java.util.Objects;

/**
 * One batch of matches confirmed as ground truth: the auto-accepted candidates
 * of a matcher run plus the review-surviving ones.
 *
 * @param batchId    identifier of the batch; the dictionary builder applies batches in caller order
 * @param candidates confirmed candidates
 */
public record AcceptedMatchSet(String batchId, List<MatchCandidate> candidates) {

    public AcceptedMatchSet {
        Objects.requireNonNull(batchId, "batchId is required");
        if (batchId.isBlank()) {
            throw new IllegalArgumentException("batchId must not be blank");
        }
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    public int size() {
        return candidates.size();
    }
}
