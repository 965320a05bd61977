package com.patent.linkage.match;

import com.patent.linkage.core.model.MatchCandidate;
import com.patent.linkage.core.model.MatchTier;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of a matcher run: the ordered candidates and the run counters.
 *
 * @param candidates every surviving candidate; one per matched distinct source
 * @param statistics counters for the run
 */
public record MatchRunResult(List<MatchCandidate> candidates, MatchStatistics statistics) {

    public MatchRunResult {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        statistics = statistics != null ? statistics : MatchStatistics.empty();
    }

    /**
     * Candidates that need no review.
     */
    public List<MatchCandidate> autoAccepted() {
        return candidates.stream().filter(MatchCandidate::isAutoAccepted).toList();
    }

    /**
     * Fuzzy candidates to hand to the review collaborator.
     */
    public List<MatchCandidate> needsReview() {
        return candidates.stream().filter(MatchCandidate::requiresReview).toList();
    }

    public List<MatchCandidate> byTier(MatchTier tier) {
        return candidates.stream().filter(c -> c.tier() == tier).toList();
    }

    /**
     * Concatenates results in the given order. Used when sources are matched in strata.
     */
    public static MatchRunResult concat(List<MatchRunResult> results) {
        List<MatchCandidate> all = new ArrayList<>();
        MatchStatistics stats = MatchStatistics.empty();
        for (MatchRunResult result : results) {
            all.addAll(result.candidates());
            stats = stats.plus(result.statistics());
        }
        return new MatchRunResult(all, stats);
    }
}
