package com.patent.linkage.match;

import com.patent.linkage.core.model.MatchCandidate;
import com.patent.linkage.core.model.MatchDecision;
import com.patent.linkage.core.model.MatchTier;
import com.patent.linkage.similarity.SimilarityAlgorithm;
import com.patent.linkage.similarity.TokenSetSimilarity;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the best-scoring target for a source key.
 *
 * <p>Ties on score go to the target sharing the most token characters with the
 * source, then to the lexicographically smallest raw target name. Scores are
 * rounded to four decimals so cutoffs compare the same way on every platform.</p>
 *
 * <p>Stateless; safe to call from several workers at once.</p>
 */
public class FuzzyScorer {

    private final SimilarityAlgorithm algorithm;
    private final double fuzzyThreshold;
    private final double rejectFloor;

    public FuzzyScorer(MatchOptions options) {
        this(options.getSimilarityAlgorithm(), options.getFuzzyThreshold(), options.getRejectFloor());
    }

    public FuzzyScorer(SimilarityAlgorithm algorithm, double fuzzyThreshold, double rejectFloor) {
        this.algorithm = algorithm;
        this.fuzzyThreshold = fuzzyThreshold;
        this.rejectFloor = rejectFloor;
    }

    /**
     * Best candidate for the source, or empty when the best score is below the reject floor.
     */
    public Optional<MatchCandidate> bestMatch(SourceEntry source, TargetIndex targets) {
        String bestKey = null;
        String bestName = null;
        double bestScore = -1;
        int bestOverlap = -1;

        for (String targetKey : targets.keys()) {
            double score = score(source.key(), targetKey);
            if (score < bestScore) {
                continue;
            }
            String targetName = targets.representative(targetKey);
            if (score > bestScore) {
                bestKey = targetKey;
                bestName = targetName;
                bestScore = score;
                bestOverlap = -1;
                continue;
            }
            if (bestOverlap < 0) {
                bestOverlap = TokenSetSimilarity.commonTokenLength(source.key(), bestKey);
            }
            int overlap = TokenSetSimilarity.commonTokenLength(source.key(), targetKey);
            if (overlap > bestOverlap || (overlap == bestOverlap && targetName.compareTo(bestName) < 0)) {
                bestKey = targetKey;
                bestName = targetName;
                bestOverlap = overlap;
            }
        }

        if (bestKey == null) {
            return Optional.empty();
        }
        MatchDecision decision = MatchDecision.forScore(bestScore, fuzzyThreshold, rejectFloor);
        if (decision == MatchDecision.REJECTED) {
            return Optional.empty();
        }
        return Optional.of(new MatchCandidate(source.name(), source.key(), bestName, bestKey,
                MatchTier.FUZZY, bestScore, decision, algorithm.getName()));
    }

    /**
     * Scores a contiguous run of sources in order.
     */
    public List<MatchCandidate> scoreAll(List<SourceEntry> sources, TargetIndex targets) {
        List<MatchCandidate> result = new ArrayList<>();
        for (SourceEntry source : sources) {
            bestMatch(source, targets).ifPresent(result::add);
        }
        return result;
    }

    double score(String sourceKey, String targetKey) {
        double raw = algorithm.compute(sourceKey, targetKey) * 100.0;
        double rounded = Math.round(raw * 10_000.0) / 10_000.0;
        return Math.max(0.0, Math.min(MatchCandidate.MAX_SCORE, rounded));
    }
}
