package com.patent.linkage.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A proposed link between a source name and a target (reference) name.
 * Raw names are kept next to their canonical keys for audit.
 *
 * @param sourceName raw source name as it appears in the source dataset
 * @param sourceKey  canonical key of the source name
 * @param targetName raw target name the source was linked to
 * @param targetKey  canonical key of the target name
 * @param tier       tier that produced the candidate
 * @param score      0-100; always 100 for exact and strict-rule candidates
 * @param decision   auto-accepted or needs-review
 * @param rule       name of the rule or scorer that produced the link
 */
public record MatchCandidate(
        String sourceName,
        String sourceKey,
        String targetName,
        String targetKey,
        MatchTier tier,
        double score,
        MatchDecision decision,
        String rule
) {
    public static final double MAX_SCORE = 100.0;

    /**
     * Tier, then descending score, then source name, then target name.
     * Re-running with identical inputs always yields the same sequence.
     */
    public static final Comparator<MatchCandidate> CANONICAL_ORDER =
            Comparator.comparing(MatchCandidate::tier)
                    .thenComparing(Comparator.comparingDouble(MatchCandidate::score).reversed())
                    .thenComparing(MatchCandidate::sourceName)
                    .thenComparing(MatchCandidate::targetName);

    public MatchCandidate {
        Objects.requireNonNull(sourceName, "sourceName is required");
        Objects.requireNonNull(targetName, "targetName is required");
        Objects.requireNonNull(tier, "tier is required");
        Objects.requireNonNull(decision, "decision is required");
        if (score < 0.0 || score > MAX_SCORE) {
            throw new IllegalArgumentException("Score must be between 0 and 100, got " + score);
        }
        sourceKey = sourceKey != null ? sourceKey : "";
        targetKey = targetKey != null ? targetKey : "";
    }

    public static MatchCandidate exact(String sourceName, String targetName, String key) {
        return new MatchCandidate(sourceName, key, targetName, key, MatchTier.EXACT,
                MAX_SCORE, MatchDecision.AUTO_ACCEPTED, "exact");
    }

    public static MatchCandidate strict(String sourceName, String sourceKey, String targetName,
                                        String targetKey, String rule) {
        return new MatchCandidate(sourceName, sourceKey, targetName, targetKey, MatchTier.STRICT_RULE,
                MAX_SCORE, MatchDecision.AUTO_ACCEPTED, rule);
    }

    public boolean isAutoAccepted() {
        return decision == MatchDecision.AUTO_ACCEPTED;
    }

    public boolean requiresReview() {
        return decision == MatchDecision.NEEDS_REVIEW;
    }
}
