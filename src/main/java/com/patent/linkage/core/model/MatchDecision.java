package com.patent.linkage.core.model;

/**
 * Decision state of a match candidate.
 */
public enum MatchDecision {
    /**
     * Exact and strict-rule matches, and fuzzy matches at or above the threshold.
     */
    AUTO_ACCEPTED,

    /**
     * Fuzzy matches between the reject floor and the threshold.
     * Handed to the review collaborator.
     */
    NEEDS_REVIEW,

    /**
     * Below the reject floor. Never surfaced in matcher output.
     */
    REJECTED;

    /**
     * Decision for a fuzzy score given the configured cutoffs.
     */
    public static MatchDecision forScore(double score, double fuzzyThreshold, double rejectFloor) {
        if (score >= fuzzyThreshold) {
            return AUTO_ACCEPTED;
        }
        if (score >= rejectFloor) {
            return NEEDS_REVIEW;
        }
        return REJECTED;
    }
}
