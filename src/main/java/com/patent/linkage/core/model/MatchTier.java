package com.patent.linkage.core.model;

/**
 * Matching strictness level. Tiers are tried in declaration order and
 * candidates are reported grouped by tier in the same order.
 */
public enum MatchTier {
    /**
     * Canonical keys are equal.
     */
    EXACT,

    /**
     * A deterministic transformation (compact spelling, acronym, containment)
     * links the keys unambiguously.
     */
    STRICT_RULE,

    /**
     * Similarity-scored match.
     */
    FUZZY
}
