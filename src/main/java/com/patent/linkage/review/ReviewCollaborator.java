package com.patent.linkage.review;

import com.patent.linkage.core.model.MatchCandidate;

import java.util.List;

/**
 * External reviewer of borderline fuzzy candidates.
 * Typically a person working through an exported review file.
 */
@FunctionalInterface
public interface ReviewCollaborator {

    /**
     * Reviews the offered candidates.
     *
     * @param offered candidates needing review, in canonical order
     * @return the offered rows the reviewer judged correct, same order, unchanged;
     *         a row left out is rejected
     */
    List<MatchCandidate> review(List<MatchCandidate> offered);

    /**
     * Reviewer that accepts every offered row.
     */
    static ReviewCollaborator acceptAll() {
        return offered -> offered;
    }

    /**
     * Reviewer that rejects every offered row.
     */
    static ReviewCollaborator rejectAll() {
        return offered -> List.of();
    }
}
