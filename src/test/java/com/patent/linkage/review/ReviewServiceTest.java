package com.patent.linkage.review;

import com.patent.linkage.core.model.MatchCandidate;
import com.patent.linkage.core.model.MatchDecision;
import com.patent.linkage.core.model.MatchTier;
import com.patent.linkage.match.MatchRunResult;
import com.patent.linkage.match.MatchStatistics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReviewService Tests")
class ReviewServiceTest {

    @Mock
    private ReviewCollaborator reviewer;

    private ReviewService service;

    private final MatchCandidate exact = MatchCandidate.exact("ACME WIDGET", "Acme Widget Inc", "acme widget");
    private final MatchCandidate fuzzyAccepted = fuzzy("Acme Widgets", "Acme Widget Inc", 95.6522,
            MatchDecision.AUTO_ACCEPTED);
    private final MatchCandidate reviewA = fuzzy("Acme Tools", "Acme Tooling", 81.8182, MatchDecision.NEEDS_REVIEW);
    private final MatchCandidate reviewB = fuzzy("Apex Tool", "Apex Tooling", 85.0, MatchDecision.NEEDS_REVIEW);

    private static MatchCandidate fuzzy(String source, String target, double score, MatchDecision decision) {
        return new MatchCandidate(source, source.toLowerCase(), target, target.toLowerCase(),
                MatchTier.FUZZY, score, decision, "TokenSet");
    }

    private MatchRunResult result(MatchCandidate... candidates) {
        return new MatchRunResult(List.of(candidates), MatchStatistics.empty());
    }

    @BeforeEach
    void setUp() {
        service = new ReviewService();
    }

    @Nested
    @DisplayName("Accepted set")
    class AcceptedSet {

        @Test
        @DisplayName("Should combine auto-accepted candidates with confirmed review rows")
        void combinesAutoAndConfirmed() {
            when(reviewer.review(List.of(reviewB, reviewA))).thenReturn(List.of(reviewA));

            AcceptedMatchSet accepted = service.accept("batch-1",
                    result(exact, fuzzyAccepted, reviewB, reviewA), reviewer);

            assertEquals("batch-1", accepted.batchId());
            assertEquals(List.of(exact, fuzzyAccepted, reviewA), accepted.candidates());
        }

        @Test
        @DisplayName("Should not call the reviewer when nothing needs review")
        void skipsReviewer() {
            AcceptedMatchSet accepted = service.accept("batch-1", result(exact, fuzzyAccepted), reviewer);

            assertEquals(2, accepted.size());
            verify(reviewer, never()).review(any());
        }

        @Test
        @DisplayName("Accept-all and reject-all reviewers")
        void builtInReviewers() {
            MatchRunResult run = result(exact, reviewB, reviewA);

            assertEquals(3, service.accept("b", run, ReviewCollaborator.acceptAll()).size());
            assertEquals(List.of(exact), service.accept("b", run, ReviewCollaborator.rejectAll()).candidates());
        }
    }

    @Nested
    @DisplayName("Reviewer contract")
    class Contract {

        @Test
        @DisplayName("Should reject rows that were not offered")
        void rowNotOffered() {
            MatchCandidate altered = fuzzy("Acme Tools", "Acme Tooling", 99.0, MatchDecision.AUTO_ACCEPTED);
            when(reviewer.review(any())).thenReturn(List.of(altered));

            assertThrows(ReviewContractException.class,
                    () -> service.accept("batch-1", result(reviewA), reviewer));
        }

        @Test
        @DisplayName("Should reject reordered rows")
        void reordered() {
            assertThrows(ReviewContractException.class,
                    () -> ReviewService.verifySubset(List.of(reviewB, reviewA), List.of(reviewA, reviewB)));
        }

        @Test
        @DisplayName("Should reject a null answer")
        void nullAnswer() {
            assertThrows(ReviewContractException.class,
                    () -> ReviewService.verifySubset(List.of(reviewA), null));
        }

        @Test
        @DisplayName("Should reject a blank batch id")
        void blankBatchId() {
            assertThrows(IllegalArgumentException.class, () -> new AcceptedMatchSet(" ", List.of()));
            assertThrows(NullPointerException.class, () -> new AcceptedMatchSet(null, List.of()));
        }
    }
}
