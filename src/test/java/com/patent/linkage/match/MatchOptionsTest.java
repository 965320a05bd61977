package com.patent.linkage.match;

import com.patent.linkage.similarity.IndelSimilarity;
import com.patent.linkage.similarity.TokenSetSimilarity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MatchOptionsTest {

    @Test
    @DisplayName("Defaults use threshold 90, floor 80 and token-set scoring")
    void defaults() {
        MatchOptions options = MatchOptions.defaults();

        assertEquals(90, options.getFuzzyThreshold());
        assertEquals(80, options.getRejectFloor());
        assertTrue(options.isFuzzyEnabled());
        assertTrue(options.isStrictRulesEnabled());
        assertInstanceOf(TokenSetSimilarity.class, options.getSimilarityAlgorithm());
        assertEquals(MatchOptions.DEFAULT_MIN_CONTAINMENT_LENGTH, options.getMinContainmentLength());
        assertTrue(options.getEffectiveWorkers() >= 1);
        assertTrue(options.getEffectiveWorkers() <= MatchOptions.DEFAULT_MAX_WORKERS);
    }

    @Test
    @DisplayName("Effective workers are capped by maxWorkers")
    void workerCap() {
        MatchOptions options = MatchOptions.builder().workerCount(16).maxWorkers(3).build();

        assertEquals(16, options.getWorkerCount());
        assertEquals(3, options.getEffectiveWorkers());
    }

    @Test
    @DisplayName("Should validate cutoffs and counts")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> MatchOptions.builder().fuzzyThreshold(101));
        assertThrows(IllegalArgumentException.class, () -> MatchOptions.builder().rejectFloor(-1));
        assertThrows(IllegalArgumentException.class,
                () -> MatchOptions.builder().fuzzyThreshold(70).rejectFloor(75).build());
        assertThrows(IllegalArgumentException.class, () -> MatchOptions.builder().workerCount(0));
        assertThrows(IllegalArgumentException.class, () -> MatchOptions.builder().maxWorkers(0));
        assertThrows(IllegalArgumentException.class, () -> MatchOptions.builder().minParallelSources(-1));
        assertThrows(IllegalArgumentException.class, () -> MatchOptions.builder().similarityAlgorithm(null));
    }

    @Test
    @DisplayName("Equal threshold and floor leave no review band")
    void equalCutoffs() {
        MatchOptions options = MatchOptions.builder().fuzzyThreshold(85).rejectFloor(85).build();
        assertEquals(options.getFuzzyThreshold(), options.getRejectFloor());
    }

    @Test
    @DisplayName("toBuilder copies every value")
    void toBuilder() {
        MatchOptions original = MatchOptions.builder()
                .fuzzyThreshold(95)
                .rejectFloor(85)
                .strictRulesEnabled(false)
                .workerCount(2)
                .maxWorkers(2)
                .minParallelSources(10)
                .minContainmentLength(12)
                .similarityAlgorithm(new IndelSimilarity())
                .build();

        MatchOptions copy = original.toBuilder().build();

        assertEquals(95, copy.getFuzzyThreshold());
        assertEquals(85, copy.getRejectFloor());
        assertFalse(copy.isStrictRulesEnabled());
        assertEquals(2, copy.getEffectiveWorkers());
        assertEquals(10, copy.getMinParallelSources());
        assertEquals(12, copy.getMinContainmentLength());
        assertEquals("Indel", copy.getSimilarityAlgorithm().getName());
        assertFalse(MatchOptions.exactOnly().isFuzzyEnabled());
    }
}
