package com.patent.linkage.metrics;

import com.patent.linkage.core.model.MatchDecision;
import com.patent.linkage.core.model.MatchTier;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCandidate(MatchTier tier, MatchDecision decision) {
    }

    @Override
    public void recordFuzzyScore(double score) {
    }

    @Override
    public void recordFuzzyScoringDuration(Duration duration) {
    }

    @Override
    public void incrementChunkRetry() {
    }

    @Override
    public void incrementConflict() {
    }

    @Override
    public void incrementFactResolved() {
    }

    @Override
    public void incrementFactUnmatched() {
    }

    @Override
    public void incrementIdentifierFilled() {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
