package com.patent.linkage.metrics;

import com.patent.linkage.core.model.MatchDecision;
import com.patent.linkage.core.model.MatchTier;

import java.time.Duration;

/**
 * Interface for recording linkage pipeline metrics.
 * The default {@link NoOpMetricsService} does nothing, so the pipeline runs
 * without any metrics backend on the classpath.
 */
public interface MetricsService {

    void recordCandidate(MatchTier tier, MatchDecision decision);

    void recordFuzzyScore(double score);

    void recordFuzzyScoringDuration(Duration duration);

    void incrementChunkRetry();

    void incrementConflict();

    void incrementFactResolved();

    void incrementFactUnmatched();

    void incrementIdentifierFilled();

    void recordCacheHit();

    void recordCacheMiss();
}
