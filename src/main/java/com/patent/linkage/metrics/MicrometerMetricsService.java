package com.patent.linkage.metrics;

import com.patent.linkage.core.model.MatchDecision;
import com.patent.linkage.core.model.MatchTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code linkage.match.candidates} - Counter (tags: tier, decision)</li>
 *   <li>{@code linkage.match.fuzzy.score} - DistributionSummary</li>
 *   <li>{@code linkage.match.fuzzy.duration} - Timer</li>
 *   <li>{@code linkage.match.chunk.retry} - Counter</li>
 *   <li>{@code linkage.dictionary.conflicts} - Counter</li>
 *   <li>{@code linkage.aggregate.facts} - Counter (tag: outcome)</li>
 *   <li>{@code linkage.reference.identifiers.filled} - Counter</li>
 *   <li>{@code linkage.cache.hit} / {@code linkage.cache.miss} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> candidateCounters = new ConcurrentHashMap<>();
    private final DistributionSummary fuzzyScoreSummary;
    private final Timer fuzzyScoringTimer;
    private final Counter chunkRetryCounter;
    private final Counter conflictCounter;
    private final Counter factResolvedCounter;
    private final Counter factUnmatchedCounter;
    private final Counter identifierFilledCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.fuzzyScoreSummary = DistributionSummary.builder("linkage.match.fuzzy.score")
                .description("Score of each surviving fuzzy candidate")
                .register(registry);
        this.fuzzyScoringTimer = Timer.builder("linkage.match.fuzzy.duration")
                .description("Wall-clock time of the fuzzy tier")
                .register(registry);
        this.chunkRetryCounter = Counter.builder("linkage.match.chunk.retry")
                .description("Fuzzy chunks re-run sequentially after a worker failure")
                .register(registry);
        this.conflictCounter = Counter.builder("linkage.dictionary.conflicts")
                .description("Alias conflicts detected while building the dictionary")
                .register(registry);
        this.factResolvedCounter = Counter.builder("linkage.aggregate.facts")
                .description("Fact records processed by the aggregator")
                .tag("outcome", "resolved")
                .register(registry);
        this.factUnmatchedCounter = Counter.builder("linkage.aggregate.facts")
                .description("Fact records processed by the aggregator")
                .tag("outcome", "unmatched")
                .register(registry);
        this.identifierFilledCounter = Counter.builder("linkage.reference.identifiers.filled")
                .description("Entities that received reference identifiers")
                .register(registry);
        this.cacheHitCounter = Counter.builder("linkage.cache.hit")
                .description("Normalization cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("linkage.cache.miss")
                .description("Normalization cache misses")
                .register(registry);
    }

    @Override
    public void recordCandidate(MatchTier tier, MatchDecision decision) {
        String key = tier.name() + ":" + decision.name();
        Counter counter = candidateCounters.computeIfAbsent(key, k ->
                Counter.builder("linkage.match.candidates")
                        .description("Match candidates produced by the tiered matcher")
                        .tag("tier", tier.name())
                        .tag("decision", decision.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordFuzzyScore(double score) {
        fuzzyScoreSummary.record(score);
    }

    @Override
    public void recordFuzzyScoringDuration(Duration duration) {
        fuzzyScoringTimer.record(duration);
    }

    @Override
    public void incrementChunkRetry() {
        chunkRetryCounter.increment();
    }

    @Override
    public void incrementConflict() {
        conflictCounter.increment();
    }

    @Override
    public void incrementFactResolved() {
        factResolvedCounter.increment();
    }

    @Override
    public void incrementFactUnmatched() {
        factUnmatchedCounter.increment();
    }

    @Override
    public void incrementIdentifierFilled() {
        identifierFilledCounter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
