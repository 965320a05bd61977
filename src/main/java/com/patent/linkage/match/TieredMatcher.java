package com.patent.linkage.match;

import com.patent.linkage.core.model.MatchCandidate;
import com.patent.linkage.core.model.MatchDecision;
import com.patent.linkage.logging.LogContext;
import com.patent.linkage.metrics.MetricsService;
import com.patent.linkage.metrics.NoOpMetricsService;
import com.patent.linkage.rules.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Links source names to target names in three tiers.
 *
 * <ol>
 *   <li><b>Exact</b> - identical canonical keys, auto-accepted.</li>
 *   <li><b>Strict rule</b> - {@link StrictRuleMatcher}, auto-accepted.</li>
 *   <li><b>Fuzzy</b> - best similarity among all targets, scored in parallel;
 *       auto-accepted at or above the threshold, sent to review between the
 *       reject floor and the threshold, dropped below the floor.</li>
 * </ol>
 *
 * <p>A source settled by an earlier tier is never considered by a later one.
 * Each distinct source name yields at most one candidate, and the returned
 * candidates are in {@link MatchCandidate#CANONICAL_ORDER}.</p>
 */
public class TieredMatcher {
    private static final Logger log = LoggerFactory.getLogger(TieredMatcher.class);

    private final NameNormalizer normalizer;
    private final MatchOptions defaultOptions;
    private final ParallelScoringExecutor executor;
    private final MetricsService metrics;

    public TieredMatcher(NameNormalizer normalizer) {
        this(normalizer, MatchOptions.defaults(), new NoOpMetricsService());
    }

    public TieredMatcher(NameNormalizer normalizer, MatchOptions defaultOptions, MetricsService metrics) {
        this.normalizer = normalizer;
        this.defaultOptions = defaultOptions;
        this.metrics = metrics;
        this.executor = new ParallelScoringExecutor(metrics);
    }

    public MatchRunResult match(List<String> sources, List<String> targets) {
        return match(sources, targets, defaultOptions);
    }

    /**
     * Matches with the given cutoffs and otherwise default options.
     */
    public MatchRunResult match(List<String> sources, List<String> targets,
                                double fuzzyThreshold, double rejectFloor) {
        return match(sources, targets, defaultOptions.toBuilder()
                .fuzzyThreshold(fuzzyThreshold)
                .rejectFloor(rejectFloor)
                .build());
    }

    public MatchRunResult match(List<String> sources, List<String> targets, MatchOptions options) {
        return match(sources, TargetIndex.build(targets, normalizer), options);
    }

    /**
     * Matches against a prebuilt index. Lets several runs share one index.
     */
    public MatchRunResult match(List<String> sources, TargetIndex targets, MatchOptions options) {
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forStage(runId, "match")) {
            log.info("match.started sources={} targets={} options={}", sources.size(), targets.size(), options);

            StrictRuleMatcher strictMatcher = new StrictRuleMatcher(options.getMinContainmentLength());
            List<MatchCandidate> candidates = new ArrayList<>();
            List<SourceEntry> fuzzyQueue = new ArrayList<>();
            Set<String> seen = new LinkedHashSet<>();
            long blank = 0;
            long exact = 0;
            long strict = 0;

            for (String source : sources) {
                String key = normalizer.normalize(source);
                if (key.isEmpty()) {
                    blank++;
                    continue;
                }
                if (!seen.add(source)) {
                    continue;
                }

                String exactTarget = targets.representative(key);
                if (exactTarget != null) {
                    candidates.add(MatchCandidate.exact(source, exactTarget, key));
                    exact++;
                    continue;
                }
                if (options.isStrictRulesEnabled()) {
                    Optional<MatchCandidate> strictMatch = strictMatcher.match(source, key, targets);
                    if (strictMatch.isPresent()) {
                        candidates.add(strictMatch.get());
                        strict++;
                        continue;
                    }
                }
                fuzzyQueue.add(new SourceEntry(source, key));
            }

            long fuzzyAccepted = 0;
            long fuzzyReview = 0;
            if (options.isFuzzyEnabled() && !fuzzyQueue.isEmpty()) {
                long start = System.nanoTime();
                List<MatchCandidate> fuzzy = executor.score(fuzzyQueue, targets, options);
                metrics.recordFuzzyScoringDuration(Duration.ofNanos(System.nanoTime() - start));
                for (MatchCandidate candidate : fuzzy) {
                    metrics.recordFuzzyScore(candidate.score());
                    if (candidate.decision() == MatchDecision.AUTO_ACCEPTED) {
                        fuzzyAccepted++;
                    } else {
                        fuzzyReview++;
                    }
                }
                candidates.addAll(fuzzy);
            }

            candidates.sort(MatchCandidate.CANONICAL_ORDER);
            candidates.forEach(c -> metrics.recordCandidate(c.tier(), c.decision()));

            MatchStatistics stats = new MatchStatistics(
                    sources.size(), seen.size(), blank, targets.size(),
                    exact, strict, fuzzyAccepted, fuzzyReview,
                    seen.size() - candidates.size());
            log.info("match.completed stats={}", stats);
            return new MatchRunResult(candidates, stats);
        }
    }

    /**
     * Matches each stratum with its own options against one shared target index,
     * concatenating results in stratum order.
     */
    public MatchRunResult matchStrata(List<SourceStratifier.Stratum> strata, List<String> targets) {
        TargetIndex index = TargetIndex.build(targets, normalizer);
        List<MatchRunResult> results = new ArrayList<>(strata.size());
        for (SourceStratifier.Stratum stratum : strata) {
            log.debug("match.stratum name={} sources={}", stratum.name(), stratum.sources().size());
            results.add(match(stratum.sources(), index, stratum.options()));
        }
        return MatchRunResult.concat(results);
    }

    public NameNormalizer getNormalizer() {
        return normalizer;
    }

    public MatchOptions getDefaultOptions() {
        return defaultOptions;
    }
}
