package com.patent.linkage.match;

import com.patent.linkage.core.model.MatchCandidate;
import com.patent.linkage.core.model.MatchTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Post-run sanity checks over matcher output. Findings are reported, never fatal.
 */
public class MatchQualityCheck {
    private static final Logger log = LoggerFactory.getLogger(MatchQualityCheck.class);

    public static final double DEFAULT_LOW_SCORE = 95;
    public static final int DEFAULT_SHORT_KEY_LENGTH = 3;

    private final double lowScore;
    private final int shortKeyLength;

    public MatchQualityCheck() {
        this(DEFAULT_LOW_SCORE, DEFAULT_SHORT_KEY_LENGTH);
    }

    public MatchQualityCheck(double lowScore, int shortKeyLength) {
        this.lowScore = lowScore;
        this.shortKeyLength = shortKeyLength;
    }

    /**
     * Findings of a quality check.
     *
     * @param oneToMany     source names linked to more than one distinct target, with those targets
     * @param lowScore      candidates scoring below the low-score mark
     * @param shortKeys     candidates whose source key is shorter than the short-key length
     * @param countsByTier  candidate count per tier
     */
    public record QualityReport(
            Map<String, Set<String>> oneToMany,
            List<MatchCandidate> lowScore,
            List<MatchCandidate> shortKeys,
            Map<MatchTier, Long> countsByTier
    ) {
        public QualityReport {
            SortedMap<String, Set<String>> sorted = new TreeMap<>();
            oneToMany.forEach((source, targets) ->
                    sorted.put(source, Collections.unmodifiableSortedSet(new TreeSet<>(targets))));
            oneToMany = Collections.unmodifiableSortedMap(sorted);
            lowScore = List.copyOf(lowScore);
            shortKeys = List.copyOf(shortKeys);
            Map<MatchTier, Long> byTier = new EnumMap<>(MatchTier.class);
            byTier.putAll(countsByTier);
            countsByTier = Collections.unmodifiableMap(byTier);
        }

        public boolean isClean() {
            return oneToMany.isEmpty() && lowScore.isEmpty() && shortKeys.isEmpty();
        }

        public long count(MatchTier tier) {
            return countsByTier.getOrDefault(tier, 0L);
        }
    }

    public QualityReport check(List<MatchCandidate> candidates) {
        Map<String, Set<String>> targetsBySource = new TreeMap<>();
        List<MatchCandidate> low = new ArrayList<>();
        List<MatchCandidate> shortKeys = new ArrayList<>();
        Map<MatchTier, Long> counts = new EnumMap<>(MatchTier.class);

        for (MatchCandidate candidate : candidates) {
            targetsBySource.computeIfAbsent(candidate.sourceName(), k -> new TreeSet<>())
                    .add(candidate.targetName());
            if (candidate.score() < lowScore) {
                low.add(candidate);
            }
            if (candidate.sourceKey().length() < shortKeyLength) {
                shortKeys.add(candidate);
            }
            counts.merge(candidate.tier(), 1L, Long::sum);
        }

        Map<String, Set<String>> oneToMany = new TreeMap<>();
        targetsBySource.forEach((source, targets) -> {
            if (targets.size() > 1) {
                oneToMany.put(source, targets);
            }
        });

        QualityReport report = new QualityReport(oneToMany, low, shortKeys, counts);
        if (!report.isClean()) {
            log.warn("match.quality oneToMany={} lowScore={} shortKeys={} tiers={}",
                    oneToMany.size(), low.size(), shortKeys.size(), counts);
        } else {
            log.info("match.quality clean=true tiers={}", counts);
        }
        return report;
    }
}
