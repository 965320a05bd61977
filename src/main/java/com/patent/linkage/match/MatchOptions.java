package com.patent.linkage.match;

import com.patent.linkage.similarity.SimilarityAlgorithm;
import com.patent.linkage.similarity.TokenSetSimilarity;

/**
 * Options for a tiered matcher run.
 * Configures the fuzzy cutoffs, parallelism and strict-rule parameters.
 */
public class MatchOptions {

    public static final double DEFAULT_FUZZY_THRESHOLD = 90;
    public static final double DEFAULT_REJECT_FLOOR = 80;
    public static final int DEFAULT_MAX_WORKERS = 4;
    public static final int DEFAULT_MIN_PARALLEL_SOURCES = 100;
    public static final int DEFAULT_MIN_CONTAINMENT_LENGTH = 8;

    private final double fuzzyThreshold;
    private final double rejectFloor;
    private final boolean fuzzyEnabled;
    private final boolean strictRulesEnabled;
    private final int workerCount;
    private final int maxWorkers;
    private final int minParallelSources;
    private final int minContainmentLength;
    private final SimilarityAlgorithm similarityAlgorithm;

    private MatchOptions(Builder builder) {
        this.fuzzyThreshold = builder.fuzzyThreshold;
        this.rejectFloor = builder.rejectFloor;
        this.fuzzyEnabled = builder.fuzzyEnabled;
        this.strictRulesEnabled = builder.strictRulesEnabled;
        this.workerCount = builder.workerCount;
        this.maxWorkers = builder.maxWorkers;
        this.minParallelSources = builder.minParallelSources;
        this.minContainmentLength = builder.minContainmentLength;
        this.similarityAlgorithm = builder.similarityAlgorithm;
    }

    public double getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    public double getRejectFloor() {
        return rejectFloor;
    }

    public boolean isFuzzyEnabled() {
        return fuzzyEnabled;
    }

    public boolean isStrictRulesEnabled() {
        return strictRulesEnabled;
    }

    /**
     * Requested worker count, before the {@link #getMaxWorkers()} cap.
     */
    public int getWorkerCount() {
        return workerCount;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    /**
     * Number of fuzzy workers actually used: the requested count capped by maxWorkers.
     */
    public int getEffectiveWorkers() {
        return Math.max(1, Math.min(workerCount, maxWorkers));
    }

    public int getMinParallelSources() {
        return minParallelSources;
    }

    public int getMinContainmentLength() {
        return minContainmentLength;
    }

    public SimilarityAlgorithm getSimilarityAlgorithm() {
        return similarityAlgorithm;
    }

    public static MatchOptions defaults() {
        return builder().build();
    }

    /**
     * Exact and strict-rule tiers only.
     */
    public static MatchOptions exactOnly() {
        return builder().fuzzyEnabled(false).build();
    }

    public static int defaultWorkerCount() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    /**
     * Returns a builder pre-populated with this instance's values.
     */
    public Builder toBuilder() {
        return builder()
                .fuzzyThreshold(fuzzyThreshold)
                .rejectFloor(rejectFloor)
                .fuzzyEnabled(fuzzyEnabled)
                .strictRulesEnabled(strictRulesEnabled)
                .workerCount(workerCount)
                .maxWorkers(maxWorkers)
                .minParallelSources(minParallelSources)
                .minContainmentLength(minContainmentLength)
                .similarityAlgorithm(similarityAlgorithm);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double fuzzyThreshold = DEFAULT_FUZZY_THRESHOLD;
        private double rejectFloor = DEFAULT_REJECT_FLOOR;
        private boolean fuzzyEnabled = true;
        private boolean strictRulesEnabled = true;
        private int workerCount = defaultWorkerCount();
        private int maxWorkers = DEFAULT_MAX_WORKERS;
        private int minParallelSources = DEFAULT_MIN_PARALLEL_SOURCES;
        private int minContainmentLength = DEFAULT_MIN_CONTAINMENT_LENGTH;
        private SimilarityAlgorithm similarityAlgorithm = new TokenSetSimilarity();

        public Builder fuzzyThreshold(double fuzzyThreshold) {
            validateScore(fuzzyThreshold, "fuzzyThreshold");
            this.fuzzyThreshold = fuzzyThreshold;
            return this;
        }

        public Builder rejectFloor(double rejectFloor) {
            validateScore(rejectFloor, "rejectFloor");
            this.rejectFloor = rejectFloor;
            return this;
        }

        public Builder fuzzyEnabled(boolean fuzzyEnabled) {
            this.fuzzyEnabled = fuzzyEnabled;
            return this;
        }

        public Builder strictRulesEnabled(boolean strictRulesEnabled) {
            this.strictRulesEnabled = strictRulesEnabled;
            return this;
        }

        public Builder workerCount(int workerCount) {
            if (workerCount <= 0) {
                throw new IllegalArgumentException("workerCount must be positive");
            }
            this.workerCount = workerCount;
            return this;
        }

        public Builder maxWorkers(int maxWorkers) {
            if (maxWorkers <= 0) {
                throw new IllegalArgumentException("maxWorkers must be positive");
            }
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder minParallelSources(int minParallelSources) {
            if (minParallelSources < 0) {
                throw new IllegalArgumentException("minParallelSources must be >= 0");
            }
            this.minParallelSources = minParallelSources;
            return this;
        }

        public Builder minContainmentLength(int minContainmentLength) {
            if (minContainmentLength <= 0) {
                throw new IllegalArgumentException("minContainmentLength must be positive");
            }
            this.minContainmentLength = minContainmentLength;
            return this;
        }

        public Builder similarityAlgorithm(SimilarityAlgorithm similarityAlgorithm) {
            if (similarityAlgorithm == null) {
                throw new IllegalArgumentException("similarityAlgorithm is required");
            }
            this.similarityAlgorithm = similarityAlgorithm;
            return this;
        }

        public MatchOptions build() {
            if (rejectFloor > fuzzyThreshold) {
                throw new IllegalArgumentException(
                        "rejectFloor must be <= fuzzyThreshold (rejectFloor=" + rejectFloor +
                                ", fuzzyThreshold=" + fuzzyThreshold + ")");
            }
            return new MatchOptions(this);
        }

        private void validateScore(double value, String name) {
            if (value < 0.0 || value > 100.0) {
                throw new IllegalArgumentException(name + " must be between 0 and 100");
            }
        }
    }

    @Override
    public String toString() {
        return "MatchOptions{" +
                "fuzzyThreshold=" + fuzzyThreshold +
                ", rejectFloor=" + rejectFloor +
                ", fuzzyEnabled=" + fuzzyEnabled +
                ", strictRulesEnabled=" + strictRulesEnabled +
                ", workers=" + getEffectiveWorkers() +
                ", minParallelSources=" + minParallelSources +
                ", minContainmentLength=" + minContainmentLength +
                ", similarity=" + similarityAlgorithm.getName() +
                '}';
    }
}
