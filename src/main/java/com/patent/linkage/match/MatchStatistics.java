package com.patent.linkage.match;

/**
 * Counters for one matcher run.
 *
 * @param totalSources    source names supplied, duplicates and blanks included
 * @param distinctSources distinct non-blank source names actually matched
 * @param blankSources    source names that normalized to the empty key
 * @param targets         distinct non-blank target keys
 * @param exactMatches    candidates from the exact tier
 * @param strictMatches   candidates from the strict-rule tier
 * @param fuzzyAccepted   fuzzy candidates at or above the threshold
 * @param fuzzyReview     fuzzy candidates between the floor and the threshold
 * @param unmatched       distinct sources with no candidate
 */
public record MatchStatistics(
        long totalSources,
        long distinctSources,
        long blankSources,
        long targets,
        long exactMatches,
        long strictMatches,
        long fuzzyAccepted,
        long fuzzyReview,
        long unmatched
) {
    public static MatchStatistics empty() {
        return new MatchStatistics(0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    public long autoAccepted() {
        return exactMatches + strictMatches + fuzzyAccepted;
    }

    public MatchStatistics plus(MatchStatistics other) {
        return new MatchStatistics(
                totalSources + other.totalSources,
                distinctSources + other.distinctSources,
                blankSources + other.blankSources,
                Math.max(targets, other.targets),
                exactMatches + other.exactMatches,
                strictMatches + other.strictMatches,
                fuzzyAccepted + other.fuzzyAccepted,
                fuzzyReview + other.fuzzyReview,
                unmatched + other.unmatched);
    }

    @Override
    public String toString() {
        return "MatchStatistics{sources=" + totalSources +
                ", distinct=" + distinctSources +
                ", blank=" + blankSources +
                ", targets=" + targets +
                ", exact=" + exactMatches +
                ", strict=" + strictMatches +
                ", fuzzyAccepted=" + fuzzyAccepted +
                ", fuzzyReview=" + fuzzyReview +
                ", unmatched=" + unmatched + '}';
    }
}
