package com.patent.linkage.similarity;

import java.util.Arrays;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Token-set similarity.
 *
 * <p>Both keys are split into token sets. The shared tokens (sorted) form a
 * base string; each side's leftover tokens are appended to it. The score is the
 * best {@link IndelSimilarity} among the three pairings of base and the two
 * extended strings. When one token set contains the other the score is 1.0,
 * so word order and extra descriptive words do not penalize a match.</p>
 */
public class TokenSetSimilarity implements SimilarityAlgorithm {

    private final IndelSimilarity indel = new IndelSimilarity();

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }

        SortedSet<String> tokens1 = tokenize(s1);
        SortedSet<String> tokens2 = tokenize(s2);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        SortedSet<String> intersection = new TreeSet<>(tokens1);
        intersection.retainAll(tokens2);
        SortedSet<String> only1 = new TreeSet<>(tokens1);
        only1.removeAll(tokens2);
        SortedSet<String> only2 = new TreeSet<>(tokens2);
        only2.removeAll(tokens1);

        if (!intersection.isEmpty() && (only1.isEmpty() || only2.isEmpty())) {
            return 1.0;
        }

        String base = String.join(" ", intersection);
        String combined1 = join(base, String.join(" ", only1));
        String combined2 = join(base, String.join(" ", only2));

        double best = indel.compute(combined1, combined2);
        if (!base.isEmpty()) {
            best = Math.max(best, indel.compute(base, combined1));
            best = Math.max(best, indel.compute(base, combined2));
        }
        return best;
    }

    @Override
    public String getName() {
        return "TokenSet";
    }

    /**
     * Total character length of the tokens two keys share.
     * Used to break ties between equally scored targets.
     */
    public static int commonTokenLength(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0;
        }
        SortedSet<String> shared = tokenize(s1);
        shared.retainAll(tokenize(s2));
        int length = 0;
        for (String token : shared) {
            length += token.length();
        }
        return length;
    }

    static SortedSet<String> tokenize(String s) {
        SortedSet<String> tokens = new TreeSet<>();
        Arrays.stream(s.trim().split("\\s+"))
                .filter(token -> !token.isEmpty())
                .forEach(tokens::add);
        return tokens;
    }

    private static String join(String base, String rest) {
        if (base.isEmpty()) {
            return rest;
        }
        if (rest.isEmpty()) {
            return base;
        }
        return base + " " + rest;
    }
}
