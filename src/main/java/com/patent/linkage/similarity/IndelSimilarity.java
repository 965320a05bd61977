package com.patent.linkage.similarity;

/**
 * Normalized insertion/deletion similarity.
 * Computes {@code 2 * LCS / (|s1| + |s2|)}, i.e. one minus the indel distance
 * divided by the combined length.
 */
public class IndelSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        int lcs = longestCommonSubsequence(s1, s2);
        return (2.0 * lcs) / (s1.length() + s2.length());
    }

    @Override
    public String getName() {
        return "Indel";
    }

    /**
     * Length of the longest common subsequence, two-row dynamic programming
     * over the shorter string.
     */
    private int longestCommonSubsequence(String s1, String s2) {
        if (s1.length() > s2.length()) {
            String temp = s1;
            s1 = s2;
            s2 = temp;
        }

        int m = s1.length();
        int[] previousRow = new int[m + 1];
        int[] currentRow = new int[m + 1];

        for (int j = 1; j <= s2.length(); j++) {
            char c = s2.charAt(j - 1);
            for (int i = 1; i <= m; i++) {
                if (s1.charAt(i - 1) == c) {
                    currentRow[i] = previousRow[i - 1] + 1;
                } else {
                    currentRow[i] = Math.max(previousRow[i], currentRow[i - 1]);
                }
            }
            int[] temp = previousRow;
            previousRow = currentRow;
            currentRow = temp;
        }

        return previousRow[m];
    }
}
