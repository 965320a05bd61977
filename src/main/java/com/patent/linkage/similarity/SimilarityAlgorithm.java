package com.patent.linkage.similarity;

/**
 * Interface for similarity computation between canonical keys.
 * All implementations return a score between 0.0 (no similarity) and 1.0 (identical)
 * and must be stateless so they can be shared by parallel scoring workers.
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two keys.
     *
     * @param s1 first key
     * @param s2 second key
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
