package com.document.verification.similarity;

/**
 * Interface for similarity computation algorithms.
 * All implementations return a percentage between 0.0 (no similarity) and 100.0 (identical).
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two strings.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity percentage between 0.0 and 100.0
     */
    double compute(String s1, String s2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
