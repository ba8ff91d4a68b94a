package com.sports.sync.similarity;

/**
 * Interface for name similarity computation.
 * Implementations return a score between 0.0 (nothing in common) and 1.0 (identical)
 * and never throw on null or empty input.
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two raw (not yet normalized) strings.
     *
     * @param s1 first string, may be null
     * @param s2 second string, may be null
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
