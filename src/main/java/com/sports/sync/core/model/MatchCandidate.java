package com.sports.sync.core.model;

/**
 * A proposed pairing found by one matching stage: positions of the two records in
 * the stage's left and right pools, the similarity score and the stage that found it.
 * Exact-key stages always score 1.0.
 */
public record MatchCandidate(
        int leftIndex,
        int rightIndex,
        double score,
        int stage
) {
    public MatchCandidate {
        if (leftIndex < 0 || rightIndex < 0) {
            throw new IllegalArgumentException("Candidate indexes must be non-negative");
        }
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0");
        }
    }
}
