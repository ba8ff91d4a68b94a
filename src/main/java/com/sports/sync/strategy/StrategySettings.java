package com.sports.sync.strategy;

import com.sports.sync.similarity.ContainmentMatcher;

/**
 * Tunable parameters of the built-in strategies.
 *
 * @param similarityThreshold    minimum cosine similarity of the thresholded name stages
 * @param matchDateToleranceDays largest match date offset tried by the date-tolerance stage
 * @param birthDateToleranceDays largest birth date difference accepted by the birth-date stage
 * @param minimumTokenLength     shortest token considered by the containment stage
 */
public record StrategySettings(
        double similarityThreshold,
        int matchDateToleranceDays,
        int birthDateToleranceDays,
        int minimumTokenLength
) {
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.75;
    public static final int DEFAULT_MATCH_DATE_TOLERANCE_DAYS = 3;
    public static final int DEFAULT_BIRTH_DATE_TOLERANCE_DAYS = 1;

    public StrategySettings {
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be between 0.0 and 1.0");
        }
        if (matchDateToleranceDays < 0 || birthDateToleranceDays < 0) {
            throw new IllegalArgumentException("Date tolerances must not be negative");
        }
        if (minimumTokenLength < 1) {
            throw new IllegalArgumentException("minimumTokenLength must be at least 1");
        }
    }

    public static StrategySettings defaults() {
        return new StrategySettings(DEFAULT_SIMILARITY_THRESHOLD, DEFAULT_MATCH_DATE_TOLERANCE_DAYS,
                DEFAULT_BIRTH_DATE_TOLERANCE_DAYS, ContainmentMatcher.DEFAULT_MINIMUM_TOKEN_LENGTH);
    }
}
