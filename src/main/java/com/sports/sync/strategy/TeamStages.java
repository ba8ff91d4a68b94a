package com.sports.sync.strategy;

import com.sports.sync.core.model.EntityType;
import com.sports.sync.rules.NormalizationEngine;
import com.sports.sync.rules.TeamNameRules;
import com.sports.sync.similarity.SimilarityAlgorithm;
import com.sports.sync.similarity.TokenCosineSimilarity;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Stages for synchronizing teams by name. Names are cleaned with
 * {@link TeamNameRules} first, so "Atlanta Beat WFC" and "Atlanta Beat" are equal.
 * <ol>
 *   <li>{@value #EXACT_NAME}: equal normalized names.</li>
 *   <li>{@value #COSINE_THRESHOLD}: token cosine similarity at or above the threshold.</li>
 *   <li>{@value #COSINE_BEST_REMAINING}: best remaining pairing with any shared token.</li>
 * </ol>
 */
public final class TeamStages {

    public static final String EXACT_NAME = "exact-name";
    public static final String COSINE_THRESHOLD = "cosine-threshold";
    public static final String COSINE_BEST_REMAINING = "cosine-best-remaining";

    static final String TEAM_NAME = "team_name";

    private static final NormalizationEngine TEAM_NAMES = TeamNameRules.createTeamEngine();
    private static final SimilarityAlgorithm COSINE = new TokenCosineSimilarity();

    private TeamStages() {
        // Utility class
    }

    public static List<MatchingStage> create(StrategySettings settings) {
        return List.of(
                MatchingStage.exactKey(EXACT_NAME, record -> {
                    String normalized = normalizedName(record.getString(TEAM_NAME));
                    return normalized.isEmpty() ? null : normalized;
                }),
                MatchingStage.scored(COSINE_THRESHOLD, (left, right) -> {
                    double score = similarity(left.getString(TEAM_NAME), right.getString(TEAM_NAME));
                    return score >= settings.similarityThreshold() && score > 0.0
                            ? OptionalDouble.of(score) : OptionalDouble.empty();
                }),
                MatchingStage.scored(COSINE_BEST_REMAINING, (left, right) -> {
                    double score = similarity(left.getString(TEAM_NAME), right.getString(TEAM_NAME));
                    return score > 0.0 ? OptionalDouble.of(score) : OptionalDouble.empty();
                })
        );
    }

    static String normalizedName(String teamName) {
        return TEAM_NAMES.normalize(teamName, EntityType.TEAM);
    }

    static double similarity(String a, String b) {
        return COSINE.compute(normalizedName(a), normalizedName(b));
    }
}
