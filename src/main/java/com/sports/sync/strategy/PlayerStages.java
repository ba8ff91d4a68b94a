package com.sports.sync.strategy;

import com.sports.sync.core.model.Record;
import com.sports.sync.similarity.ContainmentMatcher;
import com.sports.sync.similarity.DateTolerance;
import com.sports.sync.similarity.SimilarityAlgorithm;
import com.sports.sync.similarity.TokenCosineSimilarity;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Stages for synchronizing players within already-synchronized teams.
 * <ol>
 *   <li>{@value #NAME_JERSEY_TEAM}: name similarity at the threshold, equal jersey number and team.</li>
 *   <li>{@value #BIRTH_DATE_TEAM}: birth dates within the tolerance or with day and month
 *   swapped, equal team, best name/nickname similarity at the threshold.</li>
 *   <li>{@value #NAME_OR_NICKNAME_TEAM}: best name/nickname similarity at the threshold, equal team.</li>
 *   <li>{@value #CONTAINMENT_TEAM}: a name/nickname token contained in the other side, equal team.</li>
 *   <li>{@value #BEST_REMAINING_TEAM}: best remaining name/nickname pairing with any shared token, equal team.</li>
 * </ol>
 *
 * <p>Jersey numbers and birth dates are often missing. When either side has no value,
 * that predicate is dropped for the pair and the remaining predicates decide.
 * {@code team_id} is always required.</p>
 */
public final class PlayerStages {

    public static final String NAME_JERSEY_TEAM = "name-jersey-team";
    public static final String BIRTH_DATE_TEAM = "birth-date-team";
    public static final String NAME_OR_NICKNAME_TEAM = "name-or-nickname-team";
    public static final String CONTAINMENT_TEAM = "containment-team";
    public static final String BEST_REMAINING_TEAM = "best-remaining-team";

    static final String PLAYER_NAME = "player_name";
    static final String PLAYER_NICKNAME = "player_nickname";
    static final String JERSEY_NUMBER = "jersey_number";
    static final String BIRTH_DATE = "birth_date";
    static final String TEAM_ID = "team_id";

    private static final SimilarityAlgorithm COSINE = new TokenCosineSimilarity();

    private PlayerStages() {
        // Utility class
    }

    public static List<MatchingStage> create(StrategySettings settings) {
        double threshold = settings.similarityThreshold();
        ContainmentMatcher containment = new ContainmentMatcher(settings.minimumTokenLength());

        return List.of(
                MatchingStage.scored(NAME_JERSEY_TEAM, (left, right) -> {
                    if (!sameTeam(left, right) || !equalWhenPresent(left, right, JERSEY_NUMBER)) {
                        return OptionalDouble.empty();
                    }
                    double score = COSINE.compute(left.getString(PLAYER_NAME), right.getString(PLAYER_NAME));
                    return atThreshold(score, threshold);
                }),
                MatchingStage.scored(BIRTH_DATE_TEAM, (left, right) -> {
                    if (!sameTeam(left, right)
                            || !birthDatesCompatible(left, right, settings.birthDateToleranceDays())) {
                        return OptionalDouble.empty();
                    }
                    return atThreshold(bestNameSimilarity(left, right), threshold);
                }),
                MatchingStage.scored(NAME_OR_NICKNAME_TEAM, (left, right) -> {
                    if (!sameTeam(left, right)) {
                        return OptionalDouble.empty();
                    }
                    return atThreshold(bestNameSimilarity(left, right), threshold);
                }),
                MatchingStage.scored(CONTAINMENT_TEAM, (left, right) -> {
                    if (!sameTeam(left, right) || !anyNameContained(left, right, containment)) {
                        return OptionalDouble.empty();
                    }
                    return OptionalDouble.of(bestNameSimilarity(left, right));
                }),
                MatchingStage.scored(BEST_REMAINING_TEAM, (left, right) -> {
                    if (!sameTeam(left, right)) {
                        return OptionalDouble.empty();
                    }
                    double score = bestNameSimilarity(left, right);
                    return score > 0.0 ? OptionalDouble.of(score) : OptionalDouble.empty();
                })
        );
    }

    /**
     * Highest cosine similarity over the name x nickname cross combinations.
     */
    static double bestNameSimilarity(Record left, Record right) {
        double best = 0.0;
        for (String leftName : names(left)) {
            for (String rightName : names(right)) {
                best = Math.max(best, COSINE.compute(leftName, rightName));
            }
        }
        return best;
    }

    static boolean birthDatesCompatible(Record left, Record right, int toleranceDays) {
        LocalDate leftDate = left.getDate(BIRTH_DATE);
        LocalDate rightDate = right.getDate(BIRTH_DATE);
        if (leftDate == null || rightDate == null) {
            return true;
        }
        return DateTolerance.within(leftDate, rightDate, toleranceDays)
                || DateTolerance.swappedEqual(leftDate, rightDate)
                || DateTolerance.swappedEqual(rightDate, leftDate);
    }

    private static boolean anyNameContained(Record left, Record right, ContainmentMatcher containment) {
        for (String leftName : names(left)) {
            for (String rightName : names(right)) {
                if (containment.matches(leftName, rightName)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static List<String> names(Record record) {
        String name = record.getString(PLAYER_NAME);
        String nickname = record.getString(PLAYER_NICKNAME);
        if (name == null) {
            return nickname == null ? List.of() : List.of(nickname);
        }
        return nickname == null ? List.of(name) : List.of(name, nickname);
    }

    private static boolean sameTeam(Record left, Record right) {
        String team = left.keyValue(TEAM_ID);
        return team != null && team.equals(right.keyValue(TEAM_ID));
    }

    private static boolean equalWhenPresent(Record left, Record right, String column) {
        String leftValue = left.keyValue(column);
        String rightValue = right.keyValue(column);
        return leftValue == null || rightValue == null || Objects.equals(leftValue, rightValue);
    }

    private static OptionalDouble atThreshold(double score, double threshold) {
        return score > 0.0 && score >= threshold ? OptionalDouble.of(score) : OptionalDouble.empty();
    }
}
