package com.sports.sync.strategy;

import com.sports.sync.core.model.Record;
import com.sports.sync.similarity.DateTolerance;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Stages for synchronizing matches.
 * <ol>
 *   <li>{@value #EXACT_DATE}: equal match date, home team and away team.</li>
 *   <li>{@value #DATE_TOLERANCE}: same teams, one side's date shifted by up to the
 *   tolerance (time zones, TV scheduling); smaller offsets score higher.</li>
 *   <li>{@value #MATCHDAY}: same teams and matchday, for postponements beyond the tolerance.</li>
 * </ol>
 * Team identifiers are expected to be synchronized already.
 */
public final class MatchStages {

    public static final String EXACT_DATE = "exact-date";
    public static final String DATE_TOLERANCE = "date-tolerance";
    public static final String MATCHDAY = "matchday";

    static final String MATCH_DATE = "match_date";
    static final String MATCHDAY_COLUMN = "matchday";
    static final String HOME_TEAM_ID = "home_team_id";
    static final String AWAY_TEAM_ID = "away_team_id";

    private MatchStages() {
        // Utility class
    }

    public static List<MatchingStage> create(StrategySettings settings) {
        return List.of(
                MatchingStage.exactKey(EXACT_DATE,
                        KeyExtractor.ofColumnsWithDate(MATCH_DATE, MATCH_DATE, HOME_TEAM_ID, AWAY_TEAM_ID)),
                MatchingStage.scored(DATE_TOLERANCE, dateToleranceScorer(settings.matchDateToleranceDays())),
                MatchingStage.exactKey(MATCHDAY,
                        KeyExtractor.ofColumns(MATCHDAY_COLUMN, HOME_TEAM_ID, AWAY_TEAM_ID))
        );
    }

    /**
     * Shifts each side's date in turn by 1..{@code toleranceDays} days in both directions,
     * smallest offset first, and scores the first hit with {@code 1 / (1 + |offset|)}.
     */
    static CandidateScorer dateToleranceScorer(int toleranceDays) {
        return (left, right) -> {
            if (!sameTeams(left, right)) {
                return OptionalDouble.empty();
            }
            LocalDate leftDate = left.getDate(MATCH_DATE);
            LocalDate rightDate = right.getDate(MATCH_DATE);
            if (leftDate == null || rightDate == null) {
                return OptionalDouble.empty();
            }
            for (int magnitude = 1; magnitude <= toleranceDays; magnitude++) {
                for (int offset : new int[]{-magnitude, magnitude}) {
                    if (DateTolerance.shift(leftDate, offset).equals(rightDate)
                            || DateTolerance.shift(rightDate, offset).equals(leftDate)) {
                        return OptionalDouble.of(1.0 / (1 + magnitude));
                    }
                }
            }
            return OptionalDouble.empty();
        };
    }

    private static boolean sameTeams(Record left, Record right) {
        String home = left.keyValue(HOME_TEAM_ID);
        String away = left.keyValue(AWAY_TEAM_ID);
        return home != null && away != null
                && Objects.equals(home, right.keyValue(HOME_TEAM_ID))
                && Objects.equals(away, right.keyValue(AWAY_TEAM_ID));
    }
}
