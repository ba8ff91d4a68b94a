package com.sports.sync.strategy;

import com.sports.sync.core.model.EntityType;
import com.sports.sync.core.model.MatchCandidate;
import com.sports.sync.core.model.Record;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Team stages Tests")
class TeamStagesTest {

    private final MatchingStrategy strategy = MatchingStrategies.forType(EntityType.TEAM);

    private static List<Record> teams(String... names) {
        return Arrays.stream(names).map(n -> Record.of("team_name", n)).toList();
    }

    @Test
    @DisplayName("Names equal after club and women's rules match exactly")
    void exactAfterRules() {
        StrategyResult result = strategy.run(teams("Chelsea FC Women", "FC Barcelona"), teams("Barcelona", "Chelsea"));

        assertEquals(List.of(
                new MatchCandidate(0, 1, 1.0, 1),
                new MatchCandidate(1, 0, 1.0, 1)), result.matches());
    }

    @Test
    @DisplayName("Close names match through the cosine threshold stage")
    void cosineThreshold() {
        StrategyResult result = strategy.run(teams("Bayer 04 Leverkusen"), teams("Bayer Leverkusen"));

        assertEquals(1, result.matches().size());
        assertEquals(2, result.matches().get(0).stage());
        assertEquals(2.0 / Math.sqrt(6.0), result.matches().get(0).score(), 1e-9);
    }

    @Test
    @DisplayName("Leftover names sharing a token match in the best-remaining stage")
    void bestRemaining() {
        StrategyResult result = strategy.run(teams("Manchester United"), teams("Man United"));

        assertEquals(1, result.matches().size());
        assertEquals(3, result.matches().get(0).stage());
        assertEquals(0.5, result.matches().get(0).score(), 1e-9);
    }

    @Test
    @DisplayName("Names without a shared token never match")
    void noSharedToken() {
        StrategyResult result = strategy.run(teams("Bayer Leverkusen"), teams("Baier Leverkuzen"));

        assertFalse(result.hasMatches());
    }

    @Test
    @DisplayName("Greedy assignment keeps the better pairing for each club")
    void greedyAssignment() {
        StrategyResult result = strategy.run(
                teams("Manchester United", "Manchester City"),
                teams("Man City", "Man United"));

        assertEquals(List.of(
                new MatchCandidate(0, 1, 0.5, 3),
                new MatchCandidate(1, 0, 0.5, 3)), result.matches());
    }

    @Test
    @DisplayName("A raised threshold pushes close names to the last stage")
    void configurableThreshold() {
        MatchingStrategy strict = MatchingStrategies.forType(EntityType.TEAM, new StrategySettings(0.9, 3, 1, 2));

        StrategyResult result = strict.run(teams("Bayer 04 Leverkusen"), teams("Bayer Leverkusen"));

        assertEquals(3, result.matches().get(0).stage());
    }

    @Test
    @DisplayName("Missing names never match")
    void missingNames() {
        StrategyResult result = strategy.run(List.of(Record.of("team_name", null)), teams("Arsenal"));

        assertFalse(result.hasMatches());
        assertEquals("", TeamStages.normalizedName(null));
    }
}
