package com.sports.sync.merge;

import com.sports.sync.core.model.ResultRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResultDeduplicator Tests")
class ResultDeduplicatorTest {

    private final ResultDeduplicator deduplicator = new ResultDeduplicator(List.of("team_name"));

    private static ResultRow row(String opta, String statsbomb, String teamName) {
        Map<String, String> ids = new LinkedHashMap<>();
        ids.put("opta_team_id", opta);
        ids.put("statsbomb_team_id", statsbomb);
        Map<String, Object> columns = new HashMap<>();
        columns.put("team_name", teamName);
        return new ResultRow(ids, columns);
    }

    @Test
    @DisplayName("Complementary rows with the same key are merged")
    void mergesComplementaryRows() {
        List<ResultRow> result = deduplicator.deduplicate(List.of(
                row("o1", null, "Arsenal"),
                row(null, "s1", "Arsenal")));

        assertEquals(1, result.size());
        assertEquals("o1", result.get(0).getIdentifier("opta_team_id"));
        assertEquals("s1", result.get(0).getIdentifier("statsbomb_team_id"));
    }

    @Test
    @DisplayName("Rows with conflicting identifiers stay apart")
    void keepsConflictingRows() {
        List<ResultRow> result = deduplicator.deduplicate(List.of(
                row("o1", "s1", "Arsenal"),
                row("o2", null, "Arsenal")));

        assertEquals(2, result.size());
    }

    @Test
    @DisplayName("Rows with a missing key never merge")
    void nullKeysNeverMerge() {
        List<ResultRow> result = deduplicator.deduplicate(List.of(
                row("o1", null, null),
                row(null, "s1", null)));

        assertEquals(2, result.size());
    }

    @Test
    @DisplayName("Merged rows keep the position of their first row")
    void keepsFirstPosition() {
        List<ResultRow> result = deduplicator.deduplicate(List.of(
                row("o1", null, "Arsenal"),
                row("o2", "s2", "Chelsea"),
                row(null, "s1", "Arsenal")));

        assertEquals(2, result.size());
        assertEquals("o1", result.get(0).getIdentifier("opta_team_id"));
        assertEquals("s1", result.get(0).getIdentifier("statsbomb_team_id"));
        assertEquals("o2", result.get(1).getIdentifier("opta_team_id"));
    }

    @Test
    @DisplayName("A conflicting row can still merge with a later compatible row")
    void conflictingRowStartsOwnEntry() {
        List<ResultRow> result = deduplicator.deduplicate(List.of(
                row("o1", "s1", "Arsenal"),
                row("o2", null, "Arsenal"),
                row(null, "s2", "Arsenal")));

        assertEquals(2, result.size());
        assertEquals("o2", result.get(1).getIdentifier("opta_team_id"));
        assertEquals("s2", result.get(1).getIdentifier("statsbomb_team_id"));
    }

    @Test
    @DisplayName("Deduplication is idempotent")
    void idempotent() {
        List<ResultRow> once = deduplicator.deduplicate(List.of(
                row("o1", null, "Arsenal"),
                row(null, "s1", "Arsenal"),
                row("o2", null, "Chelsea")));

        assertEquals(once, deduplicator.deduplicate(once));
    }

    @Test
    @DisplayName("Date columns group by calendar date whatever their form")
    void datesGroupByDay() {
        ResultDeduplicator matches = new ResultDeduplicator(List.of("match_date", "home_team_id"));
        Map<String, Object> withLocalDate = new HashMap<>();
        withLocalDate.put("match_date", LocalDate.of(2024, 3, 5));
        withLocalDate.put("home_team_id", "t1");
        Map<String, Object> withTimestamp = new HashMap<>();
        withTimestamp.put("match_date", "2024-03-05T20:00:00");
        withTimestamp.put("home_team_id", "t1");
        Map<String, String> opta = new LinkedHashMap<>();
        opta.put("opta_match_id", "m1");
        opta.put("wyscout_match_id", null);
        Map<String, String> wyscout = new LinkedHashMap<>();
        wyscout.put("opta_match_id", null);
        wyscout.put("wyscout_match_id", "w1");

        List<ResultRow> result = matches.deduplicate(List.of(
                new ResultRow(opta, withLocalDate), new ResultRow(wyscout, withTimestamp)));

        assertEquals(1, result.size());
        assertEquals("w1", result.get(0).getIdentifier("wyscout_match_id"));
        assertEquals(LocalDate.of(2024, 3, 5), result.get(0).getColumn("match_date"));
    }

    @Test
    @DisplayName("Result rows need at least one identifier")
    void rowNeedsIdentifier() {
        assertThrows(IllegalArgumentException.class, () -> row(null, null, "Arsenal"));
    }
}
