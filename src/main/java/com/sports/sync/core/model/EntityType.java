package com.sports.sync.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Closed set of entity types that can be synchronized across providers.
 * Each type declares the columns its matching strategy reads, the optional context
 * columns used for partitioning, and the columns used to deduplicate final rows.
 */
public enum EntityType {
    MATCH("match",
            List.of("match_date", "home_team_id", "away_team_id"),
            List.of("matchday"),
            List.of("competition_id", "season_id"),
            List.of("match_date", "home_team_id", "away_team_id")),
    TEAM("team",
            List.of("team_name"),
            List.of(),
            List.of("competition_id", "season_id"),
            List.of("team_name")),
    PLAYER("player",
            List.of("player_name", "team_id"),
            List.of("player_nickname", "jersey_number", "birth_date"),
            List.of(),
            List.of("team_id", "jersey_number", "player_name"));

    public static final String COMPETITION_ID = "competition_id";
    public static final String SEASON_ID = "season_id";

    /**
     * Columns holding calendar dates; their keys compare the date, not the raw text.
     */
    public static final List<String> DATE_COLUMNS = List.of("match_date", "birth_date");

    private final String key;
    private final List<String> requiredColumns;
    private final List<String> optionalColumns;
    private final List<String> contextColumns;
    private final List<String> deduplicationColumns;

    EntityType(String key, List<String> requiredColumns, List<String> optionalColumns,
               List<String> contextColumns, List<String> deduplicationColumns) {
        this.key = key;
        this.requiredColumns = requiredColumns;
        this.optionalColumns = optionalColumns;
        this.contextColumns = contextColumns;
        this.deduplicationColumns = deduplicationColumns;
    }

    public String getKey() {
        return key;
    }

    public List<String> getRequiredColumns() {
        return requiredColumns;
    }

    public List<String> getOptionalColumns() {
        return optionalColumns;
    }

    public List<String> getContextColumns() {
        return contextColumns;
    }

    /**
     * Returns true if this type can be partitioned by competition context.
     */
    public boolean supportsCompetitionContext() {
        return !contextColumns.isEmpty();
    }

    /**
     * Name of the identifier column for the given provider, e.g. {@code opta_team_id}.
     */
    public String idField(String provider) {
        return provider + "_" + key + "_id";
    }

    /**
     * Name of the provider-agnostic identifier column used by unified schemas,
     * e.g. {@code provider_team_id}.
     */
    public String unifiedIdField() {
        return "provider_" + key + "_id";
    }

    /**
     * Returns true if the column holds an identifier of this entity type.
     */
    public boolean isIdField(String column) {
        return column != null && column.endsWith("_" + key + "_id");
    }

    /**
     * Columns every record must declare, including context columns when partitioning is on.
     */
    public List<String> requiredColumns(boolean useCompetitionContext) {
        if (!useCompetitionContext || !supportsCompetitionContext()) {
            return requiredColumns;
        }
        List<String> columns = new ArrayList<>(requiredColumns);
        columns.addAll(contextColumns);
        return List.copyOf(columns);
    }

    /**
     * Columns used to collapse duplicate result rows.
     */
    public List<String> deduplicationColumns(boolean useCompetitionContext) {
        if (!useCompetitionContext || !supportsCompetitionContext()) {
            return deduplicationColumns;
        }
        List<String> columns = new ArrayList<>(deduplicationColumns);
        columns.addAll(contextColumns);
        return List.copyOf(columns);
    }
}
