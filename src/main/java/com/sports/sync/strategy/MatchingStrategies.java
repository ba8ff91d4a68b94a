package com.sports.sync.strategy;

import com.sports.sync.core.model.EntityType;

import java.util.Objects;

/**
 * Selects the built-in stage sequence for an entity type.
 */
public final class MatchingStrategies {

    private MatchingStrategies() {
        // Utility class
    }

    public static MatchingStrategy forType(EntityType entityType) {
        return forType(entityType, StrategySettings.defaults());
    }

    public static MatchingStrategy forType(EntityType entityType, StrategySettings settings) {
        Objects.requireNonNull(entityType, "entityType is required");
        Objects.requireNonNull(settings, "settings is required");
        return switch (entityType) {
            case MATCH -> new MatchingStrategy(entityType, MatchStages.create(settings));
            case TEAM -> new MatchingStrategy(entityType, TeamStages.create(settings));
            case PLAYER -> new MatchingStrategy(entityType, PlayerStages.create(settings));
        };
    }
}
