package com.sports.sync.strategy;

import com.sports.sync.core.model.Record;

/**
 * Receives every committed match and every finished stage of a strategy run.
 * Used for verbose tracing and metrics; listeners never influence outcomes.
 */
public interface StageListener {

    StageListener NONE = new StageListener() {
    };

    default void onMatch(MatchingStage stage, int stageNumber, Record left, Record right, double score) {
    }

    default void onStageComplete(MatchingStage stage, int stageNumber, int matched,
                                 int remainingLeft, int remainingRight) {
    }
}
