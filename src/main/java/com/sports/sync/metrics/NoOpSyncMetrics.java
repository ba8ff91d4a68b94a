package com.sports.sync.metrics;

import com.sports.sync.core.model.EntityType;

import java.time.Duration;

/**
 * No-op implementation of {@link SyncMetrics}.
 */
public class NoOpSyncMetrics implements SyncMetrics {

    @Override
    public void recordSynchronizationDuration(EntityType type, Duration duration) {
    }

    @Override
    public void incrementStageMatches(EntityType type, String stage) {
    }

    @Override
    public void recordSimilarityScore(EntityType type, double score) {
    }

    @Override
    public void incrementUnmatched(EntityType type, int count) {
    }

    @Override
    public void incrementRejectedLinks(EntityType type) {
    }

    @Override
    public void recordGroupSize(EntityType type, int records) {
    }
}
