package com.sports.sync.metrics;

import com.sports.sync.core.model.EntityType;

import java.time.Duration;

/**
 * Interface for recording synchronization metrics.
 * The default {@link NoOpSyncMetrics} does nothing, so the engine works without a
 * metrics backend; {@link MicrometerSyncMetrics} publishes to a Micrometer registry.
 */
public interface SyncMetrics {

    void recordSynchronizationDuration(EntityType type, Duration duration);

    void incrementStageMatches(EntityType type, String stage);

    void recordSimilarityScore(EntityType type, double score);

    void incrementUnmatched(EntityType type, int count);

    void incrementRejectedLinks(EntityType type);

    void recordGroupSize(EntityType type, int records);
}
