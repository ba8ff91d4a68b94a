package com.sports.sync.tracing;

import com.sports.sync.core.model.EntityType;

/**
 * Interface for tracing synchronization calls.
 * The default {@link NoOpTracingService} does nothing; {@link OpenTelemetryTracingService}
 * reports spans through the OpenTelemetry API.
 */
public interface TracingService {

    String SYNCHRONIZE_SPAN = "sync.synchronize";
    String PAIR_SPAN = "sync.pair";

    /**
     * Starts the span covering one {@code synchronize()} call.
     */
    SyncSpan startSynchronization(EntityType type, int providers, int records);

    /**
     * Starts the span covering one pairwise strategy run.
     */
    SyncSpan startPair(EntityType type, String leftProvider, String rightProvider, int pass);
}
