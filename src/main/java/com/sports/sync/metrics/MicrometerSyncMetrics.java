package com.sports.sync.metrics;

import com.sports.sync.core.model.EntityType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link SyncMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code sync.duration} - Timer (tag: entityType)</li>
 *   <li>{@code sync.stage.matches} - Counter (tags: entityType, stage)</li>
 *   <li>{@code sync.similarity.score} - DistributionSummary (tag: entityType)</li>
 *   <li>{@code sync.unmatched} - Counter (tag: entityType)</li>
 *   <li>{@code sync.links.rejected} - Counter (tag: entityType)</li>
 *   <li>{@code sync.group.size} - DistributionSummary (tag: entityType)</li>
 * </ul>
 */
public class MicrometerSyncMetrics implements SyncMetrics {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();

    public MicrometerSyncMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordSynchronizationDuration(EntityType type, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(type.name(), k ->
                Timer.builder("sync.duration")
                        .description("Duration of one synchronize() call")
                        .tag("entityType", type.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementStageMatches(EntityType type, String stage) {
        String key = "stage:" + type.name() + ":" + stage;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("sync.stage.matches")
                        .description("Number of matches committed by a matching stage")
                        .tag("entityType", type.name())
                        .tag("stage", stage)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordSimilarityScore(EntityType type, double score) {
        summary("sync.similarity.score", "Scores of committed matches", type).record(score);
    }

    @Override
    public void incrementUnmatched(EntityType type, int count) {
        if (count <= 0) {
            return;
        }
        counter("sync.unmatched", "Records left without a counterpart", type).increment(count);
    }

    @Override
    public void incrementRejectedLinks(EntityType type) {
        counter("sync.links.rejected", "Matches rejected because of provider conflicts", type).increment();
    }

    @Override
    public void recordGroupSize(EntityType type, int records) {
        summary("sync.group.size", "Number of records per synchronized group", type).record(records);
    }

    private Counter counter(String name, String description, EntityType type) {
        return counterCache.computeIfAbsent(name + ":" + type.name(), k ->
                Counter.builder(name)
                        .description(description)
                        .tag("entityType", type.name())
                        .register(registry));
    }

    private DistributionSummary summary(String name, String description, EntityType type) {
        return summaryCache.computeIfAbsent(name + ":" + type.name(), k ->
                DistributionSummary.builder(name)
                        .description(description)
                        .tag("entityType", type.name())
                        .register(registry));
    }
}
