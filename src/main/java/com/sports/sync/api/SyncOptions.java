package com.sports.sync.api;

import com.sports.sync.metrics.NoOpSyncMetrics;
import com.sports.sync.metrics.SyncMetrics;
import com.sports.sync.similarity.ContainmentMatcher;
import com.sports.sync.strategy.StrategySettings;
import com.sports.sync.tracing.NoOpTracingService;
import com.sports.sync.tracing.TracingService;

import java.util.Objects;

/**
 * Options for synchronization calls.
 * Configures stage thresholds, context partitioning, verbosity and the
 * metrics and tracing backends.
 */
public class SyncOptions {

    private final boolean verbose;
    private final boolean useCompetitionContext;
    private final StrategySettings strategySettings;
    private final SyncMetrics metrics;
    private final TracingService tracing;

    private SyncOptions(Builder builder) {
        this.verbose = builder.verbose;
        this.useCompetitionContext = builder.useCompetitionContext;
        this.strategySettings = new StrategySettings(builder.similarityThreshold,
                builder.matchDateToleranceDays, builder.birthDateToleranceDays, builder.minimumTokenLength);
        this.metrics = builder.metrics;
        this.tracing = builder.tracing;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isUseCompetitionContext() {
        return useCompetitionContext;
    }

    public StrategySettings getStrategySettings() {
        return strategySettings;
    }

    public double getSimilarityThreshold() {
        return strategySettings.similarityThreshold();
    }

    public int getMatchDateToleranceDays() {
        return strategySettings.matchDateToleranceDays();
    }

    public int getBirthDateToleranceDays() {
        return strategySettings.birthDateToleranceDays();
    }

    public int getMinimumTokenLength() {
        return strategySettings.minimumTokenLength();
    }

    public SyncMetrics getMetrics() {
        return metrics;
    }

    public TracingService getTracing() {
        return tracing;
    }

    /**
     * Creates default options.
     */
    public static SyncOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options that log every stage and committed match at INFO.
     */
    public static SyncOptions verbose() {
        return builder().verbose(true).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean verbose = false;
        private boolean useCompetitionContext = false;
        private double similarityThreshold = StrategySettings.DEFAULT_SIMILARITY_THRESHOLD;
        private int matchDateToleranceDays = StrategySettings.DEFAULT_MATCH_DATE_TOLERANCE_DAYS;
        private int birthDateToleranceDays = StrategySettings.DEFAULT_BIRTH_DATE_TOLERANCE_DAYS;
        private int minimumTokenLength = ContainmentMatcher.DEFAULT_MINIMUM_TOKEN_LENGTH;
        private SyncMetrics metrics = new NoOpSyncMetrics();
        private TracingService tracing = new NoOpTracingService();

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder useCompetitionContext(boolean useCompetitionContext) {
            this.useCompetitionContext = useCompetitionContext;
            return this;
        }

        public Builder similarityThreshold(double similarityThreshold) {
            if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
                throw new IllegalArgumentException("similarityThreshold must be between 0.0 and 1.0");
            }
            this.similarityThreshold = similarityThreshold;
            return this;
        }

        public Builder matchDateToleranceDays(int matchDateToleranceDays) {
            validateTolerance(matchDateToleranceDays, "matchDateToleranceDays");
            this.matchDateToleranceDays = matchDateToleranceDays;
            return this;
        }

        public Builder birthDateToleranceDays(int birthDateToleranceDays) {
            validateTolerance(birthDateToleranceDays, "birthDateToleranceDays");
            this.birthDateToleranceDays = birthDateToleranceDays;
            return this;
        }

        public Builder minimumTokenLength(int minimumTokenLength) {
            if (minimumTokenLength < 1) {
                throw new IllegalArgumentException("minimumTokenLength must be at least 1");
            }
            this.minimumTokenLength = minimumTokenLength;
            return this;
        }

        public Builder metrics(SyncMetrics metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics is required");
            return this;
        }

        public Builder tracing(TracingService tracing) {
            this.tracing = Objects.requireNonNull(tracing, "tracing is required");
            return this;
        }

        public SyncOptions build() {
            return new SyncOptions(this);
        }

        private void validateTolerance(int value, String name) {
            if (value < 0) {
                throw new IllegalArgumentException(name + " must not be negative");
            }
        }
    }

    @Override
    public String toString() {
        return "SyncOptions{" +
                "verbose=" + verbose +
                ", useCompetitionContext=" + useCompetitionContext +
                ", similarityThreshold=" + strategySettings.similarityThreshold() +
                ", matchDateToleranceDays=" + strategySettings.matchDateToleranceDays() +
                ", birthDateToleranceDays=" + strategySettings.birthDateToleranceDays() +
                ", minimumTokenLength=" + strategySettings.minimumTokenLength() +
                '}';
    }
}
