package com.example.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * {@code pipeline.*} settings.
 *
 * @param stuckThresholdDays        days in one stage after which a candidate counts as stuck
 * @param historyLimit              number of most recent ledger entries retained per candidate
 * @param analyticsTimeout          cutoff for population-wide analytics
 * @param eventDispatchThreads      worker threads delivering status change events
 * @param seedSampleData            load the demo population into the in-memory store
 * @param migrateHistoryOnStartup   backfill an initial ledger entry for candidates without history
 */
@ConfigurationProperties(prefix = "pipeline")
public record PipelineProperties(
        @DefaultValue("14") int stuckThresholdDays,
        @DefaultValue("50") int historyLimit,
        @DefaultValue("10s") Duration analyticsTimeout,
        @DefaultValue("2") int eventDispatchThreads,
        @DefaultValue("true") boolean seedSampleData,
        @DefaultValue("false") boolean migrateHistoryOnStartup
) {
    public PipelineProperties {
        if (stuckThresholdDays < 1) throw new IllegalArgumentException("pipeline.stuck-threshold-days must be positive");
        if (historyLimit < 1) throw new IllegalArgumentException("pipeline.history-limit must be positive");
        if (eventDispatchThreads < 1) throw new IllegalArgumentException("pipeline.event-dispatch-threads must be positive");
    }

    public static PipelineProperties defaults() {
        return new PipelineProperties(14, 50, Duration.ofSeconds(10), 2, false, false);
    }
}
