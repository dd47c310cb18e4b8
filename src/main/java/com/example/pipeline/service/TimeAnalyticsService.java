package com.example.pipeline.service;

import com.example.pipeline.config.PipelineProperties;
import com.example.pipeline.model.CandidateStatus;
import com.example.pipeline.model.CandidateTimeAnalytics;
import com.example.pipeline.model.StuckCandidate;
import com.example.pipeline.model.SystemWideTimeAnalytics;
import com.example.pipeline.store.CandidateStore;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read-only analytics over the candidate store. Each call reads a fresh snapshot; results are as
 * of read time and are not isolated from concurrent transitions.
 *
 * <p>Every entry point takes an optional {@code thresholdDays}; null falls back to
 * {@code pipeline.stuck-threshold-days}.
 */
@Service
public class TimeAnalyticsService {

    private final CandidateStore store;
    private final TimeInStageCalculator calculator;
    private final SystemAnalyticsAggregator aggregator;
    private final PipelineProperties properties;

    public TimeAnalyticsService(CandidateStore store, TimeInStageCalculator calculator,
                                SystemAnalyticsAggregator aggregator, PipelineProperties properties) {
        this.store = store;
        this.calculator = calculator;
        this.aggregator = aggregator;
        this.properties = properties;
    }

    public Optional<CandidateTimeAnalytics> getCandidateTimeAnalytics(String candidateId, Integer thresholdDays) {
        int threshold = threshold(thresholdDays);
        return store.findById(candidateId)
                .filter(c -> !c.deleted())
                .map(c -> calculator.computeForCandidate(c, threshold));
    }

    /** @return empty if the population could not be processed within {@code pipeline.analytics-timeout} */
    public Optional<SystemWideTimeAnalytics> getSystemWideTimeAnalytics(Integer thresholdDays) {
        int threshold = threshold(thresholdDays);
        return aggregator.computeSystemWide(store.findAll(true), threshold, properties.analyticsTimeout());
    }

    public List<StuckCandidate> getStuckCandidates(Integer thresholdDays) {
        int threshold = threshold(thresholdDays);
        return aggregator.stuckCandidates(store.findAll(true), threshold);
    }

    public List<StuckCandidate> getCandidatesStuckInStage(CandidateStatus status, Integer thresholdDays) {
        if (status == null) throw new InvalidPipelineRequestException("status is required");
        int threshold = threshold(thresholdDays);
        return aggregator.stuckCandidatesInStage(store.findAll(true), status, threshold);
    }

    public double getAverageTimeBetweenStatuses(CandidateStatus fromStatus, CandidateStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            throw new InvalidPipelineRequestException("fromStatus and toStatus are required");
        }
        return aggregator.averageTimeBetween(fromStatus, toStatus, store.findAll(true));
    }

    public int defaultThresholdDays() {
        return properties.stuckThresholdDays();
    }

    private int threshold(Integer override) {
        if (override == null) return properties.stuckThresholdDays();
        if (override < 1) throw new InvalidPipelineRequestException("thresholdDays must be positive: " + override);
        return override;
    }
}
