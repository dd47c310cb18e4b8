package com.example.pipeline.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.List;
import java.util.Map;

/**
 * Population-wide time-in-stage report. Stage maps only contain statuses that appear in at least
 * one candidate's history and are keyed by status label in JSON.
 */
public record SystemWideTimeAnalytics(
        @JsonSerialize(keyUsing = StatusKeySerializer.class) Map<CandidateStatus, Double> averageTimePerStage,
        @JsonSerialize(keyUsing = StatusKeySerializer.class) Map<CandidateStatus, Double> medianTimePerStage,
        List<BottleneckStage> bottleneckStages,
        List<StuckCandidate> stuckCandidates,
        List<FunnelStage> conversionFunnel,
        int totalCandidates,
        double averageTimeToHire,
        long totalStatusChanges
) {
    public record BottleneckStage(
            CandidateStatus status,
            double averageDays,
            double medianDays,
            int candidatesAffected
    ) {}

    /**
     * Share of the current population sitting in {@code status}. {@code conversionRate} is a
     * population share, not a stage-to-stage progression rate.
     */
    public record FunnelStage(
            CandidateStatus status,
            int candidateCount,
            double conversionRate,
            double dropOffRate,
            double averageDaysInStage
    ) {}
}
