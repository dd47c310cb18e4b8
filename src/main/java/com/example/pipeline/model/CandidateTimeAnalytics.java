package com.example.pipeline.model;

import java.time.LocalDateTime;
import java.util.List;

public record CandidateTimeAnalytics(
        String candidateId,
        String candidateName,
        CandidateStatus currentStatus,
        CurrentStage timeInCurrentStage,
        List<TimeInStage> stageBreakdown,
        TotalTime totalTimeInProcess,
        int totalStatusChanges,
        boolean isStuck,
        int stuckThresholdDays
) {
    public record CurrentStage(long durationMs, long durationDays, long durationHours, LocalDateTime startDate) {}

    public record TotalTime(long durationMs, long durationDays, LocalDateTime startDate) {}
}
