package com.example.pipeline.model;

import java.time.LocalDateTime;

/** Time spent in one stage; {@code endDate} is null for the stage the candidate is still in. */
public record TimeInStage(
        CandidateStatus status,
        LocalDateTime startDate,
        LocalDateTime endDate,
        long durationMs,
        double durationDays
) {
    public boolean isCurrent() {
        return endDate == null;
    }
}
