package com.example.pipeline.model;

import java.time.LocalDateTime;
import java.util.UUID;

public record StatusHistoryEntry(
        String historyId,
        CandidateStatus oldStatus,
        CandidateStatus newStatus,
        LocalDateTime changedAt,
        String changedBy,
        String changedByName,
        String changedByEmail,
        String reason,
        String notes,
        StatusChangeSource source
) {
    public static StatusHistoryEntry create(CandidateStatus oldStatus, CandidateStatus newStatus,
                                            LocalDateTime changedAt, Actor actor,
                                            String reason, String notes, StatusChangeSource source) {
        return new StatusHistoryEntry(UUID.randomUUID().toString(), oldStatus, newStatus, changedAt,
                actor.id(), actor.name(), actor.email(), reason, notes,
                source != null ? source : StatusChangeSource.MANUAL);
    }

    public StatusHistoryEntry withChangedAt(LocalDateTime at) {
        return new StatusHistoryEntry(historyId, oldStatus, newStatus, at, changedBy,
                changedByName, changedByEmail, reason, notes, source);
    }

    public boolean isAutomated() {
        return source != StatusChangeSource.MANUAL;
    }
}
