package com.example.pipeline.service;

import com.example.pipeline.model.CandidateStatus;
import com.example.pipeline.model.StatusHistoryEntry;

/**
 * @param currentStatus status stored after the attempt: the new status when committed, the status
 *                      that caused the conflict otherwise, null when the candidate was not found
 * @param entry         the appended ledger entry, only set when committed
 */
public record TransitionResult(
        TransitionOutcome outcome,
        String candidateId,
        CandidateStatus currentStatus,
        StatusHistoryEntry entry
) {
    static TransitionResult committed(String candidateId, StatusHistoryEntry entry) {
        return new TransitionResult(TransitionOutcome.COMMITTED, candidateId, entry.newStatus(), entry);
    }

    static TransitionResult conflict(String candidateId, CandidateStatus actualStatus) {
        return new TransitionResult(TransitionOutcome.CONCURRENCY_CONFLICT, candidateId, actualStatus, null);
    }

    static TransitionResult notFound(String candidateId) {
        return new TransitionResult(TransitionOutcome.NOT_FOUND, candidateId, null, null);
    }

    public boolean isCommitted() {
        return outcome == TransitionOutcome.COMMITTED;
    }
}
