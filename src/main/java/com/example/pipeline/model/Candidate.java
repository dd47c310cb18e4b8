package com.example.pipeline.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * The slice of a candidate the pipeline core depends on. Profile data lives elsewhere.
 */
public record Candidate(
        String candidateId,
        String name,
        LocalDateTime dateCreated,
        CandidateStatus currentStatus,
        List<StatusHistoryEntry> statusHistory,
        boolean deleted
) {
    public Candidate {
        statusHistory = statusHistory == null ? List.of() : List.copyOf(statusHistory);
    }

    public static Candidate newCandidate(String candidateId, String name, LocalDateTime dateCreated) {
        return new Candidate(candidateId, name, dateCreated, CandidateStatus.INITIAL, List.of(), false);
    }

    /**
     * The stored status, or the status the ledger implies when none is stored. Records written
     * before status was mandatory can carry a null status.
     */
    public CandidateStatus effectiveStatus() {
        return currentStatus != null ? currentStatus : StatusHistoryLedger.currentStatus(statusHistory);
    }

    public boolean hasMissingStatus() {
        return currentStatus == null;
    }

    public boolean hasHistory() {
        return !statusHistory.isEmpty();
    }

    public Candidate withTransition(StatusHistoryEntry entry, int historyLimit) {
        return new Candidate(candidateId, name, dateCreated, entry.newStatus(),
                StatusHistoryLedger.append(statusHistory, entry, historyLimit), deleted);
    }

    public Candidate withStatus(CandidateStatus status) {
        return new Candidate(candidateId, name, dateCreated, status, statusHistory, deleted);
    }

    public Candidate markDeleted() {
        return new Candidate(candidateId, name, dateCreated, currentStatus, statusHistory, true);
    }
}
