package com.example.pipeline.store;

import com.example.pipeline.model.Candidate;
import com.example.pipeline.model.CandidateStatus;
import com.example.pipeline.model.StatusHistoryEntry;

import java.util.List;
import java.util.Optional;

/**
 * Persistence seam for the pipeline core. Implementations throw {@link CandidateStoreException}
 * when the backing storage is unavailable.
 */
public interface CandidateStore {

    Optional<Candidate> findById(String candidateId);

    /** @param activeOnly when true, soft-deleted candidates are left out */
    List<Candidate> findAll(boolean activeOnly);

    /** @return false if a candidate with the same id already exists */
    boolean add(Candidate candidate);

    /**
     * Single indivisible step: if the stored status equals {@code expectedStatus}, append
     * {@code newEntry} to the ledger and set the status to {@code newStatus}.
     *
     * A null stored status compares as {@link Candidate#effectiveStatus()}.
     *
     * @return true if the swap was applied, false if the stored status did not match
     *         or the candidate does not exist or is soft-deleted
     */
    boolean compareAndSwapStatus(String candidateId, CandidateStatus expectedStatus,
                                 StatusHistoryEntry newEntry, CandidateStatus newStatus);

    /** Writes {@code initialEntry} as the only ledger entry, provided the ledger is still empty. */
    boolean initializeHistory(String candidateId, StatusHistoryEntry initialEntry);

    /** Sets {@code status}, provided the stored status is still null. */
    boolean repairMissingStatus(String candidateId, CandidateStatus status);

    boolean softDelete(String candidateId);
}
