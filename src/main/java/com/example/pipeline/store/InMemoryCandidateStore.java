package com.example.pipeline.store;

import com.example.pipeline.model.Candidate;
import com.example.pipeline.model.CandidateStatus;
import com.example.pipeline.model.StatusHistoryEntry;
import com.example.pipeline.model.StatusHistoryLedger;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * {@link CandidateStore} backed by a {@link ConcurrentHashMap} of immutable {@link Candidate}
 * snapshots. Each write replaces the whole snapshot inside {@code computeIfPresent}, so status
 * and ledger change together and readers never see one without the other.
 */
public class InMemoryCandidateStore implements CandidateStore {

    private final Map<String, Candidate> store = new ConcurrentHashMap<>();
    private final int historyLimit;

    public InMemoryCandidateStore() {
        this(StatusHistoryLedger.DEFAULT_LIMIT);
    }

    public InMemoryCandidateStore(int historyLimit) {
        if (historyLimit < 1) throw new IllegalArgumentException("History limit must be positive: " + historyLimit);
        this.historyLimit = historyLimit;
    }

    @Override
    public Optional<Candidate> findById(String candidateId) {
        return Optional.ofNullable(store.get(candidateId));
    }

    @Override
    public List<Candidate> findAll(boolean activeOnly) {
        return store.values().stream()
                .filter(c -> !activeOnly || !c.deleted())
                .sorted(Comparator.comparing(Candidate::candidateId))
                .collect(Collectors.toList());
    }

    @Override
    public boolean add(Candidate candidate) {
        return store.putIfAbsent(candidate.candidateId(), candidate) == null;
    }

    @Override
    public boolean compareAndSwapStatus(String candidateId, CandidateStatus expectedStatus,
                                        StatusHistoryEntry newEntry, CandidateStatus newStatus) {
        if (newEntry.newStatus() != newStatus) {
            throw new IllegalArgumentException("Entry status " + newEntry.newStatus()
                    + " does not match target status " + newStatus);
        }
        AtomicBoolean swapped = new AtomicBoolean(false);
        store.computeIfPresent(candidateId, (id, current) -> {
            if (current.deleted() || current.effectiveStatus() != expectedStatus) return current;
            swapped.set(true);
            return current.withTransition(newEntry, historyLimit);
        });
        return swapped.get();
    }

    @Override
    public boolean initializeHistory(String candidateId, StatusHistoryEntry initialEntry) {
        AtomicBoolean written = new AtomicBoolean(false);
        store.computeIfPresent(candidateId, (id, current) -> {
            if (current.hasHistory()) return current;
            written.set(true);
            return current.withTransition(initialEntry, historyLimit);
        });
        return written.get();
    }

    @Override
    public boolean repairMissingStatus(String candidateId, CandidateStatus status) {
        AtomicBoolean repaired = new AtomicBoolean(false);
        store.computeIfPresent(candidateId, (id, current) -> {
            if (!current.hasMissingStatus()) return current;
            repaired.set(true);
            return current.withStatus(status);
        });
        return repaired.get();
    }

    @Override
    public boolean softDelete(String candidateId) {
        return store.computeIfPresent(candidateId, (id, current) -> current.markDeleted()) != null;
    }

    public int historyLimit() {
        return historyLimit;
    }

    public int size() {
        return store.size();
    }
}
