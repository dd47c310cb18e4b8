package com.example.pipeline.service;

import com.example.pipeline.event.StatusChangeEvent;
import com.example.pipeline.event.StatusChangePublisher;
import com.example.pipeline.model.Actor;
import com.example.pipeline.model.Candidate;
import com.example.pipeline.model.CandidateStatus;
import com.example.pipeline.model.StatusHistoryEntry;
import com.example.pipeline.store.CandidateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Applies candidate status changes as a compare-and-swap against the stored status.
 *
 * <p>A change commits only if the candidate is still in the status the caller last read. A
 * {@link TransitionOutcome#CONCURRENCY_CONFLICT} is an ordinary result: the caller re-reads the
 * candidate and decides again. Nothing here retries on its own.
 *
 * <p>Every commit, including one where the new status equals the old, appends a ledger entry and
 * is then published to the {@link StatusChangePublisher} without waiting for delivery.
 */
@Service
public class TransitionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(TransitionCoordinator.class);

    private final CandidateStore store;
    private final StatusChangePublisher publisher;
    private final Clock clock;

    public TransitionCoordinator(CandidateStore store, StatusChangePublisher publisher, Clock clock) {
        this.store = store;
        this.publisher = publisher;
        this.clock = clock;
    }

    public TransitionResult transition(String candidateId, CandidateStatus expectedStatus,
                                       CandidateStatus newStatus, Actor actor) {
        return transition(TransitionRequest.of(candidateId, expectedStatus, newStatus, actor));
    }

    public TransitionResult transition(TransitionRequest request) {
        validate(request);
        String id = request.candidateId();

        Optional<Candidate> found = store.findById(id).filter(c -> !c.deleted());
        if (found.isEmpty()) {
            log.debug("Transition rejected, candidate {} not found", id);
            return TransitionResult.notFound(id);
        }
        Candidate candidate = found.get();
        if (candidate.effectiveStatus() != request.expectedStatus()) {
            return conflict(id, request, candidate.effectiveStatus());
        }

        StatusHistoryEntry entry = StatusHistoryEntry.create(
                request.expectedStatus(), request.newStatus(), commitTime(candidate),
                request.actor(), request.reason(), request.notes(), request.source());

        if (!store.compareAndSwapStatus(id, request.expectedStatus(), entry, request.newStatus())) {
            return store.findById(id)
                    .filter(current -> !current.deleted())
                    .map(current -> conflict(id, request, current.effectiveStatus()))
                    .orElseGet(() -> TransitionResult.notFound(id));
        }

        // the ledger may have re-stamped the entry if a concurrent commit landed first
        StatusHistoryEntry committed = store.findById(id)
                .flatMap(c -> c.statusHistory().stream()
                        .filter(e -> e.historyId().equals(entry.historyId()))
                        .findFirst())
                .orElse(entry);

        log.info("Candidate {} moved {} -> {} by {} (source={})",
                id, request.expectedStatus().label(), request.newStatus().label(),
                request.actor().id(), committed.source().wireValue());

        publisher.publish(new StatusChangeEvent(id, candidate.name(), request.expectedStatus(),
                request.newStatus(), request.actor(), committed.historyId(), committed.changedAt()));
        return TransitionResult.committed(id, committed);
    }

    /** Creates a candidate in the initial status with an empty ledger. */
    public Candidate register(String candidateId, String name) {
        if (candidateId == null || candidateId.isBlank()) {
            throw new InvalidPipelineRequestException("candidateId is required");
        }
        Candidate candidate = Candidate.newCandidate(candidateId, name, LocalDateTime.now(clock));
        if (!store.add(candidate)) {
            throw new InvalidPipelineRequestException("Candidate already exists: " + candidateId);
        }
        log.info("Registered candidate {} ({}) in status {}", candidateId, name, candidate.effectiveStatus().label());
        return candidate;
    }

    private TransitionResult conflict(String id, TransitionRequest request, CandidateStatus actual) {
        log.debug("Transition conflict on candidate {}: expected {} but found {}",
                id, request.expectedStatus().label(), actual.label());
        return TransitionResult.conflict(id, actual);
    }

    private LocalDateTime commitTime(Candidate candidate) {
        LocalDateTime now = LocalDateTime.now(clock);
        if (!candidate.hasHistory()) return now;
        LocalDateTime last = candidate.statusHistory().get(candidate.statusHistory().size() - 1).changedAt();
        return last != null && last.isAfter(now) ? last : now;
    }

    private static void validate(TransitionRequest request) {
        if (request == null) throw new InvalidPipelineRequestException("Transition request is required");
        if (request.candidateId() == null || request.candidateId().isBlank()) {
            throw new InvalidPipelineRequestException("candidateId is required");
        }
        if (request.expectedStatus() == null) throw new InvalidPipelineRequestException("expectedStatus is required");
        if (request.newStatus() == null) throw new InvalidPipelineRequestException("newStatus is required");
        if (request.actor() == null || request.actor().id() == null || request.actor().id().isBlank()) {
            throw new InvalidPipelineRequestException("Actor identity (changedBy) is required");
        }
    }
}
