package com.example.pipeline.service;

import com.example.pipeline.model.Actor;
import com.example.pipeline.model.Candidate;
import com.example.pipeline.model.CandidateStatus;
import com.example.pipeline.model.StatusChangeSource;
import com.example.pipeline.model.StatusHistoryEntry;
import com.example.pipeline.store.CandidateStore;
import com.example.pipeline.store.CandidateStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Backfills a single initial ledger entry for candidates that predate status history. The entry
 * records the candidate's current status as of {@code dateCreated}. Candidates that already have
 * history, or gain some while the run is in progress, are skipped.
 *
 * <p>Candidates stored without a status are first given the status their ledger implies, which
 * is {@link CandidateStatus#INITIAL} when the ledger is empty.
 */
@Service
public class StatusHistoryMigration {

    private static final Logger log = LoggerFactory.getLogger(StatusHistoryMigration.class);

    static final Actor MIGRATION_ACTOR = new Actor("system", "System Migration", "system@migration");
    static final String MIGRATION_REASON = "Initial status - migrated from existing data";

    private final CandidateStore store;
    private final Clock clock;

    public StatusHistoryMigration(CandidateStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public MigrationStats run() {
        List<Candidate> candidates = store.findAll(false);
        int migrated = 0;
        int skipped = 0;
        int repaired = 0;
        List<MigrationStats.ErrorDetail> errors = new ArrayList<>();
        LocalDateTime runAt = LocalDateTime.now(clock);

        log.info("Status history migration started over {} candidates", candidates.size());
        for (Candidate candidate : candidates) {
            try {
                if (candidate.hasMissingStatus()
                        && store.repairMissingStatus(candidate.candidateId(), candidate.effectiveStatus())) {
                    log.info("Repaired missing status of {} ({}) -> {}", candidate.candidateId(), candidate.name(),
                            candidate.effectiveStatus().label());
                    repaired++;
                }
                if (candidate.hasHistory()) {
                    log.debug("Skipping {} ({}), already has status history", candidate.candidateId(), candidate.name());
                    skipped++;
                } else if (store.initializeHistory(candidate.candidateId(), initialEntry(candidate, runAt))) {
                    log.debug("Migrated {} ({}) in status {}", candidate.candidateId(), candidate.name(),
                            candidate.effectiveStatus().label());
                    migrated++;
                } else {
                    skipped++;
                }
            } catch (CandidateStoreException e) {
                log.warn("Status history migration failed for {}: {}", candidate.candidateId(), e.getMessage());
                errors.add(new MigrationStats.ErrorDetail(candidate.candidateId(), e.getMessage()));
            }
        }

        MigrationStats stats = new MigrationStats(candidates.size(), migrated, skipped, repaired, errors.size(),
                List.copyOf(errors));
        log.info("Status history migration finished: total={} migrated={} skipped={} repaired={} errors={}",
                stats.totalCandidates(), stats.migratedCandidates(), stats.skippedCandidates(),
                stats.repairedStatuses(), stats.errors());
        return stats;
    }

    private static StatusHistoryEntry initialEntry(Candidate candidate, LocalDateTime runAt) {
        LocalDateTime changedAt = candidate.dateCreated() != null ? candidate.dateCreated() : runAt;
        CandidateStatus status = candidate.effectiveStatus();
        return StatusHistoryEntry.create(null, status, changedAt, MIGRATION_ACTOR,
                MIGRATION_REASON, "Migrated on " + runAt + ". Original status: " + status.label(),
                StatusChangeSource.MIGRATION);
    }
}
