package com.example.pipeline.store;

import com.example.pipeline.model.Actor;
import com.example.pipeline.model.Candidate;
import com.example.pipeline.model.CandidateStatus;
import com.example.pipeline.model.StatusChangeSource;
import com.example.pipeline.model.StatusHistoryEntry;
import com.example.pipeline.model.StatusHistoryLedger;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static com.example.pipeline.model.CandidateStatus.APPLIED;
import static com.example.pipeline.model.CandidateStatus.HIRED;
import static com.example.pipeline.model.CandidateStatus.OFFER;
import static com.example.pipeline.model.CandidateStatus.REFERENCE_CHECK;
import static com.example.pipeline.model.CandidateStatus.REJECTED;
import static com.example.pipeline.model.CandidateStatus.WITHDRAWN;

/** Demo population with histories spread over the last few months. */
public final class SampleCandidates {

    private static final Actor RECRUITER_1 = new Actor("recruiter-1", "Jane Smith", "jane.smith@example.com");
    private static final Actor RECRUITER_2 = new Actor("recruiter-2", "Mark Johnson", "mark.johnson@example.com");
    private static final Actor RECRUITER_3 = new Actor("recruiter-3", "Tom Wilson", "tom.wilson@example.com");

    private SampleCandidates() {}

    public static List<Candidate> build(Clock clock) {
        LocalDateTime base = LocalDateTime.now(clock);
        return List.of(
            candidate("C001", "Alice Johnson", base.minusDays(28),
                step(APPLIED,         base.minusDays(28), Actor.SYSTEM, "Application received"),
                step(REFERENCE_CHECK, base.minusDays(20), RECRUITER_1,  "Final interview passed, checking references")),
            candidate("C002", "Bob Smith", base.minusDays(18),
                step(APPLIED,         base.minusDays(18), Actor.SYSTEM, "Referred by Head of Research"),
                step(REFERENCE_CHECK, base.minusDays(7),  RECRUITER_2,  "Strong ML profile")),
            candidate("C003", "Carol Williams", base.minusDays(10),
                step(APPLIED,         base.minusDays(10), Actor.SYSTEM, "Application received")),
            candidate("C004", "David Brown", base.minusDays(40),
                step(APPLIED,         base.minusDays(40), Actor.SYSTEM, "Agency submission"),
                step(REFERENCE_CHECK, base.minusDays(25), RECRUITER_1,  "Passed all technical rounds"),
                step(OFFER,           base.minusDays(5),  RECRUITER_1,  "Offer sent")),
            candidate("C005", "Emma Davis", base.minusDays(80),
                step(APPLIED,         base.minusDays(80), Actor.SYSTEM, "Application received"),
                step(REFERENCE_CHECK, base.minusDays(63), RECRUITER_3,  "Excellent fit"),
                step(OFFER,           base.minusDays(50), RECRUITER_3,  "Offer extended"),
                step(HIRED,           base.minusDays(30), RECRUITER_3,  "Offer accepted")),
            candidate("C006", "Frank Lee", base.minusDays(50),
                step(APPLIED,         base.minusDays(50), Actor.SYSTEM, "Application received"),
                step(REJECTED,        base.minusDays(46), RECRUITER_3,  "Skills mismatch for platform role")),
            candidate("C007", "Grace Kim", base.minusDays(35),
                step(APPLIED,         base.minusDays(35), Actor.SYSTEM, "Application received"),
                step(REFERENCE_CHECK, base.minusDays(30), RECRUITER_2,  "Moving to references"),
                step(APPLIED,         base.minusDays(24), RECRUITER_2,  "Reference unreachable, back to review"),
                step(REFERENCE_CHECK, base.minusDays(21), RECRUITER_2,  "New reference provided"),
                step(WITHDRAWN,       base.minusDays(19), RECRUITER_2,  "Accepted another offer")),
            // registered before status history existed; picked up by the history migration
            new Candidate("C008", "Henry Park", base.minusDays(16), APPLIED, List.of(), false)
        );
    }

    public static int seed(CandidateStore store, Clock clock) {
        int added = 0;
        for (Candidate candidate : build(clock)) {
            if (store.add(candidate)) added++;
        }
        return added;
    }

    private record Step(CandidateStatus status, LocalDateTime at, Actor actor, String reason) {}

    private static Step step(CandidateStatus status, LocalDateTime at, Actor actor, String reason) {
        return new Step(status, at, actor, reason);
    }

    private static Candidate candidate(String id, String name, LocalDateTime created, Step... steps) {
        List<StatusHistoryEntry> ledger = new ArrayList<>();
        CandidateStatus previous = null;
        for (Step s : steps) {
            StatusChangeSource source = s.actor() == Actor.SYSTEM ? StatusChangeSource.AUTOMATION : StatusChangeSource.MANUAL;
            ledger = StatusHistoryLedger.append(ledger,
                    StatusHistoryEntry.create(previous, s.status(), s.at(), s.actor(), s.reason(), null, source),
                    StatusHistoryLedger.DEFAULT_LIMIT);
            previous = s.status();
        }
        return new Candidate(id, name, created, StatusHistoryLedger.currentStatus(ledger), ledger, false);
    }
}
