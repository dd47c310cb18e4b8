package com.example.pipeline.service;

import com.example.pipeline.model.Candidate;
import com.example.pipeline.model.CandidateTimeAnalytics;
import com.example.pipeline.model.StatusHistoryEntry;
import com.example.pipeline.model.TimeInStage;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds how long one candidate spent in each stage from its status ledger.
 *
 * <p>Entry {@code i} opens a stage at its {@code changedAt}; the next entry closes it. The last
 * stage stays open until {@code now}. With no ledger at all, the candidate has been in its
 * current stage since {@code dateCreated}, and process time is measured from there as well.
 * Entries missing a timestamp or status are skipped.
 */
@Component
public class TimeInStageCalculator {

    static final long MS_PER_HOUR = 60L * 60 * 1000;
    static final long MS_PER_DAY  = 24 * MS_PER_HOUR;

    private final Clock clock;

    public TimeInStageCalculator(Clock clock) {
        this.clock = clock;
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    public CandidateTimeAnalytics computeForCandidate(Candidate candidate, int thresholdDays) {
        return computeForCandidate(candidate, thresholdDays, now());
    }

    public CandidateTimeAnalytics computeForCandidate(Candidate candidate, int thresholdDays, LocalDateTime now) {
        List<StatusHistoryEntry> history = usableHistory(candidate);
        long currentMs = timeInCurrentStageMs(candidate, now);
        long totalMs   = totalTimeInProcessMs(candidate, now);

        LocalDateTime currentStart = history.isEmpty() ? processStart(candidate, now)
                : history.get(history.size() - 1).changedAt();

        return new CandidateTimeAnalytics(
                candidate.candidateId(),
                candidate.name(),
                candidate.effectiveStatus(),
                new CandidateTimeAnalytics.CurrentStage(currentMs, currentMs / MS_PER_DAY,
                        currentMs / MS_PER_HOUR, currentStart),
                stageBreakdown(candidate, now),
                new CandidateTimeAnalytics.TotalTime(totalMs, totalMs / MS_PER_DAY, processStart(candidate, now)),
                candidate.statusHistory().size(),
                isStuck(candidate, thresholdDays, now),
                thresholdDays);
    }

    public List<TimeInStage> stageBreakdown(Candidate candidate, LocalDateTime now) {
        List<StatusHistoryEntry> history = usableHistory(candidate);
        List<TimeInStage> stages = new ArrayList<>(history.size());
        for (int i = 0; i < history.size(); i++) {
            StatusHistoryEntry entry = history.get(i);
            LocalDateTime end = i + 1 < history.size() ? history.get(i + 1).changedAt() : null;
            long ms = between(entry.changedAt(), end != null ? end : now);
            stages.add(new TimeInStage(entry.newStatus(), entry.changedAt(), end, ms, toDays(ms)));
        }
        return stages;
    }

    public long timeInCurrentStageMs(Candidate candidate, LocalDateTime now) {
        List<StatusHistoryEntry> history = usableHistory(candidate);
        LocalDateTime start = history.isEmpty() ? processStart(candidate, now)
                : history.get(history.size() - 1).changedAt();
        return between(start, now);
    }

    public long totalTimeInProcessMs(Candidate candidate, LocalDateTime now) {
        return between(processStart(candidate, now), now);
    }

    public boolean isStuck(Candidate candidate, int thresholdDays, LocalDateTime now) {
        return toDays(timeInCurrentStageMs(candidate, now)) > thresholdDays;
    }

    /** First recorded transition, or {@code dateCreated} when there is none. */
    LocalDateTime processStart(Candidate candidate, LocalDateTime now) {
        List<StatusHistoryEntry> history = usableHistory(candidate);
        if (!history.isEmpty()) return history.get(0).changedAt();
        return candidate.dateCreated() != null ? candidate.dateCreated() : now;
    }

    static double toDays(long ms) {
        return (double) ms / MS_PER_DAY;
    }

    private static long between(LocalDateTime from, LocalDateTime to) {
        return Math.max(0L, Duration.between(from, to).toMillis());
    }

    private static List<StatusHistoryEntry> usableHistory(Candidate candidate) {
        return candidate.statusHistory().stream()
                .filter(e -> e != null && e.changedAt() != null && e.newStatus() != null)
                .toList();
    }
}
