package com.example.pipeline.service;

import com.example.pipeline.model.Candidate;
import com.example.pipeline.model.CandidateStatus;
import com.example.pipeline.model.StatusHistoryEntry;
import com.example.pipeline.model.StuckCandidate;
import com.example.pipeline.model.SystemWideTimeAnalytics;
import com.example.pipeline.model.SystemWideTimeAnalytics.BottleneckStage;
import com.example.pipeline.model.SystemWideTimeAnalytics.FunnelStage;
import com.example.pipeline.model.TimeInStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Population-wide time-in-stage statistics built from each candidate's stage breakdown.
 * Soft-deleted candidates are ignored. All averages are rounded to one decimal.
 */
@Component
public class SystemAnalyticsAggregator {

    private static final Logger log = LoggerFactory.getLogger(SystemAnalyticsAggregator.class);

    private static final Comparator<StuckCandidate> STUCK_ORDER =
            Comparator.comparingLong(StuckCandidate::daysInStage).reversed()
                    .thenComparing(StuckCandidate::candidateId);

    private final TimeInStageCalculator calculator;

    public SystemAnalyticsAggregator(TimeInStageCalculator calculator) {
        this.calculator = calculator;
    }

    public SystemWideTimeAnalytics computeSystemWide(List<Candidate> candidates, int thresholdDays) {
        return compute(candidates, thresholdDays, () -> false);
    }

    /**
     * Same as {@link #computeSystemWide(List, int)} but gives up once {@code timeout} has elapsed.
     *
     * @return empty if the cutoff was reached; a partially computed report is never returned
     */
    public Optional<SystemWideTimeAnalytics> computeSystemWide(List<Candidate> candidates, int thresholdDays,
                                                               Duration timeout) {
        if (timeout == null) return Optional.of(computeSystemWide(candidates, thresholdDays));
        long deadline = System.nanoTime() + Math.max(0L, timeout.toNanos());
        SystemWideTimeAnalytics report = compute(candidates, thresholdDays, () -> System.nanoTime() - deadline >= 0);
        if (report == null) {
            log.warn("System-wide analytics over {} candidates abandoned after {}", candidates.size(), timeout);
        }
        return Optional.ofNullable(report);
    }

    private SystemWideTimeAnalytics compute(List<Candidate> candidates, int thresholdDays, BooleanSupplier expired) {
        LocalDateTime now = calculator.now();
        List<Candidate> active = candidates.stream().filter(c -> !c.deleted()).toList();

        Map<CandidateStatus, List<Double>> pools = new EnumMap<>(CandidateStatus.class);
        Map<CandidateStatus, Integer> currentCounts = new EnumMap<>(CandidateStatus.class);
        List<StuckCandidate> stuck = new ArrayList<>();
        double hiredDaysSum = 0;
        int hiredCount = 0;
        long totalStatusChanges = 0;

        for (Candidate candidate : active) {
            if (expired.getAsBoolean()) return null;

            for (TimeInStage stage : calculator.stageBreakdown(candidate, now)) {
                pools.computeIfAbsent(stage.status(), s -> new ArrayList<>()).add(stage.durationDays());
            }
            currentCounts.merge(candidate.effectiveStatus(), 1, Integer::sum);
            totalStatusChanges += candidate.statusHistory().size();

            if (calculator.isStuck(candidate, thresholdDays, now)) {
                stuck.add(toStuck(candidate, now));
            }
            if (candidate.effectiveStatus() == CandidateStatus.HIRED) {
                hiredDaysSum += TimeInStageCalculator.toDays(calculator.totalTimeInProcessMs(candidate, now));
                hiredCount++;
            }
        }
        if (expired.getAsBoolean()) return null;

        Map<CandidateStatus, Double> averages = new EnumMap<>(CandidateStatus.class);
        Map<CandidateStatus, Double> medians  = new EnumMap<>(CandidateStatus.class);
        pools.forEach((status, durations) -> {
            averages.put(status, round1(mean(durations)));
            medians.put(status, median(durations));
        });

        List<BottleneckStage> bottlenecks = averages.entrySet().stream()
                .filter(e -> e.getValue() > thresholdDays / 2.0)
                .map(e -> new BottleneckStage(e.getKey(), e.getValue(), medians.get(e.getKey()),
                        pools.get(e.getKey()).size()))
                .sorted(Comparator.comparingDouble(BottleneckStage::averageDays).reversed())
                .toList();

        stuck.sort(STUCK_ORDER);

        int total = active.size();
        List<FunnelStage> funnel = new ArrayList<>();
        for (CandidateStatus status : CandidateStatus.values()) {
            int count = currentCounts.getOrDefault(status, 0);
            double rate = total > 0 ? (double) count / total * 100 : 0;
            funnel.add(new FunnelStage(status, count, round1(rate), round1(100 - rate),
                    averages.getOrDefault(status, 0.0)));
        }

        double timeToHire = hiredCount > 0 ? round1(hiredDaysSum / hiredCount) : 0;

        log.debug("System-wide analytics: {} candidates, {} stuck, {} bottleneck stages",
                total, stuck.size(), bottlenecks.size());
        return new SystemWideTimeAnalytics(
                Collections.unmodifiableMap(averages),
                Collections.unmodifiableMap(medians),
                bottlenecks,
                List.copyOf(stuck),
                List.copyOf(funnel),
                total,
                timeToHire,
                totalStatusChanges);
    }

    /** Active candidates past the threshold, longest wait first. */
    public List<StuckCandidate> stuckCandidates(List<Candidate> candidates, int thresholdDays) {
        LocalDateTime now = calculator.now();
        return candidates.stream()
                .filter(c -> !c.deleted())
                .filter(c -> calculator.isStuck(c, thresholdDays, now))
                .map(c -> toStuck(c, now))
                .sorted(STUCK_ORDER)
                .toList();
    }

    public List<StuckCandidate> stuckCandidatesInStage(List<Candidate> candidates, CandidateStatus status,
                                                       int thresholdDays) {
        return stuckCandidates(candidates.stream().filter(c -> c.effectiveStatus() == status).toList(), thresholdDays);
    }

    /**
     * Mean days from {@code fromStatus} to the next {@code toStatus} across all ledgers. A later
     * {@code fromStatus} replaces an earlier one that has not been closed yet, and each
     * {@code fromStatus} closes at most one interval.
     */
    public double averageTimeBetween(CandidateStatus fromStatus, CandidateStatus toStatus, List<Candidate> candidates) {
        List<Double> durations = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (candidate.deleted()) continue;
            LocalDateTime fromTime = null;
            for (StatusHistoryEntry entry : candidate.statusHistory()) {
                if (entry.changedAt() == null) continue;
                if (entry.newStatus() == fromStatus) {
                    fromTime = entry.changedAt();
                } else if (entry.newStatus() == toStatus && fromTime != null) {
                    durations.add(TimeInStageCalculator.toDays(Duration.between(fromTime, entry.changedAt()).toMillis()));
                    fromTime = null;
                }
            }
        }
        return durations.isEmpty() ? 0 : round1(mean(durations));
    }

    private StuckCandidate toStuck(Candidate candidate, LocalDateTime now) {
        return new StuckCandidate(candidate.candidateId(), candidate.name(), candidate.effectiveStatus(),
                calculator.timeInCurrentStageMs(candidate, now) / TimeInStageCalculator.MS_PER_DAY);
    }

    static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }

    static double median(List<Double> values) {
        if (values.isEmpty()) return 0;
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int mid = sorted.size() / 2;
        return sorted.size() % 2 == 0 ? (sorted.get(mid - 1) + sorted.get(mid)) / 2 : sorted.get(mid);
    }

    static double round1(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
