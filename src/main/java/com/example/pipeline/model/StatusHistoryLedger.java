package com.example.pipeline.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only, size-bounded status ledger. Only the most recent {@code limit} entries are kept;
 * older ones are dropped on append. An entry stamped earlier than the last recorded change is
 * re-stamped to that instant so the ledger stays ordered by {@code changedAt}.
 */
public final class StatusHistoryLedger {

    public static final int DEFAULT_LIMIT = 50;

    private StatusHistoryLedger() {}

    public static List<StatusHistoryEntry> append(List<StatusHistoryEntry> ledger,
                                                  StatusHistoryEntry entry, int limit) {
        if (limit < 1) throw new IllegalArgumentException("History limit must be positive: " + limit);
        if (!ledger.isEmpty()) {
            LocalDateTime lastChange = ledger.get(ledger.size() - 1).changedAt();
            if (lastChange != null && entry.changedAt().isBefore(lastChange)) {
                entry = entry.withChangedAt(lastChange);
            }
        }
        List<StatusHistoryEntry> next = new ArrayList<>(ledger.size() + 1);
        next.addAll(ledger);
        next.add(entry);
        int overflow = next.size() - limit;
        return List.copyOf(overflow > 0 ? next.subList(overflow, next.size()) : next);
    }

    public static CandidateStatus currentStatus(List<StatusHistoryEntry> ledger) {
        return ledger.isEmpty() ? CandidateStatus.INITIAL : ledger.get(ledger.size() - 1).newStatus();
    }
}
