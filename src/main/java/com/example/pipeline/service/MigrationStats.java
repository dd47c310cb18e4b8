package com.example.pipeline.service;

import java.util.List;

/**
 * @param repairedStatuses candidates whose missing status was restored; counted independently of
 *                         {@code migratedCandidates} and {@code skippedCandidates}
 */
public record MigrationStats(
        int totalCandidates,
        int migratedCandidates,
        int skippedCandidates,
        int repairedStatuses,
        int errors,
        List<ErrorDetail> errorDetails
) {
    public record ErrorDetail(String candidateId, String error) {}
}
