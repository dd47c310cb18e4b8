package com.example.pipeline.model;

public record StuckCandidate(
        String candidateId,
        String candidateName,
        CandidateStatus status,
        long daysInStage
) {}
