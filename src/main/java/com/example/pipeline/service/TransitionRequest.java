package com.example.pipeline.service;

import com.example.pipeline.model.Actor;
import com.example.pipeline.model.CandidateStatus;
import com.example.pipeline.model.StatusChangeSource;

public record TransitionRequest(
        String candidateId,
        CandidateStatus expectedStatus,
        CandidateStatus newStatus,
        Actor actor,
        String reason,
        String notes,
        StatusChangeSource source
) {
    public static TransitionRequest of(String candidateId, CandidateStatus expectedStatus,
                                       CandidateStatus newStatus, Actor actor) {
        return new TransitionRequest(candidateId, expectedStatus, newStatus, actor, null, null, StatusChangeSource.MANUAL);
    }
}
