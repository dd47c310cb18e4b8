package com.example.pipeline.event;

import com.example.pipeline.model.Actor;
import com.example.pipeline.model.CandidateStatus;

import java.time.LocalDateTime;

public record StatusChangeEvent(
        String candidateId,
        String candidateName,
        CandidateStatus oldStatus,
        CandidateStatus newStatus,
        Actor actor,
        String historyId,
        LocalDateTime changedAt
) {}
