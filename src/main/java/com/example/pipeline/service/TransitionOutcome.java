package com.example.pipeline.service;

public enum TransitionOutcome {
    COMMITTED,
    /** Stored status no longer matched the caller's expected status. Re-read and re-decide. */
    CONCURRENCY_CONFLICT,
    NOT_FOUND
}
