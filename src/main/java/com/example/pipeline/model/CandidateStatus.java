package com.example.pipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Pipeline stages a candidate can occupy. Declaration order is the conventional order of the
 * funnel; no transition graph is enforced, any status may follow any other.
 */
public enum CandidateStatus {
    APPLIED("Applied"),
    REFERENCE_CHECK("Reference Check"),
    OFFER("Offer"),
    HIRED("Hired"),
    REJECTED("Rejected"),
    WITHDRAWN("Withdrawn");

    /** Status every candidate starts in before any transition is recorded. */
    public static final CandidateStatus INITIAL = APPLIED;

    private final String label;

    CandidateStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == HIRED || this == REJECTED || this == WITHDRAWN;
    }

    /** Accepts either the constant name or the display label, ignoring case. */
    public static Optional<CandidateStatus> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String v = value.trim();
        return Arrays.stream(values())
                .filter(s -> s.name().equalsIgnoreCase(v) || s.label.equalsIgnoreCase(v))
                .findFirst();
    }

    @JsonCreator
    static CandidateStatus fromJson(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown status: " + value));
    }
}
