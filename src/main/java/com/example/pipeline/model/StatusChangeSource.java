package com.example.pipeline.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/** Provenance tag of a status history entry. */
public enum StatusChangeSource {
    MANUAL("manual"),
    AUTOMATION("automation"),
    BULK_ACTION("bulk_action"),
    API("api"),
    MIGRATION("migration");

    private final String wireValue;

    StatusChangeSource(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public static Optional<StatusChangeSource> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String v = value.trim();
        return Arrays.stream(values())
                .filter(s -> s.wireValue.equalsIgnoreCase(v) || s.name().equalsIgnoreCase(v))
                .findFirst();
    }
}
