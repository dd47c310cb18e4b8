package com.example.pipeline.model;

/**
 * Who requested a status change: a recruiter or an automated process.
 * {@code id} is mandatory, the display fields are cached for audit views.
 */
public record Actor(
        String id,
        String name,
        String email
) {
    public static final Actor SYSTEM = new Actor("system", "System", null);

    public static Actor of(String id) {
        return new Actor(id, null, null);
    }
}
