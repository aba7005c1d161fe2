package com.appreview.review;

import java.util.Locale;

/**
 * Lifecycle status of a review.
 */
public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED,
    CONFLICTED,
    ESCALATED;

    /**
     * Returns true for the states that need an admin decision to reach a terminal status.
     * {@code ESCALATED} is treated exactly like {@code CONFLICTED}.
     */
    public boolean requiresAdminResolution() {
        return this == CONFLICTED || this == ESCALATED;
    }

    /**
     * Parses a status from string, case-insensitive. Accepts the legacy
     * {@code conflict} spelling used by the web client.
     *
     * @throws IllegalArgumentException if the value doesn't match any status
     */
    public static ReviewStatus fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Review status must not be null or blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("CONFLICT".equals(normalized)) {
            return CONFLICTED;
        }
        return valueOf(normalized);
    }
}
