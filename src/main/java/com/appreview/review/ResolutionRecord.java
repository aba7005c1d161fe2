package com.appreview.review;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only record of an admin override, conflict resolution or escalation.
 * Never replaces the {@link SupervisorDecision}s of the review; they stay visible for history.
 */
public record ResolutionRecord(
        String id,
        String reviewId,
        String adminId,
        ResolutionKind kind,
        ReviewStatus previousStatus,
        ReviewStatus finalStatus,
        String notes,
        Instant timestamp
) {
    public ResolutionRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(reviewId, "reviewId is required");
        Objects.requireNonNull(adminId, "adminId is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(finalStatus, "finalStatus is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    public static ResolutionRecord of(String reviewId, String adminId, ResolutionKind kind,
                                      ReviewStatus previousStatus, ReviewStatus finalStatus,
                                      String notes, Instant timestamp) {
        return new ResolutionRecord(UUID.randomUUID().toString(), reviewId, adminId, kind,
                previousStatus, finalStatus, notes, timestamp);
    }
}
