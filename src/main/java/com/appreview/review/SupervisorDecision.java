package com.appreview.review;

import java.time.Instant;
import java.util.Objects;

/**
 * One supervisor's vote on one review. Unique per (reviewId, supervisorId):
 * a re-vote replaces the previous decision instead of adding a second one.
 */
public record SupervisorDecision(
        String reviewId,
        String supervisorId,
        VoteDecision decision,
        String comment,
        Instant decidedAt
) {
    public SupervisorDecision {
        Objects.requireNonNull(reviewId, "reviewId is required");
        Objects.requireNonNull(supervisorId, "supervisorId is required");
        Objects.requireNonNull(decision, "decision is required");
        Objects.requireNonNull(decidedAt, "decidedAt is required");
    }

    public boolean isApproval() {
        return decision == VoteDecision.APPROVED;
    }
}
