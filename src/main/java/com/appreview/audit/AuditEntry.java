package com.appreview.audit;

import com.appreview.review.ReviewStatus;
import com.appreview.review.VoteDecision;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One line of a review's audit trail.
 *
 * <p>Status transitions carry {@code fromStatus}/{@code toStatus} and votes carry
 * {@code decision} as typed fields, so the trail can be replayed without parsing
 * {@code details}. Anything else an action wants to keep (app id, notes, tallies)
 * goes into {@code details}.</p>
 *
 * @param fromStatus status before the action, null when the action does not move the review
 * @param toStatus   status after the action, null when the action does not move the review
 * @param decision   the vote, only for {@link AuditAction#VOTE_CAST} and {@link AuditAction#VOTE_REPLACED}
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String reviewId,
        String actorId,
        ReviewStatus fromStatus,
        ReviewStatus toStatus,
        VoteDecision decision,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(reviewId, "reviewId is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        if ((fromStatus == null) != (toStatus == null)) {
            throw new IllegalArgumentException("fromStatus and toStatus must be set together");
        }
        if ((decision != null) != action.isVote()) {
            throw new IllegalArgumentException("decision is required for votes and only for votes: " + action);
        }
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static AuditEntry event(AuditAction action, String reviewId, String actorId,
                                   Map<String, Object> details, Instant at) {
        return new AuditEntry(UUID.randomUUID().toString(), action, reviewId, actorId,
                null, null, null, details, at);
    }

    public static AuditEntry transition(String reviewId, String actorId, ReviewStatus from, ReviewStatus to,
                                        Instant at) {
        Objects.requireNonNull(from, "from is required");
        Objects.requireNonNull(to, "to is required");
        return new AuditEntry(UUID.randomUUID().toString(), AuditAction.STATUS_CHANGED, reviewId, actorId,
                from, to, null, null, at);
    }

    public static AuditEntry vote(String reviewId, String supervisorId, VoteDecision decision, boolean replaced,
                                  Map<String, Object> details, Instant at) {
        return new AuditEntry(UUID.randomUUID().toString(),
                replaced ? AuditAction.VOTE_REPLACED : AuditAction.VOTE_CAST,
                reviewId, supervisorId, null, null, decision, details, at);
    }

    public boolean isTransition() {
        return toStatus != null;
    }
}
