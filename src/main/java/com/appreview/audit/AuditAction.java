package com.appreview.audit;

/**
 * Types of auditable actions in the review approval workflow.
 */
public enum AuditAction {
    REVIEW_SUBMITTED,
    REVIEW_EDITED,
    REVIEW_WITHDRAWN,
    VOTE_CAST,
    VOTE_REPLACED,
    STATUS_CHANGED,
    ADMIN_OVERRIDE,
    CONFLICT_RESOLVED,
    REVIEW_ESCALATED;

    public boolean isVote() {
        return this == VOTE_CAST || this == VOTE_REPLACED;
    }
}
