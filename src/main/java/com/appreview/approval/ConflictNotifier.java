package com.appreview.approval;

import com.appreview.review.Review;

/**
 * Notified when a review needs an admin decision.
 * Implementations must not throw; a failed notification never fails the vote.
 */
public interface ConflictNotifier {

    void conflictDetected(Review review, ApprovalSummary summary);

    void reviewEscalated(Review review, String adminId, String reason);
}
