package com.appreview.approval;

import com.appreview.review.Review;

/**
 * A review as seen by one actor, with blind-voting suppression applied.
 */
public record ReviewView(Review review, ApprovalDetails approval) {
}
