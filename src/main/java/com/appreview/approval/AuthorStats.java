package com.appreview.approval;

/**
 * Review statistics of one author.
 */
public record AuthorStats(
        int totalReviews,
        int pendingReviews,
        int approvedReviews,
        int rejectedReviews,
        int awaitingAdminReviews,
        double averageRatingGiven
) {
}
