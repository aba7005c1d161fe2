package com.appreview.error;

public class ReviewNotFoundException extends ReviewApprovalException {

    private final String reviewId;

    public ReviewNotFoundException(String reviewId) {
        super("Review not found: " + reviewId);
        this.reviewId = reviewId;
    }

    public String getReviewId() {
        return reviewId;
    }
}
