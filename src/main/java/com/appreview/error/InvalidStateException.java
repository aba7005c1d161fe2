package com.appreview.error;

import com.appreview.review.ReviewStatus;

/**
 * The operation is not legal for the review's current status.
 * Callers should re-fetch the review before trying again.
 */
public class InvalidStateException extends ReviewApprovalException {

    private final ReviewStatus currentStatus;

    public InvalidStateException(String message, ReviewStatus currentStatus) {
        super(message);
        this.currentStatus = currentStatus;
    }

    public ReviewStatus getCurrentStatus() {
        return currentStatus;
    }
}
