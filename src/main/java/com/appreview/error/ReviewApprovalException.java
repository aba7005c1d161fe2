package com.appreview.error;

/**
 * Base type for every failure raised by the review approval engine.
 * All failures are terminal for the triggering request; the engine never retries.
 */
public abstract class ReviewApprovalException extends RuntimeException {

    protected ReviewApprovalException(String message) {
        super(message);
    }

    protected ReviewApprovalException(String message, Throwable cause) {
        super(message, cause);
    }
}
