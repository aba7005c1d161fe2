package com.appreview.error;

/**
 * Raised when a per-review write could not be applied atomically: the review
 * lock could not be acquired in time, or the stored version moved underneath
 * the writer. Callers should re-read and retry.
 */
public class ConcurrencyConflictException extends ReviewApprovalException {

    public ConcurrencyConflictException(String message) {
        super(message);
    }

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
