package com.appreview.error;

/**
 * Malformed input: rating out of range, empty content, duplicate review,
 * missing mandatory reason or notes.
 */
public class ValidationException extends ReviewApprovalException {

    public ValidationException(String message) {
        super(message);
    }
}
