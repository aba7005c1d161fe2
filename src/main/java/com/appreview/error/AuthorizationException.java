package com.appreview.error;

/**
 * The calling actor lacks the capability the operation requires.
 */
public class AuthorizationException extends ReviewApprovalException {

    public AuthorizationException(String message) {
        super(message);
    }
}
