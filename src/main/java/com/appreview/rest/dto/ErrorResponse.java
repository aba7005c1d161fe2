package com.appreview.rest.dto;

import com.appreview.error.AuthorizationException;
import com.appreview.error.ConcurrencyConflictException;
import com.appreview.error.InvalidStateException;
import com.appreview.error.ReviewApprovalException;
import com.appreview.error.ReviewNotFoundException;
import com.appreview.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Standardized error response DTO.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        int status,
        String error,
        String message,
        String path,
        Instant timestamp,
        Map<String, String> details
) {
    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now(), null);
    }

    public static ErrorResponse badRequest(String message, String path) {
        return new ErrorResponse(400, "Bad Request", message, path);
    }

    public static ErrorResponse unauthorized(String message, String path) {
        return new ErrorResponse(401, "Unauthorized", message, path);
    }

    public static ErrorResponse forbidden(String message, String path) {
        return new ErrorResponse(403, "Forbidden", message, path);
    }

    public static ErrorResponse notFound(String message, String path) {
        return new ErrorResponse(404, "Not Found", message, path);
    }

    public static ErrorResponse conflict(String message, String path) {
        return new ErrorResponse(409, "Conflict", message, path);
    }

    public static ErrorResponse internalError(String message, String path) {
        return new ErrorResponse(500, "Internal Server Error", message, path);
    }

    /**
     * Maps an engine failure to its HTTP error body.
     */
    public static ErrorResponse of(ReviewApprovalException e, String path) {
        if (e instanceof ValidationException) {
            return badRequest(e.getMessage(), path);
        }
        if (e instanceof AuthorizationException) {
            return forbidden(e.getMessage(), path);
        }
        if (e instanceof ReviewNotFoundException) {
            return notFound(e.getMessage(), path);
        }
        if (e instanceof ConcurrencyConflictException) {
            return new ErrorResponse(409, "Concurrency Conflict", e.getMessage(), path);
        }
        if (e instanceof InvalidStateException invalidState) {
            Map<String, String> details = invalidState.getCurrentStatus() != null
                    ? Map.of("currentStatus", StatusNames.format(invalidState.getCurrentStatus()))
                    : null;
            return new ErrorResponse(409, "Conflict", e.getMessage(), path, Instant.now(), details);
        }
        return internalError(e.getMessage(), path);
    }
}
