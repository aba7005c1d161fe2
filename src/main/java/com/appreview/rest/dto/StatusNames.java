package com.appreview.rest.dto;

import com.appreview.error.ValidationException;
import com.appreview.review.ReviewStatus;
import com.appreview.review.VoteDecision;

import java.util.Locale;

/**
 * Wire spelling of statuses and decisions: lower case, as the web client sends them.
 */
public final class StatusNames {

    private StatusNames() {
    }

    public static String format(ReviewStatus status) {
        return status == null ? null : status.name().toLowerCase(Locale.ROOT);
    }

    public static String format(VoteDecision decision) {
        return decision == null ? null : decision.name().toLowerCase(Locale.ROOT);
    }

    public static ReviewStatus parseStatus(String value) {
        try {
            return ReviewStatus.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown status: " + value);
        }
    }

    public static VoteDecision parseDecision(String value) {
        try {
            return VoteDecision.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Decision must be either \"approved\" or \"rejected\"");
        }
    }
}
