package com.appreview.review;

import java.util.Locale;

/**
 * A supervisor's vote on a pending review.
 */
public enum VoteDecision {
    APPROVED,
    REJECTED;

    public ReviewStatus toStatus() {
        return this == APPROVED ? ReviewStatus.APPROVED : ReviewStatus.REJECTED;
    }

    public static VoteDecision fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Decision must be either \"approved\" or \"rejected\"");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
