package com.appreview.approval;

import com.appreview.review.ReviewStatus;

/**
 * Status filter for review listings. A null status matches every review.
 */
public record StatusFilter(ReviewStatus status) {

    private static final StatusFilter ALL = new StatusFilter(null);

    public static StatusFilter all() {
        return ALL;
    }

    public static StatusFilter of(ReviewStatus status) {
        return new StatusFilter(status);
    }

    /**
     * Parses {@code all} or any status name, case-insensitive. Null or blank means pending,
     * matching the moderation page's default tab.
     */
    public static StatusFilter parse(String value) {
        if (value == null || value.isBlank()) {
            return of(ReviewStatus.PENDING);
        }
        if ("all".equalsIgnoreCase(value.trim())) {
            return ALL;
        }
        return of(ReviewStatus.fromString(value));
    }

    public boolean matches(ReviewStatus candidate) {
        return status == null || status == candidate;
    }
}
