package com.appreview.rest.dto;

import com.appreview.review.ReviewContent;

import java.util.List;

/**
 * Request DTO for editing a review. Omitted fields keep their current value.
 */
public record EditReviewRequest(
        String title,
        String content,
        Integer rating,
        List<String> tags
) {
    /**
     * Overlays the provided fields on the review's current content.
     */
    public ReviewContent applyTo(ReviewContent current) {
        return new ReviewContent(
                title != null ? title : current.title(),
                content != null ? content : current.content(),
                rating != null ? rating : current.rating(),
                tags != null ? tags : current.tags());
    }
}
