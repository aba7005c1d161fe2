package com.appreview.rest.dto;

import com.appreview.error.ValidationException;
import com.appreview.review.ReviewContent;

import java.util.List;

/**
 * Request DTO for submitting a review of an app.
 */
public record SubmitReviewRequest(
        String appId,
        String title,
        String content,
        Integer rating,
        List<String> tags
) {
    public ReviewContent toContent() {
        if (rating == null) {
            throw new ValidationException("Rating is required");
        }
        return new ReviewContent(title, content, rating, tags);
    }
}
