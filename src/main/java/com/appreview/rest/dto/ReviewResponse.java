package com.appreview.rest.dto;

import com.appreview.approval.ReviewView;
import com.appreview.review.Review;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * REST response DTO for a review. {@code approval} is absent on responses that
 * carry no vote data, such as the result of a submit or an admin action.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReviewResponse(
        String id,
        String appId,
        String authorId,
        String title,
        String content,
        int rating,
        List<String> tags,
        String status,
        Instant createdAt,
        Instant updatedAt,
        String reviewedBy,
        Instant reviewedAt,
        String rejectionReason,
        long version,
        ApprovalSummaryResponse approval
) {
    public static ReviewResponse from(Review review) {
        return from(review, null);
    }

    public static ReviewResponse from(ReviewView view) {
        return from(view.review(), ApprovalSummaryResponse.from(view.approval()));
    }

    private static ReviewResponse from(Review review, ApprovalSummaryResponse approval) {
        return new ReviewResponse(
                review.getId(),
                review.getAppId(),
                review.getAuthorId(),
                review.getTitle(),
                review.getContent(),
                review.getRating(),
                review.getTags(),
                StatusNames.format(review.getStatus()),
                review.getCreatedAt(),
                review.getUpdatedAt(),
                review.getReviewedBy(),
                review.getReviewedAt(),
                review.getRejectionReason(),
                review.getVersion(),
                approval
        );
    }
}
