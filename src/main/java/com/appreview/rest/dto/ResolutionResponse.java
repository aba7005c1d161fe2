package com.appreview.rest.dto;

import com.appreview.review.ResolutionRecord;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * REST response DTO for an admin resolution record.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResolutionResponse(
        String id,
        String reviewId,
        String adminId,
        String kind,
        String previousStatus,
        String finalStatus,
        String notes,
        Instant timestamp
) {
    public static ResolutionResponse from(ResolutionRecord record) {
        return new ResolutionResponse(
                record.id(),
                record.reviewId(),
                record.adminId(),
                record.kind().name(),
                StatusNames.format(record.previousStatus()),
                StatusNames.format(record.finalStatus()),
                record.notes(),
                record.timestamp()
        );
    }
}
