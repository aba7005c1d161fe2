package com.appreview.rest.dto;

import com.appreview.review.SupervisorDecision;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * REST response DTO for one supervisor decision.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DecisionResponse(
        String supervisorId,
        String decision,
        String comment,
        Instant decidedAt
) {
    public static DecisionResponse from(SupervisorDecision decision) {
        return new DecisionResponse(
                decision.supervisorId(),
                StatusNames.format(decision.decision()),
                decision.comment(),
                decision.decidedAt()
        );
    }
}
