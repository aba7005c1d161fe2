package com.appreview.rest.dto;

import com.appreview.approval.ApprovalDetails;
import com.appreview.approval.ApprovalSummary;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * REST response DTO for a review's vote tally.
 *
 * <p>{@code decisions} is omitted while individual votes are withheld from the caller.
 * {@code myDecision} is omitted when the caller has not voted.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApprovalSummaryResponse(
        int totalEligibleSupervisors,
        int approved,
        int rejected,
        int pending,
        int requiredApprovals,
        String myDecision,
        List<DecisionResponse> decisions
) {
    public static ApprovalSummaryResponse from(ApprovalDetails details) {
        ApprovalSummary summary = details.summary();
        List<DecisionResponse> decisions = details.decisionsVisible()
                ? details.decisions().stream().map(DecisionResponse::from).toList()
                : null;
        return new ApprovalSummaryResponse(
                summary.totalEligibleSupervisors(),
                summary.approved(),
                summary.rejected(),
                summary.pending(),
                summary.requiredApprovals(),
                StatusNames.format(details.myDecision()),
                decisions
        );
    }

    public static ApprovalSummaryResponse from(ApprovalSummary summary) {
        return new ApprovalSummaryResponse(
                summary.totalEligibleSupervisors(),
                summary.approved(),
                summary.rejected(),
                summary.pending(),
                summary.requiredApprovals(),
                null,
                null
        );
    }
}
