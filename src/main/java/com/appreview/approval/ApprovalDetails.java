package com.appreview.approval;

import com.appreview.review.SupervisorDecision;
import com.appreview.review.VoteDecision;

import java.util.List;

/**
 * Role-filtered view of a review's votes.
 *
 * @param summary          aggregate counts, always visible
 * @param decisionsVisible whether individual decisions are disclosed to the viewer
 * @param decisions        individual decisions, empty when withheld
 * @param myDecision       the viewer's own vote, or null if they have not voted
 */
public record ApprovalDetails(
        ApprovalSummary summary,
        boolean decisionsVisible,
        List<SupervisorDecision> decisions,
        VoteDecision myDecision
) {
    public ApprovalDetails {
        decisions = decisions != null ? List.copyOf(decisions) : List.of();
    }
}
