package com.appreview.approval;

import com.appreview.review.SupervisorDecision;

import java.util.Collection;
import java.util.Set;

/**
 * Aggregate vote counts of one review against the current supervisor roster.
 * Derived on every read; never stored.
 *
 * <p>Only decisions cast by supervisors on the current roster are counted, so
 * {@code approved + rejected + pending == totalEligibleSupervisors} always holds.</p>
 */
public record ApprovalSummary(
        int totalEligibleSupervisors,
        int approved,
        int rejected,
        int pending,
        int requiredApprovals
) {
    public ApprovalSummary {
        if (approved + rejected + pending != totalEligibleSupervisors) {
            throw new IllegalArgumentException("approved + rejected + pending must equal totalEligibleSupervisors");
        }
    }

    /**
     * Computes the summary from the review's decisions and the roster at evaluation time.
     */
    public static ApprovalSummary compute(Collection<SupervisorDecision> decisions, Set<String> roster) {
        int approved = 0;
        int rejected = 0;
        for (SupervisorDecision decision : decisions) {
            if (!roster.contains(decision.supervisorId())) {
                continue;
            }
            if (decision.isApproval()) {
                approved++;
            } else {
                rejected++;
            }
        }
        int total = roster.size();
        return new ApprovalSummary(total, approved, rejected, total - approved - rejected,
                MajorityRule.requiredApprovals(total));
    }

    public int votesCast() {
        return approved + rejected;
    }

    public boolean allVoted() {
        return pending == 0;
    }
}
