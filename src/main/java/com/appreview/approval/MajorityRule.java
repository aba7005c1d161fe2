package com.appreview.approval;

import com.appreview.review.ReviewStatus;

/**
 * Majority decision rule applied after every vote.
 */
public final class MajorityRule {

    private MajorityRule() {
    }

    /**
     * floor(n / 2) + 1 where n is the number of eligible supervisors.
     */
    public static int requiredApprovals(int eligibleSupervisors) {
        return eligibleSupervisors / 2 + 1;
    }

    /**
     * Evaluates the status a pending review should move to.
     *
     * @return {@code APPROVED} or {@code REJECTED} once either side reaches the threshold,
     * {@code CONFLICTED} when everyone voted without a majority, otherwise {@code PENDING}
     */
    public static ReviewStatus evaluate(ApprovalSummary summary) {
        if (summary.approved() >= summary.requiredApprovals()) {
            return ReviewStatus.APPROVED;
        }
        if (summary.rejected() >= summary.requiredApprovals()) {
            return ReviewStatus.REJECTED;
        }
        if (summary.totalEligibleSupervisors() > 0 && summary.allVoted()) {
            return ReviewStatus.CONFLICTED;
        }
        return ReviewStatus.PENDING;
    }
}
