package com.appreview.approval;

import com.appreview.directory.Actor;
import com.appreview.review.Review;
import com.appreview.review.SupervisorDecision;
import com.appreview.review.VoteDecision;

import java.util.List;
import java.util.Set;

/**
 * Applies the blind-voting rule when projecting a review for a viewer.
 *
 * <p>While a review is pending only aggregate counts (and the viewer's own vote) are
 * disclosed. Individual decisions are revealed once the review leaves pending, and
 * always to admins.</p>
 */
public final class ReviewProjector {

    private ReviewProjector() {
    }

    public static boolean canView(Review review, Actor viewer) {
        return viewer.isModerator() || review.isApproved() || review.isAuthoredBy(viewer.id());
    }

    public static ApprovalDetails approvalFor(Review review, List<SupervisorDecision> decisions,
                                              Set<String> roster, Actor viewer) {
        ApprovalSummary summary = ApprovalSummary.compute(decisions, roster);
        VoteDecision myDecision = decisions.stream()
                .filter(d -> d.supervisorId().equals(viewer.id()))
                .map(SupervisorDecision::decision)
                .findFirst()
                .orElse(null);
        boolean visible = viewer.isAdmin() || !review.isPending();
        return new ApprovalDetails(summary, visible, visible ? decisions : List.of(), myDecision);
    }

    public static ReviewView project(Review review, List<SupervisorDecision> decisions,
                                     Set<String> roster, Actor viewer) {
        return new ReviewView(review, approvalFor(review, decisions, roster, viewer));
    }
}
