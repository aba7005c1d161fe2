package com.appreview.approval;

import com.appreview.directory.Actor;
import com.appreview.review.Review;
import com.appreview.review.ReviewStatus;
import com.appreview.review.SupervisorDecision;
import com.appreview.review.VoteDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReviewProjectorTest {

    private static final Set<String> ROSTER = Set.of("sup-1", "sup-2", "sup-3");

    private Review review(ReviewStatus status) {
        return Review.builder()
                .id("r-1")
                .appId("app-1")
                .authorId("alice")
                .content("text")
                .rating(4)
                .status(status)
                .build();
    }

    private final List<SupervisorDecision> decisions = List.of(
            new SupervisorDecision("r-1", "sup-1", VoteDecision.APPROVED, "good", Instant.now()),
            new SupervisorDecision("r-1", "sup-2", VoteDecision.REJECTED, "bad", Instant.now()));

    @Test
    @DisplayName("Pending reviews are visible to moderators and the author only")
    void pendingVisibility() {
        Review pending = review(ReviewStatus.PENDING);

        assertTrue(ReviewProjector.canView(pending, Actor.user("alice")));
        assertTrue(ReviewProjector.canView(pending, Actor.supervisor("sup-1")));
        assertTrue(ReviewProjector.canView(pending, Actor.admin("root")));
        assertFalse(ReviewProjector.canView(pending, Actor.user("bob")));
    }

    @Test
    @DisplayName("Approved reviews are visible to everyone, rejected ones are not")
    void decidedVisibility() {
        assertTrue(ReviewProjector.canView(review(ReviewStatus.APPROVED), Actor.user("bob")));
        assertFalse(ReviewProjector.canView(review(ReviewStatus.REJECTED), Actor.user("bob")));
    }

    @Test
    @DisplayName("Pending decisions are withheld from supervisors but not admins")
    void blindWhilePending() {
        Review pending = review(ReviewStatus.PENDING);

        ApprovalDetails supervisorView = ReviewProjector.approvalFor(pending, decisions, ROSTER, Actor.supervisor("sup-2"));
        assertFalse(supervisorView.decisionsVisible());
        assertTrue(supervisorView.decisions().isEmpty());
        assertEquals(VoteDecision.REJECTED, supervisorView.myDecision());
        assertEquals(1, supervisorView.summary().approved());
        assertEquals(1, supervisorView.summary().rejected());

        ApprovalDetails adminView = ReviewProjector.approvalFor(pending, decisions, ROSTER, Actor.admin("root"));
        assertTrue(adminView.decisionsVisible());
        assertEquals(2, adminView.decisions().size());
        assertNull(adminView.myDecision());
    }

    @Test
    @DisplayName("Conflicted reviews reveal every decision")
    void revealedOnceDecided() {
        ReviewView view = ReviewProjector.project(review(ReviewStatus.CONFLICTED), decisions, ROSTER,
                Actor.supervisor("sup-3"));

        assertTrue(view.approval().decisionsVisible());
        assertEquals(2, view.approval().decisions().size());
    }
}
