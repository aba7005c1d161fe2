package com.appreview.rest;

import com.appreview.approval.ReviewApprovalService;
import com.appreview.approval.SupervisorStats;
import com.appreview.catalog.InMemoryAppCatalog;
import com.appreview.directory.Actor;
import com.appreview.directory.InMemoryActorDirectory;
import com.appreview.error.ConcurrencyConflictException;
import com.appreview.lock.ReviewLock;
import com.appreview.rest.dto.AdminOverrideRequest;
import com.appreview.rest.dto.CastVoteRequest;
import com.appreview.rest.dto.ErrorResponse;
import com.appreview.rest.dto.EscalateRequest;
import com.appreview.rest.dto.ResolutionResponse;
import com.appreview.rest.dto.ResolveConflictRequest;
import com.appreview.rest.dto.ReviewResponse;
import com.appreview.rest.security.ActorPrincipal;
import com.appreview.review.Review;
import com.appreview.review.ReviewContent;
import com.appreview.review.ReviewStatus;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ModerationResourceTest {

    private InMemoryActorDirectory directory;
    private InMemoryAppCatalog catalog;
    private ReviewApprovalService service;
    private ModerationResource resource;

    @BeforeEach
    void setUp() {
        directory = new InMemoryActorDirectory(List.of("sup-1", "sup-2"), List.of("root"));
        catalog = new InMemoryAppCatalog();
        catalog.register("app-1");
        service = ReviewApprovalService.builder()
                .directory(directory)
                .appCatalog(catalog)
                .build();
        resource = new ModerationResource(service, directory);
    }

    private static SecurityContext as(String actorId) {
        SecurityContext sc = mock(SecurityContext.class);
        when(sc.getUserPrincipal()).thenReturn(new ActorPrincipal(actorId));
        return sc;
    }

    private Review seed() {
        return service.submit(Actor.user("alice"), "app-1", ReviewContent.of("Handy", 4));
    }

    private Review conflicted() {
        Review review = seed();
        resource.castVote(review.getId(), new CastVoteRequest("approved", null), as("sup-1"));
        resource.castVote(review.getId(), new CastVoteRequest("rejected", null), as("sup-2"));
        return review;
    }

    @Test
    @DisplayName("Should record a vote and return the evaluated review")
    void castVote() {
        Review review = seed();

        Response first = resource.castVote(review.getId(), new CastVoteRequest("approved", "ok"), as("sup-1"));
        assertEquals(200, first.getStatus());
        ReviewResponse pending = (ReviewResponse) first.getEntity();
        assertEquals("pending", pending.status());
        assertEquals(1, pending.approval().approved());
        assertNull(pending.approval().decisions());

        Response second = resource.castVote(review.getId(), new CastVoteRequest("APPROVED", null), as("sup-2"));
        ReviewResponse approved = (ReviewResponse) second.getEntity();
        assertEquals("approved", approved.status());
        assertEquals(2, approved.approval().decisions().size());
    }

    @Test
    @DisplayName("Should map vote failures to 400, 403 and 409")
    void castVoteErrors() {
        Review review = seed();

        assertEquals(400, resource.castVote(review.getId(), new CastVoteRequest("maybe", null), as("sup-1")).getStatus());
        assertEquals(403, resource.castVote(review.getId(), new CastVoteRequest("approved", null), as("alice")).getStatus());

        Review decided = seed2();
        Response late = resource.castVote(decided.getId(), new CastVoteRequest("approved", null), as("sup-1"));
        assertEquals(409, late.getStatus());
        assertEquals("Conflict", ((ErrorResponse) late.getEntity()).error());
    }

    private Review seed2() {
        catalog.register("app-2");
        Review review = service.submit(Actor.user("bob"), "app-2", ReviewContent.of("Meh", 2));
        service.adminOverride(review.getId(), Actor.admin("root"), ReviewStatus.APPROVED, null);
        return review;
    }

    @Test
    @DisplayName("Should report lock timeouts as 409 Concurrency Conflict")
    void concurrencyConflict() {
        ReviewLock busy = mock(ReviewLock.class);
        doThrow(new ConcurrencyConflictException("busy")).when(busy).lock(anyString());
        when(busy.withLock(anyString(), any())).thenCallRealMethod();
        ReviewApprovalService contended = ReviewApprovalService.builder()
                .directory(directory)
                .appCatalog(catalog)
                .reviewLock(busy)
                .build();
        ModerationResource contendedResource = new ModerationResource(contended, directory);

        Response response = contendedResource.castVote("r-1", new CastVoteRequest("approved", null), as("sup-1"));

        assertEquals(409, response.getStatus());
        assertEquals("Concurrency Conflict", ((ErrorResponse) response.getEntity()).error());
    }

    @Test
    @DisplayName("Should resolve a conflicted review and expose the resolution history")
    void resolveConflict() {
        Review review = conflicted();

        Response response = resource.resolveConflict(review.getId(),
                new ResolveConflictRequest("approved", "Reads fine"), as("root"));

        assertEquals(200, response.getStatus());
        assertEquals("approved", ((ReviewResponse) response.getEntity()).status());

        Response history = resource.listResolutions(review.getId(), as("root"));
        @SuppressWarnings("unchecked")
        List<ResolutionResponse> records = (List<ResolutionResponse>) history.getEntity();
        assertEquals(1, records.size());
        assertEquals("CONFLICT_RESOLUTION", records.get(0).kind());
        assertEquals("conflicted", records.get(0).previousStatus());

        assertEquals(403, resource.listResolutions(review.getId(), as("sup-1")).getStatus());
    }

    @Test
    @DisplayName("Should refuse to resolve a pending review")
    void resolvePending() {
        Review review = seed();

        Response response = resource.resolveConflict(review.getId(),
                new ResolveConflictRequest("approved", "notes"), as("root"));

        assertEquals(409, response.getStatus());
    }

    @Test
    @DisplayName("Should override with admin rights only")
    void override() {
        Review review = seed();

        assertEquals(403, resource.overrideReview(review.getId(),
                new AdminOverrideRequest("approved", null), as("sup-1")).getStatus());
        assertEquals(400, resource.overrideReview(review.getId(),
                new AdminOverrideRequest("rejected", null), as("root")).getStatus());

        Response response = resource.overrideReview(review.getId(),
                new AdminOverrideRequest("rejected", "Spam"), as("root"));
        assertEquals(200, response.getStatus());
        ReviewResponse body = (ReviewResponse) response.getEntity();
        assertEquals("rejected", body.status());
        assertEquals("Spam", body.rejectionReason());
        assertEquals("root", body.reviewedBy());
    }

    @Test
    @DisplayName("Should escalate and then resolve")
    void escalate() {
        Review review = seed();

        assertEquals(400, resource.escalateReview(review.getId(), null, as("root")).getStatus());
        Response escalated = resource.escalateReview(review.getId(), new EscalateRequest("Needs legal"), as("root"));
        assertEquals("escalated", ((ReviewResponse) escalated.getEntity()).status());

        Response resolved = resource.resolveConflict(review.getId(),
                new ResolveConflictRequest("rejected", "Legal says no"), as("root"));
        assertEquals("rejected", ((ReviewResponse) resolved.getEntity()).status());
    }

    @Test
    @DisplayName("Should return supervisor stats and 404 for unknown reviews")
    void statsAndNotFound() {
        Review review = seed();
        resource.castVote(review.getId(), new CastVoteRequest("approved", null), as("sup-1"));

        Response stats = resource.getSupervisorStats(as("sup-1"));
        assertEquals(200, stats.getStatus());
        assertEquals(1, ((SupervisorStats) stats.getEntity()).votesCast());
        assertEquals(403, resource.getSupervisorStats(as("alice")).getStatus());

        assertEquals(404, resource.castVote("missing", new CastVoteRequest("approved", null), as("sup-1")).getStatus());
    }
}
