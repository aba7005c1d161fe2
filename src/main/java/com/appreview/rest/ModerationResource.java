package com.appreview.rest;

import com.appreview.approval.ReviewApprovalService;
import com.appreview.directory.Actor;
import com.appreview.directory.ActorDirectory;
import com.appreview.error.ReviewApprovalException;
import com.appreview.rest.dto.AdminOverrideRequest;
import com.appreview.rest.dto.CastVoteRequest;
import com.appreview.rest.dto.EscalateRequest;
import com.appreview.rest.dto.ResolutionResponse;
import com.appreview.rest.dto.ResolveConflictRequest;
import com.appreview.rest.dto.ReviewResponse;
import com.appreview.rest.dto.StatusNames;
import com.appreview.review.Review;
import com.appreview.review.ReviewStatus;
import com.appreview.review.VoteDecision;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * REST resource for supervisors and admins.
 *
 * <p>Capabilities are checked by the engine on every call against the current actor
 * directory: votes require a supervisor on the eligible roster, overrides, conflict
 * resolution and escalation require an admin.</p>
 */
@Path("/api/v1/moderation")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Moderation", description = "Supervisor voting and admin resolution of reviews")
@SecurityRequirement(name = "apiKey")
public class ModerationResource {
    private static final Logger log = LoggerFactory.getLogger(ModerationResource.class);
    private static final String BASE_PATH = "/api/v1/moderation";

    private final ReviewApprovalService approvalService;
    private final ActorDirectory directory;

    @Inject
    public ModerationResource(ReviewApprovalService approvalService, ActorDirectory directory) {
        this.approvalService = approvalService;
        this.directory = directory;
    }

    /**
     * Casts or replaces the caller's vote.
     *
     * POST /api/v1/moderation/reviews/{id}/votes
     */
    @POST
    @Path("/reviews/{id}/votes")
    @Operation(summary = "Cast vote",
            description = "Records the supervisor's approve/reject vote. A second vote replaces the first. " +
                    "The review is approved or rejected once a strict majority of eligible supervisors agrees, " +
                    "and marked conflicted when everyone has voted without a majority.")
    @APIResponse(responseCode = "200", description = "Vote recorded; body is the review after evaluation")
    @APIResponse(responseCode = "403", description = "Caller is not an eligible supervisor")
    @APIResponse(responseCode = "409", description = "Review is not pending, or a concurrent update won")
    public Response castVote(@Parameter(description = "Review ID") @PathParam("id") String reviewId,
                             CastVoteRequest request,
                             @Context SecurityContext securityContext) {
        String path = BASE_PATH + "/reviews/" + reviewId + "/votes";
        Actor actor = ResourceSupport.currentActor(securityContext, directory);
        if (actor == null) {
            return ResourceSupport.unauthorized(path);
        }
        if (request == null) {
            return ResourceSupport.badRequest("Request body is required", path);
        }
        try {
            VoteDecision decision = StatusNames.parseDecision(request.decision());
            approvalService.castVote(reviewId, actor, decision, request.comment());
            return Response.ok(ReviewResponse.from(approvalService.getReview(reviewId, actor))).build();
        } catch (ReviewApprovalException e) {
            return ResourceSupport.failure(e, path);
        } catch (Exception e) {
            log.error("castVote.failed id={} actorId={} error={}", reviewId, actor.id(), e.getMessage(), e);
            return ResourceSupport.internalError(e, path);
        }
    }

    /**
     * GET /api/v1/moderation/stats
     */
    @GET
    @Path("/stats")
    @Operation(summary = "Supervisor statistics", description = "Votes cast by the caller and the system-wide pending count.")
    @APIResponse(responseCode = "403", description = "Caller is not a supervisor")
    public Response getSupervisorStats(@Context SecurityContext securityContext) {
        String path = BASE_PATH + "/stats";
        Actor actor = ResourceSupport.currentActor(securityContext, directory);
        if (actor == null) {
            return ResourceSupport.unauthorized(path);
        }
        try {
            return Response.ok(approvalService.supervisorStats(actor)).build();
        } catch (ReviewApprovalException e) {
            return ResourceSupport.failure(e, path);
        } catch (Exception e) {
            log.error("getSupervisorStats.failed actorId={} error={}", actor.id(), e.getMessage(), e);
            return ResourceSupport.internalError(e, path);
        }
    }

    /**
     * POST /api/v1/moderation/reviews/{id}/override
     */
    @POST
    @Path("/reviews/{id}/override")
    @Operation(summary = "Admin override",
            description = "Sets the review to approved, rejected or pending regardless of votes. Overriding to pending clears all votes. Requires admin.")
    @APIResponse(responseCode = "200", description = "Status overridden")
    @APIResponse(responseCode = "400", description = "Invalid target status or missing rejection reason")
    @APIResponse(responseCode = "403", description = "Caller is not an admin")
    public Response overrideReview(@Parameter(description = "Review ID") @PathParam("id") String reviewId,
                                   AdminOverrideRequest request,
                                   @Context SecurityContext securityContext) {
        String path = BASE_PATH + "/reviews/" + reviewId + "/override";
        Actor actor = ResourceSupport.currentActor(securityContext, directory);
        if (actor == null) {
            return ResourceSupport.unauthorized(path);
        }
        if (request == null) {
            return ResourceSupport.badRequest("Request body is required", path);
        }
        try {
            ReviewStatus target = StatusNames.parseStatus(request.status());
            Review review = approvalService.adminOverride(reviewId, actor, target, request.reason());
            return Response.ok(ReviewResponse.from(review)).build();
        } catch (ReviewApprovalException e) {
            return ResourceSupport.failure(e, path);
        } catch (Exception e) {
            log.error("overrideReview.failed id={} actorId={} error={}", reviewId, actor.id(), e.getMessage(), e);
            return ResourceSupport.internalError(e, path);
        }
    }

    /**
     * POST /api/v1/moderation/reviews/{id}/resolve
     */
    @POST
    @Path("/reviews/{id}/resolve")
    @Operation(summary = "Resolve conflict",
            description = "Final approve/reject decision on a conflicted or escalated review. Notes are required. Requires admin.")
    @APIResponse(responseCode = "200", description = "Conflict resolved")
    @APIResponse(responseCode = "409", description = "Review is not conflicted or escalated")
    public Response resolveConflict(@Parameter(description = "Review ID") @PathParam("id") String reviewId,
                                    ResolveConflictRequest request,
                                    @Context SecurityContext securityContext) {
        String path = BASE_PATH + "/reviews/" + reviewId + "/resolve";
        Actor actor = ResourceSupport.currentActor(securityContext, directory);
        if (actor == null) {
            return ResourceSupport.unauthorized(path);
        }
        if (request == null) {
            return ResourceSupport.badRequest("Request body is required", path);
        }
        try {
            VoteDecision decision = StatusNames.parseDecision(request.decision());
            Review review = approvalService.resolveConflict(reviewId, actor, decision, request.notes());
            return Response.ok(ReviewResponse.from(review)).build();
        } catch (ReviewApprovalException e) {
            return ResourceSupport.failure(e, path);
        } catch (Exception e) {
            log.error("resolveConflict.failed id={} actorId={} error={}", reviewId, actor.id(), e.getMessage(), e);
            return ResourceSupport.internalError(e, path);
        }
    }

    /**
     * POST /api/v1/moderation/reviews/{id}/escalate
     */
    @POST
    @Path("/reviews/{id}/escalate")
    @Operation(summary = "Escalate review",
            description = "Moves a pending or conflicted review to escalated for an admin decision. Requires admin.")
    @APIResponse(responseCode = "200", description = "Review escalated")
    @APIResponse(responseCode = "409", description = "Review is already decided or escalated")
    public Response escalateReview(@Parameter(description = "Review ID") @PathParam("id") String reviewId,
                                   EscalateRequest request,
                                   @Context SecurityContext securityContext) {
        String path = BASE_PATH + "/reviews/" + reviewId + "/escalate";
        Actor actor = ResourceSupport.currentActor(securityContext, directory);
        if (actor == null) {
            return ResourceSupport.unauthorized(path);
        }
        try {
            String reason = request != null ? request.reason() : null;
            Review review = approvalService.escalate(reviewId, actor, reason);
            return Response.ok(ReviewResponse.from(review)).build();
        } catch (ReviewApprovalException e) {
            return ResourceSupport.failure(e, path);
        } catch (Exception e) {
            log.error("escalateReview.failed id={} actorId={} error={}", reviewId, actor.id(), e.getMessage(), e);
            return ResourceSupport.internalError(e, path);
        }
    }

    /**
     * GET /api/v1/moderation/reviews/{id}/resolutions
     */
    @GET
    @Path("/reviews/{id}/resolutions")
    @Operation(summary = "Resolution history", description = "Admin overrides, conflict resolutions and escalations of a review, oldest first. Requires admin.")
    public Response listResolutions(@Parameter(description = "Review ID") @PathParam("id") String reviewId,
                                    @Context SecurityContext securityContext) {
        String path = BASE_PATH + "/reviews/" + reviewId + "/resolutions";
        Actor actor = ResourceSupport.currentActor(securityContext, directory);
        if (actor == null) {
            return ResourceSupport.unauthorized(path);
        }
        try {
            List<ResolutionResponse> records = approvalService.listResolutions(reviewId, actor).stream()
                    .map(ResolutionResponse::from)
                    .toList();
            return Response.ok(records).build();
        } catch (ReviewApprovalException e) {
            return ResourceSupport.failure(e, path);
        } catch (Exception e) {
            log.error("listResolutions.failed id={} error={}", reviewId, e.getMessage(), e);
            return ResourceSupport.internalError(e, path);
        }
    }
}
