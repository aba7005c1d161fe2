package com.appreview.rest;

import com.appreview.api.Page;
import com.appreview.api.PageRequest;
import com.appreview.approval.ReviewApprovalService;
import com.appreview.approval.StatusFilter;
import com.appreview.directory.Actor;
import com.appreview.directory.ActorDirectory;
import com.appreview.error.ReviewApprovalException;
import com.appreview.rest.dto.ApprovalSummaryResponse;
import com.appreview.rest.dto.EditReviewRequest;
import com.appreview.rest.dto.ReviewResponse;
import com.appreview.rest.dto.SubmitReviewRequest;
import com.appreview.review.Review;
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

/**
 * REST resource for authors and readers of app reviews.
 *
 * <p>Every caller is authenticated. Listings apply the visibility rule of the engine:
 * supervisors and admins see every review, other callers see approved reviews and their own.</p>
 */
@Path("/api/v1/reviews")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Reviews", description = "Submit, edit and browse app reviews")
@SecurityRequirement(name = "apiKey")
public class ReviewResource {
    private static final Logger log = LoggerFactory.getLogger(ReviewResource.class);
    private static final String BASE_PATH = "/api/v1/reviews";

    private final ReviewApprovalService approvalService;
    private final ActorDirectory directory;

    @Inject
    public ReviewResource(ReviewApprovalService approvalService, ActorDirectory directory) {
        this.approvalService = approvalService;
        this.directory = directory;
    }

    /**
     * POST /api/v1/reviews
     */
    @POST
    @Operation(summary = "Submit review", description = "Submits a review for an app. The review starts pending supervisor approval.")
    @APIResponse(responseCode = "201", description = "Review submitted")
    @APIResponse(responseCode = "400", description = "Invalid content, unknown app, or duplicate review")
    public Response submitReview(SubmitReviewRequest request, @Context SecurityContext securityContext) {
        Actor actor = ResourceSupport.currentActor(securityContext, directory);
        if (actor == null) {
            return ResourceSupport.unauthorized(BASE_PATH);
        }
        if (request == null) {
            return ResourceSupport.badRequest("Request body is required", BASE_PATH);
        }
        try {
            Review review = approvalService.submit(actor, request.appId(), request.toContent());
            return Response.status(Response.Status.CREATED)
                    .entity(ReviewResponse.from(review))
                    .build();
        } catch (ReviewApprovalException e) {
            return ResourceSupport.failure(e, BASE_PATH);
        } catch (Exception e) {
            log.error("submitReview.failed actorId={} error={}", actor.id(), e.getMessage(), e);
            return ResourceSupport.internalError(e, BASE_PATH);
        }
    }

    /**
     * GET /api/v1/reviews?status=pending&page=0&size=20
     */
    @GET
    @Operation(summary = "List reviews",
            description = "Lists reviews visible to the caller, newest first. status is a review status or 'all'; defaults to pending.")
    public Response listReviews(
            @QueryParam("status") String status,
            @QueryParam("page") @DefaultValue("0") int page,
            @QueryParam("size") @DefaultValue("20") int size,
            @Context SecurityContext securityContext) {
        Actor actor = ResourceSupport.currentActor(securityContext, directory);
        if (actor == null) {
            return ResourceSupport.unauthorized(BASE_PATH);
        }
        StatusFilter filter;
        PageRequest pageRequest;
        try {
            filter = StatusFilter.parse(status);
            pageRequest = PageRequest.of(page, size);
        } catch (IllegalArgumentException e) {
            return ResourceSupport.badRequest(e.getMessage(), BASE_PATH);
        }
        try {
            Page<ReviewResponse> result = approvalService.listByStatus(filter, actor, pageRequest)
                    .map(ReviewResponse::from);
            return Response.ok(result).build();
        } catch (ReviewApprovalException e) {
            return ResourceSupport.failure(e, BASE_PATH);
        } catch (Exception e) {
            log.error("listReviews.failed actorId={} error={}", actor.id(), e.getMessage(), e);
            return ResourceSupport.internalError(e, BASE_PATH);
        }
    }

    /**
     * GET /api/v1/reviews/stats
     */
    @GET
    @Path("/stats")
    @Operation(summary = "My review statistics", description = "Counts the caller's reviews by status and their average rating.")
    public Response getMyStats(@Context SecurityContext securityContext) {
        String path = BASE_PATH + "/stats";
        Actor actor = ResourceSupport.currentActor(securityContext, directory);
        if (actor == null) {
            return ResourceSupport.unauthorized(path);
        }
        try {
            return Response.ok(approvalService.authorStats(actor)).build();
        } catch (Exception e) {
            log.error("getMyStats.failed actorId={} error={}", actor.id(), e.getMessage(), e);
            return ResourceSupport.internalError(e, path);
        }
    }

    /**
     * GET /api/v1/reviews/{id}
     */
    @GET
    @Path("/{id}")
    @Operation(summary = "Get review", description = "Gets one review with its vote tally. Individual votes stay hidden while the review is pending.")
    @APIResponse(responseCode = "200", description = "Review found")
    @APIResponse(responseCode = "404", description = "Review not found or not visible to the caller")
    public Response getReview(@Parameter(description = "Review ID") @PathParam("id") String reviewId,
                              @Context SecurityContext securityContext) {
        String path = BASE_PATH + "/" + reviewId;
        Actor actor = ResourceSupport.currentActor(securityContext, directory);
        if (actor == null) {
            return ResourceSupport.unauthorized(path);
        }
        try {
            return Response.ok(ReviewResponse.from(approvalService.getReview(reviewId, actor))).build();
        } catch (ReviewApprovalException e) {
            return ResourceSupport.failure(e, path);
        } catch (Exception e) {
            log.error("getReview.failed id={} error={}", reviewId, e.getMessage(), e);
            return ResourceSupport.internalError(e, path);
        }
    }

    /**
     * PUT /api/v1/reviews/{id}
     */
    @PUT
    @Path("/{id}")
    @Operation(summary = "Edit review",
            description = "Edits the caller's own review. Omitted fields are kept. Any edit clears all supervisor votes and returns the review to pending.")
    @APIResponse(responseCode = "200", description = "Review edited and pending re-review")
    @APIResponse(responseCode = "403", description = "Not the author")
    @APIResponse(responseCode = "404", description = "Review not found")
    public Response editReview(@Parameter(description = "Review ID") @PathParam("id") String reviewId,
                               EditReviewRequest request,
                               @Context SecurityContext securityContext) {
        String path = BASE_PATH + "/" + reviewId;
        Actor actor = ResourceSupport.currentActor(securityContext, directory);
        if (actor == null) {
            return ResourceSupport.unauthorized(path);
        }
        if (request == null) {
            return ResourceSupport.badRequest("Request body is required", path);
        }
        try {
            Review review = approvalService.revise(reviewId, actor, request::applyTo);
            return Response.ok(ReviewResponse.from(review)).build();
        } catch (ReviewApprovalException e) {
            return ResourceSupport.failure(e, path);
        } catch (Exception e) {
            log.error("editReview.failed id={} error={}", reviewId, e.getMessage(), e);
            return ResourceSupport.internalError(e, path);
        }
    }

    /**
     * DELETE /api/v1/reviews/{id}
     */
    @DELETE
    @Path("/{id}")
    @Operation(summary = "Withdraw review", description = "Deletes the caller's own review while it is still pending.")
    @APIResponse(responseCode = "204", description = "Review deleted")
    @APIResponse(responseCode = "409", description = "Review is no longer pending")
    public Response withdrawReview(@Parameter(description = "Review ID") @PathParam("id") String reviewId,
                                   @Context SecurityContext securityContext) {
        String path = BASE_PATH + "/" + reviewId;
        Actor actor = ResourceSupport.currentActor(securityContext, directory);
        if (actor == null) {
            return ResourceSupport.unauthorized(path);
        }
        try {
            approvalService.withdraw(reviewId, actor);
            return Response.noContent().build();
        } catch (ReviewApprovalException e) {
            return ResourceSupport.failure(e, path);
        } catch (Exception e) {
            log.error("withdrawReview.failed id={} error={}", reviewId, e.getMessage(), e);
            return ResourceSupport.internalError(e, path);
        }
    }

    /**
     * GET /api/v1/reviews/{id}/approval-summary
     */
    @GET
    @Path("/{id}/approval-summary")
    @Operation(summary = "Approval summary",
            description = "Vote counts against the current supervisor roster. Individual decisions are included only once the review has left pending, or for admins.")
    @APIResponse(responseCode = "200", description = "Summary computed")
    @APIResponse(responseCode = "404", description = "Review not found or not visible to the caller")
    public Response getApprovalSummary(@Parameter(description = "Review ID") @PathParam("id") String reviewId,
                                       @Context SecurityContext securityContext) {
        String path = BASE_PATH + "/" + reviewId + "/approval-summary";
        Actor actor = ResourceSupport.currentActor(securityContext, directory);
        if (actor == null) {
            return ResourceSupport.unauthorized(path);
        }
        try {
            return Response.ok(ApprovalSummaryResponse.from(approvalService.getApprovalSummary(reviewId, actor)))
                    .build();
        } catch (ReviewApprovalException e) {
            return ResourceSupport.failure(e, path);
        } catch (Exception e) {
            log.error("getApprovalSummary.failed id={} error={}", reviewId, e.getMessage(), e);
            return ResourceSupport.internalError(e, path);
        }
    }
}
