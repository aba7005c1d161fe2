package com.appreview.approval;

import com.appreview.api.Page;
import com.appreview.api.PageRequest;
import com.appreview.audit.AuditAction;
import com.appreview.audit.AuditEntry;
import com.appreview.audit.AuditService;
import com.appreview.catalog.AppCatalog;
import com.appreview.directory.Actor;
import com.appreview.directory.ActorDirectory;
import com.appreview.error.AuthorizationException;
import com.appreview.error.ConcurrencyConflictException;
import com.appreview.error.InvalidStateException;
import com.appreview.error.ReviewNotFoundException;
import com.appreview.error.ValidationException;
import com.appreview.lock.LocalReviewLock;
import com.appreview.lock.ReviewLock;
import com.appreview.logging.LogContext;
import com.appreview.metrics.MetricsService;
import com.appreview.metrics.NoOpMetricsService;
import com.appreview.review.InMemoryReviewStore;
import com.appreview.review.ResolutionKind;
import com.appreview.review.ResolutionRecord;
import com.appreview.review.Review;
import com.appreview.review.ReviewContent;
import com.appreview.review.ReviewStatus;
import com.appreview.review.ReviewStore;
import com.appreview.review.SupervisorDecision;
import com.appreview.review.VoteDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Review approval engine. Owns the lifecycle of a review from submission through final
 * resolution: author submission and edits, majority voting among supervisors, conflict
 * detection, admin override and conflict resolution, and role-filtered queries.
 *
 * <p>Every state-changing operation on a review runs under the review's {@link ReviewLock}
 * key, so vote insert, tally and status write form one atomic unit. Operations on
 * different reviews proceed in parallel. Failures are raised as
 * {@link com.appreview.error.ReviewApprovalException} subtypes and never retried here.</p>
 */
public class ReviewApprovalService {
    private static final Logger log = LoggerFactory.getLogger(ReviewApprovalService.class);

    private static final Set<ReviewStatus> OVERRIDE_TARGETS =
            EnumSet.of(ReviewStatus.PENDING, ReviewStatus.APPROVED, ReviewStatus.REJECTED);

    private final ReviewStore store;
    private final ActorDirectory directory;
    private final AppCatalog appCatalog;
    private final ReviewLock reviewLock;
    private final AuditService auditService;
    private final MetricsService metrics;
    private final ConflictNotifier conflictNotifier;
    private final Clock clock;

    private ReviewApprovalService(Builder builder) {
        this.store = builder.store != null ? builder.store : new InMemoryReviewStore();
        this.directory = Objects.requireNonNull(builder.directory, "directory is required");
        this.appCatalog = Objects.requireNonNull(builder.appCatalog, "appCatalog is required");
        this.reviewLock = builder.reviewLock != null ? builder.reviewLock : new LocalReviewLock();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        this.conflictNotifier = builder.conflictNotifier != null ? builder.conflictNotifier : new LoggingConflictNotifier();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    // ========== Submission & Edit ==========

    /**
     * Submits a new review. The review starts {@code PENDING} with no decisions.
     *
     * @throws ValidationException if the content is invalid, the app is unknown,
     *                             or the author already reviewed this app
     */
    public Review submit(Actor author, String appId, ReviewContent content) {
        Objects.requireNonNull(author, "author is required");
        try (LogContext ctx = LogContext.forReview("submit", null, author.id())) {
            return timed("submit", () -> {
                validateContent(content);
                if (appId == null || appId.isBlank()) {
                    throw new ValidationException("App is required");
                }
                if (!appCatalog.exists(appId)) {
                    throw new ValidationException("Unknown app: " + appId);
                }

                return reviewLock.withLock(ReviewLock.submissionKey(appId, author.id()), () -> {
                    if (store.findByAppAndAuthor(appId, author.id()).isPresent()) {
                        throw new ValidationException("You have already submitted a review for this app.");
                    }
                    Instant now = clock.instant();
                    Review review = store.insert(Review.builder()
                            .appId(appId)
                            .authorId(author.id())
                            .content(content)
                            .status(ReviewStatus.PENDING)
                            .createdAt(now)
                            .build());

                    auditService.record(AuditEntry.event(AuditAction.REVIEW_SUBMITTED, review.getId(), author.id(),
                            Map.of("appId", appId, "rating", content.rating()), now));
                    metrics.incrementSubmitted();
                    log.info("review.submitted reviewId={} appId={} authorId={} rating={}",
                            review.getId(), appId, author.id(), content.rating());
                    return review;
                });
            });
        }
    }

    /**
     * Replaces the review text only, keeping title, rating and tags.
     *
     * @see #edit(String, Actor, ReviewContent)
     */
    public Review edit(String reviewId, Actor author, String newContent) {
        return applyEdit(reviewId, author, current -> current.withContent(newContent));
    }

    /**
     * Edits a review's content. This is a re-review transition: every supervisor decision is
     * cleared and the status returns to {@code PENDING}, whatever the previous status was.
     *
     * @throws AuthorizationException unless {@code author} wrote the review
     * @throws ValidationException    if the new content is invalid
     */
    public Review edit(String reviewId, Actor author, ReviewContent newContent) {
        return applyEdit(reviewId, author, current -> newContent);
    }

    /**
     * Edits a review by applying {@code change} to its current content under the review lock.
     * Used for partial edits where omitted fields keep their value.
     *
     * @see #edit(String, Actor, ReviewContent)
     */
    public Review revise(String reviewId, Actor author, UnaryOperator<ReviewContent> change) {
        return applyEdit(reviewId, author, change);
    }

    private Review applyEdit(String reviewId, Actor author, UnaryOperator<ReviewContent> change) {
        Objects.requireNonNull(author, "author is required");
        try (LogContext ctx = LogContext.forReview("edit", reviewId, author.id())) {
            return timed("edit", () -> reviewLock.withLock(ReviewLock.reviewKey(reviewId), () -> {
                Review review = load(reviewId);
                if (!review.isAuthoredBy(author.id())) {
                    throw new AuthorizationException("You can only edit your own reviews");
                }
                ReviewContent newContent = change.apply(review.getReviewContent());
                validateContent(newContent);

                ReviewStatus previous = review.getStatus();
                // decisions go only once the version-checked write has landed
                Review updated = store.update(review.withContent(newContent, clock.instant()));
                int cleared = store.clearDecisions(reviewId);

                auditService.record(AuditEntry.event(AuditAction.REVIEW_EDITED, reviewId, author.id(),
                        Map.of("previousStatus", previous.name(), "clearedDecisions", cleared),
                        updated.getUpdatedAt()));
                onStatusChanged(review, updated, author.id());
                if (previous == ReviewStatus.APPROVED) {
                    // rating may have changed too, but the review no longer counts until re-approved
                    refreshAppRating(review.getAppId());
                }
                log.info("review.edited reviewId={} previousStatus={} clearedDecisions={}",
                        reviewId, previous, cleared);
                return updated;
            }));
        }
    }

    /**
     * Deletes the author's own review while it is still pending.
     *
     * @throws AuthorizationException unless {@code author} wrote the review
     * @throws InvalidStateException  if the review is no longer pending
     */
    public void withdraw(String reviewId, Actor author) {
        Objects.requireNonNull(author, "author is required");
        try (LogContext ctx = LogContext.forReview("withdraw", reviewId, author.id())) {
            timed("withdraw", () -> reviewLock.withLock(ReviewLock.reviewKey(reviewId), () -> {
                Review review = load(reviewId);
                if (!review.isAuthoredBy(author.id())) {
                    throw new AuthorizationException("You can only delete your own reviews");
                }
                if (!review.isPending()) {
                    throw new InvalidStateException("You can only delete pending reviews", review.getStatus());
                }
                store.delete(reviewId);
                auditService.record(AuditEntry.event(AuditAction.REVIEW_WITHDRAWN, reviewId, author.id(),
                        Map.of("appId", review.getAppId()), clock.instant()));
                log.info("review.withdrawn reviewId={} authorId={}", reviewId, author.id());
                return null;
            }));
        }
    }

    // ========== Supervisor Voting ==========

    /**
     * Records a supervisor's vote and re-evaluates the majority rule.
     * A re-vote replaces the supervisor's earlier decision.
     *
     * @return the approval summary after the vote
     * @throws AuthorizationException if the caller is not an eligible supervisor
     * @throws InvalidStateException  if the review is not pending
     */
    public ApprovalSummary castVote(String reviewId, Actor supervisor, VoteDecision decision, String comment) {
        Objects.requireNonNull(supervisor, "supervisor is required");
        if (!supervisor.isSupervisor()) {
            log.warn("review.vote.rejected reviewId={} actorId={} reason=not_supervisor", reviewId, supervisor.id());
            throw new AuthorizationException("Supervisor privileges required");
        }
        if (decision == null) {
            throw new ValidationException("Decision must be either \"approved\" or \"rejected\"");
        }

        try (LogContext ctx = LogContext.forReview("castVote", reviewId, supervisor.id())) {
            return timed("castVote", () -> reviewLock.withLock(ReviewLock.reviewKey(reviewId), () -> {
                Set<String> roster = directory.listEligibleSupervisors();
                if (!roster.contains(supervisor.id())) {
                    throw new AuthorizationException("Supervisor " + supervisor.id() + " is not on the eligible roster");
                }
                Review review = load(reviewId);
                if (!review.isPending()) {
                    log.warn("review.vote.rejected reviewId={} status={} reason=not_pending",
                            reviewId, review.getStatus());
                    throw new InvalidStateException("Review is not pending approval. Current status: "
                            + review.getStatus(), review.getStatus());
                }

                SupervisorDecision vote = new SupervisorDecision(
                        reviewId, supervisor.id(), decision, comment, clock.instant());
                Optional<SupervisorDecision> replaced = store.saveDecision(vote);

                List<SupervisorDecision> decisions = store.findDecisions(reviewId);
                ApprovalSummary summary = ApprovalSummary.compute(decisions, roster);
                ReviewStatus outcome = MajorityRule.evaluate(summary);

                if (outcome != ReviewStatus.PENDING) {
                    finalizeVote(review, vote, decisions, roster, summary, outcome, replaced);
                }

                auditService.record(AuditEntry.vote(reviewId, supervisor.id(), decision, replaced.isPresent(),
                        Map.of("approved", summary.approved(),
                                "rejected", summary.rejected(),
                                "requiredApprovals", summary.requiredApprovals()),
                        vote.decidedAt()));
                metrics.incrementVoteCast(decision);
                log.info("review.vote.recorded reviewId={} decision={} replaced={} approved={} rejected={} " +
                                "pending={} required={} outcome={}",
                        reviewId, decision, replaced.isPresent(), summary.approved(), summary.rejected(),
                        summary.pending(), summary.requiredApprovals(), outcome);
                return summary;
            }));
        }
    }

    private void finalizeVote(Review review, SupervisorDecision vote, List<SupervisorDecision> decisions,
                              Set<String> roster, ApprovalSummary summary, ReviewStatus outcome,
                              Optional<SupervisorDecision> replaced) {
        String decidedBy = null;
        String reason = null;
        if (outcome != ReviewStatus.CONFLICTED) {
            SupervisorDecision deciding = vote.decision().toStatus() == outcome
                    ? vote
                    : latestOnSide(decisions, roster, outcome);
            decidedBy = deciding.supervisorId();
            reason = deciding.comment();
        }

        Review updated;
        try {
            updated = store.update(review.transitionTo(outcome, decidedBy, reason, clock.instant()));
        } catch (ConcurrencyConflictException e) {
            // put the previous vote back so the caller can retry against a consistent state
            if (replaced.isPresent()) {
                store.saveDecision(replaced.get());
            } else {
                store.deleteDecision(review.getId(), vote.supervisorId());
            }
            throw e;
        }

        onStatusChanged(review, updated, vote.supervisorId());
        if (outcome == ReviewStatus.APPROVED) {
            refreshAppRating(review.getAppId());
        } else if (outcome == ReviewStatus.CONFLICTED) {
            conflictNotifier.conflictDetected(updated, summary);
        }
        log.info("review.finalized reviewId={} status={} decidedBy={}", review.getId(), outcome, decidedBy);
    }

    private static SupervisorDecision latestOnSide(List<SupervisorDecision> decisions, Set<String> roster,
                                                   ReviewStatus outcome) {
        return decisions.stream()
                .filter(d -> roster.contains(d.supervisorId()))
                .filter(d -> d.decision().toStatus() == outcome)
                .max(Comparator.comparing(SupervisorDecision::decidedAt))
                .orElseThrow(() -> new IllegalStateException("No decision backs outcome " + outcome));
    }

    // ========== Admin Override & Conflict Resolution ==========

    /**
     * Sets a review's status directly, bypassing the vote. Allowed from any status.
     * Overriding to {@code PENDING} clears every decision (forced re-review); otherwise
     * decisions are kept for history. Always appends a {@link ResolutionRecord}.
     *
     * @throws AuthorizationException unless the caller is an admin
     * @throws ValidationException    for a target outside {pending, approved, rejected},
     *                                or a rejection without a reason
     */
    public Review adminOverride(String reviewId, Actor admin, ReviewStatus newStatus, String reason) {
        requireAdmin(admin, "override");
        if (newStatus == null || !OVERRIDE_TARGETS.contains(newStatus)) {
            throw new ValidationException("Status must be \"approved\", \"rejected\", or \"pending\"");
        }
        if (newStatus == ReviewStatus.REJECTED && isBlank(reason)) {
            throw new ValidationException("A reason is required when overriding a review to rejected");
        }

        try (LogContext ctx = LogContext.forReview("adminOverride", reviewId, admin.id())) {
            return timed("adminOverride", () -> reviewLock.withLock(ReviewLock.reviewKey(reviewId), () -> {
                Review review = load(reviewId);
                ReviewStatus previous = review.getStatus();

                Review updated = store.update(review.transitionTo(newStatus, admin.id(), reason, clock.instant()));
                int cleared = 0;
                if (newStatus == ReviewStatus.PENDING) {
                    cleared = store.clearDecisions(reviewId);
                }
                store.appendResolution(ResolutionRecord.of(reviewId, admin.id(), ResolutionKind.OVERRIDE,
                        previous, newStatus, reason, updated.getUpdatedAt()));

                Map<String, Object> details = new HashMap<>();
                details.put("previousStatus", previous.name());
                details.put("newStatus", newStatus.name());
                details.put("clearedDecisions", cleared);
                if (reason != null) {
                    details.put("reason", reason);
                }
                auditService.record(AuditEntry.event(AuditAction.ADMIN_OVERRIDE, reviewId, admin.id(), details,
                        updated.getUpdatedAt()));
                metrics.incrementOverride(newStatus);
                onStatusChanged(review, updated, admin.id());
                if (previous == ReviewStatus.APPROVED || newStatus == ReviewStatus.APPROVED) {
                    refreshAppRating(review.getAppId());
                }
                log.info("review.override reviewId={} from={} to={} adminId={}",
                        reviewId, previous, newStatus, admin.id());
                return updated;
            }));
        }
    }

    /**
     * Resolves a conflicted or escalated review to a final decision.
     *
     * @throws AuthorizationException unless the caller is an admin
     * @throws ValidationException    if the decision is missing or the notes are blank
     * @throws InvalidStateException  unless the review is {@code CONFLICTED} or {@code ESCALATED}
     */
    public Review resolveConflict(String reviewId, Actor admin, VoteDecision finalDecision, String notes) {
        requireAdmin(admin, "resolveConflict");
        if (finalDecision == null) {
            throw new ValidationException("Final decision must be either \"approved\" or \"rejected\"");
        }
        if (isBlank(notes)) {
            throw new ValidationException("Resolution notes are required");
        }

        try (LogContext ctx = LogContext.forReview("resolveConflict", reviewId, admin.id())) {
            return timed("resolveConflict", () -> reviewLock.withLock(ReviewLock.reviewKey(reviewId), () -> {
                Review review = load(reviewId);
                ReviewStatus previous = review.getStatus();
                if (!previous.requiresAdminResolution()) {
                    log.warn("review.resolve.rejected reviewId={} status={} reason=not_in_conflict",
                            reviewId, previous);
                    throw new InvalidStateException("Review is not in conflict status. Current status: "
                            + previous, previous);
                }

                ReviewStatus target = finalDecision.toStatus();
                Review updated = store.update(review.transitionTo(target, admin.id(), notes, clock.instant()));
                store.appendResolution(ResolutionRecord.of(reviewId, admin.id(), ResolutionKind.CONFLICT_RESOLUTION,
                        previous, target, notes, updated.getUpdatedAt()));

                auditService.record(AuditEntry.event(AuditAction.CONFLICT_RESOLVED, reviewId, admin.id(),
                        Map.of("finalDecision", finalDecision.name(), "notes", notes),
                        updated.getUpdatedAt()));
                metrics.incrementConflictResolved(finalDecision);
                onStatusChanged(review, updated, admin.id());
                if (target == ReviewStatus.APPROVED) {
                    refreshAppRating(review.getAppId());
                }
                log.info("review.conflict.resolved reviewId={} from={} decision={} adminId={}",
                        reviewId, previous, finalDecision, admin.id());
                return updated;
            }));
        }
    }

    /**
     * Moves a pending or conflicted review to {@code ESCALATED}. Escalated reviews are
     * resolved exactly like conflicted ones.
     *
     * @throws AuthorizationException unless the caller is an admin
     * @throws ValidationException    if the reason is blank
     * @throws InvalidStateException  unless the review is {@code PENDING} or {@code CONFLICTED}
     */
    public Review escalate(String reviewId, Actor admin, String reason) {
        requireAdmin(admin, "escalate");
        if (isBlank(reason)) {
            throw new ValidationException("A reason is required to escalate a review");
        }

        try (LogContext ctx = LogContext.forReview("escalate", reviewId, admin.id())) {
            return timed("escalate", () -> reviewLock.withLock(ReviewLock.reviewKey(reviewId), () -> {
                Review review = load(reviewId);
                ReviewStatus previous = review.getStatus();
                if (previous != ReviewStatus.PENDING && previous != ReviewStatus.CONFLICTED) {
                    throw new InvalidStateException("Only pending or conflicted reviews can be escalated. "
                            + "Current status: " + previous, previous);
                }

                Review updated = store.update(
                        review.transitionTo(ReviewStatus.ESCALATED, admin.id(), null, clock.instant()));
                store.appendResolution(ResolutionRecord.of(reviewId, admin.id(), ResolutionKind.ESCALATION,
                        previous, ReviewStatus.ESCALATED, reason, updated.getUpdatedAt()));

                auditService.record(AuditEntry.event(AuditAction.REVIEW_ESCALATED, reviewId, admin.id(),
                        Map.of("reason", reason), updated.getUpdatedAt()));
                onStatusChanged(review, updated, admin.id());
                conflictNotifier.reviewEscalated(updated, admin.id(), reason);
                return updated;
            }));
        }
    }

    // ========== Queries ==========

    /**
     * Computes the aggregate vote counts against the current roster.
     */
    public ApprovalSummary getApprovalSummary(String reviewId) {
        load(reviewId);
        return ApprovalSummary.compute(store.findDecisions(reviewId), directory.listEligibleSupervisors());
    }

    /**
     * Gets the vote summary as the given actor may see it. While the review is pending,
     * individual decisions are withheld from everyone but admins.
     *
     * @throws ReviewNotFoundException if the review does not exist or is not visible to the actor
     */
    public ApprovalDetails getApprovalSummary(String reviewId, Actor actor) {
        return getReview(reviewId, actor).approval();
    }

    /**
     * Gets a review with role-aware field suppression.
     *
     * @throws ReviewNotFoundException if the review does not exist or is not visible to the actor
     */
    public ReviewView getReview(String reviewId, Actor actor) {
        Objects.requireNonNull(actor, "actor is required");
        Review review = load(reviewId);
        if (!ReviewProjector.canView(review, actor)) {
            throw new ReviewNotFoundException(reviewId);
        }
        return ReviewProjector.project(review, store.findDecisions(reviewId),
                directory.listEligibleSupervisors(), actor);
    }

    /**
     * Lists reviews matching the filter, newest first. Supervisors and admins see every
     * review; other actors see approved reviews and their own.
     */
    public Page<ReviewView> listByStatus(StatusFilter filter, Actor actor, PageRequest page) {
        Objects.requireNonNull(actor, "actor is required");
        StatusFilter effective = filter != null ? filter : StatusFilter.all();
        List<Review> visible = store.findByStatus(effective.status()).stream()
                .filter(review -> ReviewProjector.canView(review, actor))
                .toList();
        Set<String> roster = directory.listEligibleSupervisors();
        return Page.of(visible, page)
                .map(review -> ReviewProjector.project(review, store.findDecisions(review.getId()), roster, actor));
    }

    /**
     * Gets the admin resolution trail of a review, oldest first.
     *
     * @throws AuthorizationException unless the caller is an admin
     */
    public List<ResolutionRecord> listResolutions(String reviewId, Actor admin) {
        requireAdmin(admin, "listResolutions");
        load(reviewId);
        return store.findResolutions(reviewId);
    }

    public AuthorStats authorStats(Actor author) {
        Objects.requireNonNull(author, "author is required");
        List<Review> reviews = store.findByAuthor(author.id());
        Map<ReviewStatus, Integer> counts = new HashMap<>();
        for (Review review : reviews) {
            counts.merge(review.getStatus(), 1, Integer::sum);
        }
        double average = reviews.stream().mapToInt(Review::getRating).average().orElse(0.0);
        return new AuthorStats(
                reviews.size(),
                counts.getOrDefault(ReviewStatus.PENDING, 0),
                counts.getOrDefault(ReviewStatus.APPROVED, 0),
                counts.getOrDefault(ReviewStatus.REJECTED, 0),
                counts.getOrDefault(ReviewStatus.CONFLICTED, 0) + counts.getOrDefault(ReviewStatus.ESCALATED, 0),
                roundTwoDecimals(average));
    }

    /**
     * @throws AuthorizationException unless the caller is a supervisor
     */
    public SupervisorStats supervisorStats(Actor supervisor) {
        Objects.requireNonNull(supervisor, "supervisor is required");
        if (!supervisor.isSupervisor()) {
            throw new AuthorizationException("Supervisor privileges required");
        }
        List<SupervisorDecision> votes = store.findDecisionsBySupervisor(supervisor.id());
        int approvals = (int) votes.stream().filter(SupervisorDecision::isApproval).count();
        return new SupervisorStats(votes.size(), approvals, votes.size() - approvals,
                store.findByStatus(ReviewStatus.PENDING).size());
    }

    public AuditService getAuditService() {
        return auditService;
    }

    // ========== Private Helpers ==========

    private Review load(String reviewId) {
        if (reviewId == null || reviewId.isBlank()) {
            throw new ValidationException("Review id is required");
        }
        return store.findById(reviewId).orElseThrow(() -> new ReviewNotFoundException(reviewId));
    }

    private void requireAdmin(Actor actor, String operation) {
        Objects.requireNonNull(actor, "admin is required");
        if (!actor.isAdmin()) {
            log.warn("review.{}.rejected actorId={} reason=not_admin", operation, actor.id());
            throw new AuthorizationException("Admin privileges required");
        }
    }

    private static void validateContent(ReviewContent content) {
        if (content == null) {
            throw new ValidationException("Review content is required");
        }
        if (isBlank(content.content())) {
            throw new ValidationException("Review content must not be empty");
        }
        if (content.rating() < ReviewContent.MIN_RATING || content.rating() > ReviewContent.MAX_RATING) {
            throw new ValidationException("Rating must be between " + ReviewContent.MIN_RATING
                    + " and " + ReviewContent.MAX_RATING + ", got " + content.rating());
        }
    }

    private void onStatusChanged(Review before, Review after, String actorId) {
        if (before.getStatus() == after.getStatus()) {
            return;
        }
        auditService.record(AuditEntry.transition(after.getId(), actorId, before.getStatus(), after.getStatus(),
                after.getUpdatedAt()));
        metrics.recordStatusTransition(before.getStatus(), after.getStatus());
    }

    private void refreshAppRating(String appId) {
        List<Review> approved = store.findByAppAndStatus(appId, ReviewStatus.APPROVED);
        double average = approved.stream().mapToInt(Review::getRating).average().orElse(0.0);
        appCatalog.updateRating(appId, roundTwoDecimals(average), approved.size());
    }

    private <T> T timed(String operation, Supplier<T> action) {
        long start = System.nanoTime();
        try {
            return action.get();
        } catch (ConcurrencyConflictException e) {
            metrics.incrementConcurrencyConflict();
            throw e;
        } finally {
            metrics.recordOperationDuration(operation, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static double roundTwoDecimals(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ReviewStore store;
        private ActorDirectory directory;
        private AppCatalog appCatalog;
        private ReviewLock reviewLock;
        private AuditService auditService;
        private MetricsService metrics;
        private ConflictNotifier conflictNotifier;
        private Clock clock;

        public Builder store(ReviewStore store) {
            this.store = store;
            return this;
        }

        public Builder directory(ActorDirectory directory) {
            this.directory = directory;
            return this;
        }

        public Builder appCatalog(AppCatalog appCatalog) {
            this.appCatalog = appCatalog;
            return this;
        }

        public Builder reviewLock(ReviewLock reviewLock) {
            this.reviewLock = reviewLock;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder conflictNotifier(ConflictNotifier conflictNotifier) {
            this.conflictNotifier = conflictNotifier;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ReviewApprovalService build() {
            return new ReviewApprovalService(this);
        }
    }
}
