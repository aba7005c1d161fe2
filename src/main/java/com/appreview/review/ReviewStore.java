package com.appreview.review;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for reviews, supervisor decisions and resolution records, keyed by review id.
 * Implementations provide different storage backends (in-memory, relational, etc.).
 *
 * <p>Updates are optimistic: {@link #update(Review)} succeeds only when the stored
 * version equals the version carried by the argument.</p>
 */
public interface ReviewStore {

    /**
     * Inserts a new review.
     *
     * @return the stored review
     * @throws IllegalArgumentException if a review with the same id already exists
     */
    Review insert(Review review);

    /**
     * Replaces a review, bumping its version.
     *
     * @param review the new state, carrying the version it was derived from
     * @return the stored review with its new version
     * @throws com.appreview.error.ReviewNotFoundException if the review no longer exists
     * @throws com.appreview.error.ConcurrencyConflictException if the stored version moved
     */
    Review update(Review review);

    /**
     * Deletes a review together with its decisions and resolution records.
     *
     * @return true if a review was removed
     */
    boolean delete(String reviewId);

    Optional<Review> findById(String reviewId);

    Optional<Review> findByAppAndAuthor(String appId, String authorId);

    /**
     * Gets reviews with the given status, newest first. A null status returns every review.
     */
    List<Review> findByStatus(ReviewStatus status);

    /**
     * Gets all reviews written by an author, newest first.
     */
    List<Review> findByAuthor(String authorId);

    /**
     * Gets the reviews of an app in the given status.
     */
    List<Review> findByAppAndStatus(String appId, ReviewStatus status);

    /**
     * Records a supervisor decision, replacing any earlier decision by the same supervisor.
     *
     * @return the replaced decision, if there was one
     */
    Optional<SupervisorDecision> saveDecision(SupervisorDecision decision);

    /**
     * Gets the decisions for a review, oldest first.
     */
    List<SupervisorDecision> findDecisions(String reviewId);

    Optional<SupervisorDecision> findDecision(String reviewId, String supervisorId);

    /**
     * Gets every decision cast by a supervisor, across all reviews.
     */
    List<SupervisorDecision> findDecisionsBySupervisor(String supervisorId);

    /**
     * Removes one supervisor's decision.
     *
     * @return true if a decision was removed
     */
    boolean deleteDecision(String reviewId, String supervisorId);

    /**
     * Removes every decision for a review.
     *
     * @return the number of decisions removed
     */
    int clearDecisions(String reviewId);

    ResolutionRecord appendResolution(ResolutionRecord record);

    /**
     * Gets the resolution records for a review, oldest first.
     */
    List<ResolutionRecord> findResolutions(String reviewId);
}
