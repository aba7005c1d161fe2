package com.appreview.review;

import com.appreview.error.ConcurrencyConflictException;
import com.appreview.error.ReviewNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link ReviewStore}.
 * Suitable for testing and single-JVM deployments.
 */
public class InMemoryReviewStore implements ReviewStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewStore.class);

    private static final Comparator<Review> NEWEST_FIRST =
            Comparator.comparing(Review::getCreatedAt).reversed().thenComparing(Review::getId);

    private final ConcurrentMap<String, Review> reviews = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Map<String, SupervisorDecision>> decisions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<ResolutionRecord>> resolutions = new ConcurrentHashMap<>();

    @Override
    public Review insert(Review review) {
        Review existing = reviews.putIfAbsent(review.getId(), review);
        if (existing != null) {
            throw new IllegalArgumentException("Review already exists: " + review.getId());
        }
        log.debug("Inserted review {} (app={}, author={})",
                review.getId(), review.getAppId(), review.getAuthorId());
        return review;
    }

    @Override
    public Review update(Review review) {
        Review[] stored = new Review[1];
        reviews.compute(review.getId(), (id, current) -> {
            if (current == null) {
                throw new ReviewNotFoundException(id);
            }
            if (current.getVersion() != review.getVersion()) {
                throw new ConcurrencyConflictException("Review " + id + " was modified concurrently (expected version "
                        + review.getVersion() + ", found " + current.getVersion() + ")");
            }
            stored[0] = review.toBuilder().version(current.getVersion() + 1).build();
            return stored[0];
        });
        log.debug("Updated review {} status={} version={}",
                review.getId(), stored[0].getStatus(), stored[0].getVersion());
        return stored[0];
    }

    @Override
    public boolean delete(String reviewId) {
        Review removed = reviews.remove(reviewId);
        decisions.remove(reviewId);
        resolutions.remove(reviewId);
        return removed != null;
    }

    @Override
    public Optional<Review> findById(String reviewId) {
        return Optional.ofNullable(reviews.get(reviewId));
    }

    @Override
    public Optional<Review> findByAppAndAuthor(String appId, String authorId) {
        return reviews.values().stream()
                .filter(r -> r.getAppId().equals(appId) && r.getAuthorId().equals(authorId))
                .findFirst();
    }

    @Override
    public List<Review> findByStatus(ReviewStatus status) {
        return reviews.values().stream()
                .filter(r -> status == null || r.getStatus() == status)
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public List<Review> findByAuthor(String authorId) {
        return reviews.values().stream()
                .filter(r -> r.getAuthorId().equals(authorId))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public List<Review> findByAppAndStatus(String appId, ReviewStatus status) {
        return reviews.values().stream()
                .filter(r -> r.getAppId().equals(appId) && r.getStatus() == status)
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public Optional<SupervisorDecision> saveDecision(SupervisorDecision decision) {
        Map<String, SupervisorDecision> byReview =
                decisions.computeIfAbsent(decision.reviewId(), k -> new ConcurrentHashMap<>());
        return Optional.ofNullable(byReview.put(decision.supervisorId(), decision));
    }

    @Override
    public List<SupervisorDecision> findDecisions(String reviewId) {
        Map<String, SupervisorDecision> byReview = decisions.get(reviewId);
        if (byReview == null) {
            return List.of();
        }
        return byReview.values().stream()
                .sorted(Comparator.comparing(SupervisorDecision::decidedAt))
                .toList();
    }

    @Override
    public Optional<SupervisorDecision> findDecision(String reviewId, String supervisorId) {
        Map<String, SupervisorDecision> byReview = decisions.get(reviewId);
        return byReview == null ? Optional.empty() : Optional.ofNullable(byReview.get(supervisorId));
    }

    @Override
    public List<SupervisorDecision> findDecisionsBySupervisor(String supervisorId) {
        List<SupervisorDecision> result = new ArrayList<>();
        for (Map<String, SupervisorDecision> byReview : decisions.values()) {
            SupervisorDecision decision = byReview.get(supervisorId);
            if (decision != null) {
                result.add(decision);
            }
        }
        return result;
    }

    @Override
    public boolean deleteDecision(String reviewId, String supervisorId) {
        Map<String, SupervisorDecision> byReview = decisions.get(reviewId);
        return byReview != null && byReview.remove(supervisorId) != null;
    }

    @Override
    public int clearDecisions(String reviewId) {
        Map<String, SupervisorDecision> removed = decisions.remove(reviewId);
        return removed != null ? removed.size() : 0;
    }

    @Override
    public ResolutionRecord appendResolution(ResolutionRecord record) {
        resolutions.computeIfAbsent(record.reviewId(), k -> new CopyOnWriteArrayList<>()).add(record);
        return record;
    }

    @Override
    public List<ResolutionRecord> findResolutions(String reviewId) {
        List<ResolutionRecord> records = resolutions.get(reviewId);
        return records != null ? List.copyOf(records) : List.of();
    }
}
