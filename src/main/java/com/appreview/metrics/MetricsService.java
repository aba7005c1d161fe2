package com.appreview.metrics;

import com.appreview.review.ReviewStatus;
import com.appreview.review.VoteDecision;

import java.time.Duration;

/**
 * Interface for recording review approval metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works
 * without any metrics registry configured.
 */
public interface MetricsService {

    void incrementSubmitted();

    void incrementVoteCast(VoteDecision decision);

    void recordStatusTransition(ReviewStatus from, ReviewStatus to);

    void incrementOverride(ReviewStatus target);

    void incrementConflictResolved(VoteDecision decision);

    void incrementConcurrencyConflict();

    void recordOperationDuration(String operation, Duration duration);
}
