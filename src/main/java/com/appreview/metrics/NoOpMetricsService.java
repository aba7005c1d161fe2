package com.appreview.metrics;

import com.appreview.review.ReviewStatus;
import com.appreview.review.VoteDecision;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void incrementSubmitted() {
    }

    @Override
    public void incrementVoteCast(VoteDecision decision) {
    }

    @Override
    public void recordStatusTransition(ReviewStatus from, ReviewStatus to) {
    }

    @Override
    public void incrementOverride(ReviewStatus target) {
    }

    @Override
    public void incrementConflictResolved(VoteDecision decision) {
    }

    @Override
    public void incrementConcurrencyConflict() {
    }

    @Override
    public void recordOperationDuration(String operation, Duration duration) {
    }
}
