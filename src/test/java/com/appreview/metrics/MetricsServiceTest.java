package com.appreview.metrics;

import com.appreview.review.ReviewStatus;
import com.appreview.review.VoteDecision;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("Should accept every call without error")
        void noOp() {
            NoOpMetricsService metrics = new NoOpMetricsService();
            assertDoesNotThrow(() -> {
                metrics.incrementSubmitted();
                metrics.incrementVoteCast(VoteDecision.APPROVED);
                metrics.recordStatusTransition(ReviewStatus.PENDING, ReviewStatus.APPROVED);
                metrics.incrementOverride(ReviewStatus.REJECTED);
                metrics.incrementConflictResolved(VoteDecision.REJECTED);
                metrics.incrementConcurrencyConflict();
                metrics.recordOperationDuration("castVote", Duration.ofMillis(3));
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private SimpleMeterRegistry registry;
        private MicrometerMetricsService metrics;

        @BeforeEach
        void setUp() {
            registry = new SimpleMeterRegistry();
            metrics = new MicrometerMetricsService(registry);
        }

        @Test
        @DisplayName("Should count submissions and concurrency conflicts")
        void plainCounters() {
            metrics.incrementSubmitted();
            metrics.incrementSubmitted();
            metrics.incrementConcurrencyConflict();

            assertEquals(2.0, registry.counter("review.submitted").count());
            assertEquals(1.0, registry.counter("review.concurrency.conflict").count());
        }

        @Test
        @DisplayName("Should tag votes by decision")
        void votesTagged() {
            metrics.incrementVoteCast(VoteDecision.APPROVED);
            metrics.incrementVoteCast(VoteDecision.APPROVED);
            metrics.incrementVoteCast(VoteDecision.REJECTED);

            assertEquals(2.0, registry.get("review.vote.cast").tag("decision", "APPROVED").counter().count());
            assertEquals(1.0, registry.get("review.vote.cast").tag("decision", "REJECTED").counter().count());
        }

        @Test
        @DisplayName("Should tag transitions, overrides and resolutions")
        void transitionsTagged() {
            metrics.recordStatusTransition(ReviewStatus.PENDING, ReviewStatus.CONFLICTED);
            metrics.incrementOverride(ReviewStatus.APPROVED);
            metrics.incrementConflictResolved(VoteDecision.REJECTED);

            assertEquals(1.0, registry.get("review.status.transition")
                    .tag("from", "PENDING").tag("to", "CONFLICTED").counter().count());
            assertEquals(1.0, registry.get("review.override").tag("target", "APPROVED").counter().count());
            assertEquals(1.0, registry.get("review.conflict.resolved").tag("decision", "REJECTED").counter().count());
        }

        @Test
        @DisplayName("Should time operations by name")
        void operationTimer() {
            metrics.recordOperationDuration("castVote", Duration.ofMillis(20));
            metrics.recordOperationDuration("castVote", Duration.ofMillis(40));

            var timer = registry.get("review.operation.duration").tag("operation", "castVote").timer();
            assertEquals(2, timer.count());
            assertEquals(60.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
        }
    }
}
