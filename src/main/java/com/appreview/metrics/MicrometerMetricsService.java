package com.appreview.metrics;

import com.appreview.review.ReviewStatus;
import com.appreview.review.VoteDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code review.submitted} - Counter</li>
 *   <li>{@code review.vote.cast} - Counter (tag: decision)</li>
 *   <li>{@code review.status.transition} - Counter (tags: from, to)</li>
 *   <li>{@code review.override} - Counter (tag: target)</li>
 *   <li>{@code review.conflict.resolved} - Counter (tag: decision)</li>
 *   <li>{@code review.concurrency.conflict} - Counter</li>
 *   <li>{@code review.operation.duration} - Timer (tag: operation)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Counter submittedCounter;
    private final Counter concurrencyConflictCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.submittedCounter = Counter.builder("review.submitted")
                .description("Number of reviews submitted")
                .register(registry);
        this.concurrencyConflictCounter = Counter.builder("review.concurrency.conflict")
                .description("Number of writes rejected because of concurrent modification")
                .register(registry);
    }

    @Override
    public void incrementSubmitted() {
        submittedCounter.increment();
    }

    @Override
    public void incrementVoteCast(VoteDecision decision) {
        counterCache.computeIfAbsent("vote:" + decision.name(), k ->
                Counter.builder("review.vote.cast")
                        .description("Number of supervisor votes recorded")
                        .tag("decision", decision.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void recordStatusTransition(ReviewStatus from, ReviewStatus to) {
        counterCache.computeIfAbsent("transition:" + from.name() + ":" + to.name(), k ->
                Counter.builder("review.status.transition")
                        .description("Number of review status transitions")
                        .tag("from", from.name())
                        .tag("to", to.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementOverride(ReviewStatus target) {
        counterCache.computeIfAbsent("override:" + target.name(), k ->
                Counter.builder("review.override")
                        .description("Number of admin overrides")
                        .tag("target", target.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementConflictResolved(VoteDecision decision) {
        counterCache.computeIfAbsent("resolved:" + decision.name(), k ->
                Counter.builder("review.conflict.resolved")
                        .description("Number of conflicts resolved by an admin")
                        .tag("decision", decision.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementConcurrencyConflict() {
        concurrencyConflictCounter.increment();
    }

    @Override
    public void recordOperationDuration(String operation, Duration duration) {
        timerCache.computeIfAbsent(operation, k ->
                Timer.builder("review.operation.duration")
                        .description("Duration of review approval operations")
                        .tag("operation", operation)
                        .register(registry))
                .record(duration);
    }
}
