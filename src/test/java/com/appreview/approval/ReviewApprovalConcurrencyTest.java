package com.appreview.approval;

import com.appreview.audit.AuditAction;
import com.appreview.audit.AuditService;
import com.appreview.catalog.InMemoryAppCatalog;
import com.appreview.directory.Actor;
import com.appreview.directory.InMemoryActorDirectory;
import com.appreview.error.InvalidStateException;
import com.appreview.error.ValidationException;
import com.appreview.review.InMemoryReviewStore;
import com.appreview.review.Review;
import com.appreview.review.ReviewContent;
import com.appreview.review.ReviewStatus;
import com.appreview.review.VoteDecision;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ReviewApprovalConcurrencyTest {

    private static final int SUPERVISORS = 9;

    private InMemoryActorDirectory directory;
    private InMemoryReviewStore store;
    private AuditService auditService;
    private ReviewApprovalService service;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        directory = new InMemoryActorDirectory();
        for (int i = 0; i < SUPERVISORS; i++) {
            directory.addSupervisor("sup-" + i);
        }
        InMemoryAppCatalog catalog = new InMemoryAppCatalog();
        catalog.register("app-1");
        store = new InMemoryReviewStore();
        auditService = new AuditService();
        service = ReviewApprovalService.builder()
                .store(store)
                .directory(directory)
                .appCatalog(catalog)
                .auditService(auditService)
                .build();
        executor = Executors.newFixedThreadPool(SUPERVISORS);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Concurrent votes on one review produce exactly one terminal transition")
    void concurrentVotesSingleTransition() throws Exception {
        Review review = service.submit(Actor.user("alice"), "app-1", ReviewContent.of("Solid", 4));
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        AtomicInteger refused = new AtomicInteger();

        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < SUPERVISORS; i++) {
            Actor supervisor = Actor.supervisor("sup-" + i);
            futures.add(executor.submit(() -> {
                start.await();
                try {
                    service.castVote(review.getId(), supervisor, VoteDecision.APPROVED, null);
                    accepted.incrementAndGet();
                } catch (InvalidStateException e) {
                    refused.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }

        int required = MajorityRule.requiredApprovals(SUPERVISORS);
        assertEquals(required, accepted.get());
        assertEquals(SUPERVISORS - required, refused.get());
        assertEquals(ReviewStatus.APPROVED, store.findById(review.getId()).orElseThrow().getStatus());
        assertEquals(1, auditService.getEntriesByAction(AuditAction.STATUS_CHANGED).size());

        ApprovalSummary summary = service.getApprovalSummary(review.getId());
        assertEquals(required, summary.approved());
        assertEquals(SUPERVISORS, summary.approved() + summary.rejected() + summary.pending());
    }

    @Test
    @DisplayName("Concurrent submissions of the same app by one author keep a single review")
    void concurrentDuplicateSubmissions() throws Exception {
        Actor author = Actor.user("alice");
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger created = new AtomicInteger();
        AtomicInteger duplicates = new AtomicInteger();

        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < SUPERVISORS; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                try {
                    service.submit(author, "app-1", ReviewContent.of("Nice", 5));
                    created.incrementAndGet();
                } catch (ValidationException e) {
                    duplicates.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }

        assertEquals(1, created.get());
        assertEquals(SUPERVISORS - 1, duplicates.get());
        assertEquals(1, store.findByAuthor("alice").size());
    }
}
