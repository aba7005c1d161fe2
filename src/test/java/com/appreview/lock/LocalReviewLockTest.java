package com.appreview.lock;

import com.appreview.error.ConcurrencyConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LocalReviewLockTest {

    @Test
    @DisplayName("Should run the action under the lock and return its result")
    void withLockReturnsResult() {
        LocalReviewLock lock = new LocalReviewLock();
        assertEquals("done", lock.withLock(ReviewLock.reviewKey("r-1"), () -> "done"));
    }

    @Test
    @DisplayName("Should allow re-entrant locking from the same thread")
    void reentrant() {
        LocalReviewLock lock = new LocalReviewLock();
        String result = lock.withLock("k", () -> lock.withLock("k", () -> "inner"));
        assertEquals("inner", result);
    }

    @Test
    @DisplayName("Should time out with ConcurrencyConflictException while another thread holds the key")
    void timesOut() throws Exception {
        LocalReviewLock lock = new LocalReviewLock(new LockConfig(50, false));
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = executor.submit(() -> lock.withLock("review:r-1", () -> {
                held.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            }));
            assertTrue(held.await(5, TimeUnit.SECONDS));

            assertThrows(ConcurrencyConflictException.class, () -> lock.lock("review:r-1"));
            assertDoesNotThrow(() -> lock.withLock("review:r-2", () -> null));

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
            assertEquals(0, lock.activeKeys());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should serialize critical sections on the same key")
    void serializesSameKey() throws Exception {
        LocalReviewLock lock = new LocalReviewLock();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 50; i++) {
                executor.submit(() -> lock.withLock("review:shared", () -> {
                    int now = inside.incrementAndGet();
                    maxInside.accumulateAndGet(now, Math::max);
                    inside.decrementAndGet();
                    return null;
                }));
            }
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, maxInside.get());
        assertEquals(0, lock.activeKeys());
    }

    @Test
    @DisplayName("Should drop a key once its last holder releases it")
    void releasedKeysAreEvicted() {
        LocalReviewLock lock = new LocalReviewLock();

        int whileNested = lock.withLock("review:r-1", () -> lock.withLock("review:r-1", lock::activeKeys));

        assertEquals(1, whileNested);
        assertEquals(0, lock.activeKeys());
    }

    @Test
    @DisplayName("Lock config rejects non-positive timeouts")
    void configValidation() {
        assertThrows(IllegalArgumentException.class, () -> new LockConfig(0, true));
        assertEquals(5000, LockConfig.defaults().timeoutMs());
    }

    @Test
    @DisplayName("Keys are namespaced by purpose")
    void keys() {
        assertEquals("review:abc", ReviewLock.reviewKey("abc"));
        assertEquals("submission:app-1:alice", ReviewLock.submissionKey("app-1", "alice"));
    }
}
