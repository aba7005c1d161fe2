package com.appreview.lock;

import java.util.function.Supplier;

/**
 * Per-key mutual exclusion for review state transitions.
 * Vote insert, tally and status write run as one unit under the review's key.
 */
public interface ReviewLock {

    /**
     * Acquires the lock on the given key, waiting at most the configured timeout.
     *
     * @param key the lock key (typically {@code review:<id>})
     * @throws com.appreview.error.ConcurrencyConflictException if the lock cannot be acquired in time
     */
    void lock(String key);

    /**
     * Releases a lock held by the current thread.
     */
    void unlock(String key);

    /**
     * Runs the action while holding the lock on {@code key}.
     */
    default <T> T withLock(String key, Supplier<T> action) {
        lock(key);
        try {
            return action.get();
        } finally {
            unlock(key);
        }
    }

    static String reviewKey(String reviewId) {
        return "review:" + reviewId;
    }

    static String submissionKey(String appId, String authorId) {
        return "submission:" + appId + ":" + authorId;
    }
}
