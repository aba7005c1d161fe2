package com.appreview.lock;

import com.appreview.error.ConcurrencyConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process lock using one {@link ReentrantLock} per key. Entries are dropped when
 * the last holder or waiter releases them, so withdrawn reviews leave nothing behind.
 * Suitable for single-JVM deployments. This is the default lock implementation.
 */
public class LocalReviewLock implements ReviewLock {
    private static final Logger log = LoggerFactory.getLogger(LocalReviewLock.class);

    private final ConcurrentHashMap<String, KeyLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalReviewLock() {
        this(LockConfig.defaults());
    }

    public LocalReviewLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public void lock(String key) {
        KeyLock entry = locks.compute(key, (k, existing) -> {
            KeyLock held = existing != null ? existing : new KeyLock(config.fair());
            held.users++;
            return held;
        });
        boolean acquired = false;
        try {
            acquired = entry.lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                log.warn("lock.timeout key={} timeoutMs={}", key, config.timeoutMs());
                throw new ConcurrencyConflictException(
                        "Failed to acquire lock for key '" + key + "' within " + config.timeoutMs() + "ms");
            }
            log.debug("Lock acquired: {}", key);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrencyConflictException("Interrupted while acquiring lock for key: " + key, e);
        } finally {
            if (!acquired) {
                release(key);
            }
        }
    }

    @Override
    public void unlock(String key) {
        KeyLock entry = locks.get(key);
        if (entry != null && entry.lock.isHeldByCurrentThread()) {
            entry.lock.unlock();
            release(key);
            log.debug("Lock released: {}", key);
        }
    }

    /**
     * Number of keys currently locked or waited on.
     */
    int activeKeys() {
        return locks.size();
    }

    // the entry leaves the map once nobody holds or waits for it
    private void release(String key) {
        locks.computeIfPresent(key, (k, entry) -> --entry.users == 0 ? null : entry);
    }

    private static final class KeyLock {
        private final ReentrantLock lock;
        private int users;

        private KeyLock(boolean fair) {
            this.lock = new ReentrantLock(fair);
        }
    }
}
