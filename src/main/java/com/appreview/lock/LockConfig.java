package com.appreview.lock;

/**
 * Configuration for review lock implementations.
 *
 * @param timeoutMs maximum time to wait for lock acquisition
 * @param fair      whether waiting writers acquire the lock in arrival order
 */
public record LockConfig(long timeoutMs, boolean fair) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    /**
     * Default configuration: 5s timeout, fair ordering.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000, true);
    }
}
