package com.identity.matching.lock;

/**
 * Configuration for the registry writer lock.
 *
 * @param timeoutMs maximum time a writer waits for exclusive access
 */
public record LockConfig(long timeoutMs) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    /**
     * Default configuration: 5s timeout.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000);
    }
}
