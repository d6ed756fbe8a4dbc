package com.wavesmith.workers.lock;

import java.time.Duration;
import java.time.Instant;

/**
 * Contents of an on-disk lock file.
 *
 * @param resource   logical resource id (goal id or file path)
 * @param holderId   worker that holds the lock
 * @param acquiredAt when the lock was taken
 * @param ttlMillis  how long the holder may keep the lock without renewing it
 */
public record LockRecord(String resource, String holderId, Instant acquiredAt, long ttlMillis) {

    public Instant expiresAt() {
        return acquiredAt.plusMillis(ttlMillis);
    }

    /** True when the TTL has run out or the lock is older than {@code staleThreshold}. */
    public boolean isStale(Instant now, Duration staleThreshold) {
        return now.isAfter(expiresAt()) || Duration.between(acquiredAt, now).compareTo(staleThreshold) > 0;
    }
}
