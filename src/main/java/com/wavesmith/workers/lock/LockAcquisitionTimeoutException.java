package com.wavesmith.workers.lock;

import java.time.Duration;

/**
 * The resource stayed claimed by another holder for the whole wait. Workers
 * treat the resource as taken and move on.
 */
public class LockAcquisitionTimeoutException extends RuntimeException {

    private final String resource;
    private final String currentHolder;

    public LockAcquisitionTimeoutException(String resource, String currentHolder, Duration timeout) {
        super("Timed out after %d ms waiting for lock on '%s' (held by %s)"
                .formatted(timeout.toMillis(), resource, currentHolder));
        this.resource = resource;
        this.currentHolder = currentHolder;
    }

    public String getResource() {
        return resource;
    }

    public String getCurrentHolder() {
        return currentHolder;
    }
}
