package com.wavesmith.core.executor;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal. The executor checks it before each wave.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
