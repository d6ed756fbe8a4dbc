package com.wavesmith.workers.governor;

import com.wavesmith.core.executor.CreateArtifactFn;
import com.wavesmith.core.executor.TieredCreator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Global ceiling on model calls shared by every worker: how many may run at
 * once, how many may start per minute, and how much heap may be in use when
 * one starts. A call that cannot be admitted within {@code maxWait} fails with
 * {@link ResourceExhaustedException}, which the executor records as an
 * artifact failure.
 */
public class ResourceGovernor {

    private static final Logger log = LoggerFactory.getLogger(ResourceGovernor.class);

    private static final Duration WINDOW = Duration.ofMinutes(1);
    private static final long MEMORY_POLL_MS = 50;

    private final Semaphore concurrentCalls;
    private final int maxConcurrentCalls;
    private final int maxCallsPerMinute;
    private final long maxHeapBytes;
    private final Duration maxWait;
    private final Clock clock;
    private final LongSupplier usedHeap;
    private final Deque<Instant> recentCalls = new ArrayDeque<>();

    /**
     * @param maxConcurrentCalls calls in flight across all workers
     * @param maxCallsPerMinute  call starts per sliding minute, 0 for no limit
     * @param maxHeapBytes       heap in use above which new calls wait, 0 for no limit
     * @param maxWait            longest a call waits for admission
     */
    public ResourceGovernor(int maxConcurrentCalls, int maxCallsPerMinute, long maxHeapBytes, Duration maxWait) {
        this(maxConcurrentCalls, maxCallsPerMinute, maxHeapBytes, maxWait, Clock.systemUTC(),
                () -> Runtime.getRuntime().totalMemory() - Runtime.getRuntime().freeMemory());
    }

    ResourceGovernor(int maxConcurrentCalls, int maxCallsPerMinute, long maxHeapBytes, Duration maxWait,
                     Clock clock, LongSupplier usedHeap) {
        this.maxConcurrentCalls = maxConcurrentCalls;
        this.concurrentCalls = new Semaphore(maxConcurrentCalls, true);
        this.maxCallsPerMinute = maxCallsPerMinute;
        this.maxHeapBytes = maxHeapBytes;
        this.maxWait = maxWait;
        this.clock = clock;
        this.usedHeap = usedHeap;
    }

    /** Wraps {@code fn} so every call goes through the governor. */
    public CreateArtifactFn govern(CreateArtifactFn fn) {
        return spec -> {
            acquire();
            try {
                return fn.create(spec);
            } finally {
                release();
            }
        };
    }

    public TieredCreator govern(TieredCreator creator) {
        return creator.map(this::govern);
    }

    /**
     * Blocks until a call may start.
     *
     * @throws ResourceExhaustedException if admission takes longer than {@code maxWait}
     */
    public void acquire() throws InterruptedException {
        long deadline = System.nanoTime() + maxWait.toNanos();
        if (!concurrentCalls.tryAcquire(maxWait.toNanos(), TimeUnit.NANOSECONDS)) {
            throw new ResourceExhaustedException(
                    "No call slot free within %d ms (%d in flight)".formatted(maxWait.toMillis(), maxConcurrentCalls));
        }
        try {
            awaitRateWindow(deadline);
            awaitMemory(deadline);
        } catch (InterruptedException | RuntimeException e) {
            concurrentCalls.release();
            throw e;
        }
    }

    public void release() {
        concurrentCalls.release();
    }

    public int inFlight() {
        return maxConcurrentCalls - concurrentCalls.availablePermits();
    }

    public synchronized int callsInLastMinute() {
        prune(clock.instant());
        return recentCalls.size();
    }

    private void awaitRateWindow(long deadline) throws InterruptedException {
        if (maxCallsPerMinute <= 0) {
            return;
        }
        while (true) {
            long waitMs;
            synchronized (this) {
                Instant now = clock.instant();
                prune(now);
                if (recentCalls.size() < maxCallsPerMinute) {
                    recentCalls.addLast(now);
                    return;
                }
                waitMs = Math.max(1, Duration.between(now, recentCalls.peekFirst().plus(WINDOW)).toMillis());
            }
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                throw new ResourceExhaustedException(
                        "Rate limit of %d calls/minute reached".formatted(maxCallsPerMinute));
            }
            log.debug("Rate limit reached, waiting up to {} ms", Math.min(waitMs, remainingMs));
            Thread.sleep(Math.min(waitMs, remainingMs));
        }
    }

    private void awaitMemory(long deadline) throws InterruptedException {
        if (maxHeapBytes <= 0) {
            return;
        }
        while (usedHeap.getAsLong() > maxHeapBytes) {
            if (System.nanoTime() >= deadline) {
                throw new ResourceExhaustedException("Heap usage %d bytes above ceiling %d"
                        .formatted(usedHeap.getAsLong(), maxHeapBytes));
            }
            Thread.sleep(MEMORY_POLL_MS);
        }
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(WINDOW);
        while (!recentCalls.isEmpty() && !recentCalls.peekFirst().isAfter(cutoff)) {
            recentCalls.pollFirst();
        }
    }
}
