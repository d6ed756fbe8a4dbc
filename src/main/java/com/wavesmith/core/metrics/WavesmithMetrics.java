package com.wavesmith.core.metrics;

import com.wavesmith.core.model.ModelTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for graph execution and worker coordination.
 */
@Service
public class WavesmithMetrics {

    private final MeterRegistry registry;

    public WavesmithMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordArtifactExecution(ModelTier tier, long ms) {
        Timer.builder("wavesmith.artifact.duration")
                .tag("tier", tier.name().toLowerCase())
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordArtifactResult(String outcome) {
        Counter.builder("wavesmith.artifacts.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordWaveSize(int size) {
        DistributionSummary.builder("wavesmith.wave.size")
                .register(registry)
                .record(size);
    }

    public void recordExecution(long ms, boolean success) {
        Timer.builder("wavesmith.execution.duration")
                .tag("result", success ? "success" : "partial")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    // --- Incremental cache ---

    public void recordCacheHits(int count) {
        Counter.builder("wavesmith.cache.hits")
                .register(registry)
                .increment(count);
    }

    public void recordCacheMisses(int count) {
        Counter.builder("wavesmith.cache.misses")
                .register(registry)
                .increment(count);
    }

    // --- Worker coordination ---

    /**
     * Records a lock that could not be acquired because another worker held it.
     *
     * @param resource the contested resource id
     */
    public void recordLockContention(String resource) {
        Counter.builder("wavesmith.lock.contention")
                .description("Lock acquisitions that found the resource already claimed")
                .register(registry)
                .increment();
    }

    public void recordStaleLockReclaimed() {
        Counter.builder("wavesmith.lock.stale_reclaimed")
                .register(registry)
                .increment();
    }

    /**
     * Records the outcome of merging one worker branch.
     *
     * @param strategy merge strategy name
     * @param success  whether the merge landed
     */
    public void recordMerge(String strategy, boolean success) {
        Counter.builder("wavesmith.merge.total")
                .tag("strategy", strategy)
                .tag("result", success ? "merged" : "conflict")
                .register(registry)
                .increment();
    }

    public void recordWorkerFailure(String reason) {
        Counter.builder("wavesmith.worker.failures")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordGoalResult(String status) {
        Counter.builder("wavesmith.goals.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
