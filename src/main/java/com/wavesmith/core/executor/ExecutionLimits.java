package com.wavesmith.core.executor;

import com.wavesmith.core.model.ModelTier;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Bounds applied to a single executor run.
 *
 * @param maxConcurrent      artifacts in flight at once across all tiers
 * @param tierConcurrency    artifacts in flight at once per tier; cheaper tiers get more slots
 * @param artifactTimeout    wall-clock limit for one create call
 * @param maxArtifacts       graph size ceiling, including discovered artifacts
 * @param maxDepth           depth above which a warning is logged
 * @param maxDiscoveryRounds how many times discovery may extend the graph
 */
public record ExecutionLimits(
    int maxConcurrent,
    Map<ModelTier, Integer> tierConcurrency,
    Duration artifactTimeout,
    int maxArtifacts,
    int maxDepth,
    int maxDiscoveryRounds
) {

    public static final int DEFAULT_MAX_CONCURRENT = 8;
    public static final int DEFAULT_MAX_ARTIFACTS = 50;
    public static final int DEFAULT_MAX_DEPTH = 10;
    public static final int DEFAULT_MAX_DISCOVERY_ROUNDS = 5;
    public static final Duration DEFAULT_ARTIFACT_TIMEOUT = Duration.ofMinutes(5);

    public ExecutionLimits {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1");
        }
        Map<ModelTier, Integer> tiers = new EnumMap<>(ModelTier.class);
        tiers.putAll(defaultTierConcurrency());
        if (tierConcurrency != null) {
            tiers.putAll(tierConcurrency);
        }
        tierConcurrency = Map.copyOf(tiers);
        artifactTimeout = artifactTimeout == null ? DEFAULT_ARTIFACT_TIMEOUT : artifactTimeout;
    }

    public static ExecutionLimits defaults() {
        return new ExecutionLimits(DEFAULT_MAX_CONCURRENT, defaultTierConcurrency(), DEFAULT_ARTIFACT_TIMEOUT,
                DEFAULT_MAX_ARTIFACTS, DEFAULT_MAX_DEPTH, DEFAULT_MAX_DISCOVERY_ROUNDS);
    }

    public static Map<ModelTier, Integer> defaultTierConcurrency() {
        return Map.of(ModelTier.SMALL, 8, ModelTier.MEDIUM, 4, ModelTier.LARGE, 2);
    }

    public int concurrencyFor(ModelTier tier) {
        return Math.max(1, Math.min(maxConcurrent, tierConcurrency.get(tier)));
    }

    public ExecutionLimits withMaxConcurrent(int value) {
        return new ExecutionLimits(value, tierConcurrency, artifactTimeout, maxArtifacts, maxDepth, maxDiscoveryRounds);
    }

    public ExecutionLimits withArtifactTimeout(Duration value) {
        return new ExecutionLimits(maxConcurrent, tierConcurrency, value, maxArtifacts, maxDepth, maxDiscoveryRounds);
    }

    public ExecutionLimits withMaxArtifacts(int value) {
        return new ExecutionLimits(maxConcurrent, tierConcurrency, artifactTimeout, value, maxDepth, maxDiscoveryRounds);
    }

    public ExecutionLimits withMaxDiscoveryRounds(int value) {
        return new ExecutionLimits(maxConcurrent, tierConcurrency, artifactTimeout, maxArtifacts, maxDepth, value);
    }
}
