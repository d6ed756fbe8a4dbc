package com.wavesmith.core.model;

import com.wavesmith.core.graph.ArtifactSpec;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aggregate outcome of one executor run.
 *
 * @param completed         results by artifact id, including artifacts carried over from a previous run
 * @param failed            error message by artifact id
 * @param blocked           artifacts not run because a dependency failed or was blocked
 * @param skipped           artifacts satisfied by a previous run rather than executed
 * @param waves             waves in the order they ran
 * @param discovered        artifacts added to the graph during execution
 * @param totalDurationMs   wall-clock duration of the run
 * @param modelDistribution number of executed artifacts per tier
 * @param cancelled         true when the run stopped early on a cancellation signal
 */
public record ExecutionResult(
    Map<String, ArtifactResult> completed,
    Map<String, String> failed,
    Set<String> blocked,
    Set<String> skipped,
    List<Set<String>> waves,
    List<ArtifactSpec> discovered,
    long totalDurationMs,
    Map<ModelTier, Integer> modelDistribution,
    boolean cancelled
) {

    public ExecutionResult {
        completed = Map.copyOf(completed);
        failed = Map.copyOf(failed);
        blocked = Set.copyOf(blocked);
        skipped = Set.copyOf(skipped);
        waves = List.copyOf(waves);
        discovered = List.copyOf(discovered);
        modelDistribution = Map.copyOf(modelDistribution);
    }

    /** Terminal state of an artifact, or PENDING if this run never reached it. */
    public ArtifactState stateOf(String artifactId) {
        if (skipped.contains(artifactId)) {
            return ArtifactState.SKIPPED;
        }
        if (completed.containsKey(artifactId)) {
            return ArtifactState.COMPLETED;
        }
        if (failed.containsKey(artifactId)) {
            return ArtifactState.FAILED;
        }
        return blocked.contains(artifactId) ? ArtifactState.BLOCKED : ArtifactState.PENDING;
    }

    /** True when every artifact completed. */
    public boolean isSuccess() {
        return failed.isEmpty() && blocked.isEmpty() && !cancelled;
    }

    public int totalArtifacts() {
        return completed.size() + failed.size() + blocked.size();
    }

    public double successRate() {
        int total = totalArtifacts();
        return total == 0 ? 0.0 : (double) completed.size() / total;
    }

    public double verificationRate() {
        if (completed.isEmpty()) {
            return 0.0;
        }
        long verified = completed.values().stream().filter(ArtifactResult::verified).count();
        return (double) verified / completed.size();
    }
}
