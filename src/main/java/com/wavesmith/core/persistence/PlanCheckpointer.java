package com.wavesmith.core.persistence;

import com.wavesmith.core.cache.ContentHasher;
import com.wavesmith.core.executor.ExecutionListener;
import com.wavesmith.core.graph.ArtifactSpec;
import com.wavesmith.core.model.ArtifactResult;
import com.wavesmith.core.model.ExecutionResult;
import com.wavesmith.core.model.ExecutionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes execution progress to a {@link PlanStore} as it happens: the snapshot
 * after every artifact, and one trace line per event.
 */
public class PlanCheckpointer implements ExecutionListener {

    private static final Logger log = LoggerFactory.getLogger(PlanCheckpointer.class);

    private final SavedExecution execution;
    private final PlanStore store;
    private final TraceLogger trace;
    private final Map<String, String> inputHashes;

    public PlanCheckpointer(SavedExecution execution, PlanStore store, TraceLogger trace) {
        this.execution = execution;
        this.store = store;
        this.trace = trace;
        this.inputHashes = new HashMap<>(ContentHasher.inputHashes(execution.getGraph()));
    }

    @Override
    public void onWaveStarted(int waveNumber, Set<String> artifactIds) {
        trace.log("wave_start", Map.of("wave", waveNumber, "artifacts", List.copyOf(artifactIds)));
    }

    @Override
    public void onArtifactCompleted(int waveNumber, ArtifactResult result) {
        execution.recordCompletion(ArtifactCompletion.from(result, inputHashes.get(result.artifactId()), Instant.now()));
        store.save(execution);
        trace.log("artifact_complete", Map.of(
                "artifact_id", result.artifactId(),
                "content_hash", result.contentHash(),
                "tier", result.modelTier().name(),
                "duration_ms", result.durationMs(),
                "verified", result.verified()));
    }

    @Override
    public void onArtifactFailed(int waveNumber, String artifactId, String error) {
        execution.recordFailure(artifactId, error);
        store.save(execution);
        trace.log("artifact_failed", Map.of("artifact_id", artifactId, "error", error));
    }

    @Override
    public void onArtifactBlocked(String artifactId, String blockedBy) {
        trace.log("artifact_blocked", Map.of("artifact_id", artifactId, "blocked_by", blockedBy));
    }

    @Override
    public void onWaveCompleted(int waveNumber, int completed, int failed) {
        trace.log("wave_complete", Map.of("wave", waveNumber, "completed", completed, "failed", failed));
    }

    @Override
    public void onGraphExtended(List<ArtifactSpec> added) {
        inputHashes.putAll(ContentHasher.inputHashes(execution.getGraph()));
        store.save(execution);
        trace.log("graph_extended", Map.of("artifacts", added.stream().map(ArtifactSpec::id).toList()));
    }

    @Override
    public void onExecutionFinished(ExecutionResult result) {
        ExecutionStatus status = finalStatus(result);
        execution.setStatus(status);
        store.save(execution);
        trace.log("execution_complete", Map.of(
                "status", status.name(),
                "completed", result.completed().size(),
                "failed", result.failed().size(),
                "blocked", result.blocked().size(),
                "skipped", result.skipped().size(),
                "duration_ms", result.totalDurationMs()));
        log.info("Execution {} saved with status {}", execution.getGoalHash(), status);
    }

    private ExecutionStatus finalStatus(ExecutionResult result) {
        if (result.cancelled()) {
            return ExecutionStatus.PAUSED;
        }
        if (!result.failed().isEmpty() || !result.blocked().isEmpty()) {
            return ExecutionStatus.FAILED;
        }
        return execution.isComplete() ? ExecutionStatus.COMPLETED : ExecutionStatus.PAUSED;
    }
}
