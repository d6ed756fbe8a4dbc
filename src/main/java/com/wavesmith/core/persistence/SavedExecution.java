package com.wavesmith.core.persistence;

import com.wavesmith.core.cache.ContentHasher;
import com.wavesmith.core.graph.ArtifactGraph;
import com.wavesmith.core.model.ArtifactResult;
import com.wavesmith.core.model.ExecutionStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Goal, graph and append-only progress of one execution.
 *
 * <p>Mutated only by the thread driving the execution (through
 * {@link PlanCheckpointer}); saved by {@link PlanStore} after every change.
 */
public class SavedExecution {

    private final String goal;
    private final String goalHash;
    private final ArtifactGraph graph;
    private final Map<String, ArtifactCompletion> completions = new LinkedHashMap<>();
    private final Map<String, String> failures = new LinkedHashMap<>();
    private final Instant createdAt;
    private ExecutionStatus status;
    private Instant updatedAt;

    public SavedExecution(String goal, ArtifactGraph graph) {
        this(goal, graph, ExecutionStatus.PLANNED, Instant.now(), null);
    }

    SavedExecution(String goal, ArtifactGraph graph, ExecutionStatus status, Instant createdAt, Instant updatedAt) {
        this.goal = goal;
        this.goalHash = ContentHasher.goalHash(goal);
        this.graph = graph;
        this.status = status;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt != null ? updatedAt : createdAt;
    }

    public String getGoal() { return goal; }
    public String getGoalHash() { return goalHash; }
    public ArtifactGraph getGraph() { return graph; }
    public Map<String, ArtifactCompletion> getCompletions() { return Collections.unmodifiableMap(completions); }
    public Map<String, String> getFailures() { return Collections.unmodifiableMap(failures); }
    public ExecutionStatus getStatus() { return status; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void recordCompletion(ArtifactCompletion completion) {
        completions.put(completion.artifactId(), completion);
        failures.remove(completion.artifactId());
        touch();
    }

    public void recordFailure(String artifactId, String error) {
        failures.put(artifactId, error);
        touch();
    }

    public void setStatus(ExecutionStatus status) {
        this.status = status;
        touch();
    }

    void restore(Map<String, ArtifactCompletion> savedCompletions, Map<String, String> savedFailures) {
        completions.putAll(savedCompletions);
        failures.putAll(savedFailures);
    }

    private void touch() {
        updatedAt = Instant.now();
    }

    /** Artifacts without a completion record, including failed ones. */
    public Set<String> pendingIds() {
        Set<String> pending = new LinkedHashSet<>(graph.ids());
        pending.removeAll(completions.keySet());
        return pending;
    }

    public boolean isComplete() {
        return pendingIds().isEmpty();
    }

    public double progress() {
        return graph.isEmpty() ? 1.0 : (double) completions.size() / graph.size();
    }

    /**
     * Index of the first wave that still has an incomplete artifact, or the
     * number of waves when everything completed.
     */
    public int resumeWave() {
        List<Set<String>> waves = graph.executionWaves();
        for (int i = 0; i < waves.size(); i++) {
            if (!completions.keySet().containsAll(waves.get(i))) {
                return i;
            }
        }
        return waves.size();
    }

    /** Completion records as content-less results, keyed by artifact id. */
    public Map<String, ArtifactResult> completedResults() {
        Map<String, ArtifactResult> results = new LinkedHashMap<>();
        completions.forEach((id, completion) -> results.put(id, completion.toResult()));
        return results;
    }
}
