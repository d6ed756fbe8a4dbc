package com.wavesmith.core.cache;

import com.wavesmith.core.graph.ArtifactGraph;
import com.wavesmith.core.model.ModelTier;
import com.wavesmith.core.scheduler.ModelTierSelector;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What an execution would do, computed without running anything.
 *
 * @param goalHash         goal identifier
 * @param waves            execution waves of the whole graph
 * @param tierDistribution artifacts per model tier
 * @param maxDepth         longest dependency chain
 * @param toExecute        artifacts that would run
 * @param toSkip           artifacts that would be reused from the previous execution
 * @param changes          classification of every artifact
 */
public record PlanPreview(
    String goalHash,
    List<Set<String>> waves,
    Map<ModelTier, Integer> tierDistribution,
    int maxDepth,
    Set<String> toExecute,
    Set<String> toSkip,
    Map<String, ChangeKind> changes
) {

    public static PlanPreview of(String goalHash, ArtifactGraph graph, IncrementalPlan plan, ChangeSet changes) {
        return new PlanPreview(goalHash, graph.executionWaves(), ModelTierSelector.distribution(graph),
                graph.maxDepth(), plan.toExecute(), plan.toSkip(), changes.kinds());
    }

    public int totalArtifacts() {
        return toExecute.size() + toSkip.size();
    }

    /** Fraction of artifacts that would be reused. */
    public double savingsRate() {
        int total = totalArtifacts();
        return total == 0 ? 0.0 : (double) toSkip.size() / total;
    }
}
