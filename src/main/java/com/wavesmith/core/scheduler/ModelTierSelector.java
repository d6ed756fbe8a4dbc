package com.wavesmith.core.scheduler;

import com.wavesmith.core.graph.ArtifactGraph;
import com.wavesmith.core.graph.ArtifactSpec;
import com.wavesmith.core.model.ModelTier;

import java.util.EnumMap;
import java.util.Map;

/**
 * Picks the model tier for an artifact from its position in the graph.
 *
 * <ul>
 *   <li>Leaves need no upstream context: {@link ModelTier#SMALL}.</li>
 *   <li>Artifacts with at most two direct dependencies: {@link ModelTier#MEDIUM}.</li>
 *   <li>Convergence points with wider fan-in: {@link ModelTier#LARGE}.</li>
 * </ul>
 */
public final class ModelTierSelector {

    static final int MEDIUM_FAN_IN_CEILING = 2;

    private ModelTierSelector() {}

    public static ModelTier select(ArtifactSpec spec, ArtifactGraph graph) {
        if (graph.depth(spec.id()) == 0) {
            return ModelTier.SMALL;
        }
        return graph.fanIn(spec.id()) <= MEDIUM_FAN_IN_CEILING ? ModelTier.MEDIUM : ModelTier.LARGE;
    }

    /** Number of artifacts that would run on each tier. Useful for cost previews. */
    public static Map<ModelTier, Integer> distribution(ArtifactGraph graph) {
        Map<ModelTier, Integer> counts = new EnumMap<>(ModelTier.class);
        for (ModelTier tier : ModelTier.values()) {
            counts.put(tier, 0);
        }
        for (ArtifactSpec spec : graph) {
            counts.merge(select(spec, graph), 1, Integer::sum);
        }
        return counts;
    }
}
