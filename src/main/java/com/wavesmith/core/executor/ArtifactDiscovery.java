package com.wavesmith.core.executor;

import com.wavesmith.core.graph.ArtifactGraph;
import com.wavesmith.core.graph.ArtifactSpec;
import com.wavesmith.core.model.ArtifactResult;

import java.util.List;
import java.util.Map;

/**
 * Invoked after each wave to propose artifacts the plan missed.
 * Proposals go through {@link ArtifactGraph#proposeExtension}.
 */
@FunctionalInterface
public interface ArtifactDiscovery {

    List<ArtifactSpec> discover(ArtifactGraph graph, Map<String, ArtifactResult> completed) throws Exception;
}
