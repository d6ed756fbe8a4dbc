package com.wavesmith.core.graph;

import java.util.Set;
import java.util.TreeSet;

public class MissingDependencyException extends GraphConstructionException {

    private final String artifactId;
    private final Set<String> missingIds;

    public MissingDependencyException(String artifactId, Set<String> missingIds) {
        super("Artifact '%s' requires missing artifacts: %s".formatted(artifactId, new TreeSet<>(missingIds)));
        this.artifactId = artifactId;
        this.missingIds = Set.copyOf(missingIds);
    }

    public String getArtifactId() {
        return artifactId;
    }

    public Set<String> getMissingIds() {
        return missingIds;
    }
}
