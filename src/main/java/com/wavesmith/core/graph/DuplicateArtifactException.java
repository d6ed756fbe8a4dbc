package com.wavesmith.core.graph;

public class DuplicateArtifactException extends GraphConstructionException {

    private final String artifactId;

    public DuplicateArtifactException(String artifactId) {
        super("Artifact '%s' already exists in graph".formatted(artifactId));
        this.artifactId = artifactId;
    }

    public String getArtifactId() {
        return artifactId;
    }
}
