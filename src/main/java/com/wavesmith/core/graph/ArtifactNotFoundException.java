package com.wavesmith.core.graph;

public class ArtifactNotFoundException extends RuntimeException {

    public ArtifactNotFoundException(String artifactId) {
        super("Artifact not found: " + artifactId);
    }
}
