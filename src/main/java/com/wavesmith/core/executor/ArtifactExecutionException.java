package com.wavesmith.core.executor;

/**
 * Raised when the create capability fails for one artifact. Recorded per
 * artifact; never aborts sibling work.
 */
public class ArtifactExecutionException extends RuntimeException {

    private final String artifactId;

    public ArtifactExecutionException(String artifactId, String message) {
        super(message);
        this.artifactId = artifactId;
    }

    public ArtifactExecutionException(String artifactId, String message, Throwable cause) {
        super(message, cause);
        this.artifactId = artifactId;
    }

    public String getArtifactId() {
        return artifactId;
    }
}
