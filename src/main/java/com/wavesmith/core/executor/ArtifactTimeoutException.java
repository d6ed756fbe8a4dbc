package com.wavesmith.core.executor;

import java.time.Duration;

public class ArtifactTimeoutException extends ArtifactExecutionException {

    public ArtifactTimeoutException(String artifactId, Duration timeout) {
        super(artifactId, "Artifact '%s' timed out after %d ms".formatted(artifactId, timeout.toMillis()));
    }
}
