package com.wavesmith.core.model;

import java.util.List;

/**
 * Output of executing a single artifact.
 *
 * @param artifactId  the artifact this result belongs to
 * @param content     produced content; null when loaded from a snapshot
 * @param verified    whether the verification callback accepted the content
 * @param issues      problems reported by verification
 * @param modelTier   tier that produced the content
 * @param durationMs  wall-clock time of the create call
 * @param contentHash SHA-256 of the content
 */
public record ArtifactResult(
    String artifactId,
    String content,
    boolean verified,
    List<String> issues,
    ModelTier modelTier,
    long durationMs,
    String contentHash
) {

    public ArtifactResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public ArtifactResult withVerification(boolean verified, List<String> issues) {
        return new ArtifactResult(artifactId, content, verified, issues, modelTier, durationMs, contentHash);
    }

    public boolean hasContent() {
        return content != null;
    }
}
