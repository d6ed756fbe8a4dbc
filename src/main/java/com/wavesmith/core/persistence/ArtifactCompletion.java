package com.wavesmith.core.persistence;

import com.wavesmith.core.model.ArtifactResult;
import com.wavesmith.core.model.ModelTier;

import java.time.Instant;

/**
 * Durable record of one completed artifact.
 *
 * @param artifactId  the artifact
 * @param contentHash SHA-256 of the produced content
 * @param inputHash   hash of the artifact spec and its dependencies' input hashes at the time it ran;
 *                    null for records written before input hashing was known
 * @param modelTier   tier that produced the content
 * @param durationMs  create duration
 * @param verified    verification outcome
 * @param completedAt completion time
 */
public record ArtifactCompletion(
    String artifactId,
    String contentHash,
    String inputHash,
    ModelTier modelTier,
    long durationMs,
    boolean verified,
    Instant completedAt
) {

    public static ArtifactCompletion from(ArtifactResult result, String inputHash, Instant completedAt) {
        return new ArtifactCompletion(result.artifactId(), result.contentHash(), inputHash,
                result.modelTier(), result.durationMs(), result.verified(), completedAt);
    }

    /** The completion as a result without content, for reuse in a later run. */
    public ArtifactResult toResult() {
        return new ArtifactResult(artifactId, null, verified, null, modelTier, durationMs, contentHash);
    }
}
