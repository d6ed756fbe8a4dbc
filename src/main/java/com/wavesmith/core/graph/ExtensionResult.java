package com.wavesmith.core.graph;

import java.util.List;

/**
 * Outcome of {@link ArtifactGraph#proposeExtension}.
 *
 * @param accepted    whether the new artifacts were added
 * @param artifactIds ids added (empty when rejected)
 * @param reason      rejection reason, null when accepted
 */
public record ExtensionResult(boolean accepted, List<String> artifactIds, String reason) {

    public static ExtensionResult accepted(List<String> artifactIds) {
        return new ExtensionResult(true, List.copyOf(artifactIds), null);
    }

    public static ExtensionResult rejected(String reason) {
        return new ExtensionResult(false, List.of(), reason);
    }
}
