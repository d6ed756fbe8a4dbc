package com.wavesmith.core.executor;

import com.wavesmith.core.graph.ArtifactSpec;
import com.wavesmith.core.model.ArtifactResult;
import com.wavesmith.core.model.ExecutionResult;

import java.util.List;
import java.util.Set;

/**
 * Progress callbacks. Always invoked on the thread that called
 * {@link ArtifactExecutor#execute}, never concurrently.
 */
public interface ExecutionListener {

    ExecutionListener NOOP = new ExecutionListener() {};

    default void onWaveStarted(int waveNumber, Set<String> artifactIds) {}

    default void onArtifactCompleted(int waveNumber, ArtifactResult result) {}

    default void onArtifactFailed(int waveNumber, String artifactId, String error) {}

    default void onArtifactBlocked(String artifactId, String blockedBy) {}

    default void onWaveCompleted(int waveNumber, int completed, int failed) {}

    default void onGraphExtended(List<ArtifactSpec> added) {}

    default void onExecutionFinished(ExecutionResult result) {}

    /** Invokes each listener in turn. */
    static ExecutionListener composite(List<ExecutionListener> listeners) {
        return new ExecutionListener() {
            @Override
            public void onWaveStarted(int waveNumber, Set<String> artifactIds) {
                listeners.forEach(l -> l.onWaveStarted(waveNumber, artifactIds));
            }

            @Override
            public void onArtifactCompleted(int waveNumber, ArtifactResult result) {
                listeners.forEach(l -> l.onArtifactCompleted(waveNumber, result));
            }

            @Override
            public void onArtifactFailed(int waveNumber, String artifactId, String error) {
                listeners.forEach(l -> l.onArtifactFailed(waveNumber, artifactId, error));
            }

            @Override
            public void onArtifactBlocked(String artifactId, String blockedBy) {
                listeners.forEach(l -> l.onArtifactBlocked(artifactId, blockedBy));
            }

            @Override
            public void onWaveCompleted(int waveNumber, int completed, int failed) {
                listeners.forEach(l -> l.onWaveCompleted(waveNumber, completed, failed));
            }

            @Override
            public void onGraphExtended(List<ArtifactSpec> added) {
                listeners.forEach(l -> l.onGraphExtended(added));
            }

            @Override
            public void onExecutionFinished(ExecutionResult result) {
                listeners.forEach(l -> l.onExecutionFinished(result));
            }
        };
    }
}
