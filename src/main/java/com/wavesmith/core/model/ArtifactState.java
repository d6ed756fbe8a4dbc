package com.wavesmith.core.model;

/**
 * Lifecycle of one artifact within a single execution.
 * COMPLETED, FAILED, BLOCKED and SKIPPED are terminal.
 */
public enum ArtifactState {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    BLOCKED,  // a dependency failed or was blocked
    SKIPPED;  // satisfied by a previous execution

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}
