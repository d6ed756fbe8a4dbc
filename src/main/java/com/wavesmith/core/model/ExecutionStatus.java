package com.wavesmith.core.model;

/**
 * Overall status of a saved execution.
 */
public enum ExecutionStatus {
    PLANNED,
    IN_PROGRESS,
    PAUSED,
    COMPLETED,
    FAILED
}
