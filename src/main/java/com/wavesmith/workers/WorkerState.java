package com.wavesmith.workers;

public enum WorkerState {
    STARTING,
    IDLE,
    CLAIMING,
    EXECUTING,
    COMMITTING,
    MERGING,
    STOPPED,
    FAILED;

    public boolean isTerminal() {
        return this == STOPPED || this == FAILED;
    }
}
