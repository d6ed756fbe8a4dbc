package com.wavesmith.core.events;

/**
 * Events published on the {@link EventBus}. Execution events carry the goal hash
 * of the graph being executed; coordinator events carry none.
 */
public enum EventType {

    WAVE_STARTED("wave.started", Scope.EXECUTION),
    WAVE_COMPLETED("wave.completed", Scope.EXECUTION),
    ARTIFACT_STARTED("artifact.started", Scope.EXECUTION),
    ARTIFACT_COMPLETED("artifact.completed", Scope.EXECUTION),
    ARTIFACT_FAILED("artifact.failed", Scope.EXECUTION),
    ARTIFACT_BLOCKED("artifact.blocked", Scope.EXECUTION),
    GRAPH_EXTENDED("graph.extended", Scope.EXECUTION),
    EXECUTION_COMPLETED("execution.completed", Scope.EXECUTION),

    COORDINATOR_STARTED("coordinator.started", Scope.COORDINATOR),
    COORDINATOR_COMPLETED("coordinator.completed", Scope.COORDINATOR),
    WORKER_STARTED("worker.started", Scope.COORDINATOR),
    WORKER_FAILED("worker.failed", Scope.COORDINATOR),
    MERGE_COMPLETED("merge.completed", Scope.COORDINATOR),
    MERGE_CONFLICT("merge.conflict", Scope.COORDINATOR);

    public enum Scope { EXECUTION, COORDINATOR }

    private final String wireName;
    private final Scope scope;

    EventType(String wireName, Scope scope) {
        this.wireName = wireName;
        this.scope = scope;
    }

    /** Dotted name used in logs and event payloads, e.g. {@code merge.conflict}. */
    public String wireName() {
        return wireName;
    }

    public Scope scope() {
        return scope;
    }
}
