package com.wavesmith.workers;

import java.time.Instant;

/**
 * Point-in-time view of one worker, written to {@code <stateDir>/workers}
 * and reported by the health indicator.
 *
 * @param id          worker identifier, equal to its branch name
 * @param pid         OS process the worker runs in
 * @param state       lifecycle state
 * @param branch      branch (or buffer name) the worker commits to
 * @param claimedGoal goal currently claimed, null when none
 * @param completed   goals completed
 * @param failed      goals failed
 * @param heartbeat   last sign of progress
 * @param startedAt   when the worker started
 * @param respawns    how many workers this one replaced
 */
public record WorkerStatus(
    String id,
    long pid,
    WorkerState state,
    String branch,
    String claimedGoal,
    int completed,
    int failed,
    Instant heartbeat,
    Instant startedAt,
    int respawns
) {
}
