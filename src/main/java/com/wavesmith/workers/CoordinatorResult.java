package com.wavesmith.workers;

import com.wavesmith.workers.isolation.MergeResult;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a {@link WorkerCoordinator} run.
 *
 * @param totalGoals       goals handed to the coordinator
 * @param goalsCompleted   goals a worker finished and committed
 * @param goalsFailed      goals that failed, including those out of retries
 * @param goalsSkipped     goals no worker got to
 * @param duration         wall-clock duration of the run
 * @param workersUsed      workers started, respawns included
 * @param mergeResults     one result per merge attempted, in merge order
 * @param mergedBranches   branches that landed on the base branch
 * @param conflictBranches branches that could not be merged
 * @param errors           problems worth an operator's attention
 * @param workerStatuses   final status of every worker
 */
public record CoordinatorResult(
    int totalGoals,
    int goalsCompleted,
    int goalsFailed,
    int goalsSkipped,
    Duration duration,
    int workersUsed,
    List<MergeResult> mergeResults,
    List<String> mergedBranches,
    List<String> conflictBranches,
    List<String> errors,
    List<WorkerStatus> workerStatuses
) {

    public CoordinatorResult {
        mergeResults = List.copyOf(mergeResults);
        mergedBranches = List.copyOf(mergedBranches);
        conflictBranches = List.copyOf(conflictBranches);
        errors = List.copyOf(errors);
        workerStatuses = List.copyOf(workerStatuses);
    }

    /** True when every goal completed and every branch merged. */
    public boolean isSuccess() {
        return goalsCompleted == totalGoals && conflictBranches.isEmpty();
    }
}
