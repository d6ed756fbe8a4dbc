package com.wavesmith.workers.isolation;

/**
 * How a worker branch is brought back into the base branch.
 */
public enum MergeStrategy {
    /** Rebase onto the base branch, then fast-forward. Fails if the rebase is not clean. */
    FAST_FORWARD,
    /** Regular merge, a merge commit is allowed. Conflicts are recorded and merging continues. */
    THREE_WAY,
    /** Merge without committing; on any conflict, abort and restore the pre-merge state. */
    ABORT_ON_CONFLICT
}
