package com.wavesmith.workers;

import com.wavesmith.core.executor.ExecutionLimits;
import com.wavesmith.workers.isolation.MergeStrategy;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings for one {@link WorkerCoordinator} run.
 *
 * @param workerCount        workers started up front
 * @param workerTimeout      longest a worker may spend on one goal before it is killed
 * @param shutdownGrace      how long merging waits for cancelled worker threads to exit
 * @param mergeStrategy      how worker branches land on the base branch
 * @param lockTimeout        how long a worker waits for a goal lock before moving on
 * @param lockTtl            lifetime written into each lock record
 * @param staleLockThreshold age after which any lock may be reclaimed
 * @param heartbeatInterval  how often the coordinator checks on workers
 * @param missedHeartbeats   silent intervals after which a worker is considered stuck
 * @param maxRetriesPerGoal  times a goal abandoned by a dead worker is handed out again
 * @param respawn            start a replacement when a worker dies
 * @param branchPrefix       worker branch prefix; the worker index is appended
 * @param baseBranch         branch to merge into; null for the branch currently checked out
 * @param cleanupBranches    delete merged worker branches at the end
 * @param stateDir           directory under the project root for locks, plans and worktrees
 * @param incremental        reuse still-valid artifacts from previous runs of the same goal
 * @param limits             executor limits for each worker
 * @param maxConcurrentCalls model calls in flight across all workers
 * @param maxCallsPerMinute  model call starts per minute across all workers, 0 for no limit
 * @param maxHeapBytes       heap ceiling for starting a model call, 0 for no limit
 * @param governorMaxWait    longest a model call waits for admission
 */
public record CoordinatorConfig(
    int workerCount,
    Duration workerTimeout,
    Duration shutdownGrace,
    MergeStrategy mergeStrategy,
    Duration lockTimeout,
    Duration lockTtl,
    Duration staleLockThreshold,
    Duration heartbeatInterval,
    int missedHeartbeats,
    int maxRetriesPerGoal,
    boolean respawn,
    String branchPrefix,
    String baseBranch,
    boolean cleanupBranches,
    String stateDir,
    boolean incremental,
    ExecutionLimits limits,
    int maxConcurrentCalls,
    int maxCallsPerMinute,
    long maxHeapBytes,
    Duration governorMaxWait
) {

    public CoordinatorConfig {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1, was " + workerCount);
        }
        if (missedHeartbeats < 1) {
            throw new IllegalArgumentException("missedHeartbeats must be at least 1, was " + missedHeartbeats);
        }
        Objects.requireNonNull(workerTimeout, "workerTimeout");
        Objects.requireNonNull(shutdownGrace, "shutdownGrace");
        Objects.requireNonNull(mergeStrategy, "mergeStrategy");
        Objects.requireNonNull(lockTimeout, "lockTimeout");
        Objects.requireNonNull(lockTtl, "lockTtl");
        Objects.requireNonNull(staleLockThreshold, "staleLockThreshold");
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        Objects.requireNonNull(branchPrefix, "branchPrefix");
        Objects.requireNonNull(stateDir, "stateDir");
        Objects.requireNonNull(governorMaxWait, "governorMaxWait");
        limits = limits == null ? ExecutionLimits.defaults() : limits;
    }

    public static CoordinatorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Silence after which a worker is considered stuck. */
    public Duration stuckThreshold() {
        return heartbeatInterval.multipliedBy(missedHeartbeats);
    }

    public String branchName(int workerIndex) {
        return branchPrefix + workerIndex;
    }

    public Builder toBuilder() {
        return new Builder()
                .workerCount(workerCount).workerTimeout(workerTimeout).shutdownGrace(shutdownGrace)
                .mergeStrategy(mergeStrategy)
                .lockTimeout(lockTimeout).lockTtl(lockTtl).staleLockThreshold(staleLockThreshold)
                .heartbeatInterval(heartbeatInterval).missedHeartbeats(missedHeartbeats)
                .maxRetriesPerGoal(maxRetriesPerGoal).respawn(respawn).branchPrefix(branchPrefix)
                .baseBranch(baseBranch).cleanupBranches(cleanupBranches).stateDir(stateDir)
                .incremental(incremental).limits(limits).maxConcurrentCalls(maxConcurrentCalls)
                .maxCallsPerMinute(maxCallsPerMinute).maxHeapBytes(maxHeapBytes)
                .governorMaxWait(governorMaxWait);
    }

    public static final class Builder {
        private int workerCount = 4;
        private Duration workerTimeout = Duration.ofMinutes(30);
        private Duration shutdownGrace = Duration.ofSeconds(30);
        private MergeStrategy mergeStrategy = MergeStrategy.FAST_FORWARD;
        private Duration lockTimeout = Duration.ofSeconds(5);
        private Duration lockTtl = Duration.ofMinutes(30);
        private Duration staleLockThreshold = Duration.ofHours(1);
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private int missedHeartbeats = 12;
        private int maxRetriesPerGoal = 2;
        private boolean respawn = true;
        private String branchPrefix = "work/worker-";
        private String baseBranch;
        private boolean cleanupBranches = true;
        private String stateDir = ".wavesmith";
        private boolean incremental = true;
        private ExecutionLimits limits = ExecutionLimits.defaults();
        private int maxConcurrentCalls = 8;
        private int maxCallsPerMinute = 0;
        private long maxHeapBytes = 0;
        private Duration governorMaxWait = Duration.ofMinutes(5);

        private Builder() {
        }

        public Builder workerCount(int v) { this.workerCount = v; return this; }
        public Builder workerTimeout(Duration v) { this.workerTimeout = v; return this; }
        public Builder shutdownGrace(Duration v) { this.shutdownGrace = v; return this; }
        public Builder mergeStrategy(MergeStrategy v) { this.mergeStrategy = v; return this; }
        public Builder lockTimeout(Duration v) { this.lockTimeout = v; return this; }
        public Builder lockTtl(Duration v) { this.lockTtl = v; return this; }
        public Builder staleLockThreshold(Duration v) { this.staleLockThreshold = v; return this; }
        public Builder heartbeatInterval(Duration v) { this.heartbeatInterval = v; return this; }
        public Builder missedHeartbeats(int v) { this.missedHeartbeats = v; return this; }
        public Builder maxRetriesPerGoal(int v) { this.maxRetriesPerGoal = v; return this; }
        public Builder respawn(boolean v) { this.respawn = v; return this; }
        public Builder branchPrefix(String v) { this.branchPrefix = v; return this; }
        public Builder baseBranch(String v) { this.baseBranch = v; return this; }
        public Builder cleanupBranches(boolean v) { this.cleanupBranches = v; return this; }
        public Builder stateDir(String v) { this.stateDir = v; return this; }
        public Builder incremental(boolean v) { this.incremental = v; return this; }
        public Builder limits(ExecutionLimits v) { this.limits = v; return this; }
        public Builder maxConcurrentCalls(int v) { this.maxConcurrentCalls = v; return this; }
        public Builder maxCallsPerMinute(int v) { this.maxCallsPerMinute = v; return this; }
        public Builder maxHeapBytes(long v) { this.maxHeapBytes = v; return this; }
        public Builder governorMaxWait(Duration v) { this.governorMaxWait = v; return this; }

        public CoordinatorConfig build() {
            return new CoordinatorConfig(workerCount, workerTimeout, shutdownGrace, mergeStrategy, lockTimeout, lockTtl,
                    staleLockThreshold, heartbeatInterval, missedHeartbeats, maxRetriesPerGoal, respawn,
                    branchPrefix, baseBranch, cleanupBranches, stateDir, incremental, limits,
                    maxConcurrentCalls, maxCallsPerMinute, maxHeapBytes, governorMaxWait);
        }
    }
}
