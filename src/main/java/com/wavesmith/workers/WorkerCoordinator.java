package com.wavesmith.workers;

import com.wavesmith.core.cache.ChangeDetector;
import com.wavesmith.core.cache.IncrementalExecutor;
import com.wavesmith.core.events.EventBus;
import com.wavesmith.core.events.EventType;
import com.wavesmith.core.events.WavesmithEvent;
import com.wavesmith.core.executor.ArtifactExecutor;
import com.wavesmith.core.executor.TieredCreator;
import com.wavesmith.core.metrics.WavesmithMetrics;
import com.wavesmith.core.persistence.PlanStore;
import com.wavesmith.workers.governor.ResourceGovernor;
import com.wavesmith.workers.isolation.GitCommandException;
import com.wavesmith.workers.isolation.GitWorkspaceManager;
import com.wavesmith.workers.isolation.GitWorktreeIsolation;
import com.wavesmith.workers.isolation.MergeResult;
import com.wavesmith.workers.isolation.MergeStrategy;
import com.wavesmith.workers.isolation.StagingBufferIsolation;
import com.wavesmith.workers.isolation.Workspace;
import com.wavesmith.workers.isolation.WorkspaceIsolation;
import com.wavesmith.workers.lock.FileLockManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a backlog of goals across several workers, each in its own isolated
 * workspace, then merges the workers' branches back into the base branch.
 *
 * <p>Run phases:
 * <ol>
 *   <li>Setup: state directories, isolation (git worktrees when the project is
 *       a clean git repository, staging buffers otherwise), lock manager and
 *       the shared resource governor.</li>
 *   <li>Workers claim goals under file locks and execute them.</li>
 *   <li>Monitoring: workers that crash, stop sending heartbeats or overrun
 *       their timeout are killed, their goal released for retry and
 *       optionally replaced.</li>
 *   <li>Merge: branches of workers that completed goals are merged in
 *       first-commit order.</li>
 *   <li>Cleanup: worktrees removed, merged branches deleted.</li>
 * </ol>
 */
public class WorkerCoordinator {

    private static final Logger log = LoggerFactory.getLogger(WorkerCoordinator.class);

    private final Path projectRoot;
    private final CoordinatorConfig config;
    private final GitWorkspaceManager git;
    private final ArtifactExecutor executor;
    private final WavesmithMetrics metrics;
    private final EventBus eventBus;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean();
    private final List<WorkerHandle> current = new CopyOnWriteArrayList<>();

    public WorkerCoordinator(Path projectRoot, CoordinatorConfig config, GitWorkspaceManager git,
                             ArtifactExecutor executor, WavesmithMetrics metrics, EventBus eventBus) {
        this(projectRoot, config, git, executor, metrics, eventBus, Clock.systemUTC());
    }

    public WorkerCoordinator(Path projectRoot, CoordinatorConfig config) {
        this(projectRoot, config, new GitWorkspaceManager(), new ArtifactExecutor(), null, new EventBus());
    }

    WorkerCoordinator(Path projectRoot, CoordinatorConfig config, GitWorkspaceManager git,
                      ArtifactExecutor executor, WavesmithMetrics metrics, EventBus eventBus, Clock clock) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
        this.config = config;
        this.git = git;
        this.executor = executor;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public CoordinatorConfig getConfig() {
        return config;
    }

    /**
     * Executes every goal and merges the results.
     *
     * @param goals    goals in priority order
     * @param planner  turns a goal into its artifact graph
     * @param creators builds each worker's create capabilities for its workspace
     * @throws IllegalStateException if a run is already in progress or the git working tree is dirty
     */
    public CoordinatorResult execute(List<Goal> goals, GoalPlanner planner, CreatorFactory creators) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A coordinator run is already in progress");
        }
        Instant start = clock.instant();
        try {
            return new Run(goals, planner, creators).execute(start);
        } finally {
            current.clear();
            running.set(false);
        }
    }

    /** Statuses of the workers of the run in progress; empty between runs. */
    public List<WorkerStatus> currentStatuses() {
        return current.stream().map(h -> h.worker().status()).toList();
    }

    public boolean isRunning() {
        return running.get();
    }

    private record WorkerHandle(Worker worker, Future<?> future, AtomicBoolean reaped) {
        WorkerHandle(Worker worker, Future<?> future) {
            this(worker, future, new AtomicBoolean());
        }

        boolean isActive() {
            return !reaped.get() && !future.isDone();
        }
    }

    /** State of one {@link #execute} call. */
    private final class Run {

        private final GoalBacklog backlog;
        private final GoalPlanner planner;
        private final CreatorFactory creators;
        private final List<String> errors = new CopyOnWriteArrayList<>();
        private final AtomicInteger nextIndex = new AtomicInteger();

        private Path stateDir;
        private Path workersDir;
        private WorkspaceIsolation isolation;
        private FileLockManager locks;
        private ResourceGovernor governor;
        private PlanStore plans;
        private ExecutorService pool;

        Run(List<Goal> goals, GoalPlanner planner, CreatorFactory creators) {
            this.backlog = new GoalBacklog(goals, config.maxRetriesPerGoal());
            this.planner = planner;
            this.creators = creators;
        }

        CoordinatorResult execute(Instant start) {
            setup();
            log.info("Coordinating {} goal(s) across {} worker(s) using {}",
                    backlog.size(), config.workerCount(), isolation.name());
            publish(EventType.COORDINATOR_STARTED, Map.of("goals", backlog.size(), "workers", config.workerCount(),
                    "isolation", isolation.name()));

            pool = Executors.newCachedThreadPool(namedThreads("wavesmith-worker"));
            var mergeResults = new ArrayList<MergeResult>();
            var merged = new ArrayList<String>();
            var conflicted = new ArrayList<String>();
            try {
                for (int i = 0; i < config.workerCount(); i++) {
                    spawn(0);
                }
                monitor();
                Set<Worker> lingering = awaitWorkerThreads();
                int skipped = backlog.skipUnfinished();
                if (skipped > 0) {
                    errors.add("%d goal(s) were never completed".formatted(skipped));
                }
                merge(mergeResults, merged, conflicted, lingering);
                cleanup(merged, lingering);
            } finally {
                pool.shutdownNow();
            }

            for (GoalBacklog.GoalState state : GoalBacklog.GoalState.values()) {
                int count = backlog.count(state);
                for (int i = 0; i < count && metrics != null; i++) {
                    metrics.recordGoalResult(state.name().toLowerCase());
                }
            }
            backlog.errors().forEach((goalId, error) -> errors.add("Goal " + goalId + ": " + error));

            var result = new CoordinatorResult(
                    backlog.size(),
                    backlog.count(GoalBacklog.GoalState.COMPLETED),
                    backlog.count(GoalBacklog.GoalState.FAILED),
                    backlog.count(GoalBacklog.GoalState.SKIPPED),
                    Duration.between(start, clock.instant()),
                    current.size(),
                    mergeResults, merged, conflicted, errors,
                    current.stream().map(h -> h.worker().status()).toList());
            log.info("Coordinator finished in {}: {}/{} goal(s) completed, {} failed, {} skipped, {} branch(es) merged, {} conflicted",
                    result.duration(), result.goalsCompleted(), result.totalGoals(), result.goalsFailed(),
                    result.goalsSkipped(), merged.size(), conflicted.size());
            publish(EventType.COORDINATOR_COMPLETED, Map.of("completed", result.goalsCompleted(),
                    "failed", result.goalsFailed(), "skipped", result.goalsSkipped(),
                    "conflicts", conflicted.size()));
            return result;
        }

        // ══════════════════════════════════════════════════════════════════
        // SETUP
        // ══════════════════════════════════════════════════════════════════

        private void setup() {
            stateDir = projectRoot.resolve(config.stateDir());
            workersDir = stateDir.resolve("workers");
            try {
                Files.createDirectories(stateDir.resolve("locks"));
                Files.createDirectories(workersDir);
                Path ignore = stateDir.resolve(".gitignore");
                if (!Files.exists(ignore)) {
                    Files.writeString(ignore, "*\n");
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create state directory " + stateDir, e);
            }

            isolation = selectIsolation();
            locks = new FileLockManager(stateDir.resolve("locks"), config.lockTtl(), config.staleLockThreshold(),
                    clock, metrics);
            governor = new ResourceGovernor(config.maxConcurrentCalls(), config.maxCallsPerMinute(),
                    config.maxHeapBytes(), config.governorMaxWait());
            if (config.incremental()) {
                plans = new PlanStore(stateDir.resolve("plans"));
            }
        }

        private WorkspaceIsolation selectIsolation() {
            if (!git.isGitRepository(projectRoot)) {
                log.info("{} is not a git repository, isolating workers in staging buffers", projectRoot);
                return new StagingBufferIsolation(projectRoot);
            }
            if (!git.isWorkingTreeClean(projectRoot)) {
                throw new IllegalStateException("Working tree at " + projectRoot
                        + " has uncommitted changes; commit or stash them before running workers");
            }
            String base = config.baseBranch();
            if (base != null && !base.equals(git.currentBranch(projectRoot)) && !git.checkout(projectRoot, base)) {
                throw new GitCommandException("Cannot check out base branch '" + base + "'");
            }
            return new GitWorktreeIsolation(git, projectRoot, stateDir.resolve("worktrees"), base);
        }

        private boolean spawn(int respawns) {
            int index = nextIndex.getAndIncrement();
            String branch = config.branchName(index);
            try {
                Workspace workspace = isolation.create(branch, branch);
                TieredCreator creator = governor.govern(creators.create(workspace));
                IncrementalExecutor incremental = plans == null ? null
                        : new IncrementalExecutor(executor, plans, ChangeDetector.forWorkspace(workspace::readFile), metrics);
                var worker = new Worker(index, workspace, isolation, backlog, locks, planner, creator, executor,
                        incremental, config, workersDir, clock, respawns);
                current.add(new WorkerHandle(worker, pool.submit(worker)));
                publish(EventType.WORKER_STARTED, Map.of("workerId", branch, "respawns", respawns));
                return true;
            } catch (RuntimeException e) {
                log.error("Could not start worker {}: {}", branch, e.getMessage(), e);
                errors.add("Could not start worker " + branch + ": " + e.getMessage());
                return false;
            }
        }

        // ══════════════════════════════════════════════════════════════════
        // MONITORING
        // ══════════════════════════════════════════════════════════════════

        private void monitor() {
            try {
                while (current.stream().anyMatch(WorkerHandle::isActive)) {
                    Thread.sleep(config.heartbeatInterval().toMillis());
                    for (WorkerHandle handle : List.copyOf(current)) {
                        check(handle);
                    }
                }
                // workers that finished between the last check and loop exit
                for (WorkerHandle handle : List.copyOf(current)) {
                    check(handle);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Coordinator interrupted, stopping all workers");
                errors.add("Coordinator interrupted");
                for (WorkerHandle handle : current) {
                    reap(handle, "interrupted", "coordinator interrupted", false);
                }
            }
        }

        private void check(WorkerHandle handle) {
            if (handle.reaped().get()) {
                return;
            }
            Worker worker = handle.worker();
            if (handle.future().isDone()) {
                if (worker.state() != WorkerState.STOPPED) {
                    reap(handle, "crash", "crashed: " + crashCause(handle.future()), true);
                }
                return;
            }
            Instant now = clock.instant();
            Duration silent = Duration.between(worker.heartbeat(), now);
            if (silent.compareTo(config.stuckThreshold()) > 0) {
                reap(handle, "heartbeat", "no heartbeat for " + silent.toMillis() + "ms", true);
                return;
            }
            worker.goalStartedAt()
                    .filter(started -> Duration.between(started, now).compareTo(config.workerTimeout()) > 0)
                    .ifPresent(started -> reap(handle, "timeout", "exceeded worker timeout of " + config.workerTimeout(), true));
        }

        private void reap(WorkerHandle handle, String kind, String reason, boolean replace) {
            if (!handle.reaped().compareAndSet(false, true)) {
                return;
            }
            Worker worker = handle.worker();
            String goalId = worker.claimedGoal();
            worker.fail(reason);
            handle.future().cancel(true);
            if (metrics != null) {
                metrics.recordWorkerFailure(kind);
            }
            errors.add("Worker " + worker.id() + " " + reason);
            publish(EventType.WORKER_FAILED, Map.of("workerId", worker.id(), "reason", reason));

            if (goalId != null) {
                locks.forceRelease(Worker.lockResource(goalId));
            }
            backlog.releaseClaimOf(worker.id(), "worker " + worker.id() + " " + reason);

            if (replace && config.respawn() && !backlog.isDrained()) {
                if (worker.respawns() < config.maxRetriesPerGoal()) {
                    log.info("Respawning replacement for worker {}", worker.id());
                    spawn(worker.respawns() + 1);
                } else {
                    log.warn("Worker {} out of respawns ({})", worker.id(), worker.respawns());
                }
            }
        }

        /**
         * Waits for every worker thread to leave its run loop. Reaped workers are
         * cancelled but may still be finishing a model call, a write or a commit.
         *
         * @return workers still running once the grace period is over
         */
        private Set<Worker> awaitWorkerThreads() {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(config.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Worker threads still running after {}", config.shutdownGrace());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for worker threads to exit");
            }
            Set<Worker> lingering = new HashSet<>();
            for (WorkerHandle handle : current) {
                Worker worker = handle.worker();
                if (worker.isActive()) {
                    log.error("Worker {} did not exit within {}, leaving its workspace unmerged",
                            worker.id(), config.shutdownGrace());
                    errors.add("Worker " + worker.id() + " still running after " + config.shutdownGrace()
                            + "; workspace left unmerged");
                    lingering.add(worker);
                }
            }
            return lingering;
        }

        // ══════════════════════════════════════════════════════════════════
        // MERGE & CLEANUP
        // ══════════════════════════════════════════════════════════════════

        private void merge(List<MergeResult> results, List<String> merged, List<String> conflicted,
                           Set<Worker> lingering) {
            Map<Workspace, Worker> byWorkspace = new HashMap<>();
            var candidates = new ArrayList<Workspace>();
            for (WorkerHandle handle : current) {
                if (handle.worker().completedCount() > 0 && !lingering.contains(handle.worker())) {
                    byWorkspace.put(handle.worker().workspace(), handle.worker());
                    candidates.add(handle.worker().workspace());
                }
            }
            List<Workspace> ordered = isolation.mergeOrder(candidates);
            MergeStrategy strategy = config.mergeStrategy();

            for (int i = 0; i < ordered.size(); i++) {
                Workspace workspace = ordered.get(i);
                Worker worker = byWorkspace.get(workspace);
                worker.transition(WorkerState.MERGING);
                MergeResult result;
                try {
                    result = isolation.merge(workspace, strategy);
                } catch (RuntimeException e) {
                    log.error("Merge of {} failed: {}", workspace.branch(), e.getMessage(), e);
                    result = MergeResult.failure(strategy, workspace.branch(), List.of(), e.getMessage());
                }
                worker.transition(WorkerState.STOPPED);
                results.add(result);
                if (metrics != null) {
                    metrics.recordMerge(strategy.name(), result.success());
                }
                publish(result.success() ? EventType.MERGE_COMPLETED : EventType.MERGE_CONFLICT, Map.of(
                        "branch", workspace.branch(),
                        "strategy", strategy.name(),
                        "files", result.success() ? result.filesMerged() : result.conflicts()));

                if (result.success()) {
                    merged.add(workspace.branch());
                    log.info("Merged {} ({} file(s))", workspace.branch(), result.filesMerged().size());
                    continue;
                }
                conflicted.add(workspace.branch());
                errors.add("Merge of %s failed: %s %s".formatted(workspace.branch(), result.error(), result.conflicts()));
                if (strategy == MergeStrategy.ABORT_ON_CONFLICT) {
                    List<String> left = ordered.subList(i + 1, ordered.size()).stream().map(Workspace::branch).toList();
                    log.error("Merge of {} aborted on conflict in {}; stopping with {} branch(es) unmerged",
                            workspace.branch(), result.conflicts(), left.size());
                    if (!left.isEmpty()) {
                        errors.add("Left unmerged after conflict: " + left);
                    }
                    return;
                }
            }
        }

        private void cleanup(List<String> merged, Set<Worker> lingering) {
            for (WorkerHandle handle : current) {
                Worker worker = handle.worker();
                if (lingering.contains(worker)) {
                    continue;
                }
                boolean deleteBranch = config.cleanupBranches()
                        && (merged.contains(worker.id()) || worker.completedCount() == 0);
                try {
                    isolation.cleanup(worker.workspace(), deleteBranch);
                } catch (RuntimeException e) {
                    log.warn("Cleanup of {} failed: {}", worker.id(), e.getMessage());
                    errors.add("Cleanup of " + worker.id() + " failed: " + e.getMessage());
                }
                try {
                    Files.deleteIfExists(worker.statusFile());
                } catch (IOException e) {
                    log.warn("Could not remove status file {}: {}", worker.statusFile(), e.getMessage());
                }
            }
        }
    }

    private static String crashCause(Future<?> future) {
        try {
            future.get();
            return "exited without stopping";
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return cause.getClass().getSimpleName() + ": " + cause.getMessage();
        } catch (CancellationException e) {
            return "cancelled";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "interrupted";
        }
    }

    private void publish(EventType type, Map<String, Object> payload) {
        eventBus.publish(WavesmithEvent.coordinator(type, payload));
    }

    private static ThreadFactory namedThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
