package com.wavesmith.workers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wavesmith.core.cache.IncrementalExecutor;
import com.wavesmith.core.executor.ArtifactExecutor;
import com.wavesmith.core.executor.CancellationToken;
import com.wavesmith.core.executor.ExecutionListener;
import com.wavesmith.core.executor.ExecutionRequest;
import com.wavesmith.core.executor.TieredCreator;
import com.wavesmith.core.graph.ArtifactGraph;
import com.wavesmith.core.graph.ArtifactSpec;
import com.wavesmith.core.logging.MdcContext;
import com.wavesmith.core.model.ArtifactResult;
import com.wavesmith.core.model.ExecutionResult;
import com.wavesmith.core.persistence.PlanStore;
import com.wavesmith.workers.isolation.Workspace;
import com.wavesmith.workers.isolation.WorkspaceIsolation;
import com.wavesmith.workers.lock.FileLockManager;
import com.wavesmith.workers.lock.LockAcquisitionTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One independent executor bound to its own workspace. Claims goals from the
 * shared backlog under a file lock, executes each goal's graph, commits the
 * produced files and moves on until the backlog is drained.
 */
class Worker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private static final long IDLE_POLL_MS = 100;

    private final int index;
    private final String id;
    private final Workspace workspace;
    private final WorkspaceIsolation isolation;
    private final GoalBacklog backlog;
    private final FileLockManager locks;
    private final GoalPlanner planner;
    private final TieredCreator creator;
    private final ArtifactExecutor executor;
    private final IncrementalExecutor incremental;
    private final CoordinatorConfig config;
    private final Path statusFile;
    private final Clock clock;
    private final int respawns;
    private final ObjectMapper objectMapper = PlanStore.defaultMapper();
    private final CancellationToken cancellation = new CancellationToken();
    private final Instant startedAt;

    private volatile WorkerState state = WorkerState.STARTING;
    private volatile String claimedGoal;
    private volatile Instant heartbeat;
    private volatile Instant goalStartedAt;
    private volatile int completed;
    private volatile int failed;
    private volatile boolean active;

    Worker(int index, Workspace workspace, WorkspaceIsolation isolation, GoalBacklog backlog,
           FileLockManager locks, GoalPlanner planner, TieredCreator creator, ArtifactExecutor executor,
           IncrementalExecutor incremental, CoordinatorConfig config, Path workersDir, Clock clock, int respawns) {
        this.index = index;
        this.id = workspace.branch();
        this.workspace = workspace;
        this.isolation = isolation;
        this.backlog = backlog;
        this.locks = locks;
        this.planner = planner;
        this.creator = creator;
        this.executor = executor;
        this.incremental = incremental;
        this.config = config;
        this.statusFile = workersDir.resolve("worker-" + index + ".json");
        this.clock = clock;
        this.respawns = respawns;
        this.startedAt = clock.instant();
        this.heartbeat = startedAt;
    }

    @Override
    public void run() {
        active = true;
        MdcContext.setWorker(id);
        log.info("Worker {} started in {}", id, isolation.name());
        try {
            transition(WorkerState.IDLE);
            while (!cancellation.isCancelled() && !Thread.currentThread().isInterrupted()) {
                Optional<Goal> goal = claimNext();
                if (goal.isPresent()) {
                    runGoal(goal.get());
                    continue;
                }
                if (backlog.isDrained()) {
                    break;
                }
                transition(WorkerState.IDLE);
                beat();
                Thread.sleep(IDLE_POLL_MS);
            }
            transition(WorkerState.STOPPED);
            log.info("Worker {} stopped: {} completed, {} failed", id, completed, failed);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Worker {} interrupted", id);
        } finally {
            locks.releaseAll(id);
            MdcContext.clearWorker();
            active = false;
        }
    }

    private Optional<Goal> claimNext() throws InterruptedException {
        transition(WorkerState.CLAIMING);
        for (Goal goal : backlog.pending()) {
            String resource = lockResource(goal.id());
            try {
                locks.acquire(resource, id, config.lockTimeout());
            } catch (LockAcquisitionTimeoutException e) {
                log.debug("Goal {} is held by {}, trying the next one", goal.id(), e.getCurrentHolder());
                continue;
            }
            if (backlog.tryClaim(goal.id(), id)) {
                log.info("Worker {} claimed goal {}", id, goal.id());
                return Optional.of(goal);
            }
            locks.release(resource, id);
        }
        return Optional.empty();
    }

    private void runGoal(Goal goal) throws InterruptedException {
        claimedGoal = goal.id();
        goalStartedAt = clock.instant();
        transition(WorkerState.EXECUTING);
        beat();
        try {
            ArtifactGraph graph = planner.plan(goal);
            var writer = new WorkspaceWriter(graph);
            var request = ExecutionRequest.builder(graph, creator)
                    .limits(config.limits())
                    .listener(writer)
                    .cancellation(cancellation)
                    .build();
            ExecutionResult result = incremental != null
                    ? incremental.execute(goal.description(), request, false)
                    : executor.execute(request);
            if (cancellation.isCancelled()) {
                log.warn("Worker {} abandoned goal {} after cancellation", id, goal.id());
                return;
            }

            if (result.isSuccess() && writer.failures.isEmpty()) {
                transition(WorkerState.COMMITTING);
                beat();
                if (isolation.commit(workspace, "Complete goal " + goal.id() + ": " + goal.description())) {
                    recordCompleted(goal);
                    return;
                }
                recordFailed(goal, "Failed to commit workspace " + id);
            } else {
                recordFailed(goal, describeFailure(result, writer.failures));
            }
            isolation.discardChanges(workspace);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            if (cancellation.isCancelled()) {
                log.warn("Worker {} abandoned goal {} after cancellation: {}", id, goal.id(), e.getMessage());
                return;
            }
            log.error("Worker {} failed goal {}: {}", id, goal.id(), e.getMessage(), e);
            recordFailed(goal, e.getClass().getSimpleName() + ": " + e.getMessage());
            isolation.discardChanges(workspace);
        } finally {
            locks.release(lockResource(goal.id()), id);
            claimedGoal = null;
            goalStartedAt = null;
            writeStatus();
        }
    }

    private void recordCompleted(Goal goal) {
        if (backlog.complete(goal.id(), id)) {
            completed++;
            log.info("Worker {} completed goal {}", id, goal.id());
        }
    }

    private void recordFailed(Goal goal, String error) {
        if (backlog.fail(goal.id(), id, error)) {
            failed++;
            log.warn("Worker {} failed goal {}: {}", id, goal.id(), error);
        }
    }

    private static String describeFailure(ExecutionResult result, List<String> writeFailures) {
        var parts = new ArrayList<String>();
        if (!result.failed().isEmpty()) {
            parts.add("failed artifacts " + result.failed().keySet());
        }
        if (!result.blocked().isEmpty()) {
            parts.add("blocked artifacts " + result.blocked());
        }
        if (result.cancelled()) {
            parts.add("execution cancelled");
        }
        parts.addAll(writeFailures);
        return String.join("; ", parts);
    }

    static String lockResource(String goalId) {
        return "goal:" + goalId;
    }

    // ══════════════════════════════════════════════════════════════════════════
    // STATE
    // ══════════════════════════════════════════════════════════════════════════

    synchronized void transition(WorkerState next) {
        if (state == WorkerState.FAILED || state == next) {
            return;
        }
        log.debug("Worker {}: {} -> {}", id, state, next);
        state = next;
        writeStatus();
    }

    /** Marks the worker failed and stops it from starting more work. */
    synchronized void fail(String reason) {
        if (state == WorkerState.FAILED) {
            return;
        }
        log.warn("Worker {} marked failed: {}", id, reason);
        state = WorkerState.FAILED;
        cancellation.cancel();
        writeStatus();
    }

    void beat() {
        heartbeat = clock.instant();
    }

    int index() {
        return index;
    }

    String id() {
        return id;
    }

    Workspace workspace() {
        return workspace;
    }

    WorkerState state() {
        return state;
    }

    String claimedGoal() {
        return claimedGoal;
    }

    Instant heartbeat() {
        return heartbeat;
    }

    Optional<Instant> goalStartedAt() {
        return Optional.ofNullable(goalStartedAt);
    }

    /** True while the worker's thread is inside {@link #run()}. */
    boolean isActive() {
        return active;
    }

    int completedCount() {
        return completed;
    }

    int respawns() {
        return respawns;
    }

    Path statusFile() {
        return statusFile;
    }

    WorkerStatus status() {
        return new WorkerStatus(id, ProcessHandle.current().pid(), state, workspace.branch(), claimedGoal,
                completed, failed, heartbeat, startedAt, respawns);
    }

    private void writeStatus() {
        try {
            Files.writeString(statusFile, objectMapper.writeValueAsString(status()));
        } catch (IOException e) {
            log.warn("Could not write status file {}: {}", statusFile, e.getMessage());
        }
    }

    /**
     * Writes each completed artifact's content to the file it produces and
     * counts progress as a heartbeat.
     */
    private final class WorkspaceWriter implements ExecutionListener {

        private final ArtifactGraph graph;
        private final List<String> failures = new ArrayList<>();

        WorkspaceWriter(ArtifactGraph graph) {
            this.graph = graph;
        }

        @Override
        public void onWaveStarted(int waveNumber, Set<String> artifactIds) {
            beat();
        }

        @Override
        public void onArtifactCompleted(int waveNumber, ArtifactResult result) {
            beat();
            Optional<ArtifactSpec> spec = graph.find(result.artifactId());
            String file = spec.map(ArtifactSpec::producesFile).orElse(null);
            if (file == null || file.isBlank() || !result.hasContent()) {
                return;
            }
            try {
                workspace.writeFile(file, result.content());
            } catch (RuntimeException e) {
                log.error("Could not write {} for artifact {}: {}", file, result.artifactId(), e.getMessage());
                failures.add("could not write " + file);
            }
        }

        @Override
        public void onArtifactFailed(int waveNumber, String artifactId, String error) {
            beat();
        }

        @Override
        public void onWaveCompleted(int waveNumber, int completed, int failed) {
            beat();
        }
    }
}
