package com.wavesmith.workers;

import com.wavesmith.core.events.EventBus;
import com.wavesmith.core.events.WavesmithEvent;
import com.wavesmith.core.executor.ArtifactExecutor;
import com.wavesmith.core.executor.TieredCreator;
import com.wavesmith.core.graph.ArtifactGraph;
import com.wavesmith.core.graph.ArtifactSpec;
import com.wavesmith.core.metrics.WavesmithMetrics;
import com.wavesmith.workers.isolation.GitWorkspaceManager;
import com.wavesmith.workers.isolation.MergeStrategy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Coordinator runs against a plain directory, so workers are isolated in
 * staging buffers.
 */
class WorkerCoordinatorTest {

    @TempDir
    Path projectRoot;

    private GitWorkspaceManager git;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private Map<String, AtomicInteger> planned;

    @BeforeEach
    void setUp() {
        git = mock(GitWorkspaceManager.class);
        when(git.isGitRepository(any())).thenReturn(false);
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        planned = new ConcurrentHashMap<>();
    }

    private CoordinatorConfig.Builder fastConfig() {
        return CoordinatorConfig.builder()
                .workerCount(2)
                .heartbeatInterval(Duration.ofMillis(50))
                .missedHeartbeats(10)
                .lockTimeout(Duration.ofMillis(100))
                .maxRetriesPerGoal(1);
    }

    private WorkerCoordinator coordinator(CoordinatorConfig config) {
        return new WorkerCoordinator(projectRoot, config, git, new ArtifactExecutor(eventBus, null),
                new WavesmithMetrics(registry), eventBus);
    }

    /** Each goal becomes one artifact producing {@code <goal id>.py}. */
    private final GoalPlanner planner = goal -> {
        planned.computeIfAbsent(goal.id(), k -> new AtomicInteger()).incrementAndGet();
        if (goal.id().startsWith("bad")) {
            throw new IllegalStateException("planner cannot decompose " + goal.id());
        }
        return ArtifactGraph.of(List.of(new ArtifactSpec(goal.id(), goal.description(), "",
                goal.id() + ".py", null, null, Map.of())));
    };

    private static CreatorFactory writing() {
        return workspace -> TieredCreator.uniform(spec -> "# " + spec.description() + "\n");
    }

    private static List<Goal> goals(String... ids) {
        return Arrays.stream(ids).map(id -> new Goal(id, "Implement " + id)).toList();
    }

    @Test
    @DisplayName("every goal runs exactly once and its files are merged")
    void completesAllGoals() throws Exception {
        List<String> events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(e -> events.add(e.eventType()));

        CoordinatorResult result = coordinator(fastConfig().build())
                .execute(goals("g1", "g2", "g3", "g4"), planner, writing());

        assertTrue(result.isSuccess(), result.errors().toString());
        assertEquals(4, result.goalsCompleted());
        planned.forEach((goal, count) -> assertEquals(1, count.get(), goal));
        for (String goal : List.of("g1", "g2", "g3", "g4")) {
            assertEquals("# Implement " + goal + "\n", Files.readString(projectRoot.resolve(goal + ".py")));
        }
        assertFalse(result.mergedBranches().isEmpty());
        assertTrue(result.conflictBranches().isEmpty());
        assertEquals("coordinator.started", events.get(0));
        assertEquals("coordinator.completed", events.get(events.size() - 1));
        assertTrue(events.contains("merge.completed"));
    }

    @Test
    @DisplayName("creates the state directory and removes worker status files afterwards")
    void stateDirectory() throws Exception {
        coordinator(fastConfig().build()).execute(goals("g1"), planner, writing());

        Path stateDir = projectRoot.resolve(".wavesmith");
        assertEquals("*\n", Files.readString(stateDir.resolve(".gitignore")));
        try (var files = Files.list(stateDir.resolve("workers"))) {
            assertEquals(0, files.count());
        }
        assertTrue(Files.isDirectory(stateDir.resolve("plans")));
    }

    @Test
    @DisplayName("a failing goal does not stop the others")
    void goalFailure() {
        CoordinatorResult result = coordinator(fastConfig().build())
                .execute(goals("g1", "bad-1", "g2"), planner, writing());

        assertEquals(2, result.goalsCompleted());
        assertEquals(1, result.goalsFailed());
        assertFalse(result.isSuccess());
        assertTrue(result.errors().stream().anyMatch(e -> e.contains("bad-1")));
        assertFalse(Files.exists(projectRoot.resolve("bad-1.py")));
        assertTrue(Files.exists(projectRoot.resolve("g2.py")));
    }

    @Test
    @DisplayName("a stuck worker is reaped, its goal retried, and completed work still merged")
    void stuckWorker() throws Exception {
        CreatorFactory hangsOnSlow = workspace -> TieredCreator.uniform(spec -> {
            if (spec.id().equals("slow")) {
                Thread.sleep(30_000);
            }
            return "# " + spec.description() + "\n";
        });
        var config = fastConfig().workerCount(1).build();

        CoordinatorResult result = coordinator(config).execute(goals("fast", "slow"), planner, hangsOnSlow);

        assertEquals(1, result.goalsCompleted());
        assertEquals(1, result.goalsFailed());
        assertEquals(2, result.workersUsed());
        assertEquals(2, planned.get("slow").get());
        assertTrue(result.errors().stream().anyMatch(e -> e.contains("no heartbeat")));
        assertTrue(Files.exists(projectRoot.resolve("fast.py")));
        assertFalse(Files.exists(projectRoot.resolve("slow.py")));
        assertEquals(2.0, registry.find("wavesmith.worker.failures").tag("reason", "heartbeat").counter().count());
    }

    @Test
    @DisplayName("a dirty git working tree is rejected before any worker starts")
    void dirtyWorkingTree() {
        when(git.isGitRepository(any())).thenReturn(true);
        when(git.isWorkingTreeClean(any())).thenReturn(false);
        var coordinator = coordinator(fastConfig().build());

        assertThrows(IllegalStateException.class, () -> coordinator.execute(goals("g1"), planner, writing()));
        assertFalse(coordinator.isRunning());
        assertTrue(planned.isEmpty());
    }

    @Test
    @DisplayName("no statuses are reported between runs")
    void idleStatuses() {
        var coordinator = coordinator(fastConfig().build());
        coordinator.execute(goals("g1"), planner, writing());

        assertFalse(coordinator.isRunning());
        assertTrue(coordinator.currentStatuses().isEmpty());
    }

    @Test
    @DisplayName("worker branches follow the configured prefix")
    void branchNames() {
        CoordinatorResult result = coordinator(fastConfig().branchPrefix("agents/w").build())
                .execute(goals("g1", "g2"), planner, writing());

        assertTrue(result.workerStatuses().stream().allMatch(s -> s.branch().startsWith("agents/w")));
        assertTrue(result.mergedBranches().stream().allMatch(b -> b.startsWith("agents/w")));
    }

    @Test
    @DisplayName("a rerun rebuilds a goal whose output never reached the project")
    void rerunRebuildsUnmergedOutput() throws Exception {
        GoalPlanner sharedFile = goal -> ArtifactGraph.of(List.of(new ArtifactSpec(goal.id(), goal.description(), "",
                "shared.py", null, null, Map.of())));
        List<String> created = new CopyOnWriteArrayList<>();
        CreatorFactory slowWriter = workspace -> TieredCreator.uniform(spec -> {
            created.add(spec.id());
            Thread.sleep(300);
            return "# " + spec.description() + "\n";
        });
        var config = fastConfig().mergeStrategy(MergeStrategy.THREE_WAY).build();

        CoordinatorResult first = coordinator(config).execute(goals("a", "b"), planner(sharedFile), slowWriter);

        assertEquals(1, first.mergedBranches().size());
        assertEquals(1, first.conflictBranches().size());
        String winner = Files.readString(projectRoot.resolve("shared.py"));
        String loser = winner.equals("# Implement a\n") ? "b" : "a";

        created.clear();
        CoordinatorResult second = coordinator(config).execute(goals("a", "b"), planner(sharedFile), slowWriter);

        assertEquals(List.of(loser), created);
        assertTrue(second.conflictBranches().isEmpty(), second.errors().toString());
        assertEquals(2, second.goalsCompleted());
        assertEquals("# Implement " + loser + "\n", Files.readString(projectRoot.resolve("shared.py")));
    }

    @Test
    @DisplayName("a reaped worker still running after the grace period is left unmerged")
    void lingeringWorkerNotMerged() throws Exception {
        var release = new CountDownLatch(1);
        var planReturned = new CountDownLatch(1);
        GoalPlanner hangsUninterruptibly = goal -> {
            if (goal.id().equals("hang")) {
                try {
                    awaitIgnoringInterrupts(release);
                } finally {
                    planReturned.countDown();
                }
            }
            return planner.plan(goal);
        };
        var config = fastConfig().workerCount(1).respawn(false).shutdownGrace(Duration.ofMillis(200)).build();

        CoordinatorResult result;
        try {
            result = coordinator(config).execute(goals("done", "hang"), hangsUninterruptibly, writing());
        } finally {
            release.countDown();
        }

        assertEquals(1, result.goalsCompleted());
        assertTrue(result.mergedBranches().isEmpty());
        assertTrue(result.errors().stream().anyMatch(e -> e.contains("still running")), result.errors().toString());
        assertFalse(Files.exists(projectRoot.resolve("done.py")));

        assertTrue(planReturned.await(5, TimeUnit.SECONDS));
        Path status = projectRoot.resolve(".wavesmith/workers/worker-0.json");
        long deadline = System.currentTimeMillis() + 5_000;
        while (System.currentTimeMillis() < deadline
                && (!Files.exists(status) || Files.readString(status).contains("\"hang\""))) {
            Thread.sleep(20);
        }
        Thread.sleep(100);
    }

    private GoalPlanner planner(GoalPlanner delegate) {
        return goal -> {
            planned.computeIfAbsent(goal.id(), k -> new AtomicInteger()).incrementAndGet();
            return delegate.plan(goal);
        };
    }

    /** Blocks until released, re-entering the wait when interrupted. */
    private static void awaitIgnoringInterrupts(CountDownLatch latch) {
        boolean interrupted = false;
        while (latch.getCount() > 0) {
            try {
                latch.await();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
