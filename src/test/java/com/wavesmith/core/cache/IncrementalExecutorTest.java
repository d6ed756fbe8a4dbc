package com.wavesmith.core.cache;

import com.wavesmith.core.executor.ArtifactExecutor;
import com.wavesmith.core.executor.CreateArtifactFn;
import com.wavesmith.core.executor.ExecutionLimits;
import com.wavesmith.core.executor.ExecutionRequest;
import com.wavesmith.core.graph.ArtifactGraph;
import com.wavesmith.core.graph.ArtifactSpec;
import com.wavesmith.core.model.ExecutionResult;
import com.wavesmith.core.model.ExecutionStatus;
import com.wavesmith.core.persistence.PlanStore;
import com.wavesmith.core.persistence.SavedExecution;
import com.wavesmith.core.persistence.TraceLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class IncrementalExecutorTest {

    private static final String GOAL = "Build a REST api for users";

    @TempDir
    Path plansDir;

    private PlanStore store;
    private IncrementalExecutor incremental;
    private List<String> created;
    private CreateArtifactFn recording;

    @BeforeEach
    void setUp() {
        store = new PlanStore(plansDir);
        incremental = new IncrementalExecutor(new ArtifactExecutor(), store);
        created = new CopyOnWriteArrayList<>();
        recording = spec -> {
            created.add(spec.id());
            return "content of " + spec.id();
        };
    }

    private static ArtifactGraph graph(String apiDescription) {
        return ArtifactGraph.of(List.of(
                ArtifactSpec.of("schema", "Users table"),
                ArtifactSpec.of("model", "User model", "schema"),
                ArtifactSpec.of("api", apiDescription, "model")));
    }

    private ExecutionResult run(ArtifactGraph graph) {
        return incremental.execute(GOAL, graph, recording, ExecutionLimits.defaults());
    }

    @Test
    @DisplayName("first run builds everything and saves a completed snapshot")
    void firstRunIsFullBuild() {
        ExecutionResult result = run(graph("User api"));

        assertTrue(result.isSuccess());
        assertEquals(List.of("schema", "model", "api"), created);
        SavedExecution saved = store.findByGoal(GOAL).orElseThrow();
        assertEquals(ExecutionStatus.COMPLETED, saved.getStatus());
        assertEquals(Set.of("schema", "model", "api"), saved.getCompletions().keySet());
    }

    @Test
    @DisplayName("an unchanged second run executes nothing")
    void secondRunIsNoop() {
        run(graph("User api"));
        created.clear();

        ExecutionResult result = run(graph("User api"));

        assertTrue(created.isEmpty());
        assertEquals(Set.of("schema", "model", "api"), result.skipped());
        assertEquals(3, result.completed().size());
        assertTrue(result.waves().isEmpty());
        assertEquals(ExecutionStatus.COMPLETED, store.findByGoal(GOAL).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("editing one artifact reruns only it and its dependents")
    void partialRebuild() {
        run(graph("User api"));
        created.clear();

        ExecutionResult result = run(graph("User api with pagination"));

        assertEquals(List.of("api"), created);
        assertEquals(Set.of("schema", "model"), result.skipped());
        assertTrue(result.isSuccess());
    }

    @Test
    @DisplayName("artifacts that failed last time are retried")
    void retriesFailures() {
        CreateArtifactFn flaky = spec -> {
            if (spec.id().equals("api")) {
                throw new IllegalStateException("rate limited");
            }
            return "content of " + spec.id();
        };
        ExecutionResult first = incremental.execute(GOAL, graph("User api"), flaky, ExecutionLimits.defaults());
        assertEquals(Set.of("api"), first.failed().keySet());
        assertEquals(ExecutionStatus.FAILED, store.findByGoal(GOAL).orElseThrow().getStatus());

        ExecutionResult second = run(graph("User api"));

        assertEquals(List.of("api"), created);
        assertTrue(second.isSuccess());
    }

    @Test
    @DisplayName("forceRebuild ignores the previous execution")
    void forceRebuild() {
        run(graph("User api"));
        created.clear();

        incremental.execute(GOAL, ExecutionRequest.builder(graph("User api"), recording).build(), true);

        assertEquals(3, created.size());
    }

    @Test
    @DisplayName("preview reports what would run without running it")
    void preview() {
        run(graph("User api"));
        created.clear();

        PlanPreview preview = incremental.preview(GOAL, graph("User api v2"));

        assertTrue(created.isEmpty());
        assertEquals(Set.of("api"), preview.toExecute());
        assertEquals(Set.of("schema", "model"), preview.toSkip());
        assertEquals(ChangeKind.SPEC_CHANGED, preview.changes().get("api"));
        assertEquals(2.0 / 3.0, preview.savingsRate(), 1e-9);
        assertEquals(ContentHasher.goalHash(GOAL), preview.goalHash());
    }

    @Test
    @DisplayName("writes an analysis entry to the trace on incremental runs")
    void traceRecordsAnalysis() {
        run(graph("User api"));
        run(graph("User api v2"));

        TraceLogger trace = store.traceLogger(ContentHasher.goalHash(GOAL));
        List<String> events = trace.readAll().stream().map(TraceLogger.TraceEntry::event).toList();

        assertEquals("full_rebuild", events.get(0));
        assertTrue(events.contains("incremental_analysis"));
        assertEquals("execution_complete", events.get(events.size() - 1));
    }
}
