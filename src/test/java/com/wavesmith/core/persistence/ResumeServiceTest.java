package com.wavesmith.core.persistence;

import com.wavesmith.core.cache.ContentHasher;
import com.wavesmith.core.executor.ArtifactExecutor;
import com.wavesmith.core.executor.CancellationToken;
import com.wavesmith.core.executor.ExecutionLimits;
import com.wavesmith.core.executor.ExecutionListener;
import com.wavesmith.core.executor.ExecutionRequest;
import com.wavesmith.core.executor.TieredCreator;
import com.wavesmith.core.graph.ArtifactGraph;
import com.wavesmith.core.graph.ArtifactSpec;
import com.wavesmith.core.model.ExecutionResult;
import com.wavesmith.core.model.ExecutionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class ResumeServiceTest {

    private static final String GOAL = "Build a billing service";

    @TempDir
    Path plansDir;

    private PlanStore store;
    private ArtifactExecutor executor;
    private ResumeService resumeService;
    private List<String> created;
    private TieredCreator creator;

    @BeforeEach
    void setUp() {
        store = new PlanStore(plansDir);
        executor = new ArtifactExecutor();
        resumeService = new ResumeService(store, executor);
        created = new CopyOnWriteArrayList<>();
        creator = TieredCreator.uniform(spec -> {
            created.add(spec.id());
            return "content of " + spec.id();
        });
    }

    private static ArtifactGraph graph() {
        return ArtifactGraph.of(List.of(
                ArtifactSpec.of("invoice", "Invoice schema"),
                ArtifactSpec.of("ledger", "Ledger", "invoice"),
                ArtifactSpec.of("api", "Billing api", "ledger"))).freeze();
    }

    /** Runs the first wave only, checkpointing as it goes, then stops as if the process died. */
    private SavedExecution interruptedAfterFirstWave() {
        var execution = new SavedExecution(GOAL, graph());
        TraceLogger trace = store.traceLogger(execution.getGoalHash());
        var token = new CancellationToken();
        var checkpointer = new PlanCheckpointer(execution, store, trace);
        executor.execute(ExecutionRequest.builder(execution.getGraph(), creator)
                .listener(ExecutionListener.composite(List.of(checkpointer, new ExecutionListener() {
                    @Override
                    public void onWaveCompleted(int waveNumber, int completed, int failed) {
                        token.cancel();
                    }
                })))
                .cancellation(token)
                .goalHash(execution.getGoalHash())
                .build());
        created.clear();
        return execution;
    }

    @Test
    @DisplayName("a cancelled run is saved as PAUSED with its progress")
    void pausedSnapshot() {
        SavedExecution execution = interruptedAfterFirstWave();

        SavedExecution saved = store.load(execution.getGoalHash()).orElseThrow();
        assertEquals(ExecutionStatus.PAUSED, saved.getStatus());
        assertEquals(Set.of("invoice"), saved.getCompletions().keySet());
        assertEquals(1, saved.resumeWave());
        assertEquals(1.0 / 3.0, saved.progress(), 1e-9);
    }

    @Test
    @DisplayName("resume runs only the artifacts that never completed")
    void resumeContinues() {
        String hash = interruptedAfterFirstWave().getGoalHash();

        ExecutionResult result = resumeService.resume(hash, creator, ExecutionLimits.defaults());

        assertEquals(List.of("ledger", "api"), created);
        assertEquals(Set.of("invoice"), result.skipped());
        assertTrue(result.isSuccess());
        assertEquals(ExecutionStatus.COMPLETED, store.load(hash).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("resume appends to the existing trace")
    void resumeTrace() {
        String hash = interruptedAfterFirstWave().getGoalHash();
        resumeService.resume(hash, creator, ExecutionLimits.defaults());

        List<String> events = store.traceLogger(hash).readAll().stream()
                .map(TraceLogger.TraceEntry::event)
                .toList();

        assertEquals("wave_start", events.get(0));
        assertTrue(events.indexOf("resume") > events.indexOf("execution_complete"));
        assertEquals("execution_complete", events.get(events.size() - 1));
        assertEquals(3, events.stream().filter("artifact_complete"::equals).count());
    }

    @Test
    @DisplayName("resuming an unknown goal is rejected")
    void unknownGoal() {
        assertThrows(IllegalArgumentException.class,
                () -> resumeService.resume(ContentHasher.goalHash("nothing"), creator, ExecutionLimits.defaults()));
    }

    @Test
    @DisplayName("resuming a corrupt snapshot fails without running anything")
    void corruptSnapshot() throws Exception {
        String hash = interruptedAfterFirstWave().getGoalHash();
        Files.writeString(plansDir.resolve(hash + ".json"), "{\"version\": 1, \"goal\": ");

        assertThrows(PersistenceCorruptionException.class,
                () -> resumeService.resume(hash, creator, ExecutionLimits.defaults()));
        assertTrue(created.isEmpty());
    }
}
