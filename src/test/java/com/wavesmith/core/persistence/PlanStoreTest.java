package com.wavesmith.core.persistence;

import com.wavesmith.core.cache.ContentHasher;
import com.wavesmith.core.graph.ArtifactGraph;
import com.wavesmith.core.graph.ArtifactSpec;
import com.wavesmith.core.model.ExecutionStatus;
import com.wavesmith.core.model.ModelTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PlanStoreTest {

    private static final String GOAL = "Build a chat server";

    @TempDir
    Path plansDir;

    private PlanStore store;

    @BeforeEach
    void setUp() {
        store = new PlanStore(plansDir);
    }

    private static SavedExecution execution(String goal) {
        var graph = ArtifactGraph.of(List.of(
                new ArtifactSpec("protocol", "Wire protocol", "frames are length prefixed", "protocol.md",
                        null, "protocol", Map.of("priority", 1)),
                ArtifactSpec.of("server", "Server loop", "protocol"))).freeze();
        var execution = new SavedExecution(goal, graph);
        execution.recordCompletion(new ArtifactCompletion("protocol", ContentHasher.sha256("frames"),
                "input-1", ModelTier.SMALL, 42, true, Instant.parse("2026-01-02T03:04:05Z")));
        execution.setStatus(ExecutionStatus.IN_PROGRESS);
        return execution;
    }

    // -- Round trip -------------------------------------------------------------

    @Nested
    @DisplayName("save and load")
    class SaveAndLoad {

        @Test
        @DisplayName("restores goal, graph, completions and status")
        void roundTrip() {
            SavedExecution original = execution(GOAL);
            Path path = store.save(original);

            assertEquals(plansDir.resolve(original.getGoalHash() + ".json"), path);
            SavedExecution loaded = store.load(original.getGoalHash()).orElseThrow();

            assertEquals(GOAL, loaded.getGoal());
            assertEquals(ExecutionStatus.IN_PROGRESS, loaded.getStatus());
            assertEquals(original.getGraph().specs(), loaded.getGraph().specs());
            assertEquals(original.getCompletions(), loaded.getCompletions());
            assertEquals(Set.of("server"), loaded.pendingIds());
            assertEquals(1, loaded.resumeWave());
        }

        @Test
        @DisplayName("leaves no temp files behind after saving")
        void atomicSave() throws Exception {
            SavedExecution execution = execution(GOAL);
            store.save(execution);
            execution.setStatus(ExecutionStatus.COMPLETED);
            store.save(execution);

            try (var files = Files.list(plansDir)) {
                assertEquals(List.of(execution.getGoalHash() + ".json"),
                        files.map(p -> p.getFileName().toString()).toList());
            }
            assertEquals(ExecutionStatus.COMPLETED, store.load(execution.getGoalHash()).orElseThrow().getStatus());
        }

        @Test
        @DisplayName("returns empty for an unknown goal")
        void missing() {
            assertTrue(store.load("0123456789abcdef").isEmpty());
            assertTrue(store.findByGoal("never planned").isEmpty());
        }

        @Test
        @DisplayName("lists most recently updated executions first")
        void listRecent() throws Exception {
            store.save(execution("first goal"));
            Thread.sleep(5);
            store.save(execution("second goal"));

            List<SavedExecution> recent = store.listRecent(10);

            assertEquals(List.of("second goal", "first goal"), recent.stream().map(SavedExecution::getGoal).toList());
            assertEquals(1, store.listRecent(1).size());
        }

        @Test
        @DisplayName("delete removes snapshot and trace")
        void delete() {
            SavedExecution execution = execution(GOAL);
            store.save(execution);
            store.traceLogger(execution.getGoalHash()).log("plan_created", Map.of("artifacts", 2));

            assertTrue(store.delete(execution.getGoalHash()));
            assertFalse(store.exists(execution.getGoalHash()));
            assertFalse(Files.exists(store.tracePath(execution.getGoalHash())));
        }
    }

    // -- Corruption -------------------------------------------------------------

    @Nested
    @DisplayName("corrupt snapshots")
    class Corruption {

        private String hash;

        @BeforeEach
        void saveOne() {
            hash = execution(GOAL).getGoalHash();
            store.save(execution(GOAL));
        }

        private void overwrite(String json) throws Exception {
            Files.writeString(store.snapshotPath(hash), json);
        }

        @Test
        @DisplayName("truncated JSON fails closed")
        void truncated() throws Exception {
            String json = Files.readString(store.snapshotPath(hash));
            overwrite(json.substring(0, json.length() / 2));

            var e = assertThrows(PersistenceCorruptionException.class, () -> store.load(hash));
            assertTrue(e.getMessage().contains("unreadable JSON"));
            assertEquals(store.snapshotPath(hash), e.getPath());
        }

        @Test
        @DisplayName("a snapshot whose goal does not match its hash fails closed")
        void goalMismatch() throws Exception {
            overwrite(Files.readString(store.snapshotPath(hash)).replace(GOAL, "some other goal"));

            var e = assertThrows(PersistenceCorruptionException.class, () -> store.load(hash));
            assertTrue(e.getMessage().contains("goal hash"));
        }

        @Test
        @DisplayName("a completion for an unknown artifact fails closed")
        void unknownCompletion() throws Exception {
            overwrite(Files.readString(store.snapshotPath(hash)).replace("\"protocol\" : {", "\"ghost\" : {"));

            assertThrows(PersistenceCorruptionException.class, () -> store.load(hash));
        }

        @Test
        @DisplayName("a cyclic stored graph fails closed")
        void cyclicGraph() throws Exception {
            String json = Files.readString(store.snapshotPath(hash));
            overwrite(json.replaceFirst("\"requires\" : \\[ \\]", "\"requires\" : [ \"server\" ]"));

            var e = assertThrows(PersistenceCorruptionException.class, () -> store.load(hash));
            assertTrue(e.getMessage().contains("invalid graph"));
        }

        @Test
        @DisplayName("listRecent skips corrupt snapshots")
        void listSkipsCorrupt() throws Exception {
            overwrite("{ not json");
            store.save(execution("healthy goal"));

            assertEquals(List.of("healthy goal"), store.listRecent(10).stream().map(SavedExecution::getGoal).toList());
        }
    }
}
