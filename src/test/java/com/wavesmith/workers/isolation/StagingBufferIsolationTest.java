package com.wavesmith.workers.isolation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StagingBufferIsolationTest {

    @TempDir
    Path projectRoot;

    private StagingBufferIsolation isolation;

    @BeforeEach
    void setUp() {
        isolation = new StagingBufferIsolation(projectRoot);
    }

    private Workspace committed(String workerId, String path, String content) {
        Workspace ws = isolation.create(workerId, "work/" + workerId);
        ws.writeFile(path, content);
        assertTrue(isolation.commit(ws, "goal done"));
        return ws;
    }

    @Test
    @DisplayName("writes stay invisible on disk until merged")
    void isolatedUntilMerge() {
        Workspace ws = committed("worker-1", "src/file1.py", "print(1)");

        assertFalse(Files.exists(projectRoot.resolve("src/file1.py")));
        assertEquals(Optional.of("print(1)"), ws.readFile("src/file1.py"));

        MergeResult result = isolation.merge(ws, MergeStrategy.FAST_FORWARD);

        assertTrue(result.success());
        assertEquals(List.of("src/file1.py"), result.filesMerged());
        assertTrue(Files.exists(projectRoot.resolve("src/file1.py")));
    }

    @Test
    @DisplayName("workers touching disjoint files both merge")
    void disjointFiles() throws Exception {
        Workspace w1 = committed("worker-1", "file1.py", "one");
        Workspace w2 = committed("worker-2", "file2.py", "two");

        assertTrue(isolation.merge(w1, MergeStrategy.FAST_FORWARD).success());
        assertTrue(isolation.merge(w2, MergeStrategy.FAST_FORWARD).success());
        assertEquals("one", Files.readString(projectRoot.resolve("file1.py")));
        assertEquals("two", Files.readString(projectRoot.resolve("file2.py")));
    }

    @Test
    @DisplayName("a second worker editing the same file conflicts and writes nothing")
    void sharedFileConflict() throws Exception {
        Files.writeString(projectRoot.resolve("shared.py"), "base");
        Workspace w1 = isolation.create("worker-1", "work/worker-1");
        Workspace w2 = isolation.create("worker-2", "work/worker-2");
        w1.writeFile("shared.py", "from worker 1");
        w2.writeFile("shared.py", "from worker 2");
        w2.writeFile("other.py", "other");
        isolation.commit(w1, "w1");
        isolation.commit(w2, "w2");

        assertTrue(isolation.merge(w1, MergeStrategy.ABORT_ON_CONFLICT).success());
        MergeResult second = isolation.merge(w2, MergeStrategy.ABORT_ON_CONFLICT);

        assertFalse(second.success());
        assertEquals(List.of("shared.py"), second.conflicts());
        assertNotNull(second.error());
        assertEquals("from worker 1", Files.readString(projectRoot.resolve("shared.py")));
        assertFalse(Files.exists(projectRoot.resolve("other.py")));
    }

    @Test
    @DisplayName("identical edits from two workers are not a conflict")
    void identicalEdits() {
        Workspace w1 = committed("worker-1", "shared.py", "same");
        Workspace w2 = committed("worker-2", "shared.py", "same");

        assertTrue(isolation.merge(w1, MergeStrategy.THREE_WAY).success());
        MergeResult second = isolation.merge(w2, MergeStrategy.THREE_WAY);

        assertTrue(second.success());
        assertTrue(second.filesMerged().isEmpty());
    }

    @Test
    @DisplayName("discarded changes are never merged")
    void discard() {
        Workspace ws = isolation.create("worker-1", "work/worker-1");
        ws.writeFile("kept.py", "kept");
        isolation.commit(ws, "first goal");
        ws.writeFile("dropped.py", "dropped");
        assertEquals(Set.of("dropped.py"), ws.modifiedFiles());

        isolation.discardChanges(ws);
        MergeResult result = isolation.merge(ws, MergeStrategy.FAST_FORWARD);

        assertEquals(List.of("kept.py"), result.filesMerged());
        assertFalse(Files.exists(projectRoot.resolve("dropped.py")));
    }

    @Test
    @DisplayName("paths escaping the project are rejected")
    void pathEscape() {
        Workspace ws = isolation.create("worker-1", "work/worker-1");

        assertThrows(IllegalArgumentException.class, () -> ws.writeFile("../outside.py", "x"));
    }
}
