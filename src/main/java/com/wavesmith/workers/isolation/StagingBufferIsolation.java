package com.wavesmith.workers.isolation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Isolation for projects that are not git repositories. Each worker writes
 * into an in-memory buffer; merging copies the buffer onto disk.
 *
 * <p>The disk content of a file is captured the first time a worker writes
 * it. At merge time a file conflicts when the disk no longer matches that
 * capture and also differs from the worker's version. A merge with any
 * conflict writes nothing.
 */
public class StagingBufferIsolation implements WorkspaceIsolation {

    private static final Logger log = LoggerFactory.getLogger(StagingBufferIsolation.class);

    private final Path projectRoot;

    public StagingBufferIsolation(Path projectRoot) {
        this.projectRoot = projectRoot;
    }

    @Override
    public Workspace create(String workerId, String branch) {
        log.info("Worker {} isolated in staging buffer '{}'", workerId, branch);
        return new BufferWorkspace(workerId, branch, projectRoot);
    }

    @Override
    public boolean commit(Workspace workspace, String message) {
        BufferWorkspace buffer = bufferOf(workspace);
        int count = buffer.commitStaged();
        log.debug("Committed {} buffered file(s) for {}: {}", count, workspace.branch(), message);
        return true;
    }

    @Override
    public void discardChanges(Workspace workspace) {
        bufferOf(workspace).discardStaged();
    }

    @Override
    public synchronized MergeResult merge(Workspace workspace, MergeStrategy strategy) {
        BufferWorkspace buffer = bufferOf(workspace);
        Map<String, String> ours = buffer.committedFiles();
        Map<String, Optional<String>> base = buffer.baseSnapshot();

        List<String> conflicts = new ArrayList<>();
        List<String> changed = new ArrayList<>();
        for (var entry : ours.entrySet()) {
            String path = entry.getKey();
            Optional<String> onDisk = readDisk(projectRoot, path);
            if (onDisk.isPresent() && onDisk.get().equals(entry.getValue())) {
                continue;
            }
            if (!onDisk.equals(base.getOrDefault(path, Optional.empty()))) {
                conflicts.add(path);
            } else {
                changed.add(path);
            }
        }

        if (!conflicts.isEmpty()) {
            log.warn("Buffer '{}' conflicts with files changed since it was staged: {}", workspace.branch(), conflicts);
            return MergeResult.failure(strategy, workspace.branch(), conflicts,
                    "Files changed on disk since '%s' staged them".formatted(workspace.branch()));
        }

        for (String path : changed) {
            writeDisk(projectRoot.resolve(path), ours.get(path));
        }
        log.info("Merged buffer '{}' ({} file(s))", workspace.branch(), changed.size());
        return MergeResult.success(strategy, workspace.branch(), changed);
    }

    @Override
    public void cleanup(Workspace workspace, boolean deleteBranch) {
        bufferOf(workspace).discard();
    }

    @Override
    public String name() {
        return "staging-buffer";
    }

    private static BufferWorkspace bufferOf(Workspace workspace) {
        if (workspace instanceof BufferWorkspace buffer) {
            return buffer;
        }
        throw new IllegalArgumentException("Workspace " + workspace.workerId() + " was not created by staging isolation");
    }

    static Optional<String> readDisk(Path root, String relativePath) {
        Path file = root.resolve(relativePath);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private static void writeDisk(Path file, String content) {
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }

    /** In-memory workspace. Reads fall through to disk for files it has not written. */
    static final class BufferWorkspace implements Workspace {

        private final String workerId;
        private final String branch;
        private final Path projectRoot;
        private final Map<String, String> staged = new LinkedHashMap<>();
        private final Map<String, String> committed = new LinkedHashMap<>();
        private final Map<String, Optional<String>> base = new LinkedHashMap<>();

        BufferWorkspace(String workerId, String branch, Path projectRoot) {
            this.workerId = workerId;
            this.branch = branch;
            this.projectRoot = projectRoot;
        }

        @Override
        public String workerId() {
            return workerId;
        }

        @Override
        public String branch() {
            return branch;
        }

        @Override
        public Optional<Path> root() {
            return Optional.empty();
        }

        @Override
        public synchronized void writeFile(String relativePath, String content) {
            Objects.requireNonNull(content, "content");
            String key = normalize(relativePath);
            base.computeIfAbsent(key, k -> readDisk(projectRoot, k));
            staged.put(key, content);
        }

        @Override
        public synchronized Optional<String> readFile(String relativePath) {
            String key = normalize(relativePath);
            if (staged.containsKey(key)) {
                return Optional.of(staged.get(key));
            }
            if (committed.containsKey(key)) {
                return Optional.of(committed.get(key));
            }
            return readDisk(projectRoot, key);
        }

        @Override
        public synchronized Set<String> modifiedFiles() {
            return new TreeSet<>(staged.keySet());
        }

        synchronized int commitStaged() {
            int count = staged.size();
            committed.putAll(staged);
            staged.clear();
            return count;
        }

        synchronized void discardStaged() {
            staged.clear();
        }

        synchronized Map<String, String> committedFiles() {
            return new LinkedHashMap<>(committed);
        }

        synchronized Map<String, Optional<String>> baseSnapshot() {
            return new LinkedHashMap<>(base);
        }

        synchronized void discard() {
            staged.clear();
            committed.clear();
            base.clear();
        }

        private String normalize(String relativePath) {
            Path resolved = projectRoot.resolve(relativePath).normalize();
            if (!resolved.startsWith(projectRoot.normalize())) {
                throw new IllegalArgumentException("Path escapes workspace: " + relativePath);
            }
            return projectRoot.normalize().relativize(resolved).toString().replace('\\', '/');
        }
    }
}
