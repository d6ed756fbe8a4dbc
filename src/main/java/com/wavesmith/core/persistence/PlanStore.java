package com.wavesmith.core.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wavesmith.core.cache.ContentHasher;
import com.wavesmith.core.graph.ArtifactGraph;
import com.wavesmith.core.graph.ArtifactSpec;
import com.wavesmith.core.graph.GraphConstructionException;
import com.wavesmith.core.model.ExecutionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * File-backed store of {@link SavedExecution} snapshots.
 *
 * <p>Layout under the plans directory:
 * <ul>
 *   <li>{@code <goalHash>.json} - latest snapshot, replaced atomically on every save</li>
 *   <li>{@code <goalHash>.trace.jsonl} - append-only event log, see {@link TraceLogger}</li>
 * </ul>
 *
 * <p>Loading fails closed: a snapshot that cannot be parsed or whose contents
 * are inconsistent raises {@link PersistenceCorruptionException}.
 */
public class PlanStore {

    private static final Logger log = LoggerFactory.getLogger(PlanStore.class);

    static final int SNAPSHOT_VERSION = 1;
    private static final String SNAPSHOT_SUFFIX = ".json";

    private final Path plansDir;
    private final ObjectMapper objectMapper;

    public PlanStore(Path plansDir) {
        this(plansDir, defaultMapper());
    }

    public PlanStore(Path plansDir, ObjectMapper objectMapper) {
        this.plansDir = plansDir;
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .build();
    }

    public Path getPlansDir() {
        return plansDir;
    }

    /**
     * Writes the snapshot to a temp file and atomically moves it over the
     * previous one.
     *
     * @return path of the snapshot
     */
    public Path save(SavedExecution execution) {
        Path target = snapshotPath(execution.getGoalHash());
        var snapshot = new Snapshot(
                SNAPSHOT_VERSION,
                execution.getGoal(),
                execution.getGoalHash(),
                execution.getGraph().specs(),
                execution.getCompletions(),
                execution.getFailures(),
                execution.getStatus(),
                execution.getCreatedAt(),
                execution.getUpdatedAt());
        try {
            Files.createDirectories(plansDir);
            byte[] bytes = objectMapper.writeValueAsBytes(snapshot);
            Path temp = Files.createTempFile(plansDir, "." + execution.getGoalHash() + "-", ".tmp");
            try {
                Files.write(temp, bytes);
                try {
                    Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } catch (IOException e) {
                Files.deleteIfExists(temp);
                throw e;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save execution " + execution.getGoalHash(), e);
        }
        log.debug("Saved execution {} ({} completed, status {})",
                execution.getGoalHash(), execution.getCompletions().size(), execution.getStatus());
        return target;
    }

    /**
     * @return the snapshot for the hash, or empty when none was saved
     * @throws PersistenceCorruptionException if the snapshot exists but cannot be trusted
     */
    public Optional<SavedExecution> load(String goalHash) {
        Path path = snapshotPath(goalHash);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        Snapshot snapshot;
        try {
            snapshot = objectMapper.readValue(Files.readString(path, StandardCharsets.UTF_8), Snapshot.class);
        } catch (IOException e) {
            throw new PersistenceCorruptionException(path, "unreadable JSON", e);
        }
        return Optional.of(toExecution(path, goalHash, snapshot));
    }

    public Optional<SavedExecution> findByGoal(String goal) {
        Optional<SavedExecution> found = load(ContentHasher.goalHash(goal));
        if (found.isPresent() && !found.get().getGoal().equals(goal)) {
            log.warn("Goal hash collision for {}; ignoring stored execution", found.get().getGoalHash());
            return Optional.empty();
        }
        return found;
    }

    /**
     * Most recently updated executions first. Unreadable snapshots are logged
     * and left out.
     */
    public List<SavedExecution> listRecent(int limit) {
        if (!Files.isDirectory(plansDir)) {
            return List.of();
        }
        List<SavedExecution> executions = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(plansDir, "*" + SNAPSHOT_SUFFIX)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                String hash = name.substring(0, name.length() - SNAPSHOT_SUFFIX.length());
                try {
                    load(hash).ifPresent(executions::add);
                } catch (PersistenceCorruptionException e) {
                    log.warn("Skipping corrupt snapshot {}: {}", path, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + plansDir, e);
        }
        return executions.stream()
                .sorted(Comparator.comparing(SavedExecution::getUpdatedAt).reversed())
                .limit(limit)
                .toList();
    }

    public boolean exists(String goalHash) {
        return Files.exists(snapshotPath(goalHash));
    }

    /** Removes the snapshot and its trace. */
    public boolean delete(String goalHash) {
        try {
            boolean deleted = Files.deleteIfExists(snapshotPath(goalHash));
            Files.deleteIfExists(tracePath(goalHash));
            return deleted;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete execution " + goalHash, e);
        }
    }

    public TraceLogger traceLogger(String goalHash) {
        return new TraceLogger(tracePath(goalHash), objectMapper);
    }

    Path snapshotPath(String goalHash) {
        return plansDir.resolve(goalHash + SNAPSHOT_SUFFIX);
    }

    Path tracePath(String goalHash) {
        return plansDir.resolve(goalHash + ".trace.jsonl");
    }

    private SavedExecution toExecution(Path path, String goalHash, Snapshot snapshot) {
        if (snapshot.version() != SNAPSHOT_VERSION) {
            throw new PersistenceCorruptionException(path, "unsupported version " + snapshot.version());
        }
        if (snapshot.goal() == null || snapshot.artifacts() == null || snapshot.status() == null
                || snapshot.createdAt() == null) {
            throw new PersistenceCorruptionException(path, "missing required fields");
        }
        if (!goalHash.equals(snapshot.goalHash()) || !goalHash.equals(ContentHasher.goalHash(snapshot.goal()))) {
            throw new PersistenceCorruptionException(path, "goal hash does not match goal text");
        }

        ArtifactGraph graph;
        try {
            graph = ArtifactGraph.of(snapshot.artifacts()).freeze();
        } catch (GraphConstructionException | IllegalArgumentException e) {
            throw new PersistenceCorruptionException(path, "invalid graph: " + e.getMessage(), e);
        }

        Map<String, ArtifactCompletion> completions = snapshot.completions() == null ? Map.of() : snapshot.completions();
        Map<String, String> failures = snapshot.failures() == null ? Map.of() : snapshot.failures();
        for (var entry : completions.entrySet()) {
            ArtifactCompletion completion = entry.getValue();
            if (completion == null || !entry.getKey().equals(completion.artifactId())
                    || !graph.contains(entry.getKey()) || completion.contentHash() == null) {
                throw new PersistenceCorruptionException(path, "inconsistent completion record " + entry.getKey());
            }
        }
        for (String id : failures.keySet()) {
            if (!graph.contains(id)) {
                throw new PersistenceCorruptionException(path, "failure recorded for unknown artifact " + id);
            }
        }

        var execution = new SavedExecution(snapshot.goal(), graph, snapshot.status(),
                snapshot.createdAt(), snapshot.updatedAt());
        execution.restore(completions, failures);
        return execution;
    }

    /**
     * On-disk form of a {@link SavedExecution}.
     */
    record Snapshot(
        int version,
        String goal,
        String goalHash,
        List<ArtifactSpec> artifacts,
        Map<String, ArtifactCompletion> completions,
        Map<String, String> failures,
        ExecutionStatus status,
        Instant createdAt,
        Instant updatedAt
    ) {}
}
