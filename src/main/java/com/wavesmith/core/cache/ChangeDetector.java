package com.wavesmith.core.cache;

import com.wavesmith.core.graph.ArtifactGraph;
import com.wavesmith.core.graph.ArtifactSpec;
import com.wavesmith.core.persistence.ArtifactCompletion;
import com.wavesmith.core.persistence.SavedExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Decides which artifacts of a graph can be reused from a previous execution.
 *
 * <p>An artifact is {@link ChangeKind#UNCHANGED} only when it completed before,
 * its recorded input hash equals the current one and every dependency is
 * itself unchanged. Any change therefore invalidates the whole downstream
 * cascade.
 */
public class ChangeDetector {

    private static final Logger log = LoggerFactory.getLogger(ChangeDetector.class);

    private final Function<String, Optional<String>> outputs;
    private final boolean missingOutputModified;

    public ChangeDetector() {
        this(null, false);
    }

    /**
     * @param projectRoot root against which {@link ArtifactSpec#producesFile()} is resolved to
     *                    detect externally modified outputs; null disables the check. A produced
     *                    file that does not exist is not treated as modified.
     */
    public ChangeDetector(Path projectRoot) {
        this(projectRoot == null ? null : file -> readOutput(projectRoot, file), false);
    }

    private ChangeDetector(Function<String, Optional<String>> outputs, boolean missingOutputModified) {
        this.outputs = outputs;
        this.missingOutputModified = missingOutputModified;
    }

    /**
     * Detector for a workspace that receives every produced file. Outputs are
     * read through {@code outputs}; an output missing there is
     * {@link ChangeKind#OUTPUT_MODIFIED}, so reused results always exist in the
     * workspace they are reused in.
     *
     * @param outputs reads a produced file by its relative path, empty when absent
     */
    public static ChangeDetector forWorkspace(Function<String, Optional<String>> outputs) {
        return new ChangeDetector(outputs, true);
    }

    /**
     * @param previous the previous execution, or null when there is none
     */
    public ChangeSet detect(ArtifactGraph graph, SavedExecution previous) {
        Map<String, String> inputHashes = ContentHasher.inputHashes(graph);
        Map<String, ChangeKind> kinds = new HashMap<>();

        for (String id : graph.topologicalOrder()) {
            ArtifactSpec spec = graph.get(id);
            kinds.put(id, classify(spec, inputHashes.get(id), kinds, previous));
        }

        Set<String> removed = new HashSet<>();
        if (previous != null) {
            for (String id : previous.getGraph().ids()) {
                if (!graph.contains(id)) {
                    removed.add(id);
                }
            }
        }

        var changes = new ChangeSet(kinds, inputHashes, removed);
        log.debug("Change detection: {} unchanged, {} changed, {} removed",
                changes.unchanged().size(), changes.changed().size(), removed.size());
        return changes;
    }

    /**
     * Splits the graph into artifacts to run and artifacts to reuse. Every
     * dependent of a changed artifact runs, even if classification alone would
     * have kept it.
     */
    public IncrementalPlan planIncremental(ArtifactGraph graph, ChangeSet changes) {
        Set<String> toExecute = new HashSet<>(changes.changed());
        for (String id : changes.changed()) {
            if (graph.contains(id)) {
                toExecute.addAll(graph.transitiveDependents(id));
            }
        }
        Set<String> toSkip = new HashSet<>(graph.ids());
        toSkip.removeAll(toExecute);
        return new IncrementalPlan(toExecute, toSkip);
    }

    private ChangeKind classify(ArtifactSpec spec, String inputHash, Map<String, ChangeKind> upstream,
                                SavedExecution previous) {
        if (previous == null) {
            return ChangeKind.ADDED;
        }
        Optional<ArtifactSpec> before = previous.getGraph().find(spec.id());
        if (before.isEmpty()) {
            return ChangeKind.ADDED;
        }
        if (!ContentHasher.fingerprint(before.get()).equals(ContentHasher.fingerprint(spec))) {
            return ChangeKind.SPEC_CHANGED;
        }
        for (String req : spec.requires()) {
            if (upstream.get(req) != ChangeKind.UNCHANGED) {
                return ChangeKind.DEPENDENCY_CHANGED;
            }
        }
        ArtifactCompletion completion = previous.getCompletions().get(spec.id());
        if (completion == null) {
            return ChangeKind.NOT_COMPLETED;
        }
        if (!inputHash.equals(completion.inputHash())) {
            return ChangeKind.DEPENDENCY_CHANGED;
        }
        if (outputModified(spec, completion)) {
            return ChangeKind.OUTPUT_MODIFIED;
        }
        return ChangeKind.UNCHANGED;
    }

    private boolean outputModified(ArtifactSpec spec, ArtifactCompletion completion) {
        String file = spec.producesFile();
        if (outputs == null || file == null || file.isBlank()) {
            return false;
        }
        Optional<String> current;
        try {
            current = outputs.apply(file);
        } catch (RuntimeException e) {
            log.warn("Cannot read output {} of {}, treating as modified: {}", file, spec.id(), e.getMessage());
            return true;
        }
        if (current.isEmpty()) {
            if (missingOutputModified) {
                log.debug("Output {} of {} is missing, rebuilding", file, spec.id());
            }
            return missingOutputModified;
        }
        return !ContentHasher.sha256(current.get()).equals(completion.contentHash());
    }

    private static Optional<String> readOutput(Path projectRoot, String file) {
        Path path = projectRoot.resolve(file);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + path, e);
        }
    }
}
