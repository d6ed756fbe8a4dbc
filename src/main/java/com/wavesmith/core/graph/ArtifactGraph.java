package com.wavesmith.core.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Dependency graph of {@link ArtifactSpec}s.
 *
 * <p>Specs may reference artifacts that have not been added yet, but every
 * reference must resolve before {@link #freeze()} or {@link #executionWaves()}.
 * Adding a spec that would close a cycle fails with
 * {@link CyclicDependencyException} and leaves the graph untouched.
 *
 * <p>{@link #add} is meant for the single planning thread. Once frozen, the graph
 * only grows through {@link #proposeExtension}, which validates a whole batch
 * under the graph's monitor.
 */
public class ArtifactGraph implements Iterable<ArtifactSpec> {

    private static final Logger log = LoggerFactory.getLogger(ArtifactGraph.class);

    private final Map<String, ArtifactSpec> artifacts = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependents = new HashMap<>();
    private volatile boolean frozen;

    public static ArtifactGraph of(Collection<ArtifactSpec> specs) {
        var graph = new ArtifactGraph();
        graph.addAll(specs);
        return graph;
    }

    // ══════════════════════════════════════════════════════════════════════
    // CONSTRUCTION
    // ══════════════════════════════════════════════════════════════════════

    /**
     * Adds a spec to the graph.
     *
     * @throws DuplicateArtifactException if the id already exists
     * @throws CyclicDependencyException  if the artifact closes a cycle
     * @throws IllegalStateException      if the graph is frozen
     */
    public synchronized void add(ArtifactSpec spec) {
        if (frozen) {
            throw new IllegalStateException("Graph is frozen; use proposeExtension to add '%s'".formatted(spec.id()));
        }
        if (artifacts.containsKey(spec.id())) {
            throw new DuplicateArtifactException(spec.id());
        }
        List<String> cycle = findCycleThrough(spec);
        if (cycle != null) {
            throw new CyclicDependencyException(cycle);
        }
        insert(spec);
    }

    /**
     * Adds specs in order. If any spec is rejected, none of the batch is kept.
     */
    public synchronized void addAll(Collection<ArtifactSpec> specs) {
        List<String> added = new ArrayList<>();
        try {
            for (ArtifactSpec spec : specs) {
                add(spec);
                added.add(spec.id());
            }
        } catch (RuntimeException e) {
            for (int i = added.size() - 1; i >= 0; i--) {
                remove(added.get(i));
            }
            throw e;
        }
    }

    /**
     * Validates the graph and rejects further {@link #add} calls.
     *
     * @throws MissingDependencyException if any reference is dangling
     * @throws CyclicDependencyException  if the graph has a cycle
     */
    public synchronized ArtifactGraph freeze() {
        requireResolved(artifacts.keySet());
        detectCycle().ifPresent(cycle -> {
            throw new CyclicDependencyException(cycle);
        });
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Adds a batch of discovered artifacts to a (possibly frozen) graph.
     *
     * <p>The batch is accepted only when its ids are new, every requirement
     * resolves to an existing artifact or another member of the batch, the
     * batch introduces no cycle and the graph stays within {@code maxArtifacts}.
     * Existing artifacts never gain dependencies, so waves that already ran stay
     * valid; new nodes land in waves after the ones they depend on.
     */
    public synchronized ExtensionResult proposeExtension(Collection<ArtifactSpec> newSpecs, int maxArtifacts) {
        if (newSpecs.isEmpty()) {
            return ExtensionResult.accepted(List.of());
        }
        if (artifacts.size() + newSpecs.size() > maxArtifacts) {
            return ExtensionResult.rejected("Extension would grow graph to %d artifacts (limit %d)"
                    .formatted(artifacts.size() + newSpecs.size(), maxArtifacts));
        }

        Map<String, ArtifactSpec> batch = new LinkedHashMap<>();
        for (ArtifactSpec spec : newSpecs) {
            if (artifacts.containsKey(spec.id()) || batch.putIfAbsent(spec.id(), spec) != null) {
                return ExtensionResult.rejected("Duplicate artifact id: " + spec.id());
            }
        }
        for (ArtifactSpec spec : batch.values()) {
            for (String req : spec.requires()) {
                if (!artifacts.containsKey(req) && !batch.containsKey(req)) {
                    return ExtensionResult.rejected("Artifact '%s' requires unknown artifact '%s'".formatted(spec.id(), req));
                }
            }
        }
        for (String id : batch.keySet()) {
            Set<String> existing = dependents.getOrDefault(id, Set.of());
            if (!existing.isEmpty()) {
                return ExtensionResult.rejected("Existing artifacts %s already reference '%s'".formatted(existing, id));
            }
        }

        Optional<List<String>> cycle = detectCycle(batch);
        if (cycle.isPresent()) {
            return ExtensionResult.rejected("Cyclic dependency detected: " + String.join(" -> ", cycle.get()));
        }

        batch.values().forEach(this::insert);
        log.info("Graph extended with {} artifact(s): {}", batch.size(), batch.keySet());
        return ExtensionResult.accepted(new ArrayList<>(batch.keySet()));
    }

    public ExtensionResult proposeExtension(Collection<ArtifactSpec> newSpecs) {
        return proposeExtension(newSpecs, Integer.MAX_VALUE);
    }

    // ══════════════════════════════════════════════════════════════════════
    // LOOKUP
    // ══════════════════════════════════════════════════════════════════════

    public synchronized ArtifactSpec get(String id) {
        ArtifactSpec spec = artifacts.get(id);
        if (spec == null) {
            throw new ArtifactNotFoundException(id);
        }
        return spec;
    }

    public synchronized Optional<ArtifactSpec> find(String id) {
        return Optional.ofNullable(artifacts.get(id));
    }

    public synchronized boolean contains(String id) {
        return artifacts.containsKey(id);
    }

    public synchronized int size() {
        return artifacts.size();
    }

    public synchronized boolean isEmpty() {
        return artifacts.isEmpty();
    }

    /** Artifact ids in insertion order. */
    public synchronized List<String> ids() {
        return List.copyOf(artifacts.keySet());
    }

    public synchronized List<ArtifactSpec> specs() {
        return List.copyOf(artifacts.values());
    }

    @Override
    public Iterator<ArtifactSpec> iterator() {
        return specs().iterator();
    }

    /** Artifacts with no dependencies. */
    public synchronized List<String> leaves() {
        return artifacts.values().stream().filter(ArtifactSpec::isLeaf).map(ArtifactSpec::id).toList();
    }

    /** Artifacts nothing else depends on (the final outputs). */
    public synchronized List<String> roots() {
        return artifacts.keySet().stream()
                .filter(id -> dependents.getOrDefault(id, Set.of()).isEmpty())
                .toList();
    }

    public synchronized Set<String> dependents(String id) {
        get(id);
        return Set.copyOf(dependents.getOrDefault(id, Set.of()));
    }

    /** Every artifact that depends on {@code id}, directly or transitively. */
    public synchronized Set<String> transitiveDependents(String id) {
        get(id);
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(dependents.getOrDefault(id, Set.of()));
        while (!queue.isEmpty()) {
            String next = queue.poll();
            if (seen.add(next)) {
                queue.addAll(dependents.getOrDefault(next, Set.of()));
            }
        }
        return seen;
    }

    /** Number of direct dependencies. */
    public synchronized int fanIn(String id) {
        return get(id).requires().size();
    }

    /** Number of artifacts that directly depend on this one. */
    public synchronized int fanOut(String id) {
        get(id);
        return dependents.getOrDefault(id, Set.of()).size();
    }

    /**
     * Longest dependency chain below an artifact. Leaves have depth 0.
     */
    public synchronized int depth(String id) {
        get(id);
        return depth(id, new HashMap<>());
    }

    public synchronized int maxDepth() {
        Map<String, Integer> memo = new HashMap<>();
        int max = 0;
        for (String id : artifacts.keySet()) {
            max = Math.max(max, depth(id, memo));
        }
        return max;
    }

    /**
     * Post-order walk with an explicit stack. A node is settled once every
     * resolved requirement has a depth in {@code memo}.
     */
    private int depth(String id, Map<String, Integer> memo) {
        Deque<String> stack = new ArrayDeque<>();
        stack.push(id);
        while (!stack.isEmpty()) {
            String node = stack.peek();
            if (memo.containsKey(node)) {
                stack.pop();
                continue;
            }
            ArtifactSpec spec = artifacts.get(node);
            int result = 0;
            boolean settled = true;
            if (spec != null) {
                for (String req : spec.requires()) {
                    if (!artifacts.containsKey(req)) {
                        continue;
                    }
                    Integer known = memo.get(req);
                    if (known == null) {
                        stack.push(req);
                        settled = false;
                    } else {
                        result = Math.max(result, known + 1);
                    }
                }
            }
            if (settled) {
                memo.put(node, result);
                stack.pop();
            }
        }
        return memo.get(id);
    }

    // ══════════════════════════════════════════════════════════════════════
    // SCHEDULING
    // ══════════════════════════════════════════════════════════════════════

    public List<Set<String>> executionWaves() {
        return executionWaves(Set.of());
    }

    /**
     * Computes execution waves for every artifact not in {@code satisfied},
     * treating satisfied artifacts as already available.
     *
     * <p>Kahn-style in-degree reduction: each wave holds every remaining node
     * whose dependencies are all satisfied or scheduled in earlier waves.
     *
     * @throws MissingDependencyException if a remaining artifact has a dangling reference
     * @throws CyclicDependencyException  if nodes remain once no more progress can be made
     */
    public synchronized List<Set<String>> executionWaves(Set<String> satisfied) {
        Set<String> remaining = new LinkedHashSet<>(artifacts.keySet());
        remaining.removeAll(satisfied);
        requireResolved(remaining);

        Map<String, Integer> inDegree = new HashMap<>();
        Deque<String> ready = new ArrayDeque<>();
        for (String id : remaining) {
            int degree = 0;
            for (String req : artifacts.get(id).requires()) {
                if (remaining.contains(req)) {
                    degree++;
                }
            }
            inDegree.put(id, degree);
            if (degree == 0) {
                ready.add(id);
            }
        }

        List<Set<String>> waves = new ArrayList<>();
        int scheduled = 0;
        while (!ready.isEmpty()) {
            Set<String> wave = new LinkedHashSet<>(ready);
            ready.clear();
            for (String id : wave) {
                for (String dependent : dependents.getOrDefault(id, Set.of())) {
                    Integer degree = inDegree.get(dependent);
                    if (degree == null) {
                        continue;
                    }
                    if (degree == 1) {
                        ready.add(dependent);
                    }
                    inDegree.put(dependent, degree - 1);
                }
            }
            scheduled += wave.size();
            waves.add(Collections.unmodifiableSet(wave));
        }

        if (scheduled != remaining.size()) {
            Map<String, ArtifactSpec> residual = new LinkedHashMap<>();
            inDegree.forEach((id, degree) -> {
                if (degree > 0) {
                    residual.put(id, artifacts.get(id));
                }
            });
            throw new CyclicDependencyException(detectCycle(residual).orElse(new ArrayList<>(residual.keySet())));
        }
        return Collections.unmodifiableList(waves);
    }

    /** All artifacts in dependency order. */
    public List<String> topologicalOrder() {
        List<String> order = new ArrayList<>();
        executionWaves().forEach(order::addAll);
        return order;
    }

    /**
     * Returns a new graph holding the given artifacts plus everything they
     * transitively require.
     */
    public synchronized ArtifactGraph subgraph(Collection<String> ids) {
        Set<String> closure = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>(ids);
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (closure.add(id)) {
                for (String req : get(id).requires()) {
                    if (artifacts.containsKey(req)) {
                        queue.add(req);
                    }
                }
            }
        }
        var sub = new ArtifactGraph();
        for (ArtifactSpec spec : artifacts.values()) {
            if (closure.contains(spec.id())) {
                sub.insert(spec);
            }
        }
        return sub;
    }

    /** Unfrozen copy with the same artifacts. */
    public synchronized ArtifactGraph copy() {
        var copy = new ArtifactGraph();
        artifacts.values().forEach(copy::insert);
        return copy;
    }

    // ══════════════════════════════════════════════════════════════════════
    // VALIDATION
    // ══════════════════════════════════════════════════════════════════════

    /**
     * Checks the graph for dangling references, cycles and orphans.
     *
     * @return human-readable problems, empty when the graph is valid
     */
    public synchronized List<String> validate() {
        List<String> errors = new ArrayList<>();
        for (ArtifactSpec spec : artifacts.values()) {
            Set<String> missing = missingRequirements(spec);
            if (!missing.isEmpty()) {
                errors.add(new MissingDependencyException(spec.id(), missing).getMessage());
            }
        }
        detectCycle().ifPresent(cycle -> errors.add(new CyclicDependencyException(cycle).getMessage()));
        Set<String> orphans = findOrphans();
        if (!orphans.isEmpty()) {
            errors.add("Orphan artifacts (not connected to any root): " + orphans);
        }
        return errors;
    }

    public synchronized Optional<List<String>> detectCycle() {
        return detectCycle(artifacts);
    }

    /**
     * Artifacts that no root reaches through its dependencies. Only possible
     * when the graph contains a cycle.
     */
    public synchronized Set<String> findOrphans() {
        List<String> roots = roots();
        if (roots.isEmpty()) {
            return Set.of();
        }
        Set<String> connected = new HashSet<>(roots);
        Deque<String> queue = new ArrayDeque<>(roots);
        while (!queue.isEmpty()) {
            for (String req : artifacts.get(queue.poll()).requires()) {
                if (artifacts.containsKey(req) && connected.add(req)) {
                    queue.add(req);
                }
            }
        }
        Set<String> orphans = new LinkedHashSet<>(artifacts.keySet());
        orphans.removeAll(connected);
        return orphans;
    }

    /** Mermaid flowchart, dependencies pointing at their dependents. */
    public synchronized String toMermaid() {
        var sb = new StringBuilder("graph TD");
        for (ArtifactSpec spec : artifacts.values()) {
            String desc = spec.description();
            String label = desc.length() > 30 ? desc.substring(0, 30) + "..." : desc;
            sb.append("\n    ").append(spec.id()).append("[\"").append(spec.id()).append(": ")
                    .append(label.replace('"', '\'')).append("\"]");
            for (String req : spec.requires()) {
                sb.append("\n    ").append(req).append(" --> ").append(spec.id());
            }
        }
        return sb.toString();
    }

    // ══════════════════════════════════════════════════════════════════════
    // INTERNALS
    // ══════════════════════════════════════════════════════════════════════

    private void insert(ArtifactSpec spec) {
        artifacts.put(spec.id(), spec);
        for (String req : spec.requires()) {
            dependents.computeIfAbsent(req, k -> new LinkedHashSet<>()).add(spec.id());
        }
    }

    private void remove(String id) {
        ArtifactSpec spec = artifacts.remove(id);
        if (spec == null) {
            return;
        }
        for (String req : spec.requires()) {
            Set<String> deps = dependents.get(req);
            if (deps != null) {
                deps.remove(id);
                if (deps.isEmpty()) {
                    dependents.remove(req);
                }
            }
        }
    }

    private Set<String> missingRequirements(ArtifactSpec spec) {
        Set<String> missing = new LinkedHashSet<>();
        for (String req : spec.requires()) {
            if (!artifacts.containsKey(req)) {
                missing.add(req);
            }
        }
        return missing;
    }

    private void requireResolved(Collection<String> ids) {
        for (String id : ids) {
            Set<String> missing = missingRequirements(artifacts.get(id));
            if (!missing.isEmpty()) {
                throw new MissingDependencyException(id, missing);
            }
        }
    }

    /**
     * DFS from the candidate's requirements through existing edges. Reaching the
     * candidate's own id means an existing artifact already depends on it, which
     * is only possible when something already references the candidate.
     *
     * @return the closed cycle starting and ending at the candidate, or null
     */
    private List<String> findCycleThrough(ArtifactSpec candidate) {
        if (!dependents.containsKey(candidate.id())) {
            return null;
        }
        Set<String> visited = new HashSet<>();
        Deque<String> path = new ArrayDeque<>();
        Deque<Iterator<String>> edges = new ArrayDeque<>();
        path.push(candidate.id());
        edges.push(candidate.requires().iterator());

        while (!edges.isEmpty()) {
            Iterator<String> it = edges.peek();
            if (!it.hasNext()) {
                edges.pop();
                path.pop();
                continue;
            }
            String next = it.next();
            if (next.equals(candidate.id())) {
                List<String> cycle = new ArrayList<>(path);
                Collections.reverse(cycle);
                cycle.add(candidate.id());
                return cycle;
            }
            ArtifactSpec spec = artifacts.get(next);
            if (spec != null && visited.add(next)) {
                path.push(next);
                edges.push(spec.requires().iterator());
            }
        }
        return null;
    }

    private enum Mark { WHITE, GRAY, BLACK }

    /**
     * White/gray/black DFS over the given nodes. Edges to nodes outside the
     * map are ignored.
     */
    private static Optional<List<String>> detectCycle(Map<String, ArtifactSpec> nodes) {
        Map<String, Mark> marks = new HashMap<>();
        nodes.keySet().forEach(id -> marks.put(id, Mark.WHITE));

        for (String start : nodes.keySet()) {
            if (marks.get(start) != Mark.WHITE) {
                continue;
            }
            Deque<String> stack = new ArrayDeque<>();
            Map<String, Iterator<String>> edges = new HashMap<>();
            stack.push(start);
            marks.put(start, Mark.GRAY);
            edges.put(start, nodes.get(start).requires().iterator());

            while (!stack.isEmpty()) {
                String node = stack.peek();
                Iterator<String> it = edges.get(node);
                if (!it.hasNext()) {
                    marks.put(node, Mark.BLACK);
                    stack.pop();
                    continue;
                }
                String next = it.next();
                Mark mark = marks.get(next);
                if (mark == Mark.GRAY) {
                    List<String> path = new ArrayList<>(stack);
                    Collections.reverse(path);
                    List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                    cycle.add(next);
                    return Optional.of(cycle);
                }
                if (mark == Mark.WHITE) {
                    marks.put(next, Mark.GRAY);
                    edges.put(next, nodes.get(next).requires().iterator());
                    stack.push(next);
                }
            }
        }
        return Optional.empty();
    }
}
