package com.wavesmith.core.cache;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Per-artifact change classification between a graph and a previous execution.
 *
 * @param kinds       classification of every artifact in the current graph
 * @param inputHashes current input hash of every artifact
 * @param removed     artifacts present in the previous graph only
 */
public record ChangeSet(Map<String, ChangeKind> kinds, Map<String, String> inputHashes, Set<String> removed) {

    public ChangeSet {
        kinds = Map.copyOf(kinds);
        inputHashes = Map.copyOf(inputHashes);
        removed = Set.copyOf(removed);
    }

    public ChangeKind kindOf(String artifactId) {
        return kinds.get(artifactId);
    }

    public Set<String> unchanged() {
        return withKind(ChangeKind.UNCHANGED);
    }

    /** Every artifact that is not {@link ChangeKind#UNCHANGED}. */
    public Set<String> changed() {
        Set<String> ids = new TreeSet<>();
        kinds.forEach((id, kind) -> {
            if (kind != ChangeKind.UNCHANGED) {
                ids.add(id);
            }
        });
        return ids;
    }

    public Set<String> withKind(ChangeKind kind) {
        Set<String> ids = new TreeSet<>();
        kinds.forEach((id, k) -> {
            if (k == kind) {
                ids.add(id);
            }
        });
        return ids;
    }
}
