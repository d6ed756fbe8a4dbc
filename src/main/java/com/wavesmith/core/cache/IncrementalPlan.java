package com.wavesmith.core.cache;

import java.util.Set;

/**
 * Partition of a graph into artifacts to run and artifacts reused from the
 * previous execution.
 */
public record IncrementalPlan(Set<String> toExecute, Set<String> toSkip) {

    public IncrementalPlan {
        toExecute = Set.copyOf(toExecute);
        toSkip = Set.copyOf(toSkip);
    }

    public boolean isFullRebuild() {
        return toSkip.isEmpty();
    }

    public boolean isNoop() {
        return toExecute.isEmpty();
    }
}
