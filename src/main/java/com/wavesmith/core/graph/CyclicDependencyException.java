package com.wavesmith.core.graph;

import java.util.List;

/**
 * Thrown when a dependency cycle is found. The cycle is reported as a closed
 * path, e.g. {@code [a, b, a]}.
 */
public class CyclicDependencyException extends GraphConstructionException {

    private final List<String> cycle;

    public CyclicDependencyException(List<String> cycle) {
        super("Cyclic dependency detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
