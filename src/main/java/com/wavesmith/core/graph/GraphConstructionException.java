package com.wavesmith.core.graph;

/**
 * Base class for errors raised while building an {@link ArtifactGraph}.
 * These are never retried; the planner must fix the graph.
 */
public class GraphConstructionException extends RuntimeException {

    public GraphConstructionException(String message) {
        super(message);
    }

    public GraphConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
