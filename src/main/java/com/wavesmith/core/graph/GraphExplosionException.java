package com.wavesmith.core.graph;

/**
 * Raised when a graph grows past the configured artifact ceiling.
 */
public class GraphExplosionException extends GraphConstructionException {

    private final int count;
    private final int limit;

    public GraphExplosionException(int count, int limit) {
        super("Graph has %d artifacts, exceeding the limit of %d".formatted(count, limit));
        this.count = count;
        this.limit = limit;
    }

    public int getCount() {
        return count;
    }

    public int getLimit() {
        return limit;
    }
}
