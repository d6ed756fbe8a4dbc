package com.wavesmith.workers;

import com.wavesmith.core.graph.ArtifactGraph;

/**
 * Turns a goal into the artifact graph a worker executes.
 */
@FunctionalInterface
public interface GoalPlanner {

    ArtifactGraph plan(Goal goal) throws Exception;
}
