package com.wavesmith.workers;

import com.wavesmith.core.executor.TieredCreator;
import com.wavesmith.workers.isolation.Workspace;

/**
 * Builds the create capabilities for one worker. Called once per worker, with
 * the workspace the worker is bound to.
 */
@FunctionalInterface
public interface CreatorFactory {

    TieredCreator create(Workspace workspace);
}
