package com.wavesmith.core.executor;

import com.wavesmith.core.graph.ArtifactSpec;

/**
 * Caller-supplied capability that produces the content of one artifact,
 * typically by calling a language-model backend.
 *
 * <p>Implementations must be safe to call from several threads at once and
 * should respond to interruption, which is how per-artifact timeouts cancel them.
 */
@FunctionalInterface
public interface CreateArtifactFn {

    String create(ArtifactSpec spec) throws Exception;
}
