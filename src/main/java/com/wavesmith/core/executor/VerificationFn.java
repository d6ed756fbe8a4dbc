package com.wavesmith.core.executor;

import com.wavesmith.core.graph.ArtifactSpec;

/**
 * Optional check of produced content against the artifact's contract.
 */
@FunctionalInterface
public interface VerificationFn {

    VerificationResult verify(ArtifactSpec spec, String content) throws Exception;
}
