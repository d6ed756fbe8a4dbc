package com.wavesmith.core.executor;

import com.wavesmith.core.graph.ArtifactGraph;
import com.wavesmith.core.model.ArtifactResult;

import java.util.Map;
import java.util.Objects;

/**
 * Everything one executor run needs. Build with {@link #builder(ArtifactGraph, TieredCreator)}.
 *
 * @param graph              graph to execute; frozen by the executor if it is not already
 * @param creator            create capability per tier
 * @param limits             concurrency and size bounds
 * @param verifier           optional verification callback
 * @param verificationPolicy what an unverified artifact means for the run
 * @param listener           progress callbacks
 * @param cancellation       cancellation signal checked before each wave
 * @param discovery          optional discovery step run after each wave
 * @param satisfied          results carried over from an earlier run; these artifacts are not executed
 * @param goalHash           goal identifier used for events and log context, may be null
 */
public record ExecutionRequest(
    ArtifactGraph graph,
    TieredCreator creator,
    ExecutionLimits limits,
    VerificationFn verifier,
    VerificationPolicy verificationPolicy,
    ExecutionListener listener,
    CancellationToken cancellation,
    ArtifactDiscovery discovery,
    Map<String, ArtifactResult> satisfied,
    String goalHash
) {

    public ExecutionRequest {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(creator, "creator");
        limits = limits == null ? ExecutionLimits.defaults() : limits;
        verificationPolicy = verificationPolicy == null ? VerificationPolicy.RECORD : verificationPolicy;
        listener = listener == null ? ExecutionListener.NOOP : listener;
        cancellation = cancellation == null ? CancellationToken.none() : cancellation;
        satisfied = satisfied == null ? Map.of() : Map.copyOf(satisfied);
    }

    public static Builder builder(ArtifactGraph graph, TieredCreator creator) {
        return new Builder(graph, creator);
    }

    public static Builder builder(ArtifactGraph graph, CreateArtifactFn createFn) {
        return new Builder(graph, TieredCreator.uniform(createFn));
    }

    public static final class Builder {
        private final ArtifactGraph graph;
        private final TieredCreator creator;
        private ExecutionLimits limits;
        private VerificationFn verifier;
        private VerificationPolicy verificationPolicy;
        private ExecutionListener listener;
        private CancellationToken cancellation;
        private ArtifactDiscovery discovery;
        private Map<String, ArtifactResult> satisfied;
        private String goalHash;

        private Builder(ArtifactGraph graph, TieredCreator creator) {
            this.graph = graph;
            this.creator = creator;
        }

        public Builder limits(ExecutionLimits limits) { this.limits = limits; return this; }
        public Builder verifier(VerificationFn verifier) { this.verifier = verifier; return this; }
        public Builder verificationPolicy(VerificationPolicy policy) { this.verificationPolicy = policy; return this; }
        public Builder listener(ExecutionListener listener) { this.listener = listener; return this; }
        public Builder cancellation(CancellationToken cancellation) { this.cancellation = cancellation; return this; }
        public Builder discovery(ArtifactDiscovery discovery) { this.discovery = discovery; return this; }
        public Builder satisfied(Map<String, ArtifactResult> satisfied) { this.satisfied = satisfied; return this; }
        public Builder goalHash(String goalHash) { this.goalHash = goalHash; return this; }

        public ExecutionRequest build() {
            return new ExecutionRequest(graph, creator, limits, verifier, verificationPolicy, listener,
                    cancellation, discovery, satisfied, goalHash);
        }
    }
}
