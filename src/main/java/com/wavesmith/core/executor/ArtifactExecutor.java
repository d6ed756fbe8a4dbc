package com.wavesmith.core.executor;

import com.wavesmith.core.cache.ContentHasher;
import com.wavesmith.core.events.EventBus;
import com.wavesmith.core.events.EventType;
import com.wavesmith.core.events.WavesmithEvent;
import com.wavesmith.core.graph.ArtifactGraph;
import com.wavesmith.core.graph.ArtifactSpec;
import com.wavesmith.core.graph.ExtensionResult;
import com.wavesmith.core.graph.GraphExplosionException;
import com.wavesmith.core.logging.MdcContext;
import com.wavesmith.core.metrics.WavesmithMetrics;
import com.wavesmith.core.model.ArtifactResult;
import com.wavesmith.core.model.ExecutionResult;
import com.wavesmith.core.model.ModelTier;
import com.wavesmith.core.scheduler.ModelTierSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes an {@link ArtifactGraph} wave by wave.
 *
 * <p>Artifacts within a wave run concurrently on a pool bounded by
 * {@link ExecutionLimits#maxConcurrent()}, with an additional semaphore per
 * model tier. Results come back through a completion queue drained by the
 * calling thread, which is the only writer of the result maps. A wave must
 * reach a terminal state for every artifact before the next one starts.
 *
 * <p>A failing artifact never stops its siblings; its dependents are reported
 * as blocked instead of being run with missing inputs.
 */
@Component
public class ArtifactExecutor {

    private static final Logger log = LoggerFactory.getLogger(ArtifactExecutor.class);

    private final EventBus eventBus;
    private final WavesmithMetrics metrics;

    @Autowired
    public ArtifactExecutor(EventBus eventBus, @Autowired(required = false) WavesmithMetrics metrics) {
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public ArtifactExecutor() {
        this(new EventBus(), null);
    }

    public ExecutionResult execute(ArtifactGraph graph, CreateArtifactFn createFn, ExecutionLimits limits) {
        return execute(ExecutionRequest.builder(graph, createFn).limits(limits).build());
    }

    public ExecutionResult execute(ExecutionRequest request) {
        ArtifactGraph graph = request.graph();
        ExecutionLimits limits = request.limits();
        if (graph.size() > limits.maxArtifacts()) {
            throw new GraphExplosionException(graph.size(), limits.maxArtifacts());
        }
        if (!graph.isFrozen()) {
            graph.freeze();
        }
        if (graph.maxDepth() > limits.maxDepth()) {
            log.warn("Graph depth {} exceeds recommended maximum {}", graph.maxDepth(), limits.maxDepth());
        }

        var run = new Run(request);
        request.satisfied().forEach((id, result) -> {
            if (graph.contains(id)) {
                run.completed.put(id, result);
                run.skipped.add(id);
            }
        });

        List<Set<String>> plan = graph.executionWaves(run.completed.keySet());
        log.info("Executing {} artifact(s) in {} wave(s), {} already satisfied",
                graph.size() - run.skipped.size(), plan.size(), run.skipped.size());

        ExecutorService pool = Executors.newFixedThreadPool(limits.maxConcurrent(), namedThreads("artifact-task"));
        ExecutorService callPool = Executors.newCachedThreadPool(namedThreads("artifact-call"));
        try {
            Deque<Set<String>> pending = new ArrayDeque<>(plan);
            int waveNumber = 0;
            int discoveryRounds = 0;
            while (!pending.isEmpty()) {
                if (request.cancellation().isCancelled()) {
                    log.info("Cancellation observed; not starting wave {}", waveNumber + 1);
                    run.cancelled = true;
                    break;
                }
                waveNumber++;
                runWave(run, waveNumber, pending.poll(), pool, callPool);
                if (run.cancelled) {
                    break;
                }

                if (request.discovery() != null && discoveryRounds < limits.maxDiscoveryRounds()) {
                    List<ArtifactSpec> added = discover(run);
                    if (!added.isEmpty()) {
                        discoveryRounds++;
                        pending = new ArrayDeque<>(graph.executionWaves(run.terminalIds()));
                    }
                }
            }
        } finally {
            pool.shutdownNow();
            callPool.shutdownNow();
        }

        ExecutionResult result = run.toResult();
        log.info("Execution finished: {} completed, {} failed, {} blocked, {} skipped in {} ms{}",
                result.completed().size(), result.failed().size(), result.blocked().size(),
                result.skipped().size(), result.totalDurationMs(), result.cancelled() ? " (cancelled)" : "");
        request.listener().onExecutionFinished(result);
        publish(request, EventType.EXECUTION_COMPLETED, null, Map.of(
                "completed", result.completed().size(),
                "failed", result.failed().size(),
                "blocked", result.blocked().size(),
                "cancelled", result.cancelled()));
        if (metrics != null) {
            metrics.recordExecution(result.totalDurationMs(), result.isSuccess());
        }
        return result;
    }

    // ══════════════════════════════════════════════════════════════════════
    // WAVES
    // ══════════════════════════════════════════════════════════════════════

    private void runWave(Run run, int waveNumber, Set<String> wave, ExecutorService pool, ExecutorService callPool) {
        ExecutionRequest request = run.request;
        ArtifactGraph graph = request.graph();
        MdcContext.setWave(request.goalHash(), waveNumber);
        try {
            List<ArtifactSpec> runnable = new ArrayList<>();
            for (String id : wave) {
                ArtifactSpec spec = graph.get(id);
                String blocker = firstUnavailableDependency(run, spec);
                if (blocker != null) {
                    run.blocked.add(id);
                    log.warn("Artifact {} blocked by {}", id, blocker);
                    request.listener().onArtifactBlocked(id, blocker);
                    publish(request, EventType.ARTIFACT_BLOCKED, id, Map.of("blockedBy", blocker));
                } else {
                    runnable.add(spec);
                }
            }
            if (runnable.isEmpty()) {
                return;
            }

            Set<String> ids = new LinkedHashSet<>();
            runnable.forEach(s -> ids.add(s.id()));
            log.info("Wave {}: {} artifact(s) {}", waveNumber, ids.size(), ids);
            request.listener().onWaveStarted(waveNumber, ids);
            publish(request, EventType.WAVE_STARTED, null, Map.of("wave", waveNumber, "artifacts", List.copyOf(ids)));
            if (metrics != null) {
                metrics.recordWaveSize(ids.size());
            }

            Map<String, ArtifactResult> waveCompleted = new LinkedHashMap<>();
            Map<String, String> waveFailed = new LinkedHashMap<>();
            CompletionService<ArtifactOutcome> completion = new ExecutorCompletionService<>(pool);
            Map<String, Future<ArtifactOutcome>> inFlight = new HashMap<>();
            for (ArtifactSpec spec : runnable) {
                ModelTier tier = ModelTierSelector.select(spec, graph);
                run.tierCounts.merge(tier, 1, Integer::sum);
                inFlight.put(spec.id(), completion.submit(() -> runArtifact(run, spec, tier, waveNumber, callPool)));
            }

            for (int i = 0; i < runnable.size(); i++) {
                ArtifactOutcome outcome;
                try {
                    outcome = completion.take().get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while waiting for wave {}; abandoning {} in-flight artifact(s)",
                            waveNumber, inFlight.size());
                    inFlight.values().forEach(f -> f.cancel(true));
                    inFlight.keySet().forEach(id -> waveFailed.put(id, "Interrupted before completion"));
                    run.cancelled = true;
                    break;
                } catch (ExecutionException e) {
                    // runArtifact converts every failure into an outcome
                    throw new IllegalStateException("Artifact task failed unexpectedly", e.getCause());
                }
                inFlight.remove(outcome.artifactId());
                if (outcome.result() != null) {
                    waveCompleted.put(outcome.artifactId(), outcome.result());
                } else {
                    waveFailed.put(outcome.artifactId(), outcome.error());
                }
            }

            if (request.verifier() != null && !run.cancelled) {
                verify(run, waveCompleted, waveFailed, pool);
            }

            waveCompleted.forEach((id, result) -> {
                run.completed.put(id, result);
                request.listener().onArtifactCompleted(waveNumber, result);
                publish(request, EventType.ARTIFACT_COMPLETED, id, Map.of(
                        "tier", result.modelTier().name(),
                        "durationMs", result.durationMs(),
                        "verified", result.verified()));
            });
            waveFailed.forEach((id, error) -> {
                run.failed.put(id, error);
                request.listener().onArtifactFailed(waveNumber, id, error);
                publish(request, EventType.ARTIFACT_FAILED, id, Map.of("error", error));
            });
            run.waves.add(Collections.unmodifiableSet(ids));

            log.info("Wave {} complete: {} completed, {} failed", waveNumber, waveCompleted.size(), waveFailed.size());
            request.listener().onWaveCompleted(waveNumber, waveCompleted.size(), waveFailed.size());
            publish(request, EventType.WAVE_COMPLETED, null, Map.of(
                    "wave", waveNumber, "completed", waveCompleted.size(), "failed", waveFailed.size()));
        } finally {
            MdcContext.clear();
        }
    }

    private String firstUnavailableDependency(Run run, ArtifactSpec spec) {
        for (String req : spec.requires()) {
            if (run.failed.containsKey(req) || run.blocked.contains(req)) {
                return req;
            }
        }
        return null;
    }

    /**
     * Runs one artifact on a pool thread. Never throws; failures become outcomes.
     */
    private ArtifactOutcome runArtifact(Run run, ArtifactSpec spec, ModelTier tier, int waveNumber,
                                        ExecutorService callPool) {
        ExecutionRequest request = run.request;
        MdcContext.setArtifact(request.goalHash(), spec.id(), waveNumber);
        Semaphore permits = run.tierPermits.get(tier);
        boolean acquired = false;
        try {
            permits.acquire();
            acquired = true;

            log.debug("Creating artifact {} on {} tier", spec.id(), tier);
            publish(request, EventType.ARTIFACT_STARTED, spec.id(), Map.of("tier", tier.name()));
            long startMs = System.currentTimeMillis();

            String content = invokeWithTimeout(spec, request.creator().forTier(tier), request.limits(), callPool);
            if (content == null) {
                throw new ArtifactExecutionException(spec.id(), "Artifact '%s' produced no content".formatted(spec.id()));
            }

            long elapsedMs = System.currentTimeMillis() - startMs;
            if (metrics != null) {
                metrics.recordArtifactExecution(tier, elapsedMs);
                metrics.recordArtifactResult("completed");
            }
            return ArtifactOutcome.success(new ArtifactResult(
                    spec.id(), content, false, List.of(), tier, elapsedMs, ContentHasher.sha256(content)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailed();
            return ArtifactOutcome.failure(spec.id(), "Interrupted: " + e.getMessage());
        } catch (ArtifactExecutionException e) {
            log.warn("Artifact {} failed: {}", spec.id(), e.getMessage());
            recordFailed();
            return ArtifactOutcome.failure(spec.id(), e.getMessage());
        } catch (Exception e) {
            log.error("Infrastructure error creating artifact {}: {}", spec.id(), e.getMessage(), e);
            recordFailed();
            return ArtifactOutcome.failure(spec.id(), describe(e));
        } finally {
            if (acquired) {
                permits.release();
            }
            MdcContext.clear();
        }
    }

    private void recordFailed() {
        if (metrics == null) {
            return;
        }
        try {
            metrics.recordArtifactResult("failed");
        } catch (RuntimeException e) {
            log.warn("Could not record artifact failure metric: {}", e.getMessage());
        }
    }

    private String invokeWithTimeout(ArtifactSpec spec, CreateArtifactFn fn, ExecutionLimits limits,
                                     ExecutorService callPool) throws InterruptedException {
        Future<String> call = callPool.submit(() -> fn.create(spec));
        try {
            return call.get(limits.artifactTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new ArtifactTimeoutException(spec.id(), limits.artifactTimeout());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ArtifactExecutionException(spec.id(), describe(cause), cause);
        } catch (InterruptedException e) {
            call.cancel(true);
            throw e;
        }
    }

    /**
     * Runs verification for a finished wave. Unverified artifacts stay completed
     * unless the policy escalates them to failures.
     */
    private void verify(Run run, Map<String, ArtifactResult> waveCompleted, Map<String, String> waveFailed,
                        ExecutorService pool) {
        ExecutionRequest request = run.request;
        Map<String, Future<VerificationResult>> checks = new LinkedHashMap<>();
        for (ArtifactResult result : waveCompleted.values()) {
            ArtifactSpec spec = request.graph().get(result.artifactId());
            checks.put(result.artifactId(), pool.submit(() -> request.verifier().verify(spec, result.content())));
        }
        for (var entry : checks.entrySet()) {
            String id = entry.getKey();
            VerificationResult verification;
            try {
                verification = entry.getValue().get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                verification = VerificationResult.failed("Verification interrupted");
            } catch (ExecutionException e) {
                log.warn("Verification of {} threw: {}", id, describe(e.getCause()));
                verification = VerificationResult.failed("Verification error: " + describe(e.getCause()));
            }
            ArtifactResult verified = waveCompleted.get(id).withVerification(verification.verified(), verification.issues());
            if (!verification.verified() && request.verificationPolicy() == VerificationPolicy.FAIL_ON_UNVERIFIED) {
                waveCompleted.remove(id);
                waveFailed.put(id, "Verification failed: " + String.join("; ", verification.issues()));
            } else {
                waveCompleted.put(id, verified);
            }
        }
    }

    private List<ArtifactSpec> discover(Run run) {
        ExecutionRequest request = run.request;
        List<ArtifactSpec> proposed;
        try {
            proposed = request.discovery().discover(request.graph(), Collections.unmodifiableMap(run.completed));
        } catch (Exception e) {
            log.warn("Discovery step failed, continuing with current graph: {}", describe(e));
            return List.of();
        }
        if (proposed == null || proposed.isEmpty()) {
            return List.of();
        }
        ExtensionResult extension = request.graph().proposeExtension(proposed, request.limits().maxArtifacts());
        if (!extension.accepted()) {
            log.warn("Discovered artifacts rejected: {}", extension.reason());
            return List.of();
        }
        run.discovered.addAll(proposed);
        request.listener().onGraphExtended(List.copyOf(proposed));
        publish(request, EventType.GRAPH_EXTENDED, null, Map.of("artifacts", extension.artifactIds()));
        return proposed;
    }

    private void publish(ExecutionRequest request, EventType type, String artifactId, Map<String, Object> payload) {
        eventBus.publish(WavesmithEvent.of(type, request.goalHash(), artifactId, payload));
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static ThreadFactory namedThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private record ArtifactOutcome(String artifactId, ArtifactResult result, String error) {
        static ArtifactOutcome success(ArtifactResult result) {
            return new ArtifactOutcome(result.artifactId(), result, null);
        }

        static ArtifactOutcome failure(String artifactId, String error) {
            return new ArtifactOutcome(artifactId, null, error);
        }
    }

    /**
     * Mutable state of one execution, owned by the calling thread.
     */
    private static final class Run {
        final ExecutionRequest request;
        final long startedAt = System.currentTimeMillis();
        final Map<String, ArtifactResult> completed = new LinkedHashMap<>();
        final Map<String, String> failed = new LinkedHashMap<>();
        final Set<String> blocked = new LinkedHashSet<>();
        final Set<String> skipped = new LinkedHashSet<>();
        final List<Set<String>> waves = new ArrayList<>();
        final List<ArtifactSpec> discovered = new ArrayList<>();
        final Map<ModelTier, Integer> tierCounts = new EnumMap<>(ModelTier.class);
        final Map<ModelTier, Semaphore> tierPermits = new EnumMap<>(ModelTier.class);
        boolean cancelled;

        Run(ExecutionRequest request) {
            this.request = request;
            for (ModelTier tier : ModelTier.values()) {
                tierCounts.put(tier, 0);
                tierPermits.put(tier, new Semaphore(request.limits().concurrencyFor(tier)));
            }
        }

        Set<String> terminalIds() {
            Set<String> ids = new HashSet<>(completed.keySet());
            ids.addAll(failed.keySet());
            ids.addAll(blocked);
            return ids;
        }

        ExecutionResult toResult() {
            return new ExecutionResult(completed, failed, blocked, skipped, waves, discovered,
                    System.currentTimeMillis() - startedAt, tierCounts, cancelled);
        }
    }
}
