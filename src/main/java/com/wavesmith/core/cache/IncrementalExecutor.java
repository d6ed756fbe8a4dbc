package com.wavesmith.core.cache;

import com.wavesmith.core.executor.ArtifactExecutor;
import com.wavesmith.core.executor.CreateArtifactFn;
import com.wavesmith.core.executor.ExecutionLimits;
import com.wavesmith.core.executor.ExecutionListener;
import com.wavesmith.core.executor.ExecutionRequest;
import com.wavesmith.core.graph.ArtifactGraph;
import com.wavesmith.core.metrics.WavesmithMetrics;
import com.wavesmith.core.model.ArtifactResult;
import com.wavesmith.core.model.ExecutionResult;
import com.wavesmith.core.model.ExecutionStatus;
import com.wavesmith.core.persistence.ArtifactCompletion;
import com.wavesmith.core.persistence.PlanCheckpointer;
import com.wavesmith.core.persistence.PlanStore;
import com.wavesmith.core.persistence.SavedExecution;
import com.wavesmith.core.persistence.TraceLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs a graph like a build system: artifacts whose inputs are unchanged since
 * the last execution of the same goal are reused, everything else runs.
 *
 * <p>Progress is saved after every artifact so an interrupted run can be
 * continued by {@link com.wavesmith.core.persistence.ResumeService}.
 */
public class IncrementalExecutor {

    private static final Logger log = LoggerFactory.getLogger(IncrementalExecutor.class);

    private final ArtifactExecutor executor;
    private final PlanStore store;
    private final ChangeDetector detector;
    private final WavesmithMetrics metrics;

    public IncrementalExecutor(ArtifactExecutor executor, PlanStore store, ChangeDetector detector,
                               WavesmithMetrics metrics) {
        this.executor = executor;
        this.store = store;
        this.detector = detector;
        this.metrics = metrics;
    }

    public IncrementalExecutor(ArtifactExecutor executor, PlanStore store) {
        this(executor, store, new ChangeDetector(), null);
    }

    public ExecutionResult execute(String goal, ArtifactGraph graph, CreateArtifactFn createFn, ExecutionLimits limits) {
        return execute(goal, ExecutionRequest.builder(graph, createFn).limits(limits).build(), false);
    }

    /**
     * @param goal         goal text; its hash keys the saved execution
     * @param request      the run to perform; satisfied results and goal hash are filled in here
     * @param forceRebuild ignore any previous execution
     */
    public ExecutionResult execute(String goal, ExecutionRequest request, boolean forceRebuild) {
        ArtifactGraph graph = request.graph();
        String goalHash = ContentHasher.goalHash(goal);
        TraceLogger trace = store.traceLogger(goalHash);

        Optional<SavedExecution> previous = forceRebuild ? Optional.empty() : store.findByGoal(goal);
        ChangeSet changes = detector.detect(graph, previous.orElse(null));
        IncrementalPlan plan = detector.planIncremental(graph, changes);

        var execution = new SavedExecution(goal, graph);
        Map<String, ArtifactResult> reused = new LinkedHashMap<>();
        if (previous.isPresent()) {
            for (String id : graph.ids()) {
                if (plan.toSkip().contains(id)) {
                    ArtifactCompletion completion = previous.get().getCompletions().get(id);
                    execution.recordCompletion(completion);
                    reused.put(id, completion.toResult());
                }
            }
            log.info("Incremental plan for {}: {} to execute, {} reused, {} removed",
                    goalHash, plan.toExecute().size(), plan.toSkip().size(), changes.removed().size());
            trace.log("incremental_analysis", Map.of(
                    "to_execute", plan.toExecute().size(),
                    "to_skip", plan.toSkip().size(),
                    "changed", changes.changed().stream().map(id -> id + ":" + changes.kindOf(id)).toList(),
                    "removed", List.copyOf(changes.removed())));
        } else {
            log.info("Full build for {}: {} artifact(s)", goalHash, graph.size());
            trace.log("full_rebuild", Map.of(
                    "reason", forceRebuild ? "forced" : "no previous execution",
                    "artifacts", graph.size()));
        }
        if (metrics != null) {
            metrics.recordCacheHits(plan.toSkip().size());
            metrics.recordCacheMisses(plan.toExecute().size());
        }

        execution.setStatus(ExecutionStatus.IN_PROGRESS);
        store.save(execution);
        trace.log("plan_created", Map.of("artifacts", graph.size(), "waves", graph.executionWaves().size()));

        var checkpointer = new PlanCheckpointer(execution, store, trace);
        var incremental = ExecutionRequest.builder(graph, request.creator())
                .limits(request.limits())
                .verifier(request.verifier())
                .verificationPolicy(request.verificationPolicy())
                .listener(ExecutionListener.composite(List.of(checkpointer, request.listener())))
                .cancellation(request.cancellation())
                .discovery(request.discovery())
                .satisfied(reused)
                .goalHash(goalHash)
                .build();
        return executor.execute(incremental);
    }

    /** Computes what {@link #execute} would do for the goal without running anything. */
    public PlanPreview preview(String goal, ArtifactGraph graph) {
        Optional<SavedExecution> previous = store.findByGoal(goal);
        ChangeSet changes = detector.detect(graph, previous.orElse(null));
        return PlanPreview.of(ContentHasher.goalHash(goal), graph, detector.planIncremental(graph, changes), changes);
    }
}
