package com.wavesmith.core.persistence;

import com.wavesmith.core.executor.ArtifactExecutor;
import com.wavesmith.core.executor.ExecutionLimits;
import com.wavesmith.core.executor.ExecutionListener;
import com.wavesmith.core.executor.ExecutionRequest;
import com.wavesmith.core.executor.TieredCreator;
import com.wavesmith.core.model.ExecutionResult;
import com.wavesmith.core.model.ExecutionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Continues a saved execution after a crash or pause.
 *
 * <p>Prior completions are reused as-is; nothing is re-hashed. Work restarts
 * at the lowest wave that still has an incomplete artifact. For hash-checked
 * reuse see {@link com.wavesmith.core.cache.IncrementalExecutor}.
 */
public class ResumeService {

    private static final Logger log = LoggerFactory.getLogger(ResumeService.class);

    private final PlanStore store;
    private final ArtifactExecutor executor;

    public ResumeService(PlanStore store, ArtifactExecutor executor) {
        this.store = store;
        this.executor = executor;
    }

    /**
     * Loads and resumes the execution saved for {@code goalHash}.
     *
     * @throws PersistenceCorruptionException if the snapshot cannot be trusted
     * @throws IllegalArgumentException       if nothing was saved for the hash
     */
    public ExecutionResult resume(String goalHash, TieredCreator creator, ExecutionLimits limits) {
        SavedExecution execution = store.load(goalHash)
                .orElseThrow(() -> new IllegalArgumentException("No saved execution for " + goalHash));
        return resume(execution, ExecutionRequest.builder(execution.getGraph(), creator).limits(limits).build());
    }

    /**
     * Resumes {@code execution}. The request's graph, satisfied results and
     * goal hash are replaced with the saved ones; its creator, limits,
     * verifier and listener are kept.
     */
    public ExecutionResult resume(SavedExecution execution, ExecutionRequest request) {
        int resumeWave = execution.resumeWave();
        TraceLogger trace = store.traceLogger(execution.getGoalHash());
        log.info("Resuming {} from wave {} ({} of {} artifacts complete)", execution.getGoalHash(),
                resumeWave + 1, execution.getCompletions().size(), execution.getGraph().size());
        trace.log("resume", Map.of(
                "resume_wave", resumeWave,
                "completed", execution.getCompletions().size(),
                "pending", execution.pendingIds().size()));

        execution.setStatus(ExecutionStatus.IN_PROGRESS);
        store.save(execution);

        var checkpointer = new PlanCheckpointer(execution, store, trace);
        var resumed = ExecutionRequest.builder(execution.getGraph(), request.creator())
                .limits(request.limits())
                .verifier(request.verifier())
                .verificationPolicy(request.verificationPolicy())
                .listener(ExecutionListener.composite(List.of(checkpointer, request.listener())))
                .cancellation(request.cancellation())
                .discovery(request.discovery())
                .satisfied(execution.completedResults())
                .goalHash(execution.getGoalHash())
                .build();
        return executor.execute(resumed);
    }
}
