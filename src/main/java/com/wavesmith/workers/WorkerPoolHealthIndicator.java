package com.wavesmith.workers;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports the worker pool of the coordinator run in progress. DEGRADED when
 * any worker has failed, or when the last finished run left conflicted branches.
 */
@Component
public class WorkerPoolHealthIndicator implements HealthIndicator {

    private final WorkerCoordinator coordinator;
    private final CoordinatorActivity activity;

    public WorkerPoolHealthIndicator(WorkerCoordinator coordinator, CoordinatorActivity activity) {
        this.coordinator = coordinator;
        this.activity = activity;
    }

    @Override
    public Health health() {
        CoordinatorActivity.Snapshot last = activity.snapshot();
        if (!coordinator.isRunning()) {
            Health.Builder builder = last.mergeConflicts() > 0 ? Health.status("DEGRADED") : Health.up();
            builder.withDetail("workers", 0).withDetail("running", false);
            if (last.hasRun()) {
                builder.withDetail("lastRun", runDetails(last));
            }
            return builder.build();
        }
        List<WorkerStatus> statuses = coordinator.currentStatuses();
        Map<String, Object> workers = new LinkedHashMap<>();
        long failed = 0;
        for (WorkerStatus status : statuses) {
            var detail = new LinkedHashMap<String, Object>();
            detail.put("state", status.state().name());
            detail.put("pid", status.pid());
            detail.put("claimedGoal", status.claimedGoal() != null ? status.claimedGoal() : "");
            detail.put("completed", status.completed());
            detail.put("failed", status.failed());
            detail.put("heartbeat", status.heartbeat().toString());
            workers.put(status.id(), detail);
            if (status.state() == WorkerState.FAILED) {
                failed++;
            }
        }
        Health.Builder builder = failed > 0 ? Health.status("DEGRADED") : Health.up();
        return builder
                .withDetail("running", true)
                .withDetail("workers", workers)
                .withDetail("failedWorkers", failed)
                .withDetail("currentRun", runDetails(last))
                .build();
    }

    private static Map<String, Object> runDetails(CoordinatorActivity.Snapshot run) {
        var detail = new LinkedHashMap<String, Object>();
        detail.put("started", String.valueOf(run.runStarted()));
        if (run.runFinished() != null) {
            detail.put("finished", run.runFinished().toString());
        }
        detail.put("workersStarted", run.workersStarted());
        detail.put("workerFailures", run.workerFailures());
        detail.put("mergesCompleted", run.mergesCompleted());
        detail.put("mergeConflicts", run.mergeConflicts());
        detail.put("recentEvents", run.recent());
        return detail;
    }
}
