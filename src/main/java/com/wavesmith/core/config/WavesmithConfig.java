package com.wavesmith.core.config;

import com.wavesmith.core.cache.ChangeDetector;
import com.wavesmith.core.cache.IncrementalExecutor;
import com.wavesmith.core.events.EventBus;
import com.wavesmith.core.executor.ArtifactExecutor;
import com.wavesmith.core.executor.ExecutionLimits;
import com.wavesmith.core.metrics.WavesmithMetrics;
import com.wavesmith.core.model.ModelTier;
import com.wavesmith.core.persistence.PlanStore;
import com.wavesmith.core.persistence.ResumeService;
import com.wavesmith.workers.CoordinatorConfig;
import com.wavesmith.workers.WorkerCoordinator;
import com.wavesmith.workers.isolation.GitWorkspaceManager;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.Map;

/**
 * Builds the engine's beans from {@link WavesmithProperties}.
 */
@Configuration
public class WavesmithConfig {

    @Bean
    public ExecutionLimits executionLimits(WavesmithProperties properties) {
        var executor = properties.getExecutor();
        return new ExecutionLimits(
                executor.getMaxConcurrent(),
                Map.of(ModelTier.SMALL, executor.getSmallConcurrency(),
                       ModelTier.MEDIUM, executor.getMediumConcurrency(),
                       ModelTier.LARGE, executor.getLargeConcurrency()),
                executor.getArtifactTimeout(),
                executor.getMaxArtifacts(),
                executor.getMaxDepth(),
                executor.getMaxDiscoveryRounds());
    }

    @Bean
    public PlanStore planStore(WavesmithProperties properties) {
        return new PlanStore(projectRoot(properties).resolve(properties.getPlansDir()));
    }

    @Bean
    public ChangeDetector changeDetector(WavesmithProperties properties) {
        return properties.getPersistence().isCheckOutputFiles()
                ? new ChangeDetector(projectRoot(properties))
                : new ChangeDetector();
    }

    @Bean
    public IncrementalExecutor incrementalExecutor(ArtifactExecutor executor, PlanStore planStore,
                                                   ChangeDetector changeDetector,
                                                   @Autowired(required = false) WavesmithMetrics metrics) {
        return new IncrementalExecutor(executor, planStore, changeDetector, metrics);
    }

    @Bean
    public ResumeService resumeService(PlanStore planStore, ArtifactExecutor executor) {
        return new ResumeService(planStore, executor);
    }

    @Bean
    public GitWorkspaceManager gitWorkspaceManager() {
        return new GitWorkspaceManager();
    }

    @Bean
    public CoordinatorConfig coordinatorConfig(WavesmithProperties properties, ExecutionLimits limits) {
        var coordinator = properties.getCoordinator();
        var governor = properties.getGovernor();
        return CoordinatorConfig.builder()
                .workerCount(coordinator.getWorkerCount())
                .workerTimeout(coordinator.getWorkerTimeout())
                .shutdownGrace(coordinator.getShutdownGrace())
                .mergeStrategy(coordinator.getMergeStrategy())
                .lockTimeout(coordinator.getLockTimeout())
                .lockTtl(coordinator.getLockTtl())
                .staleLockThreshold(coordinator.getStaleLockThreshold())
                .heartbeatInterval(coordinator.getHeartbeatInterval())
                .missedHeartbeats(coordinator.getMissedHeartbeats())
                .maxRetriesPerGoal(coordinator.getMaxRetriesPerGoal())
                .respawn(coordinator.isRespawn())
                .branchPrefix(coordinator.getBranchPrefix())
                .baseBranch(coordinator.getBaseBranch())
                .cleanupBranches(coordinator.isCleanupBranches())
                .stateDir(coordinator.getStateDir())
                .incremental(coordinator.isIncremental())
                .limits(limits)
                .maxConcurrentCalls(governor.getMaxConcurrentCalls())
                .maxCallsPerMinute(governor.getMaxCallsPerMinute())
                .maxHeapBytes(governor.getMaxHeapMb() * 1024 * 1024)
                .governorMaxWait(governor.getMaxWait())
                .build();
    }

    @Bean
    public WorkerCoordinator workerCoordinator(WavesmithProperties properties, CoordinatorConfig config,
                                               GitWorkspaceManager git, ArtifactExecutor executor,
                                               @Autowired(required = false) WavesmithMetrics metrics,
                                               EventBus eventBus) {
        return new WorkerCoordinator(projectRoot(properties), config, git, executor, metrics, eventBus);
    }

    private static Path projectRoot(WavesmithProperties properties) {
        return Path.of(properties.getProjectRoot()).toAbsolutePath().normalize();
    }
}
