package com.wavesmith;

import com.wavesmith.core.cache.IncrementalExecutor;
import com.wavesmith.core.executor.ExecutionLimits;
import com.wavesmith.core.model.ModelTier;
import com.wavesmith.core.persistence.PlanStore;
import com.wavesmith.core.persistence.ResumeService;
import com.wavesmith.workers.CoordinatorActivity;
import com.wavesmith.workers.CoordinatorConfig;
import com.wavesmith.workers.WorkerCoordinator;
import com.wavesmith.workers.WorkerPoolHealthIndicator;
import com.wavesmith.workers.isolation.MergeStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "wavesmith.project-root=${java.io.tmpdir}",
        "wavesmith.executor.large-concurrency=1",
        "wavesmith.coordinator.worker-count=3",
        "wavesmith.coordinator.merge-strategy=ABORT_ON_CONFLICT"
})
class WavesmithApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Test
    @DisplayName("context wires the engine beans")
    void contextLoads() {
        assertNotNull(context.getBean(WorkerCoordinator.class));
        assertNotNull(context.getBean(IncrementalExecutor.class));
        assertNotNull(context.getBean(ResumeService.class));
        assertNotNull(context.getBean(PlanStore.class));
        assertNotNull(context.getBean(CoordinatorActivity.class));
    }

    @Test
    @DisplayName("executor limits bind from properties")
    void executionLimitsBound() {
        ExecutionLimits limits = context.getBean(ExecutionLimits.class);

        assertEquals(8, limits.maxConcurrent());
        assertEquals(1, limits.concurrencyFor(ModelTier.LARGE));
        assertEquals(4, limits.concurrencyFor(ModelTier.MEDIUM));
        assertEquals(Duration.ofMinutes(5), limits.artifactTimeout());
    }

    @Test
    @DisplayName("coordinator config binds from properties")
    void coordinatorConfigBound() {
        CoordinatorConfig config = context.getBean(CoordinatorConfig.class);

        assertEquals(3, config.workerCount());
        assertEquals(MergeStrategy.ABORT_ON_CONFLICT, config.mergeStrategy());
        assertEquals(Duration.ofSeconds(30), config.heartbeatInterval());
        assertEquals(Duration.ofSeconds(30), config.shutdownGrace());
    }

    @Test
    @DisplayName("idle worker pool reports UP")
    void healthIndicatorIdle() {
        var health = context.getBean(WorkerPoolHealthIndicator.class).health();

        assertEquals(Status.UP, health.getStatus());
    }
}
