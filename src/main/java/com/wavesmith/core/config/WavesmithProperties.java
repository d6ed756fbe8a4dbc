package com.wavesmith.core.config;

import com.wavesmith.workers.isolation.MergeStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "wavesmith")
public class WavesmithProperties {

    private String projectRoot = ".";
    private Executor executor = new Executor();
    private Persistence persistence = new Persistence();
    private Coordinator coordinator = new Coordinator();
    private Governor governor = new Governor();

    // -- Shortcuts (delegate to nested) --
    public String getPlansDir() { return persistence.plansDir; }

    public String getProjectRoot() { return projectRoot; }
    public void setProjectRoot(String projectRoot) { this.projectRoot = projectRoot; }
    public Executor getExecutor() { return executor; }
    public void setExecutor(Executor executor) { this.executor = executor; }
    public Persistence getPersistence() { return persistence; }
    public void setPersistence(Persistence persistence) { this.persistence = persistence; }
    public Coordinator getCoordinator() { return coordinator; }
    public void setCoordinator(Coordinator coordinator) { this.coordinator = coordinator; }
    public Governor getGovernor() { return governor; }
    public void setGovernor(Governor governor) { this.governor = governor; }

    public static class Executor {
        private int maxConcurrent = 8;
        private int smallConcurrency = 8;
        private int mediumConcurrency = 4;
        private int largeConcurrency = 2;
        private Duration artifactTimeout = Duration.ofMinutes(5);
        private int maxArtifacts = 50;
        private int maxDepth = 10;
        private int maxDiscoveryRounds = 5;

        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }
        public int getSmallConcurrency() { return smallConcurrency; }
        public void setSmallConcurrency(int smallConcurrency) { this.smallConcurrency = smallConcurrency; }
        public int getMediumConcurrency() { return mediumConcurrency; }
        public void setMediumConcurrency(int mediumConcurrency) { this.mediumConcurrency = mediumConcurrency; }
        public int getLargeConcurrency() { return largeConcurrency; }
        public void setLargeConcurrency(int largeConcurrency) { this.largeConcurrency = largeConcurrency; }
        public Duration getArtifactTimeout() { return artifactTimeout; }
        public void setArtifactTimeout(Duration artifactTimeout) { this.artifactTimeout = artifactTimeout; }
        public int getMaxArtifacts() { return maxArtifacts; }
        public void setMaxArtifacts(int maxArtifacts) { this.maxArtifacts = maxArtifacts; }
        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }
        public int getMaxDiscoveryRounds() { return maxDiscoveryRounds; }
        public void setMaxDiscoveryRounds(int maxDiscoveryRounds) { this.maxDiscoveryRounds = maxDiscoveryRounds; }
    }

    public static class Persistence {
        /** Relative paths resolve against the project root. */
        private String plansDir = ".wavesmith/plans";
        /** Check output files on disk against recorded hashes during incremental planning. */
        private boolean checkOutputFiles = true;

        public String getPlansDir() { return plansDir; }
        public void setPlansDir(String plansDir) { this.plansDir = plansDir; }
        public boolean isCheckOutputFiles() { return checkOutputFiles; }
        public void setCheckOutputFiles(boolean checkOutputFiles) { this.checkOutputFiles = checkOutputFiles; }
    }

    public static class Coordinator {
        private int workerCount = 4;
        private Duration workerTimeout = Duration.ofMinutes(30);
        private Duration shutdownGrace = Duration.ofSeconds(30);
        private MergeStrategy mergeStrategy = MergeStrategy.FAST_FORWARD;
        private Duration lockTimeout = Duration.ofSeconds(5);
        private Duration lockTtl = Duration.ofMinutes(30);
        private Duration staleLockThreshold = Duration.ofHours(1);
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private int missedHeartbeats = 12;
        private int maxRetriesPerGoal = 2;
        private boolean respawn = true;
        private String branchPrefix = "work/worker-";
        private String baseBranch;
        private boolean cleanupBranches = true;
        private String stateDir = ".wavesmith";
        private boolean incremental = true;

        public int getWorkerCount() { return workerCount; }
        public void setWorkerCount(int workerCount) { this.workerCount = workerCount; }
        public Duration getWorkerTimeout() { return workerTimeout; }
        public void setWorkerTimeout(Duration workerTimeout) { this.workerTimeout = workerTimeout; }
        public Duration getShutdownGrace() { return shutdownGrace; }
        public void setShutdownGrace(Duration shutdownGrace) { this.shutdownGrace = shutdownGrace; }
        public MergeStrategy getMergeStrategy() { return mergeStrategy; }
        public void setMergeStrategy(MergeStrategy mergeStrategy) { this.mergeStrategy = mergeStrategy; }
        public Duration getLockTimeout() { return lockTimeout; }
        public void setLockTimeout(Duration lockTimeout) { this.lockTimeout = lockTimeout; }
        public Duration getLockTtl() { return lockTtl; }
        public void setLockTtl(Duration lockTtl) { this.lockTtl = lockTtl; }
        public Duration getStaleLockThreshold() { return staleLockThreshold; }
        public void setStaleLockThreshold(Duration staleLockThreshold) { this.staleLockThreshold = staleLockThreshold; }
        public Duration getHeartbeatInterval() { return heartbeatInterval; }
        public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }
        public int getMissedHeartbeats() { return missedHeartbeats; }
        public void setMissedHeartbeats(int missedHeartbeats) { this.missedHeartbeats = missedHeartbeats; }
        public int getMaxRetriesPerGoal() { return maxRetriesPerGoal; }
        public void setMaxRetriesPerGoal(int maxRetriesPerGoal) { this.maxRetriesPerGoal = maxRetriesPerGoal; }
        public boolean isRespawn() { return respawn; }
        public void setRespawn(boolean respawn) { this.respawn = respawn; }
        public String getBranchPrefix() { return branchPrefix; }
        public void setBranchPrefix(String branchPrefix) { this.branchPrefix = branchPrefix; }
        public String getBaseBranch() { return baseBranch; }
        public void setBaseBranch(String baseBranch) { this.baseBranch = baseBranch; }
        public boolean isCleanupBranches() { return cleanupBranches; }
        public void setCleanupBranches(boolean cleanupBranches) { this.cleanupBranches = cleanupBranches; }
        public String getStateDir() { return stateDir; }
        public void setStateDir(String stateDir) { this.stateDir = stateDir; }
        public boolean isIncremental() { return incremental; }
        public void setIncremental(boolean incremental) { this.incremental = incremental; }
    }

    public static class Governor {
        private int maxConcurrentCalls = 8;
        private int maxCallsPerMinute = 0;
        private long maxHeapMb = 0;
        private Duration maxWait = Duration.ofMinutes(5);

        public int getMaxConcurrentCalls() { return maxConcurrentCalls; }
        public void setMaxConcurrentCalls(int maxConcurrentCalls) { this.maxConcurrentCalls = maxConcurrentCalls; }
        public int getMaxCallsPerMinute() { return maxCallsPerMinute; }
        public void setMaxCallsPerMinute(int maxCallsPerMinute) { this.maxCallsPerMinute = maxCallsPerMinute; }
        public long getMaxHeapMb() { return maxHeapMb; }
        public void setMaxHeapMb(long maxHeapMb) { this.maxHeapMb = maxHeapMb; }
        public Duration getMaxWait() { return maxWait; }
        public void setMaxWait(Duration maxWait) { this.maxWait = maxWait; }
    }
}
