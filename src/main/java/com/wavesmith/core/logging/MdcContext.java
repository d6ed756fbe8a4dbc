package com.wavesmith.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Wavesmith-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setGoal(String goalHash) {
        put("goalHash", goalHash);
    }

    public static void setArtifact(String goalHash, String artifactId, int waveNumber) {
        put("goalHash", goalHash);
        put("artifactId", artifactId);
        MDC.put("waveNumber", String.valueOf(waveNumber));
    }

    public static void setWave(String goalHash, int waveNumber) {
        put("goalHash", goalHash);
        MDC.put("waveNumber", String.valueOf(waveNumber));
    }

    public static void setWorker(String workerId) {
        put("workerId", workerId);
    }

    /** Clears artifact-level keys, keeping the worker id of the current thread. */
    public static void clear() {
        MDC.remove("goalHash");
        MDC.remove("artifactId");
        MDC.remove("waveNumber");
    }

    public static void clearWorker() {
        clear();
        MDC.remove("workerId");
    }

    private static void put(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }
}
