package com.wavesmith.core.executor;

/**
 * What an unverified artifact means for the run.
 */
public enum VerificationPolicy {
    /** Keep the artifact as completed with {@code verified=false}. */
    RECORD,
    /** Treat the artifact as failed, blocking its dependents. */
    FAIL_ON_UNVERIFIED
}
