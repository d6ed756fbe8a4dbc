package com.wavesmith.core.cache;

/**
 * Why an artifact does or does not need to run again.
 */
public enum ChangeKind {
    UNCHANGED,
    ADDED,               // not in the previous graph
    SPEC_CHANGED,        // own fields differ from the previous run
    DEPENDENCY_CHANGED,  // something upstream is not unchanged
    OUTPUT_MODIFIED,     // produced file was edited outside the engine
    NOT_COMPLETED        // pending or failed in the previous run
}
