package com.wavesmith.workers.isolation;

import java.util.List;

/**
 * A merge under {@link MergeStrategy#ABORT_ON_CONFLICT} hit conflicts and was
 * rolled back. Needs manual resolution.
 */
public class MergeConflictException extends RuntimeException {

    private final String branch;
    private final List<String> conflicts;

    public MergeConflictException(String branch, List<String> conflicts) {
        super("Merge of '%s' aborted, conflicting files: %s".formatted(branch, conflicts));
        this.branch = branch;
        this.conflicts = List.copyOf(conflicts);
    }

    public String getBranch() {
        return branch;
    }

    public List<String> getConflicts() {
        return conflicts;
    }
}
