package com.wavesmith.workers.isolation;

import java.util.List;

/**
 * Creates isolated workspaces for workers and merges them back.
 */
public interface WorkspaceIsolation {

    Workspace create(String workerId, String branch);

    /**
     * Records the workspace's current changes.
     *
     * @return false if committing failed
     */
    boolean commit(Workspace workspace, String message);

    /** Drops the workspace's uncommitted changes. */
    void discardChanges(Workspace workspace);

    MergeResult merge(Workspace workspace, MergeStrategy strategy);

    /** Order in which workspaces should be merged. */
    default List<Workspace> mergeOrder(List<Workspace> workspaces) {
        return workspaces;
    }

    void cleanup(Workspace workspace, boolean deleteBranch);

    String name();
}
