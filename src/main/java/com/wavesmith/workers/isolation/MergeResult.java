package com.wavesmith.workers.isolation;

import java.util.List;

/**
 * Outcome of merging one worker branch.
 *
 * @param success     whether the branch landed on the base branch
 * @param strategy    strategy used
 * @param branch      worker branch
 * @param filesMerged files changed on the base branch by this merge
 * @param conflicts   files that could not be merged
 * @param error       failure description, null on success
 */
public record MergeResult(
    boolean success,
    MergeStrategy strategy,
    String branch,
    List<String> filesMerged,
    List<String> conflicts,
    String error
) {

    public MergeResult {
        filesMerged = filesMerged == null ? List.of() : List.copyOf(filesMerged);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public static MergeResult success(MergeStrategy strategy, String branch, List<String> filesMerged) {
        return new MergeResult(true, strategy, branch, filesMerged, List.of(), null);
    }

    public static MergeResult failure(MergeStrategy strategy, String branch, List<String> conflicts, String error) {
        return new MergeResult(false, strategy, branch, List.of(), conflicts, error);
    }
}
