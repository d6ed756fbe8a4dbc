package com.wavesmith.workers.isolation;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/**
 * One worker's private view of the project. Writes made here are invisible
 * to other workers until merged.
 */
public interface Workspace {

    String workerId();

    /** Branch name the workspace commits to; also the worker's identifier in status reports. */
    String branch();

    /** Directory backing the workspace, or empty when it lives in memory. */
    Optional<Path> root();

    void writeFile(String relativePath, String content);

    Optional<String> readFile(String relativePath);

    /** Files changed in this workspace and not yet committed. */
    Set<String> modifiedFiles();
}
