package com.wavesmith.workers.isolation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One git worktree and branch per worker. Worktrees live under
 * {@code worktreesDir} and are merged back into the base branch in the order
 * their first commit was made.
 */
public class GitWorktreeIsolation implements WorkspaceIsolation {

    private static final Logger log = LoggerFactory.getLogger(GitWorktreeIsolation.class);

    private final GitWorkspaceManager git;
    private final Path repoRoot;
    private final Path worktreesDir;
    private final String baseBranch;

    public GitWorktreeIsolation(GitWorkspaceManager git, Path repoRoot, Path worktreesDir, String baseBranch) {
        this.git = git;
        this.repoRoot = repoRoot;
        this.worktreesDir = worktreesDir;
        this.baseBranch = baseBranch != null ? baseBranch : git.currentBranch(repoRoot);
    }

    public String baseBranch() {
        return baseBranch;
    }

    @Override
    public Workspace create(String workerId, String branch) {
        Path path = worktreesDir.resolve(workerId.replaceAll("[^A-Za-z0-9._-]", "-"));
        var result = git.addWorktree(repoRoot, path, branch, baseBranch);
        if (!result.success()) {
            throw new GitCommandException(result.error());
        }
        log.info("Worker {} isolated in worktree {} on branch '{}'", workerId, path, branch);
        return new WorktreeWorkspace(workerId, branch, result.worktreePath());
    }

    @Override
    public boolean commit(Workspace workspace, String message) {
        boolean committed = git.commitAll(pathOf(workspace), message);
        if (committed && workspace instanceof WorktreeWorkspace worktree) {
            worktree.resetModified();
        }
        return committed;
    }

    @Override
    public void discardChanges(Workspace workspace) {
        git.discardUncommitted(pathOf(workspace));
        if (workspace instanceof WorktreeWorkspace worktree) {
            worktree.resetModified();
        }
    }

    @Override
    public MergeResult merge(Workspace workspace, MergeStrategy strategy) {
        if (strategy == MergeStrategy.FAST_FORWARD) {
            // rebase needs a clean worktree; anything uncommitted was never part of a goal
            git.discardUncommitted(pathOf(workspace));
        }
        return git.merge(repoRoot, workspace.branch(), pathOf(workspace), strategy, baseBranch);
    }

    @Override
    public List<Workspace> mergeOrder(List<Workspace> workspaces) {
        return workspaces.stream()
                .sorted(Comparator.comparing((Workspace ws) ->
                        git.firstCommitTime(repoRoot, baseBranch, ws.branch()).orElse(Instant.MAX)))
                .toList();
    }

    @Override
    public void cleanup(Workspace workspace, boolean deleteBranch) {
        git.removeWorktree(repoRoot, pathOf(workspace));
        if (deleteBranch && !git.deleteBranch(repoRoot, workspace.branch())) {
            log.warn("Could not delete branch '{}'", workspace.branch());
        }
    }

    @Override
    public String name() {
        return "git-worktree";
    }

    private static Path pathOf(Workspace workspace) {
        return workspace.root().orElseThrow(() ->
                new IllegalArgumentException("Workspace " + workspace.workerId() + " is not backed by a worktree"));
    }

    /** Workspace backed by a checked-out worktree directory. */
    static final class WorktreeWorkspace implements Workspace {

        private final String workerId;
        private final String branch;
        private final Path root;
        private final Set<String> written = new LinkedHashSet<>();

        WorktreeWorkspace(String workerId, String branch, Path root) {
            this.workerId = workerId;
            this.branch = branch;
            this.root = root;
        }

        @Override
        public String workerId() {
            return workerId;
        }

        @Override
        public String branch() {
            return branch;
        }

        @Override
        public Optional<Path> root() {
            return Optional.of(root);
        }

        @Override
        public synchronized void writeFile(String relativePath, String content) {
            Path target = resolve(relativePath);
            try {
                Files.createDirectories(target.getParent());
                Files.writeString(target, content, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write " + target, e);
            }
            written.add(relativePath);
        }

        @Override
        public Optional<String> readFile(String relativePath) {
            Path target = resolve(relativePath);
            if (!Files.isRegularFile(target)) {
                return Optional.empty();
            }
            try {
                return Optional.of(Files.readString(target, StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + target, e);
            }
        }

        @Override
        public synchronized Set<String> modifiedFiles() {
            return Set.copyOf(written);
        }

        synchronized void resetModified() {
            written.clear();
        }

        private Path resolve(String relativePath) {
            Path target = root.resolve(relativePath).normalize();
            if (!target.startsWith(root)) {
                throw new IllegalArgumentException("Path escapes workspace: " + relativePath);
            }
            return target;
        }
    }
}
