package com.braid.core.spi;

import java.nio.file.Path;

/**
 * The git sequences the orchestrator needs, run against the project repository.
 * Implementations never throw for expected git failures.
 */
public interface GitOperations {

    Path repoPath();

    /**
     * The repository's default branch, e.g. from {@code origin/HEAD}.
     */
    String defaultBranch();

    GitResult createWorktree(Path worktreePath, String branchName, String baseBranch, boolean createBranch);

    /**
     * Removes a worktree checkout and, when requested, its branch.
     * Succeeds when the worktree is already gone.
     */
    GitResult deleteWorktree(Path worktreePath, String branchName, boolean force, boolean deleteBranch);

    /**
     * Whether the repository has the named remote configured.
     */
    boolean hasRemote(String remote);

    GitResult fetch(String remote, String branch);

    GitResult checkout(String branch);

    GitResult pull(String remote, String branch);

    /**
     * Non-fast-forward merge of {@code branch} into the current branch.
     */
    GitResult merge(String branch, String message);

    GitResult abortMerge();

    GitResult push(String remote, String branch);

    GitResult revParse(String ref);
}
