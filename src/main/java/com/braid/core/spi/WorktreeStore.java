package com.braid.core.spi;

import com.braid.core.model.Worktree;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for {@link Worktree} records.
 */
public interface WorktreeStore {

    Worktree create(String projectId, String branchName, String worktreePath, String baseBranch, String taskId);

    Optional<Worktree> get(String worktreeId);

    /**
     * The most recently created non-merged worktree linked to the task, if any.
     */
    Optional<Worktree> getByTask(String taskId);

    Optional<Worktree> getByBranch(String projectId, String branchName);

    /**
     * All worktrees of a project, or of every project when {@code projectId} is null.
     */
    List<Worktree> list(String projectId);

    Optional<Worktree> claim(String worktreeId, String agentSessionId);

    Optional<Worktree> release(String worktreeId);

    Optional<Worktree> markMerged(String worktreeId);

    Optional<Worktree> markStale(String worktreeId);

    Optional<Worktree> updateTask(String worktreeId, String taskId);

    /**
     * @return true if a record was deleted, false if none existed
     */
    boolean delete(String worktreeId);
}
