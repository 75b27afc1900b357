package com.braid.core.engine;

/**
 * Switches for {@link OrchestrationEngine#cleanupReviewedWorktrees}.
 *
 * @param mergeToBase     merge each branch into its worktree's base branch first
 * @param deleteWorktrees remove the checkout and record after marking it merged
 * @param deleteBranches  also delete the task branch
 * @param force           remove dirty checkouts / unmerged branches
 * @param push            push the base branch after a merge when a remote exists
 */
public record CleanupOptions(
    boolean mergeToBase,
    boolean deleteWorktrees,
    boolean deleteBranches,
    boolean force,
    boolean push
) {

    public static CleanupOptions defaults() {
        return new CleanupOptions(true, true, false, false, true);
    }

    public CleanupOptions withMergeToBase(boolean value) {
        return new CleanupOptions(value, deleteWorktrees, deleteBranches, force, push);
    }

    public CleanupOptions withDeleteBranches(boolean value) {
        return new CleanupOptions(mergeToBase, deleteWorktrees, value, force, push);
    }

    public CleanupOptions withPush(boolean value) {
        return new CleanupOptions(mergeToBase, deleteWorktrees, deleteBranches, force, value);
    }
}
