package com.braid.workspace;

import com.braid.core.model.Worktree;

/**
 * Outcome of {@link WorktreeProvisioner#provision}.
 *
 * @param success      true when a worktree is ready for an agent
 * @param worktree     the provisioned or reused worktree (null when skipped)
 * @param newlyCreated true when this call created the worktree; only those are destroyed on spawn failure
 * @param reason       why the task was skipped (null on success)
 */
public record ProvisionResult(boolean success, Worktree worktree, boolean newlyCreated, String reason) {

    public static ProvisionResult created(Worktree worktree) {
        return new ProvisionResult(true, worktree, true, null);
    }

    public static ProvisionResult reused(Worktree worktree) {
        return new ProvisionResult(true, worktree, false, null);
    }

    public static ProvisionResult skipped(String reason) {
        return new ProvisionResult(false, null, false, reason);
    }
}
