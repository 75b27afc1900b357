package com.braid.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * An isolated git worktree and branch provisioned for a single task.
 *
 * @param id             unique worktree identifier
 * @param projectId      owning project
 * @param branchName     branch checked out in the worktree (e.g. {@code task/T-1})
 * @param worktreePath   filesystem path of the checkout
 * @param baseBranch     branch the worktree was created from and merges back into
 * @param taskId         task the worktree serves (nullable)
 * @param agentSessionId session currently owning the worktree (nullable when released)
 * @param status         record status
 * @param createdAt      creation time
 * @param updatedAt      last modification time
 */
public record Worktree(
    String id,
    String projectId,
    String branchName,
    String worktreePath,
    String baseBranch,
    String taskId,
    String agentSessionId,
    WorktreeStatus status,
    Instant createdAt,
    Instant updatedAt
) implements Serializable {

    public boolean isOwned() {
        return agentSessionId != null && !agentSessionId.isBlank();
    }

    /** True for a provisioned worktree that an agent session currently holds. */
    public boolean isActivelyOwned() {
        return status == WorktreeStatus.ACTIVE && isOwned();
    }
}
