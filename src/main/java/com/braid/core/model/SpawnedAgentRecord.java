package com.braid.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * An agent launched into a worktree and not yet classified by reconciliation.
 *
 * @param sessionId    the agent's session id; the key used for liveness checks
 * @param taskId       the task the agent works on
 * @param worktreeId   the worktree the agent owns
 * @param runId        the agent run id reported by the runner (nullable)
 * @param branchName   the worktree branch (nullable)
 * @param worktreePath the worktree checkout path (nullable)
 * @param title        task title at spawn time (nullable)
 * @param pid          process id when the runner exposes one (nullable)
 * @param spawnedAt    when the agent was launched (nullable)
 */
public record SpawnedAgentRecord(
    String sessionId,
    String taskId,
    String worktreeId,
    String runId,
    String branchName,
    String worktreePath,
    String title,
    Long pid,
    Instant spawnedAt
) implements Serializable {

    public static SpawnedAgentRecord of(String sessionId, String taskId, String worktreeId) {
        return new SpawnedAgentRecord(sessionId, taskId, worktreeId, null, null, null, null, null, null);
    }

    public boolean hasSessionId() {
        return sessionId != null && !sessionId.isBlank();
    }
}
