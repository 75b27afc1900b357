package com.braid.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A spawned agent whose task was closed.
 */
public record CompletedAgentRecord(
    String sessionId,
    String taskId,
    String worktreeId,
    String runId,
    String branchName,
    String worktreePath,
    Instant completedAt,
    String closedReason,
    String commitSha
) implements Serializable {

    public static CompletedAgentRecord from(SpawnedAgentRecord spawned, Task task) {
        return new CompletedAgentRecord(
                spawned.sessionId(), spawned.taskId(), spawned.worktreeId(), spawned.runId(),
                spawned.branchName(), spawned.worktreePath(),
                task.closedAt(), task.closedReason(), task.closedCommitSha());
    }
}
