package com.braid.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A spawned agent classified as failed. The task itself is left untouched for retry.
 */
public record FailedAgentRecord(
    String sessionId,
    String taskId,
    String worktreeId,
    String runId,
    String branchName,
    String worktreePath,
    String failureReason,
    Instant failedAt
) implements Serializable {

    public static FailedAgentRecord from(SpawnedAgentRecord spawned, String reason, Instant failedAt) {
        return new FailedAgentRecord(
                spawned.sessionId(), spawned.taskId(), spawned.worktreeId(), spawned.runId(),
                spawned.branchName(), spawned.worktreePath(), reason, failedAt);
    }
}
