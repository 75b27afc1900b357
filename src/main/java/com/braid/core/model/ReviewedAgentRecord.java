package com.braid.core.model;

import java.io.Serializable;

/**
 * A completed agent whose work was approved and is waiting to be merged.
 */
public record ReviewedAgentRecord(
    String sessionId,
    String taskId,
    String worktreeId,
    String branchName
) implements Serializable {

    public static ReviewedAgentRecord from(CompletedAgentRecord completed) {
        return new ReviewedAgentRecord(completed.sessionId(), completed.taskId(),
                completed.worktreeId(), completed.branchName());
    }
}
