package com.braid.core.engine;

import com.braid.core.model.TaskStatus;
import com.braid.core.model.WorktreeStatus;

import java.util.List;

/**
 * Direct subtasks of a parent, grouped by status, with their worktree state.
 */
public record OrchestrationStatus(
    String parentTaskId,
    TaskStatus parentStatus,
    List<Subtask> open,
    List<Subtask> inProgress,
    List<Subtask> closed,
    boolean isComplete
) {

    public OrchestrationStatus {
        open = List.copyOf(open);
        inProgress = List.copyOf(inProgress);
        closed = List.copyOf(closed);
    }

    public int totalCount() {
        return open.size() + inProgress.size() + closed.size();
    }

    /**
     * @param worktreeId     the task's current worktree (null if none)
     * @param worktreeStatus status of that worktree (null if none)
     * @param hasActiveAgent whether an agent session owns the worktree
     */
    public record Subtask(
        String taskId,
        String title,
        TaskStatus status,
        String worktreeId,
        WorktreeStatus worktreeStatus,
        boolean hasActiveAgent
    ) {
    }
}
