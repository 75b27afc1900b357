package com.braid.core.engine;

import java.util.List;

/**
 * Outcome of merging and cleaning up reviewed agents.
 */
public record CleanupResult(
    List<Merged> merged,
    List<Deleted> deleted,
    List<Failed> failed,
    int remainingReviewed
) {

    public CleanupResult {
        merged = List.copyOf(merged);
        deleted = List.copyOf(deleted);
        failed = List.copyOf(failed);
    }

    public record Merged(String worktreeId, String taskId, String branchName, String mergeCommit) {
    }

    public record Deleted(String worktreeId, String taskId, String worktreePath, boolean branchDeleted) {
    }

    /**
     * A reviewed record that could not be cleaned up; it stays in reviewed.
     */
    public record Failed(String sessionId, String taskId, String worktreeId, String reason) {
    }
}
