package com.braid.workspace;

import java.util.List;

/**
 * Worktrees removed, and those that could not be removed, by a stale cleanup.
 */
public record StaleCleanupResult(List<String> deleted, List<String> failed) {

    public StaleCleanupResult {
        deleted = List.copyOf(deleted);
        failed = List.copyOf(failed);
    }

    public int deletedCount() {
        return deleted.size();
    }
}
