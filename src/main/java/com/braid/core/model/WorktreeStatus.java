package com.braid.core.model;

/**
 * Status of a worktree record.
 */
public enum WorktreeStatus {
    /** Provisioned and (possibly) claimed by an agent session. */
    ACTIVE,
    /** The owning session let go of it; the checkout still exists. */
    RELEASED,
    /** Its branch was merged into the base branch. */
    MERGED,
    /** Marked for removal by stale cleanup. */
    STALE
}
