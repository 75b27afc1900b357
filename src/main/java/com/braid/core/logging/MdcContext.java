package com.braid.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Braid-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setTask(String sessionId, String taskId) {
        MDC.put("sessionId", sessionId);
        MDC.put("taskId", taskId);
    }

    public static void setWorktree(String sessionId, String taskId, String worktreeId) {
        setTask(sessionId, taskId);
        if (worktreeId != null) {
            MDC.put("worktreeId", worktreeId);
        } else {
            MDC.remove("worktreeId");
        }
    }

    /** Drops the task-level keys and keeps the session. */
    public static void clearTask() {
        MDC.remove("taskId");
        MDC.remove("worktreeId");
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("taskId");
        MDC.remove("worktreeId");
    }
}
