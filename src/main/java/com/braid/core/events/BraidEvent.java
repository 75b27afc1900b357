package com.braid.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while orchestrating a task tree.
 *
 * @param eventType event type (e.g. "agent.spawned", "agent.failed", "worktree.merged")
 * @param sessionId the orchestrating session this event belongs to
 * @param taskId    the task this event relates to (nullable for session-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record BraidEvent(
    String eventType,
    String sessionId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String AGENT_SPAWNED = "agent.spawned";
    public static final String AGENT_SKIPPED = "agent.skipped";
    public static final String AGENT_COMPLETED = "agent.completed";
    public static final String AGENT_FAILED = "agent.failed";
    public static final String WORKTREE_MERGED = "worktree.merged";
    public static final String WORKTREE_MERGE_FAILED = "worktree.merge_failed";

    public static BraidEvent of(String eventType, String sessionId, String taskId, Map<String, Object> payload) {
        return new BraidEvent(eventType, sessionId, taskId, payload, Instant.now());
    }
}
