package com.braid.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A unit of work owned by the external task store.
 *
 * @param id                 unique task identifier
 * @param title              short human-readable title
 * @param description        what the task should accomplish (nullable)
 * @param status             current lifecycle status
 * @param parentTaskId       parent in the task hierarchy (nullable for roots)
 * @param priority           lower values are scheduled first
 * @param type               task type, e.g. "task", "bug", "epic"
 * @param category           optional category used in agent prompts
 * @param validationCriteria how the work will be validated (nullable)
 * @param createdAt          creation time, used as the final ordering tie-break
 * @param closedAt           when the task was closed (nullable)
 * @param closedReason       reason given when closing (nullable)
 * @param closedCommitSha    commit recorded when closing (nullable)
 */
public record Task(
    String id,
    String title,
    String description,
    TaskStatus status,
    String parentTaskId,
    int priority,
    String type,
    String category,
    String validationCriteria,
    Instant createdAt,
    Instant closedAt,
    String closedReason,
    String closedCommitSha
) implements Serializable {

    public Task withStatus(TaskStatus newStatus) {
        return new Task(id, title, description, newStatus, parentTaskId, priority, type, category,
                validationCriteria, createdAt, closedAt, closedReason, closedCommitSha);
    }
}
