package com.braid.core.engine;

/**
 * A ready task that was not spawned in this pass. It stays ready for the next one.
 */
public record SkippedTask(String taskId, String title, String reason) {
}
