package com.braid.core.engine;

/**
 * What a dry run would spawn for one task.
 */
public record PlannedTask(
    String taskId,
    String title,
    String category,
    String prompt,
    String provider,
    String model,
    String mode,
    String workflow
) {
}
