package com.braid.core.spi;

/**
 * Raised when a caller names a task that does not exist. This is a caller error,
 * never converted into a partial result.
 */
public class TaskNotFoundException extends RuntimeException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
