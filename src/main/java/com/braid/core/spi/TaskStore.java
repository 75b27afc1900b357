package com.braid.core.spi;

import com.braid.core.model.Task;
import com.braid.core.model.TaskDependency;
import com.braid.core.model.TaskStatus;

import java.util.List;
import java.util.Optional;

/**
 * Read/update access to the external task store.
 * The store owns tasks and their dependencies; the engine only reads them and
 * moves a task to {@link TaskStatus#IN_PROGRESS} after spawning its agent.
 */
public interface TaskStore {

    Optional<Task> get(String taskId);

    /**
     * Direct children of a task, in any order.
     */
    List<Task> listChildren(String parentTaskId);

    /**
     * Outgoing dependency edges of a task (edges where {@code taskId} is the dependent).
     */
    List<TaskDependency> listDependencies(String taskId);

    Task updateStatus(String taskId, TaskStatus status);
}
