package com.braid.core.scheduler;

import com.braid.core.model.DependencyKind;
import com.braid.core.model.Task;
import com.braid.core.model.TaskDependency;
import com.braid.core.model.TaskStatus;
import com.braid.core.spi.TaskNotFoundException;
import com.braid.core.spi.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Computes which descendants of a parent task are ready to be worked on.
 * <p>
 * A task is ready when it is open, none of its blocking dependencies points at a
 * task that is still unclosed, and no ancestor between it and the parent is
 * blocked either. Results come parent-before-children, siblings ordered by
 * priority and then creation time.
 */
@Service
public class TaskGraphResolver {

    private static final Logger log = LoggerFactory.getLogger(TaskGraphResolver.class);

    public static final Comparator<Task> SIBLING_ORDER = Comparator
            .comparingInt(Task::priority)
            .thenComparing(Task::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Task::id);

    private final TaskStore taskStore;

    public TaskGraphResolver(TaskStore taskStore) {
        this.taskStore = taskStore;
    }

    /**
     * Ready descendants of {@code parentTaskId}, excluding the parent itself.
     *
     * @throws TaskNotFoundException when the parent id is blank or unknown
     */
    public List<Task> resolveReady(String parentTaskId) {
        Task parent = requireTask(parentTaskId);

        var ready = new ArrayList<Task>();
        var visited = new HashSet<String>();
        visited.add(parent.id());
        collect(parent, false, ready, visited);

        log.info("resolveReady: {} ready task(s) under {}", ready.size(), parent.id());
        return ready;
    }

    /**
     * Whether {@code ancestorId} appears on the parent chain of {@code taskId}.
     */
    public boolean isDescendantOf(String taskId, String ancestorId) {
        if (taskId == null || ancestorId == null) {
            return false;
        }
        Set<String> visited = new HashSet<>();
        Optional<Task> current = taskStore.get(taskId);
        while (current.isPresent() && visited.add(current.get().id())) {
            String parentId = current.get().parentTaskId();
            if (parentId == null) {
                return false;
            }
            if (parentId.equals(ancestorId)) {
                return true;
            }
            current = taskStore.get(parentId);
        }
        return false;
    }

    /**
     * Whether any BLOCKS dependency of the task points at an existing task that is not closed.
     */
    public boolean isBlocked(Task task) {
        for (TaskDependency dep : taskStore.listDependencies(task.id())) {
            if (dep.kind() != DependencyKind.BLOCKS) {
                continue;
            }
            Optional<Task> blocker = taskStore.get(dep.dependsOn());
            if (blocker.isEmpty()) {
                log.debug("  {} - blocker {} no longer exists, ignoring", task.id(), dep.dependsOn());
                continue;
            }
            if (blocker.get().status() != TaskStatus.CLOSED) {
                log.debug("  {} - blocked by {} ({})", task.id(), blocker.get().id(), blocker.get().status());
                return true;
            }
        }
        return false;
    }

    private void collect(Task node, boolean ancestorBlocked, List<Task> ready, Set<String> visited) {
        List<Task> children = new ArrayList<>(taskStore.listChildren(node.id()));
        children.sort(SIBLING_ORDER);

        for (Task child : children) {
            if (!visited.add(child.id())) {
                log.warn("Task hierarchy cycle detected at {}; skipping", child.id());
                continue;
            }
            boolean blocked = isBlocked(child);
            if (!ancestorBlocked && !blocked && child.status() == TaskStatus.OPEN) {
                ready.add(child);
            }
            collect(child, ancestorBlocked || blocked, ready, visited);
        }
    }

    private Task requireTask(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new TaskNotFoundException(taskId);
        }
        return taskStore.get(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }
}
