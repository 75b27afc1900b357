package com.braid.core.engine;

import com.braid.core.model.Task;
import com.braid.core.model.TaskStatus;
import com.braid.core.spi.TaskNotFoundException;
import com.braid.core.spi.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Blocks until a task reaches a terminal status (closed or failed) or the
 * timeout elapses. The wait is an explicit poll loop over a {@link Sleeper};
 * interrupting the waiting thread ends it early.
 */
public class WaitCoordinator {

    private static final Logger log = LoggerFactory.getLogger(WaitCoordinator.class);

    static final Duration FALLBACK_POLL_INTERVAL = Duration.ofSeconds(10);

    private final TaskStore taskStore;
    private final Sleeper sleeper;
    private final Clock clock;

    public WaitCoordinator(TaskStore taskStore, Sleeper sleeper, Clock clock) {
        this.taskStore = taskStore;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * @throws TaskNotFoundException when the task does not exist when the wait starts
     */
    public WaitResult waitForTask(String taskId, Duration timeout, Duration pollInterval) {
        Task task = taskStore.get(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        Duration interval = pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()
                ? FALLBACK_POLL_INTERVAL
                : pollInterval;

        Instant start = clock.instant();
        Instant deadline = start.plus(timeout);
        log.debug("Waiting up to {} for task {} (poll every {})", timeout, taskId, interval);

        while (true) {
            if (task.status().isTerminal()) {
                log.info("Task {} reached {} after {}", taskId, task.status().value(), elapsed(start));
                return new WaitResult(taskId, true, false, elapsed(start), task.status(), null);
            }

            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                log.info("Timed out after {} waiting for task {} (status {})", timeout, taskId, task.status().value());
                return new WaitResult(taskId, false, true, elapsed(start), task.status(), null);
            }

            Duration remaining = Duration.between(now, deadline);
            try {
                sleeper.sleep(remaining.compareTo(interval) < 0 ? remaining : interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Wait for task {} interrupted", taskId);
                return new WaitResult(taskId, false, false, elapsed(start), task.status(), "Wait interrupted");
            }

            Optional<Task> refreshed = taskStore.get(taskId);
            if (refreshed.isEmpty()) {
                log.warn("Task {} disappeared while waiting", taskId);
                return new WaitResult(taskId, false, false, elapsed(start), null,
                        "Task " + taskId + " no longer exists");
            }
            task = refreshed.get();
        }
    }

    private Duration elapsed(Instant start) {
        return Duration.between(start, clock.instant());
    }
}
