package com.braid.core.engine;

import com.braid.core.model.CompletedAgentRecord;
import com.braid.core.model.FailedAgentRecord;
import com.braid.core.model.SpawnedAgentRecord;
import com.braid.core.model.Task;
import com.braid.core.model.TaskStatus;
import com.braid.core.model.Worktree;
import com.braid.core.spi.AgentRunner;
import com.braid.core.spi.TaskStore;
import com.braid.core.spi.WorktreeStore;
import com.braid.core.state.OrchestrationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Classifies spawned agents from observable signals: task status, worker
 * liveness and worktree ownership. Checks run in a fixed order and the first
 * match wins; a closed task beats a live process.
 *
 * <p>Pure with respect to state: it returns a new {@link OrchestrationState}
 * and leaves persisting it to the caller.
 */
public class StatusReconciler {

    private static final Logger log = LoggerFactory.getLogger(StatusReconciler.class);

    static final String MISSING_SESSION = "Missing session_id in agent record (corrupted record)";
    static final String NO_TASK_ID = "Unknown status - no task_id";
    static final String EXITED_BEFORE_START = "Agent exited before starting work (task still open)";
    static final String TASK_FAILED = "Task reported failure";
    static final String RELEASED_WITHOUT_CLOSING = "Agent released worktree without closing task";
    static final String EXITED_WITHOUT_COMPLETING = "Agent exited without completing task";

    private final TaskStore taskStore;
    private final WorktreeStore worktreeStore;
    private final AgentRunner agentRunner;
    private final Clock clock;

    public StatusReconciler(TaskStore taskStore, WorktreeStore worktreeStore, AgentRunner agentRunner, Clock clock) {
        this.taskStore = taskStore;
        this.worktreeStore = worktreeStore;
        this.agentRunner = agentRunner;
        this.clock = clock;
    }

    public Reconciliation reconcile(OrchestrationState state) {
        var completed = new ArrayList<CompletedAgentRecord>();
        var failed = new ArrayList<FailedAgentRecord>();
        var running = new ArrayList<SpawnedAgentRecord>();

        for (SpawnedAgentRecord agent : state.spawned()) {
            Classification outcome;
            try {
                outcome = classify(agent);
            } catch (RuntimeException e) {
                log.warn("Status check failed for agent {} (task {})", agent.sessionId(), agent.taskId(), e);
                outcome = Classification.failed("Status check failed: " + e.getMessage());
            }

            switch (outcome.kind()) {
                case RUNNING -> running.add(agent);
                case COMPLETED -> completed.add(CompletedAgentRecord.from(agent, outcome.task()));
                case FAILED -> {
                    log.info("Agent {} for task {} failed: {}", agent.sessionId(), agent.taskId(), outcome.reason());
                    failed.add(FailedAgentRecord.from(agent, outcome.reason(), clock.instant()));
                }
            }
        }

        OrchestrationState next = state.withSpawned(running)
                .appendCompleted(completed)
                .appendFailed(failed);
        return new Reconciliation(next, completed, failed, running);
    }

    Classification classify(SpawnedAgentRecord agent) {
        if (!agent.hasSessionId()) {
            return Classification.failed(MISSING_SESSION);
        }

        Optional<Task> task = agent.taskId() == null ? Optional.empty() : taskStore.get(agent.taskId());
        if (task.isPresent() && task.get().status() == TaskStatus.CLOSED) {
            return Classification.completed(task.get());
        }

        if (agentRunner.getRunning(agent.sessionId()).isPresent()) {
            return Classification.running();
        }

        if (agent.taskId() == null || agent.taskId().isBlank()) {
            return Classification.failed(NO_TASK_ID);
        }
        if (task.isEmpty()) {
            return Classification.failed("Task not found: " + agent.taskId());
        }

        return switch (task.get().status()) {
            case OPEN -> Classification.failed(EXITED_BEFORE_START);
            case FAILED -> Classification.failed(TASK_FAILED);
            case IN_PROGRESS -> worktreeStillOwned(agent)
                    ? Classification.failed(EXITED_WITHOUT_COMPLETING)
                    : Classification.failed(RELEASED_WITHOUT_CLOSING);
            case CLOSED -> Classification.completed(task.get());
        };
    }

    private boolean worktreeStillOwned(SpawnedAgentRecord agent) {
        if (agent.worktreeId() == null) {
            return false;
        }
        return worktreeStore.get(agent.worktreeId())
                .map(Worktree::isActivelyOwned)
                .orElse(false);
    }

    enum Kind { RUNNING, COMPLETED, FAILED }

    record Classification(Kind kind, Task task, String reason) {

        static Classification running() {
            return new Classification(Kind.RUNNING, null, null);
        }

        static Classification completed(Task task) {
            return new Classification(Kind.COMPLETED, task, null);
        }

        static Classification failed(String reason) {
            return new Classification(Kind.FAILED, null, reason);
        }
    }
}
