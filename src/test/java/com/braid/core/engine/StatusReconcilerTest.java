package com.braid.core.engine;

import com.braid.core.model.SpawnedAgentRecord;
import com.braid.core.model.TaskStatus;
import com.braid.core.model.Worktree;
import com.braid.core.persistence.InMemoryWorktreeStore;
import com.braid.core.spi.RunningAgent;
import com.braid.core.state.OrchestrationState;
import com.braid.support.FakeAgentRunner;
import com.braid.support.InMemoryTaskStore;
import com.braid.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.braid.support.InMemoryTaskStore.task;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link StatusReconciler}.
 */
class StatusReconcilerTest {

    private static final Instant T0 = Instant.parse("2024-06-01T09:00:00Z");

    private InMemoryTaskStore tasks;
    private InMemoryWorktreeStore worktrees;
    private FakeAgentRunner runner;
    private StatusReconciler reconciler;

    @BeforeEach
    void setUp() {
        tasks = new InMemoryTaskStore();
        worktrees = new InMemoryWorktreeStore();
        runner = new FakeAgentRunner();
        reconciler = new StatusReconciler(tasks, worktrees, runner, new MutableClock(T0));
        tasks.add(task("P", null));
    }

    private OrchestrationState stateWith(SpawnedAgentRecord... records) {
        var state = OrchestrationState.empty("S1");
        for (SpawnedAgentRecord record : records) {
            state = state.appendSpawned(record);
        }
        return state;
    }

    private SpawnedAgentRecord inProgressAgent(String taskId, String sessionId) {
        tasks.add(task(taskId, "P"));
        tasks.setStatus(taskId, TaskStatus.IN_PROGRESS);
        Worktree wt = worktrees.create("proj", "task/" + taskId, "/tmp/" + taskId, "main", taskId);
        worktrees.claim(wt.id(), sessionId);
        return SpawnedAgentRecord.of(sessionId, taskId, wt.id());
    }

    @Test
    @DisplayName("Crash recovery: closed, released and running agents are told apart")
    void crashClassification() {
        SpawnedAgentRecord a1 = inProgressAgent("T1", "A1");
        SpawnedAgentRecord a2 = inProgressAgent("T2", "A2");
        SpawnedAgentRecord a3 = inProgressAgent("T3", "A3");

        tasks.close("T1", "done", "abc123", T0);
        worktrees.release(a2.worktreeId());
        runner.markRunning("A3");

        Reconciliation result = reconciler.reconcile(stateWith(a1, a2, a3));

        assertEquals(List.of("T1"), result.newlyCompleted().stream().map(c -> c.taskId()).toList());
        assertEquals("abc123", result.newlyCompleted().get(0).commitSha());
        assertEquals(1, result.newlyFailed().size());
        assertEquals("T2", result.newlyFailed().get(0).taskId());
        assertEquals(StatusReconciler.RELEASED_WITHOUT_CLOSING, result.newlyFailed().get(0).failureReason());
        assertEquals(List.of(a3), result.stillRunning());

        OrchestrationState next = result.state();
        assertEquals(List.of(a3), next.spawned());
        assertEquals(1, next.completed().size());
        assertEquals(1, next.failed().size());
        assertEquals(T0, next.failed().get(0).failedAt());
    }

    @Test
    @DisplayName("A closed task wins over a live process")
    void closedBeatsRunning() {
        SpawnedAgentRecord agent = inProgressAgent("T1", "A1");
        runner.markRunning("A1");
        tasks.close("T1", "done", null, T0);

        Reconciliation result = reconciler.reconcile(stateWith(agent));

        assertEquals(1, result.newlyCompleted().size());
        assertTrue(result.stillRunning().isEmpty());
    }

    @Test
    @DisplayName("Exited agent that still owns its worktree exited without completing")
    void exitedOwningWorktree() {
        SpawnedAgentRecord agent = inProgressAgent("T1", "A1");

        Reconciliation result = reconciler.reconcile(stateWith(agent));

        assertEquals(StatusReconciler.EXITED_WITHOUT_COMPLETING, result.newlyFailed().get(0).failureReason());
    }

    @Test
    @DisplayName("Open and failed tasks of exited agents have their own reasons")
    void openAndFailedTasks() {
        tasks.add(task("T1", "P"));
        tasks.add(task("T2", "P"));
        tasks.setStatus("T2", TaskStatus.FAILED);

        Reconciliation result = reconciler.reconcile(stateWith(
                SpawnedAgentRecord.of("A1", "T1", "wt-x"),
                SpawnedAgentRecord.of("A2", "T2", "wt-y")));

        assertEquals(StatusReconciler.EXITED_BEFORE_START, result.newlyFailed().get(0).failureReason());
        assertEquals(StatusReconciler.TASK_FAILED, result.newlyFailed().get(1).failureReason());
    }

    @Test
    @DisplayName("Records without a session id, without a task id, or with a vanished task fail")
    void corruptedRecords() {
        runner.markRunning("A3");

        Reconciliation result = reconciler.reconcile(stateWith(
                SpawnedAgentRecord.of(null, "T1", "wt-1"),
                SpawnedAgentRecord.of("A2", null, "wt-2"),
                SpawnedAgentRecord.of("A4", "GONE", "wt-4"),
                SpawnedAgentRecord.of("A3", null, "wt-3")));

        List<String> reasons = result.newlyFailed().stream().map(f -> f.failureReason()).toList();
        assertEquals(List.of(StatusReconciler.MISSING_SESSION, StatusReconciler.NO_TASK_ID, "Task not found: GONE"),
                reasons);
        assertEquals(1, result.stillRunning().size());
    }

    @Test
    @DisplayName("A failing status check marks only that agent failed")
    void statusCheckFailure() {
        tasks.add(task("T1", "P"));
        tasks.add(task("T2", "P"));
        runner.markRunning("A2");
        var failingRunner = new FakeAgentRunner() {
            @Override
            public Optional<RunningAgent> getRunning(String sessionId) {
                if (sessionId.equals("A1")) {
                    throw new IllegalStateException("runner offline");
                }
                return runner.getRunning(sessionId);
            }
        };
        reconciler = new StatusReconciler(tasks, worktrees, failingRunner, new MutableClock(T0));

        Reconciliation result = reconciler.reconcile(stateWith(
                SpawnedAgentRecord.of("A1", "T1", "wt-1"),
                SpawnedAgentRecord.of("A2", "T2", "wt-2")));

        assertEquals("Status check failed: runner offline", result.newlyFailed().get(0).failureReason());
        assertEquals(1, result.stillRunning().size());
    }

    @Test
    @DisplayName("No change when every agent is still running")
    void unchanged() {
        SpawnedAgentRecord agent = inProgressAgent("T1", "A1");
        runner.markRunning("A1");

        Reconciliation result = reconciler.reconcile(stateWith(agent));

        assertFalse(result.changed());
    }
}
