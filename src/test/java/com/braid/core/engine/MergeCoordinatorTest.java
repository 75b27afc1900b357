package com.braid.core.engine;

import com.braid.core.events.BraidEvent;
import com.braid.core.events.EventBus;
import com.braid.core.metrics.BraidMetrics;
import com.braid.core.model.ReviewedAgentRecord;
import com.braid.core.model.Worktree;
import com.braid.core.model.WorktreeStatus;
import com.braid.core.persistence.InMemorySessionVariableStore;
import com.braid.core.persistence.InMemoryWorktreeStore;
import com.braid.core.spi.GitResult;
import com.braid.core.state.OrchestrationState;
import com.braid.core.state.OrchestrationStateStore;
import com.braid.core.state.SessionLockRegistry;
import com.braid.support.FakeGitOperations;
import com.braid.support.MutableClock;
import com.braid.workspace.WorkspaceInitializer;
import com.braid.workspace.WorktreeProvisioner;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link MergeCoordinator}.
 */
class MergeCoordinatorTest {

    private static final Instant T0 = Instant.parse("2024-06-01T09:00:00Z");
    private static final GitResult CONFLICT = new GitResult(false, 1,
            "Auto-merging a.txt\nCONFLICT (content): Merge conflict in a.txt", "", "git merge failed");

    @TempDir
    Path tempDir;

    private OrchestrationStateStore stateStore;
    private InMemoryWorktreeStore worktrees;
    private FakeGitOperations git;
    private SimpleMeterRegistry registry;
    private List<BraidEvent> events;
    private MergeCoordinator coordinator;

    @BeforeEach
    void setUp() {
        var clock = new MutableClock(T0);
        var locks = new SessionLockRegistry();
        stateStore = new OrchestrationStateStore(new InMemorySessionVariableStore(), locks);
        worktrees = new InMemoryWorktreeStore(clock);
        git = new FakeGitOperations(tempDir);
        registry = new SimpleMeterRegistry();
        var metrics = new BraidMetrics(registry);
        var eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribe("S1", events::add);
        var provisioner = new WorktreeProvisioner(worktrees, git,
                new WorkspaceInitializer(tempDir, ".braid/project.json", new ObjectMapper()),
                locks, metrics, tempDir.resolve("wts"), "task/", clock);
        coordinator = new MergeCoordinator(stateStore, worktrees, provisioner, git, eventBus, metrics, "origin", clock);
    }

    private ReviewedAgentRecord reviewed(String taskId) {
        Worktree wt = worktrees.create("proj", "task/" + taskId, "/tmp/wt/" + taskId, "main", taskId);
        worktrees.release(wt.id());
        return new ReviewedAgentRecord("A-" + taskId, taskId, wt.id(), wt.branchName());
    }

    private void seed(ReviewedAgentRecord... records) {
        stateStore.update("S1", s -> s.withReviewed(List.of(records)));
    }

    @Nested
    @DisplayName("Batch merges")
    class Batch {

        @Test
        @DisplayName("A conflict in the middle of a batch keeps the others merged")
        void partialBatch() {
            ReviewedAgentRecord r1 = reviewed("T1");
            ReviewedAgentRecord r2 = reviewed("T2");
            ReviewedAgentRecord r3 = reviewed("T3");
            seed(r1, r2, r3);
            git.fail("merge", "task/T2", CONFLICT);

            CleanupResult result = coordinator.cleanup("S1", CleanupOptions.defaults());

            assertEquals(2, result.merged().size());
            assertEquals(2, result.deleted().size());
            assertEquals(1, result.failed().size());
            assertEquals("Merge conflict detected merging task/T2 into main", result.failed().get(0).reason());
            assertEquals(1, result.remainingReviewed());
            assertEquals("abc123", result.merged().get(0).mergeCommit());

            OrchestrationState state = stateStore.load("S1");
            assertEquals(List.of(r2), state.reviewed());
            assertTrue(worktrees.get(r1.worktreeId()).isEmpty());
            assertTrue(worktrees.get(r3.worktreeId()).isEmpty());
            assertEquals(WorktreeStatus.RELEASED, worktrees.get(r2.worktreeId()).orElseThrow().status());
            assertEquals(1, git.count("abortMerge"));
            assertEquals(1.0, registry.find("braid.merges.conflicts").counter().count());
        }

        @Test
        @DisplayName("Re-running after a conflict only retries the failed record")
        void rerunIsIdempotent() {
            seed(reviewed("T1"), reviewed("T2"));
            git.fail("merge", "task/T2", CONFLICT);

            coordinator.cleanup("S1", CleanupOptions.defaults());
            CleanupResult second = coordinator.cleanup("S1", CleanupOptions.defaults());

            assertTrue(second.merged().isEmpty());
            assertEquals(1, second.failed().size());
            assertEquals(1, second.remainingReviewed());
            assertEquals(1, git.calls().stream().filter(c -> c.equals("merge task/T1")).count());
            assertEquals(2, stateStore.load("S1").cleanupHistory().size());
        }

        @Test
        @DisplayName("Cleanup summary is appended to the history")
        void summary() {
            seed(reviewed("T1"));

            coordinator.cleanup("S1", CleanupOptions.defaults());

            var history = stateStore.load("S1").cleanupHistory();
            assertEquals(1, history.size());
            assertEquals(1, history.get(0).mergedCount());
            assertEquals(1, history.get(0).deletedCount());
            assertEquals(0, history.get(0).failedCount());
            assertEquals(T0, history.get(0).timestamp());
        }

        @Test
        @DisplayName("Nothing reviewed is a no-op")
        void nothingReviewed() {
            CleanupResult result = coordinator.cleanup("S1", CleanupOptions.defaults());

            assertEquals(0, result.remainingReviewed());
            assertTrue(git.calls().isEmpty());
        }
    }

    @Nested
    @DisplayName("Individual records")
    class Records {

        @Test
        @DisplayName("A record without worktree id fails and stays reviewed")
        void missingWorktreeId() {
            seed(new ReviewedAgentRecord("A1", "T1", null, "task/T1"));

            CleanupResult result = coordinator.cleanup("S1", CleanupOptions.defaults());

            assertEquals("Missing worktree_id", result.failed().get(0).reason());
            assertEquals(1, result.remainingReviewed());
        }

        @Test
        @DisplayName("A record whose worktree is already gone is cleaned without git calls")
        void missingWorktree() {
            seed(new ReviewedAgentRecord("A1", "T1", "wt-gone", "task/T1"));

            CleanupResult result = coordinator.cleanup("S1", CleanupOptions.defaults());

            assertTrue(result.failed().isEmpty());
            assertEquals(0, result.remainingReviewed());
            assertTrue(git.calls().isEmpty());
        }

        @Test
        @DisplayName("A push failure leaves the record reviewed and the worktree unmerged")
        void pushFailure() {
            ReviewedAgentRecord record = reviewed("T1");
            seed(record);
            git.fail("push", new GitResult(false, 1, "", "rejected (non-fast-forward)", "failed"));

            CleanupResult result = coordinator.cleanup("S1", CleanupOptions.defaults());

            assertEquals("Merge succeeded but push failed: rejected (non-fast-forward)", result.failed().get(0).reason());
            assertEquals(1, result.remainingReviewed());
            assertEquals(WorktreeStatus.RELEASED, worktrees.get(record.worktreeId()).orElseThrow().status());
            assertEquals(BraidEvent.WORKTREE_MERGE_FAILED, events.get(events.size() - 1).eventType());
        }

        @Test
        @DisplayName("Without a remote only checkout and merge run")
        void noRemote() {
            seed(reviewed("T1"));
            git.withoutRemote();

            coordinator.cleanup("S1", CleanupOptions.defaults());

            assertEquals(0, git.count("fetch"));
            assertEquals(0, git.count("pull"));
            assertEquals(0, git.count("push"));
            assertEquals(List.of("checkout main", "merge task/T1", "revParse HEAD", "deleteWorktree task/T1"),
                    git.calls());
        }

        @Test
        @DisplayName("With a remote: fetch, checkout, pull, merge, push")
        void withRemote() {
            seed(reviewed("T1"));

            coordinator.cleanup("S1", CleanupOptions.defaults());

            assertEquals(List.of("fetch main", "checkout main", "pull main", "merge task/T1", "revParse HEAD",
                    "push main", "deleteWorktree task/T1"), git.calls());
            assertEquals(BraidEvent.WORKTREE_MERGED, events.get(0).eventType());
        }

        @Test
        @DisplayName("Skipping the merge only marks merged and removes the worktree")
        void withoutMerge() {
            ReviewedAgentRecord record = reviewed("T1");
            seed(record);

            CleanupResult result = coordinator.cleanup("S1",
                    CleanupOptions.defaults().withMergeToBase(false).withDeleteBranches(true));

            assertTrue(result.merged().isEmpty());
            assertTrue(result.deleted().get(0).branchDeleted());
            assertEquals(List.of("deleteWorktree task/T1 +branch"), git.calls());
        }

        @Test
        @DisplayName("Keeping worktrees leaves them marked merged")
        void keepWorktrees() {
            ReviewedAgentRecord record = reviewed("T1");
            seed(record);

            coordinator.cleanup("S1", new CleanupOptions(true, false, false, false, false));

            assertEquals(WorktreeStatus.MERGED, worktrees.get(record.worktreeId()).orElseThrow().status());
            assertEquals(0, git.count("push"));
            assertTrue(stateStore.load("S1").reviewed().isEmpty());
        }

        @Test
        @DisplayName("A failed worktree removal keeps the record reviewed")
        void deletionFailure() {
            seed(reviewed("T1"));
            git.fail("deleteWorktree", new GitResult(false, 128, "", "locked", "failed"));

            CleanupResult result = coordinator.cleanup("S1", CleanupOptions.defaults());

            assertEquals("Worktree deletion failed: locked", result.failed().get(0).reason());
            assertEquals(1, result.merged().size());
            assertEquals(1, result.remainingReviewed());
        }

        @Test
        @DisplayName("A rerun after a failed deletion removes the worktree without merging again")
        void rerunAfterDeletionFailure() {
            ReviewedAgentRecord record = reviewed("T1");
            seed(record);
            git.fail("deleteWorktree", new GitResult(false, 128, "", "locked", "failed"));
            coordinator.cleanup("S1", CleanupOptions.defaults());
            assertEquals(WorktreeStatus.MERGED, worktrees.get(record.worktreeId()).orElseThrow().status());

            git.clear("deleteWorktree");
            CleanupResult second = coordinator.cleanup("S1", CleanupOptions.defaults());

            assertTrue(second.merged().isEmpty());
            assertEquals(1, second.deleted().size());
            assertTrue(second.failed().isEmpty());
            assertEquals(0, second.remainingReviewed());
            assertEquals(1, git.count("merge"));
            assertEquals(1, git.count("push"));
            assertTrue(worktrees.get(record.worktreeId()).isEmpty());

            OrchestrationState state = stateStore.load("S1");
            assertEquals(1, state.cleanupHistory().get(0).mergedCount());
            assertEquals(0, state.cleanupHistory().get(1).mergedCount());
            assertEquals(1, state.cleanupHistory().get(1).deletedCount());
        }
    }

    @Test
    @DisplayName("Other merge failures are reported with git's error")
    void otherMergeFailure() {
        seed(reviewed("T1"));
        git.fail("merge", new GitResult(false, 1, "", "fatal: refusing to merge unrelated histories", "failed"));

        CleanupResult result = coordinator.cleanup("S1", CleanupOptions.defaults());

        assertEquals("Merge failed: fatal: refusing to merge unrelated histories", result.failed().get(0).reason());
        assertEquals(0, git.count("abortMerge"));
        assertTrue(result.merged().isEmpty());
    }
}
