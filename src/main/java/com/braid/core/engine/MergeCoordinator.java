package com.braid.core.engine;

import com.braid.core.events.BraidEvent;
import com.braid.core.events.EventBus;
import com.braid.core.metrics.BraidMetrics;
import com.braid.core.model.CleanupSummary;
import com.braid.core.model.ReviewedAgentRecord;
import com.braid.core.model.Worktree;
import com.braid.core.model.WorktreeStatus;
import com.braid.core.spi.GitOperations;
import com.braid.core.spi.GitResult;
import com.braid.core.spi.WorktreeStore;
import com.braid.core.state.OrchestrationState;
import com.braid.core.state.OrchestrationStateStore;
import com.braid.workspace.WorktreeProvisioner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merges reviewed agents' branches into their base branches and removes their worktrees.
 *
 * <p>Records are handled one at a time and each outcome is committed to the state
 * store before the next record starts, so a failure half-way through a batch never
 * undoes or repeats work already merged. Failed records stay in reviewed for a
 * later call.
 */
public class MergeCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MergeCoordinator.class);

    private final OrchestrationStateStore stateStore;
    private final WorktreeStore worktreeStore;
    private final WorktreeProvisioner provisioner;
    private final GitOperations git;
    private final EventBus eventBus;
    private final BraidMetrics metrics;
    private final String remote;
    private final Clock clock;

    public MergeCoordinator(OrchestrationStateStore stateStore, WorktreeStore worktreeStore,
                            WorktreeProvisioner provisioner, GitOperations git, EventBus eventBus,
                            BraidMetrics metrics, String remote, Clock clock) {
        this.stateStore = stateStore;
        this.worktreeStore = worktreeStore;
        this.provisioner = provisioner;
        this.git = git;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.remote = remote;
        this.clock = clock;
    }

    public CleanupResult cleanup(String sessionId, CleanupOptions options) {
        var merged = new ArrayList<CleanupResult.Merged>();
        var deleted = new ArrayList<CleanupResult.Deleted>();
        var failed = new ArrayList<CleanupResult.Failed>();

        List<ReviewedAgentRecord> reviewed = stateStore.load(sessionId).reviewed();
        if (reviewed.isEmpty()) {
            log.info("No reviewed agents to clean up for session {}", sessionId);
            return new CleanupResult(merged, deleted, failed, 0);
        }

        for (ReviewedAgentRecord record : reviewed) {
            boolean cleaned;
            try {
                cleaned = process(sessionId, record, options, merged, deleted, failed);
            } catch (RuntimeException e) {
                log.error("Error cleaning up worktree {} for task {}", record.worktreeId(), record.taskId(), e);
                failed.add(failure(record, e.getMessage()));
                cleaned = false;
            }
            if (cleaned) {
                stateStore.update(sessionId, state -> removeReviewed(state, record));
            }
        }

        var summary = new CleanupSummary(merged.size(), deleted.size(), failed.size(), clock.instant());
        OrchestrationState finalState = stateStore.update(sessionId, state -> state.appendCleanup(summary));

        log.info("Cleanup for session {}: {} merged, {} deleted, {} failed, {} still reviewed",
                sessionId, merged.size(), deleted.size(), failed.size(), finalState.reviewed().size());
        return new CleanupResult(merged, deleted, failed, finalState.reviewed().size());
    }

    /**
     * @return true when the record is done with and can leave reviewed
     */
    private boolean process(String sessionId, ReviewedAgentRecord record, CleanupOptions options,
                            List<CleanupResult.Merged> merged, List<CleanupResult.Deleted> deleted,
                            List<CleanupResult.Failed> failed) {
        if (record.worktreeId() == null || record.worktreeId().isBlank()) {
            failed.add(failure(record, "Missing worktree_id"));
            return false;
        }

        Optional<Worktree> found = worktreeStore.get(record.worktreeId());
        if (found.isEmpty()) {
            log.info("Worktree {} already gone; treating task {} as cleaned", record.worktreeId(), record.taskId());
            return true;
        }
        Worktree worktree = found.get();
        String branch = record.branchName() != null ? record.branchName() : worktree.branchName();

        if (worktree.status() == WorktreeStatus.MERGED) {
            log.info("Branch {} of task {} already merged; only removing its worktree", branch, record.taskId());
        } else if (options.mergeToBase()) {
            String baseBranch = worktree.baseBranch() != null ? worktree.baseBranch() : git.defaultBranch();
            MergeOutcome outcome = mergeToBase(branch, baseBranch, options.push());
            metrics.recordMerge(outcome.success());
            if (!outcome.success()) {
                failed.add(failure(record, outcome.error()));
                eventBus.publish(BraidEvent.of(BraidEvent.WORKTREE_MERGE_FAILED, sessionId, record.taskId(),
                        Map.of("worktreeId", worktree.id(), "branch", branch, "reason", outcome.error())));
                return false;
            }
            merged.add(new CleanupResult.Merged(worktree.id(), record.taskId(), branch, outcome.mergeCommit()));
            eventBus.publish(BraidEvent.of(BraidEvent.WORKTREE_MERGED, sessionId, record.taskId(),
                    Map.of("worktreeId", worktree.id(), "branch", branch, "baseBranch", baseBranch)));
        }

        worktreeStore.markMerged(worktree.id());

        if (options.deleteWorktrees()) {
            GitResult removed = provisioner.destroy(worktree, options.deleteBranches(), options.force());
            if (!removed.success()) {
                failed.add(failure(record, "Worktree deletion failed: " + removed.error()));
                return false;
            }
            deleted.add(new CleanupResult.Deleted(worktree.id(), record.taskId(), worktree.worktreePath(),
                    options.deleteBranches()));
        }
        return true;
    }

    /**
     * fetch, checkout, pull, {@code merge --no-ff}, then push. The remote steps are
     * skipped when the repository has no such remote.
     */
    MergeOutcome mergeToBase(String branch, String baseBranch, boolean push) {
        boolean withRemote = git.hasRemote(remote);

        if (withRemote) {
            GitResult fetch = git.fetch(remote, baseBranch);
            if (!fetch.success()) {
                return MergeOutcome.failed("Merge failed: failed to fetch " + baseBranch + ": " + fetch.error());
            }
        }
        GitResult checkout = git.checkout(baseBranch);
        if (!checkout.success()) {
            return MergeOutcome.failed("Merge failed: failed to checkout " + baseBranch + ": " + checkout.error());
        }
        if (withRemote) {
            GitResult pull = git.pull(remote, baseBranch);
            if (!pull.success()) {
                return MergeOutcome.failed("Merge failed: failed to pull " + baseBranch + ": " + pull.error());
            }
        }

        GitResult merge = git.merge(branch, "Merge branch '" + branch + "'");
        if (!merge.success()) {
            if (merge.hasConflict()) {
                GitResult abort = git.abortMerge();
                if (!abort.success()) {
                    log.error("merge --abort failed after conflict on {}: {}", branch, abort.error());
                }
                metrics.recordMergeConflict();
                log.warn("Merge conflict merging {} into {}", branch, baseBranch);
                return MergeOutcome.failed("Merge conflict detected merging " + branch + " into " + baseBranch);
            }
            return MergeOutcome.failed("Merge failed: " + merge.error());
        }

        GitResult head = git.revParse("HEAD");
        String mergeCommit = head.success() ? head.stdout().trim() : null;

        if (withRemote && push) {
            GitResult pushed = git.push(remote, baseBranch);
            if (!pushed.success()) {
                return MergeOutcome.failed("Merge succeeded but push failed: " + pushed.error());
            }
        }
        log.info("Merged {} into {} at {}", branch, baseBranch, mergeCommit);
        return MergeOutcome.merged(mergeCommit);
    }

    private static OrchestrationState removeReviewed(OrchestrationState state, ReviewedAgentRecord record) {
        var remaining = new ArrayList<>(state.reviewed());
        if (!remaining.remove(record)) {
            return state;
        }
        return state.withReviewed(remaining);
    }

    private static CleanupResult.Failed failure(ReviewedAgentRecord record, String reason) {
        return new CleanupResult.Failed(record.sessionId(), record.taskId(), record.worktreeId(), reason);
    }

    record MergeOutcome(boolean success, String mergeCommit, String error) {

        static MergeOutcome merged(String mergeCommit) {
            return new MergeOutcome(true, mergeCommit, null);
        }

        static MergeOutcome failed(String error) {
            return new MergeOutcome(false, null, error);
        }
    }
}
