package com.braid.workspace;

import com.braid.core.logging.MdcContext;
import com.braid.core.metrics.BraidMetrics;
import com.braid.core.model.Task;
import com.braid.core.model.Worktree;
import com.braid.core.model.WorktreeStatus;
import com.braid.core.spi.GitOperations;
import com.braid.core.spi.GitResult;
import com.braid.core.spi.WorktreeStore;
import com.braid.core.state.SessionLockRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Creates, hands out and destroys one isolated git worktree per task.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #provision} reuses an unowned worktree of the task, or creates
 *       branch {@code task/<id>} in a fresh worktree and initialises it</li>
 *   <li>{@link #claim} binds the worktree to the spawned agent's session</li>
 *   <li>{@link #release} drops ownership, keeping files and branch</li>
 *   <li>{@link #destroy} removes the checkout (optionally the branch) and the record</li>
 * </ol>
 *
 * <p>A failed creation or initialisation is rolled back completely: no record,
 * no checkout and no branch survive.
 */
public class WorktreeProvisioner {

    private static final Logger log = LoggerFactory.getLogger(WorktreeProvisioner.class);

    private final WorktreeStore worktreeStore;
    private final GitOperations git;
    private final WorkspaceInitializer initializer;
    private final SessionLockRegistry locks;
    private final BraidMetrics metrics;
    private final Path baseDir;
    private final String branchPrefix;
    private final Clock clock;

    public WorktreeProvisioner(WorktreeStore worktreeStore, GitOperations git, WorkspaceInitializer initializer,
                               SessionLockRegistry locks, BraidMetrics metrics, Path baseDir, String branchPrefix,
                               Clock clock) {
        this.worktreeStore = worktreeStore;
        this.git = git;
        this.initializer = initializer;
        this.locks = locks;
        this.metrics = metrics;
        this.baseDir = baseDir;
        this.branchPrefix = branchPrefix;
        this.clock = clock;
    }

    public String branchNameFor(String taskId) {
        return branchPrefix + taskId;
    }

    /**
     * {@code <base-dir>/<project>/<branch with '/' replaced by '-'>}.
     */
    public Path worktreePathFor(String projectName, String branchName) {
        return baseDir.resolve(projectName).resolve(branchName.replace("/", "-"));
    }

    /**
     * Explicit branch, else the repository's detected default, else {@code main}.
     */
    public String resolveBaseBranch(String explicit) {
        if (explicit != null && !explicit.isBlank()) {
            return explicit;
        }
        String detected = git.defaultBranch();
        return detected == null || detected.isBlank() ? "main" : detected;
    }

    public ProvisionResult provision(Task task, ProvisionRequest request) {
        return locks.withLock(request.parentSessionId(), () -> provisionLocked(task, request));
    }

    private ProvisionResult provisionLocked(Task task, ProvisionRequest request) {
        String branchName = branchNameFor(task.id());

        Optional<Worktree> byTask = worktreeStore.getByTask(task.id());
        if (byTask.isPresent() && byTask.get().isOwned()) {
            return ProvisionResult.skipped("Already has active worktree: " + byTask.get().id());
        }
        Optional<Worktree> byBranch = worktreeStore.getByBranch(request.projectId(), branchName);
        if (byBranch.isPresent() && byBranch.get().isOwned()) {
            return ProvisionResult.skipped("Branch " + branchName + " has active agent");
        }

        if (byTask.isPresent()) {
            log.info("Reusing worktree {} for task {}", byTask.get().id(), task.id());
            return ProvisionResult.reused(byTask.get());
        }
        if (byBranch.isPresent()) {
            Worktree existing = byBranch.get();
            log.info("Reusing worktree {} on branch {} for task {}", existing.id(), branchName, task.id());
            if (!task.id().equals(existing.taskId())) {
                existing = worktreeStore.updateTask(existing.id(), task.id()).orElse(existing);
            }
            return ProvisionResult.reused(existing);
        }

        return createFresh(task, request, branchName);
    }

    private ProvisionResult createFresh(Task task, ProvisionRequest request, String branchName) {
        String baseBranch = resolveBaseBranch(request.baseBranch());
        Path worktreePath = worktreePathFor(projectName(request.projectId()), branchName);

        GitResult created = git.createWorktree(worktreePath, branchName, baseBranch, true);
        if (!created.success()) {
            metrics.recordWorktreeOperation("provision", false);
            log.warn("Failed to create worktree for task {}: {}", task.id(), created.error());
            return ProvisionResult.skipped("Failed to create worktree: " + created.error());
        }

        Worktree worktree;
        try {
            worktree = worktreeStore.create(request.projectId(), branchName, worktreePath.toString(),
                    baseBranch, task.id());
        } catch (RuntimeException e) {
            log.error("Failed to record worktree for task {}; removing checkout", task.id(), e);
            git.deleteWorktree(worktreePath, branchName, true, true);
            metrics.recordWorktreeOperation("provision", false);
            return ProvisionResult.skipped("Failed to create worktree record: " + e.getMessage());
        }

        MdcContext.setWorktree(request.parentSessionId(), task.id(), worktree.id());
        try {
            initializer.initialize(worktreePath, request.provider());
        } catch (IOException | RuntimeException e) {
            log.warn("Worktree initialization failed for task {}; rolling back", task.id(), e);
            rollback(worktree);
            return ProvisionResult.skipped("Worktree initialization failed: " + e.getMessage());
        }

        metrics.recordWorktreeOperation("provision", true);
        log.info("Created worktree {} at {} (branch: {}, base: {})", worktree.id(), worktreePath, branchName, baseBranch);
        return ProvisionResult.created(worktree);
    }

    private void rollback(Worktree worktree) {
        worktreeStore.delete(worktree.id());
        GitResult removed = git.deleteWorktree(Path.of(worktree.worktreePath()), worktree.branchName(), true, true);
        if (!removed.success()) {
            log.warn("Rollback could not remove worktree {}: {}", worktree.worktreePath(), removed.error());
        }
        metrics.recordWorktreeOperation("rollback", removed.success());
    }

    public Optional<Worktree> claim(String worktreeId, String sessionId) {
        return worktreeStore.claim(worktreeId, sessionId);
    }

    public Optional<Worktree> release(String worktreeId) {
        return worktreeStore.release(worktreeId);
    }

    /**
     * Removes the worktree checkout, optionally its branch, and its record.
     * The record survives when git refuses to remove the checkout.
     */
    public GitResult destroy(Worktree worktree, boolean deleteBranch, boolean force) {
        GitResult removed = git.deleteWorktree(Path.of(worktree.worktreePath()), worktree.branchName(),
                force, deleteBranch);
        metrics.recordWorktreeOperation("destroy", removed.success());
        if (!removed.success()) {
            log.warn("Failed to delete worktree {} at {}: {}", worktree.id(), worktree.worktreePath(), removed.error());
            return removed;
        }
        worktreeStore.delete(worktree.id());
        log.info("Destroyed worktree {} (branch {} {})", worktree.id(), worktree.branchName(),
                deleteBranch ? "deleted" : "kept");
        return removed;
    }

    /**
     * Deletes worktrees that are STALE, or ACTIVE/RELEASED without an owner and not
     * updated for {@code olderThan}. Merged worktrees and branches are left alone.
     */
    public StaleCleanupResult cleanupStale(String projectId, Duration olderThan, boolean force) {
        Instant cutoff = clock.instant().minus(olderThan);
        List<String> deleted = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (Worktree worktree : worktreeStore.list(projectId)) {
            if (!isStale(worktree, cutoff)) {
                continue;
            }
            GitResult result = destroy(worktree, false, force);
            if (result.success()) {
                deleted.add(worktree.id());
            } else {
                failed.add(worktree.id());
            }
        }
        metrics.recordWorktreeOperation("stale_cleanup", failed.isEmpty());
        log.info("Stale worktree cleanup: {} deleted, {} failed", deleted.size(), failed.size());
        return new StaleCleanupResult(deleted, failed);
    }

    static boolean isStale(Worktree worktree, Instant cutoff) {
        if (worktree.status() == WorktreeStatus.STALE) {
            return true;
        }
        if (worktree.status() == WorktreeStatus.MERGED || worktree.isOwned()) {
            return false;
        }
        Instant lastTouched = worktree.updatedAt() != null ? worktree.updatedAt() : worktree.createdAt();
        return lastTouched != null && lastTouched.isBefore(cutoff);
    }

    private String projectName(String projectId) {
        if (projectId != null && !projectId.isBlank()) {
            return projectId;
        }
        Path name = git.repoPath().getFileName();
        return name == null ? "project" : name.toString();
    }
}
