package com.braid.core.persistence;

import com.braid.core.model.Worktree;
import com.braid.core.model.WorktreeStatus;
import com.braid.core.spi.WorktreeStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Worktree records kept in memory, in creation order. Not durable across restarts.
 */
public class InMemoryWorktreeStore implements WorktreeStore {

    private final Map<String, Worktree> worktrees = new LinkedHashMap<>();
    private final Clock clock;

    public InMemoryWorktreeStore() {
        this(Clock.systemUTC());
    }

    public InMemoryWorktreeStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Worktree create(String projectId, String branchName, String worktreePath,
                                       String baseBranch, String taskId) {
        Instant now = clock.instant();
        var worktree = new Worktree(WorktreeIds.next(), projectId, branchName, worktreePath, baseBranch,
                taskId, null, WorktreeStatus.ACTIVE, now, now);
        worktrees.put(worktree.id(), worktree);
        return worktree;
    }

    @Override
    public synchronized Optional<Worktree> get(String worktreeId) {
        return Optional.ofNullable(worktrees.get(worktreeId));
    }

    @Override
    public synchronized Optional<Worktree> getByTask(String taskId) {
        return worktrees.values().stream()
                .filter(wt -> taskId != null && taskId.equals(wt.taskId()))
                .filter(wt -> wt.status() != WorktreeStatus.MERGED)
                .max(Comparator.comparing(Worktree::createdAt));
    }

    @Override
    public synchronized Optional<Worktree> getByBranch(String projectId, String branchName) {
        return worktrees.values().stream()
                .filter(wt -> wt.branchName().equals(branchName))
                .filter(wt -> projectId == null || projectId.equals(wt.projectId()))
                .filter(wt -> wt.status() != WorktreeStatus.MERGED)
                .max(Comparator.comparing(Worktree::createdAt));
    }

    @Override
    public synchronized List<Worktree> list(String projectId) {
        return worktrees.values().stream()
                .filter(wt -> projectId == null || projectId.equals(wt.projectId()))
                .toList();
    }

    @Override
    public Optional<Worktree> claim(String worktreeId, String agentSessionId) {
        return modify(worktreeId, wt -> copy(wt, wt.taskId(), agentSessionId, WorktreeStatus.ACTIVE));
    }

    @Override
    public Optional<Worktree> release(String worktreeId) {
        return modify(worktreeId, wt -> copy(wt, wt.taskId(), null, WorktreeStatus.RELEASED));
    }

    @Override
    public Optional<Worktree> markMerged(String worktreeId) {
        return modify(worktreeId, wt -> copy(wt, wt.taskId(), null, WorktreeStatus.MERGED));
    }

    @Override
    public Optional<Worktree> markStale(String worktreeId) {
        return modify(worktreeId, wt -> copy(wt, wt.taskId(), wt.agentSessionId(), WorktreeStatus.STALE));
    }

    @Override
    public Optional<Worktree> updateTask(String worktreeId, String taskId) {
        return modify(worktreeId, wt -> copy(wt, taskId, wt.agentSessionId(), wt.status()));
    }

    @Override
    public synchronized boolean delete(String worktreeId) {
        return worktrees.remove(worktreeId) != null;
    }

    private synchronized Optional<Worktree> modify(String worktreeId, UnaryOperator<Worktree> change) {
        Worktree existing = worktrees.get(worktreeId);
        if (existing == null) {
            return Optional.empty();
        }
        Worktree updated = change.apply(existing);
        worktrees.put(worktreeId, updated);
        return Optional.of(updated);
    }

    private Worktree copy(Worktree wt, String taskId, String sessionId, WorktreeStatus status) {
        return new Worktree(wt.id(), wt.projectId(), wt.branchName(), wt.worktreePath(), wt.baseBranch(),
                taskId, sessionId, status, wt.createdAt(), clock.instant());
    }
}
