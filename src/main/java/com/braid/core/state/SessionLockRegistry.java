package com.braid.core.state;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One reentrant lock per orchestrating session. Every read-modify-write of a
 * session's state document, and the worktree check-then-create, runs under it.
 * <p>
 * A lock is dropped from the registry when its last holder leaves and nobody is
 * waiting for it. A thread that acquired a lock which was dropped meanwhile
 * retries on the session's current lock.
 */
public class SessionLockRegistry {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String sessionId, Supplier<T> action) {
        ReentrantLock lock = acquire(sessionId);
        try {
            return action.get();
        } finally {
            lock.unlock();
            evictIfIdle(sessionId, lock);
        }
    }

    public void withLock(String sessionId, Runnable action) {
        withLock(sessionId, () -> {
            action.run();
            return null;
        });
    }

    /** Whether the calling thread currently holds the session's lock. */
    public boolean isHeldByCurrentThread(String sessionId) {
        ReentrantLock lock = locks.get(sessionId);
        return lock != null && lock.isHeldByCurrentThread();
    }

    /** Sessions with a live lock. */
    int size() {
        return locks.size();
    }

    private ReentrantLock acquire(String sessionId) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(sessionId, id -> new ReentrantLock());
            lock.lock();
            if (locks.get(sessionId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    private void evictIfIdle(String sessionId, ReentrantLock lock) {
        locks.computeIfPresent(sessionId, (id, current) ->
                current == lock && !current.isLocked() && !current.hasQueuedThreads() ? null : current);
    }
}
