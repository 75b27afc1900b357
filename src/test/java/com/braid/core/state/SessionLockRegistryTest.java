package com.braid.core.state;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class SessionLockRegistryTest {

    private final SessionLockRegistry registry = new SessionLockRegistry();

    @Test
    @DisplayName("A session's lock is dropped once nobody holds it")
    void idleLocksAreDropped() {
        registry.withLock("S1", () -> assertEquals(1, registry.size()));
        registry.withLock("S2", () -> assertTrue(registry.isHeldByCurrentThread("S2")));

        assertEquals(0, registry.size());
        assertFalse(registry.isHeldByCurrentThread("S1"));
    }

    @Test
    @DisplayName("Nested use keeps the lock until the outermost holder leaves")
    void reentrant() {
        registry.withLock("S1", () -> {
            registry.withLock("S1", () -> assertTrue(registry.isHeldByCurrentThread("S1")));
            assertTrue(registry.isHeldByCurrentThread("S1"));
            assertEquals(1, registry.size());
        });

        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("Threads of one session never run their actions at the same time")
    void mutualExclusion() throws InterruptedException {
        var inside = new AtomicBoolean();
        var overlap = new AtomicBoolean();
        int[] counter = {0};
        var workers = new ArrayList<Thread>();
        for (int i = 0; i < 8; i++) {
            workers.add(new Thread(() -> {
                for (int n = 0; n < 500; n++) {
                    registry.withLock("S1", () -> {
                        if (!inside.compareAndSet(false, true)) {
                            overlap.set(true);
                        }
                        counter[0]++;
                        inside.set(false);
                    });
                }
            }));
        }
        workers.forEach(Thread::start);
        for (Thread worker : workers) {
            worker.join();
        }

        assertFalse(overlap.get());
        assertEquals(4000, counter[0]);
        assertEquals(0, registry.size());
    }
}
