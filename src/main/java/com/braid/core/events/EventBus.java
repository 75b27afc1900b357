package com.braid.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Delivers orchestration events to the hosting layer.
 * <p>
 * Subscribers register for one orchestrating session or for all of them. The bus
 * also keeps the last {@value #RECENT_EVENTS_PER_SESSION} events of every session,
 * so a host that polls instead of subscribing can still see why a task was skipped
 * or a merge failed.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    public static final int RECENT_EVENTS_PER_SESSION = 50;

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<BraidEvent>>> sessionSubscribers =
            new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Consumer<BraidEvent>> globalSubscribers = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<String, Deque<BraidEvent>> recent = new ConcurrentHashMap<>();

    /**
     * Records the event in its session's history, then hands it to the session's
     * subscribers followed by the global ones. A throwing subscriber does not stop
     * delivery to the rest.
     */
    public void publish(BraidEvent event) {
        log.debug("Publishing {} for session {} (task {})", event.eventType(), event.sessionId(), event.taskId());
        remember(event);

        List<Consumer<BraidEvent>> sessionSubs =
                event.sessionId() == null ? null : sessionSubscribers.get(event.sessionId());
        if (sessionSubs != null) {
            sessionSubs.forEach(subscriber -> deliver(subscriber, event));
        }
        globalSubscribers.forEach(subscriber -> deliver(subscriber, event));
    }

    public Subscription subscribe(String sessionId, Consumer<BraidEvent> consumer) {
        sessionSubscribers.compute(sessionId, (id, subs) -> {
            var list = subs == null ? new CopyOnWriteArrayList<Consumer<BraidEvent>>() : subs;
            list.add(consumer);
            return list;
        });
        return () -> sessionSubscribers.computeIfPresent(sessionId, (id, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    public Subscription subscribeAll(Consumer<BraidEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * The session's most recent events, oldest first.
     */
    public List<BraidEvent> recentEvents(String sessionId) {
        Deque<BraidEvent> events = recent.get(sessionId);
        if (events == null) {
            return List.of();
        }
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    /** Drops the session's history and subscribers. */
    public void forgetSession(String sessionId) {
        recent.remove(sessionId);
        sessionSubscribers.remove(sessionId);
    }

    boolean hasSessionSubscribers(String sessionId) {
        return sessionSubscribers.containsKey(sessionId);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void remember(BraidEvent event) {
        if (event.sessionId() == null) {
            return;
        }
        Deque<BraidEvent> events = recent.computeIfAbsent(event.sessionId(), id -> new ArrayDeque<>());
        synchronized (events) {
            events.addLast(event);
            while (events.size() > RECENT_EVENTS_PER_SESSION) {
                events.removeFirst();
            }
        }
    }

    private void deliver(Consumer<BraidEvent> subscriber, BraidEvent event) {
        try {
            subscriber.accept(event);
        } catch (RuntimeException e) {
            log.warn("Subscriber failed on {} for session {}: {}", event.eventType(), event.sessionId(),
                    e.getMessage(), e);
        }
    }
}
