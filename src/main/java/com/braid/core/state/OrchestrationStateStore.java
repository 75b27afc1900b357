package com.braid.core.state;

import com.braid.core.model.CleanupSummary;
import com.braid.core.model.CompletedAgentRecord;
import com.braid.core.model.FailedAgentRecord;
import com.braid.core.model.ReviewedAgentRecord;
import com.braid.core.model.SpawnedAgentRecord;
import com.braid.core.spi.SessionVariableStore;
import com.braid.core.spi.SessionVariables;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Maps an {@link OrchestrationState} onto the hosting session's variable document.
 * <p>
 * The four agent lists and the cleanup history live under well-known keys with
 * snake_case entry fields, so the document stays readable by workflow rules that
 * inspect it. All other session variables are carried through untouched.
 * <p>
 * Every write is a read-modify-write under the session's lock from
 * {@link SessionLockRegistry}. Writes that lose an optimistic version race
 * against another writer of the document are re-read and re-applied.
 */
public class OrchestrationStateStore {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationStateStore.class);

    public static final String SPAWNED_AGENTS = "spawned_agents";
    public static final String COMPLETED_AGENTS = "completed_agents";
    public static final String FAILED_AGENTS = "failed_agents";
    public static final String REVIEWED_AGENTS = "reviewed_agents";
    public static final String CLEANUP_HISTORY = "cleanup_history";

    /** Read-modify-write attempts before a version conflict is given up on. */
    static final int MAX_UPDATE_ATTEMPTS = 3;

    private static final Set<String> STATE_KEYS = Set.of(
            SPAWNED_AGENTS, COMPLETED_AGENTS, FAILED_AGENTS, REVIEWED_AGENTS, CLEANUP_HISTORY);

    private final SessionVariableStore variableStore;
    private final SessionLockRegistry locks;
    private final ObjectMapper objectMapper;

    public OrchestrationStateStore(SessionVariableStore variableStore, SessionLockRegistry locks) {
        this.variableStore = Objects.requireNonNull(variableStore, "SessionVariableStore must not be null");
        this.locks = Objects.requireNonNull(locks, "SessionLockRegistry must not be null");
        this.objectMapper = stateMapper();
    }

    static ObjectMapper stateMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public SessionLockRegistry locks() {
        return locks;
    }

    /**
     * Reads the current state; an empty state when the session has no document yet.
     */
    public OrchestrationState load(String sessionId) {
        return locks.withLock(sessionId, () -> variableStore.get(sessionId)
                .map(this::toState)
                .orElseGet(() -> OrchestrationState.empty(sessionId)));
    }

    /**
     * Applies {@code mutation} to the freshly read state and saves the result.
     * Nothing is written when the mutation returns an equal state.
     *
     * @return the state as stored after the call
     */
    public OrchestrationState update(String sessionId, UnaryOperator<OrchestrationState> mutation) {
        return locks.withLock(sessionId, () -> {
            for (int attempt = 1; ; attempt++) {
                OrchestrationState current = load(sessionId);
                OrchestrationState next = mutation.apply(current);
                if (next == null || next.equals(current)) {
                    return current;
                }
                try {
                    return save(next);
                } catch (ConcurrentStateModificationException e) {
                    if (attempt >= MAX_UPDATE_ATTEMPTS) {
                        throw e;
                    }
                    log.warn("State of session {} changed underneath us (attempt {}/{}), re-reading",
                            sessionId, attempt, MAX_UPDATE_ATTEMPTS);
                }
            }
        });
    }

    private OrchestrationState save(OrchestrationState state) {
        Map<String, Object> variables = new LinkedHashMap<>(state.variables());
        try {
            variables.put(SPAWNED_AGENTS, toJson(state.spawned()));
            variables.put(COMPLETED_AGENTS, toJson(state.completed()));
            variables.put(FAILED_AGENTS, toJson(state.failed()));
            variables.put(REVIEWED_AGENTS, toJson(state.reviewed()));
            variables.put(CLEANUP_HISTORY, toJson(state.cleanupHistory()));
        } catch (IllegalArgumentException e) {
            throw new StateStoreException("Failed to serialize orchestration state for session " + state.sessionId(), e);
        }

        SessionVariables saved = variableStore.save(
                new SessionVariables(state.sessionId(), state.version(), variables));
        log.debug("Saved orchestration state for session {} at version {} (spawned={}, completed={}, failed={}, reviewed={})",
                state.sessionId(), saved.version(), state.spawned().size(), state.completed().size(),
                state.failed().size(), state.reviewed().size());
        return state.withVersion(saved.version());
    }

    private OrchestrationState toState(SessionVariables document) {
        Map<String, Object> raw = document.variables();
        Map<String, Object> others = new LinkedHashMap<>();
        raw.forEach((key, value) -> {
            if (!STATE_KEYS.contains(key)) {
                others.put(key, value);
            }
        });

        return new OrchestrationState(
                document.sessionId(),
                document.version(),
                readSpawned(document.sessionId(), raw.get(SPAWNED_AGENTS)),
                readList(document.sessionId(), raw.get(COMPLETED_AGENTS), new TypeReference<CompletedAgentRecord>() {}),
                readList(document.sessionId(), raw.get(FAILED_AGENTS), new TypeReference<FailedAgentRecord>() {}),
                readList(document.sessionId(), raw.get(REVIEWED_AGENTS), new TypeReference<ReviewedAgentRecord>() {}),
                readList(document.sessionId(), raw.get(CLEANUP_HISTORY), new TypeReference<CleanupSummary>() {}),
                others);
    }

    /**
     * Unreadable spawned entries are kept as records without a session id so
     * reconciliation moves them to failed instead of dropping them.
     */
    private List<SpawnedAgentRecord> readSpawned(String sessionId, Object raw) {
        List<SpawnedAgentRecord> records = new ArrayList<>();
        for (Object entry : entries(sessionId, SPAWNED_AGENTS, raw)) {
            if (entry == null) {
                continue;
            }
            try {
                records.add(objectMapper.convertValue(entry, SpawnedAgentRecord.class));
            } catch (IllegalArgumentException e) {
                log.warn("Unreadable spawned agent entry in session {}: {}", sessionId, e.getMessage());
                records.add(SpawnedAgentRecord.of(null, taskIdOf(entry), null));
            }
        }
        return records;
    }

    private <T> List<T> readList(String sessionId, Object raw, TypeReference<T> type) {
        List<T> records = new ArrayList<>();
        for (Object entry : entries(sessionId, type.getType().getTypeName(), raw)) {
            if (entry == null) {
                continue;
            }
            try {
                records.add(objectMapper.convertValue(entry, type));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping unreadable {} entry in session {}: {}",
                        type.getType().getTypeName(), sessionId, e.getMessage());
            }
        }
        return records;
    }

    private List<?> entries(String sessionId, String key, Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof List<?> list) {
            return list;
        }
        log.warn("Expected a list under '{}' in session {} but found {}", key, sessionId, raw.getClass().getSimpleName());
        return List.of();
    }

    private Object toJson(List<?> records) {
        return objectMapper.convertValue(records, new TypeReference<List<Map<String, Object>>>() {});
    }

    private static String taskIdOf(Object entry) {
        if (entry instanceof Map<?, ?> map && map.get("task_id") != null) {
            return map.get("task_id").toString();
        }
        return null;
    }
}
