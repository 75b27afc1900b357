package com.braid.core.state;

import com.braid.core.model.CleanupSummary;
import com.braid.core.model.CompletedAgentRecord;
import com.braid.core.model.FailedAgentRecord;
import com.braid.core.model.ReviewedAgentRecord;
import com.braid.core.model.SpawnedAgentRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of one orchestrating session's progress: the four agent
 * lists plus cleanup history. Mutators return a new snapshot; nothing is written
 * until the snapshot is handed back to {@link OrchestrationStateStore}.
 *
 * @param sessionId      the orchestrating session
 * @param version        store version this snapshot was read at
 * @param spawned        agents launched and not yet classified
 * @param completed      agents whose task closed
 * @param failed         agents classified as failed
 * @param reviewed       approved agents waiting for merge
 * @param cleanupHistory one summary per cleanup call
 * @param variables      the session's other workflow variables, read-only
 */
public record OrchestrationState(
    String sessionId,
    long version,
    List<SpawnedAgentRecord> spawned,
    List<CompletedAgentRecord> completed,
    List<FailedAgentRecord> failed,
    List<ReviewedAgentRecord> reviewed,
    List<CleanupSummary> cleanupHistory,
    Map<String, Object> variables
) {

    public OrchestrationState {
        spawned = copy(spawned);
        completed = copy(completed);
        failed = copy(failed);
        reviewed = copy(reviewed);
        cleanupHistory = copy(cleanupHistory);
        variables = variables == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public static OrchestrationState empty(String sessionId) {
        return new OrchestrationState(sessionId, 0L, List.of(), List.of(), List.of(), List.of(), List.of(), Map.of());
    }

    public OrchestrationState withSpawned(List<SpawnedAgentRecord> newSpawned) {
        return new OrchestrationState(sessionId, version, newSpawned, completed, failed, reviewed, cleanupHistory, variables);
    }

    public OrchestrationState appendSpawned(SpawnedAgentRecord record) {
        return withSpawned(append(spawned, record));
    }

    public OrchestrationState appendCompleted(List<CompletedAgentRecord> records) {
        return new OrchestrationState(sessionId, version, spawned, concat(completed, records), failed, reviewed,
                cleanupHistory, variables);
    }

    public OrchestrationState appendFailed(List<FailedAgentRecord> records) {
        return new OrchestrationState(sessionId, version, spawned, completed, concat(failed, records), reviewed,
                cleanupHistory, variables);
    }

    public OrchestrationState withCompleted(List<CompletedAgentRecord> newCompleted) {
        return new OrchestrationState(sessionId, version, spawned, newCompleted, failed, reviewed, cleanupHistory, variables);
    }

    public OrchestrationState withReviewed(List<ReviewedAgentRecord> newReviewed) {
        return new OrchestrationState(sessionId, version, spawned, completed, failed, newReviewed, cleanupHistory, variables);
    }

    public OrchestrationState appendCleanup(CleanupSummary summary) {
        return new OrchestrationState(sessionId, version, spawned, completed, failed, reviewed,
                append(cleanupHistory, summary), variables);
    }

    OrchestrationState withVersion(long newVersion) {
        return new OrchestrationState(sessionId, newVersion, spawned, completed, failed, reviewed, cleanupHistory, variables);
    }

    /**
     * A non-blank string workflow variable, e.g. {@code coding_provider}.
     */
    public Optional<String> variable(String name) {
        Object value = variables.get(name);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString();
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    private static <T> List<T> append(List<T> list, T item) {
        var result = new ArrayList<>(list);
        result.add(item);
        return result;
    }

    private static <T> List<T> concat(List<T> list, List<T> more) {
        var result = new ArrayList<>(list);
        result.addAll(more);
        return result;
    }
}
