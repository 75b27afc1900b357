package com.braid.core.engine;

import com.braid.core.model.CompletedAgentRecord;
import com.braid.core.model.FailedAgentRecord;
import com.braid.core.model.SpawnedAgentRecord;
import com.braid.core.state.OrchestrationState;

import java.util.List;

/**
 * Result of classifying every spawned agent of a state: the state to store and
 * what moved.
 */
public record Reconciliation(
    OrchestrationState state,
    List<CompletedAgentRecord> newlyCompleted,
    List<FailedAgentRecord> newlyFailed,
    List<SpawnedAgentRecord> stillRunning
) {

    public boolean changed() {
        return !newlyCompleted.isEmpty() || !newlyFailed.isEmpty();
    }
}
