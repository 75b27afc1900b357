package com.braid.core.engine;

import com.braid.core.model.CompletedAgentRecord;
import com.braid.core.model.FailedAgentRecord;
import com.braid.core.model.SpawnedAgentRecord;

import java.util.List;

/**
 * Outcome of one reconciliation pass.
 *
 * @param newlyCompleted agents moved to completed by this pass
 * @param newlyFailed    agents moved to failed by this pass
 * @param stillRunning   agents left in spawned
 * @param allDone        true when no agent is left in spawned
 * @param summary        list sizes after the pass
 */
public record PollResult(
    List<CompletedAgentRecord> newlyCompleted,
    List<FailedAgentRecord> newlyFailed,
    List<SpawnedAgentRecord> stillRunning,
    boolean allDone,
    Summary summary
) {

    public PollResult {
        newlyCompleted = List.copyOf(newlyCompleted);
        newlyFailed = List.copyOf(newlyFailed);
        stillRunning = List.copyOf(stillRunning);
    }

    public record Summary(int running, int completed, int failed) {
    }
}
