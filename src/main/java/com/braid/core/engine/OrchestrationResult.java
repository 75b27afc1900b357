package com.braid.core.engine;

import com.braid.core.model.SpawnedAgentRecord;

import java.util.List;

/**
 * Outcome of one orchestration pass. Every ready task appears in exactly one of
 * {@code spawned}, {@code skipped} or (on a dry run) {@code planned}.
 */
public record OrchestrationResult(
    String parentTaskId,
    List<SpawnedAgentRecord> spawned,
    List<SkippedTask> skipped,
    List<PlannedTask> planned,
    boolean dryRun,
    String message
) {

    public OrchestrationResult {
        spawned = List.copyOf(spawned);
        skipped = List.copyOf(skipped);
        planned = List.copyOf(planned);
    }

    public int spawnedCount() {
        return spawned.size();
    }

    public int skippedCount() {
        return skipped.size();
    }
}
