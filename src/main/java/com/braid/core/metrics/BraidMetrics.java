package com.braid.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for orchestration passes.
 */
@Service
public class BraidMetrics {

    private final MeterRegistry registry;

    public BraidMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSpawn(String provider) {
        Counter.builder("braid.agents.spawned")
                .tag("provider", provider == null ? "unknown" : provider)
                .register(registry)
                .increment();
    }

    public void recordSkip(String category) {
        Counter.builder("braid.agents.skipped")
                .description("Ready tasks that were not spawned in a pass")
                .tag("reason", category)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "completed" or "failed"
     */
    public void recordReconciliation(String outcome) {
        Counter.builder("braid.agents.reconciled")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordRunningAgents(int count) {
        DistributionSummary.builder("braid.agents.running")
                .description("Agents still running after a reconciliation pass")
                .register(registry)
                .record(count);
    }

    public void recordMerge(boolean success) {
        Counter.builder("braid.merges.total")
                .tag("result", success ? "merged" : "failed")
                .register(registry)
                .increment();
    }

    public void recordMergeConflict() {
        Counter.builder("braid.merges.conflicts")
                .description("Merge conflicts while merging reviewed branches")
                .register(registry)
                .increment();
    }

    /**
     * Records worktree lifecycle operations.
     *
     * @param operation "provision", "rollback", "destroy" or "stale_cleanup"
     * @param success   whether the operation succeeded
     */
    public void recordWorktreeOperation(String operation, boolean success) {
        Counter.builder("braid.worktree.operations")
                .description("Git worktree lifecycle operations")
                .tag("operation", operation)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordPassDuration(String pass, long ms) {
        Timer.builder("braid.pass.duration")
                .tag("pass", pass)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
