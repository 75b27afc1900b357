package com.braid.agent;

import com.braid.core.metrics.BraidMetrics;
import com.braid.core.model.Task;
import com.braid.core.model.Worktree;
import com.braid.core.spi.AgentLaunch;
import com.braid.core.spi.AgentRunner;
import com.braid.core.spi.SpawnPermission;
import com.braid.core.spi.SpawnResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Launches one agent per task inside its worktree through the configured {@link AgentRunner}.
 * Runner exceptions and refusals come back as a failed {@link SpawnResult}, never thrown.
 */
public class AgentSpawner {

    private static final Logger log = LoggerFactory.getLogger(AgentSpawner.class);

    private final AgentRunner runner;
    private final BraidMetrics metrics;

    /**
     * @param runner the agent runner, or null when none is configured
     */
    public AgentSpawner(AgentRunner runner, BraidMetrics metrics) {
        this.runner = runner;
        this.metrics = metrics;
    }

    public boolean isConfigured() {
        return runner != null;
    }

    /** The configured runner, or null. */
    public AgentRunner runner() {
        return runner;
    }

    /**
     * Asks the runner whether the orchestrating session may start another agent (depth limit).
     */
    public SpawnPermission checkPermission(String parentSessionId) {
        try {
            return runner.canSpawn(parentSessionId);
        } catch (RuntimeException e) {
            log.warn("canSpawn check failed for session {}", parentSessionId, e);
            return SpawnPermission.deny("Spawn check failed: " + e.getMessage(), -1);
        }
    }

    public SpawnResult spawn(Worktree worktree, Task task, SpawnRequest request) {
        var launch = new AgentLaunch(
                request.parentSessionId(),
                request.projectId(),
                task.id(),
                worktree.id(),
                Path.of(worktree.worktreePath()),
                TaskPromptBuilder.build(task),
                request.provider(),
                request.model(),
                request.mode(),
                request.terminal(),
                request.workflow());

        SpawnResult result;
        try {
            result = runner.spawn(launch);
        } catch (RuntimeException e) {
            log.error("Agent runner threw while spawning task {}", task.id(), e);
            return SpawnResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        if (result == null || !result.success()) {
            String error = result == null || result.error() == null ? "unknown error" : result.error();
            log.warn("Failed to spawn agent for task {}: {}", task.id(), error);
            return SpawnResult.failed(error);
        }
        if (result.sessionId() == null || result.sessionId().isBlank()) {
            log.warn("Agent runner returned no session id for task {}", task.id());
            return SpawnResult.failed("Agent runner returned no session id");
        }

        metrics.recordSpawn(request.provider());
        log.info("Spawned agent {} for task {} in worktree {} (provider={}, mode={})",
                result.sessionId(), task.id(), worktree.id(), request.provider(), request.mode().value());
        return result;
    }
}
