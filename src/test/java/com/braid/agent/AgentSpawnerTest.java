package com.braid.agent;

import com.braid.core.metrics.BraidMetrics;
import com.braid.core.model.ExecutionMode;
import com.braid.core.model.Task;
import com.braid.core.model.Worktree;
import com.braid.core.model.WorktreeStatus;
import com.braid.core.spi.AgentLaunch;
import com.braid.core.spi.AgentRunner;
import com.braid.core.spi.SpawnPermission;
import com.braid.core.spi.SpawnResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Instant;

import static com.braid.support.InMemoryTaskStore.task;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentSpawnerTest {

    @Mock
    private AgentRunner runner;

    private SimpleMeterRegistry registry;
    private AgentSpawner spawner;
    private Worktree worktree;
    private SpawnRequest request;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        spawner = new AgentSpawner(runner, new BraidMetrics(registry));
        worktree = new Worktree("wt-1", "proj", "task/T1", "/tmp/wt/task-T1", "main", "T1", null,
                WorktreeStatus.ACTIVE, Instant.EPOCH, Instant.EPOCH);
        request = new SpawnRequest("S1", "proj", "claude", "opus", ExecutionMode.HEADLESS, "auto", "auto-task");
    }

    @Test
    @DisplayName("Launch carries the worktree, prompt and resolved settings")
    void launch() {
        when(runner.spawn(any())).thenReturn(SpawnResult.started("agent-1", "run-1", 77L));
        Task task = task("T1", "P");

        SpawnResult result = spawner.spawn(worktree, task, request);

        assertTrue(result.success());
        var captor = ArgumentCaptor.forClass(AgentLaunch.class);
        verify(runner).spawn(captor.capture());
        AgentLaunch launch = captor.getValue();
        assertEquals("S1", launch.parentSessionId());
        assertEquals("wt-1", launch.worktreeId());
        assertEquals(Path.of("/tmp/wt/task-T1"), launch.workingDirectory());
        assertEquals("claude", launch.provider());
        assertEquals("opus", launch.model());
        assertEquals(ExecutionMode.HEADLESS, launch.mode());
        assertEquals(TaskPromptBuilder.build(task), launch.prompt());
        assertEquals(1.0, registry.find("braid.agents.spawned").tag("provider", "claude").counter().count());
    }

    @Test
    @DisplayName("Runner exceptions become failed results")
    void runnerThrows() {
        when(runner.spawn(any())).thenThrow(new IllegalStateException("boom"));

        SpawnResult result = spawner.spawn(worktree, task("T1", "P"), request);

        assertFalse(result.success());
        assertEquals("boom", result.error());
    }

    @Test
    @DisplayName("A result without a session id is a failure")
    void noSessionId() {
        when(runner.spawn(any())).thenReturn(SpawnResult.started(" ", "run-1", null));

        SpawnResult result = spawner.spawn(worktree, task("T1", "P"), request);

        assertFalse(result.success());
        assertEquals("Agent runner returned no session id", result.error());
        assertNull(registry.find("braid.agents.spawned").counter());
    }

    @Test
    @DisplayName("Failed runner results keep their error, or report unknown")
    void failedResult() {
        when(runner.spawn(any())).thenReturn(SpawnResult.failed("no terminal"), (SpawnResult) null);

        assertEquals("no terminal", spawner.spawn(worktree, task("T1", "P"), request).error());
        assertEquals("unknown error", spawner.spawn(worktree, task("T1", "P"), request).error());
    }

    @Test
    @DisplayName("Permission check exceptions deny the spawn")
    void permissionThrows() {
        when(runner.canSpawn("S1")).thenThrow(new IllegalStateException("db down"));

        SpawnPermission permission = spawner.checkPermission("S1");

        assertFalse(permission.allowed());
        assertEquals("Spawn check failed: db down", permission.reason());
    }

    @Test
    @DisplayName("No runner means not configured")
    void notConfigured() {
        assertFalse(new AgentSpawner(null, new BraidMetrics(registry)).isConfigured());
        assertTrue(spawner.isConfigured());
    }
}
