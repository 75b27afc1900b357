package com.braid.agent;

import com.braid.core.spi.AgentLaunch;
import com.braid.core.spi.AgentRunner;
import com.braid.core.spi.RunningAgent;
import com.braid.core.spi.SpawnPermission;
import com.braid.core.spi.SpawnResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link AgentRunner} that starts each agent as a detached local process.
 *
 * <p>The command is a template, one argument per entry, with placeholders
 * {@code {provider}}, {@code {model}}, {@code {prompt_file}}, {@code {session_id}},
 * {@code {task_id}} and {@code {workflow}}. The process runs in the worktree with
 * {@code BRAID_*} environment variables identifying its session and task; its output
 * goes to a log file next to the prompt file. Every mode runs headless.
 *
 * <p>Liveness is answered from the {@link Process} handles this runner started,
 * so agents launched before a restart are reported as not running. Handles are
 * dropped as soon as their process exits.
 */
public class ProcessAgentRunner implements AgentRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessAgentRunner.class);

    private final List<String> commandTemplate;
    private final int maxAgentDepth;
    private final Path runDir;

    private final ConcurrentHashMap<String, Process> processes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RunningAgent> agents = new ConcurrentHashMap<>();
    /** Spawn depth of each session this runner started; unknown sessions are roots (depth 0). */
    private final ConcurrentHashMap<String, Integer> depths = new ConcurrentHashMap<>();

    public ProcessAgentRunner(List<String> commandTemplate, int maxAgentDepth, Path runDir) {
        if (commandTemplate == null || commandTemplate.isEmpty()) {
            throw new IllegalArgumentException("Agent command template must not be empty");
        }
        this.commandTemplate = List.copyOf(commandTemplate);
        this.maxAgentDepth = maxAgentDepth;
        this.runDir = runDir;
    }

    @Override
    public SpawnPermission canSpawn(String parentSessionId) {
        int childDepth = depths.getOrDefault(parentSessionId, 0) + 1;
        if (childDepth > maxAgentDepth) {
            return SpawnPermission.deny("Max agent depth (" + maxAgentDepth + ") exceeded", childDepth);
        }
        return SpawnPermission.allow(childDepth);
    }

    @Override
    public SpawnResult spawn(AgentLaunch launch) {
        String sessionId = "agent-" + UUID.randomUUID();
        String runId = "run-" + UUID.randomUUID().toString().substring(0, 8);

        try {
            Files.createDirectories(runDir);
            Path promptFile = runDir.resolve(sessionId + ".prompt.md");
            Path logFile = runDir.resolve(sessionId + ".log");
            Files.writeString(promptFile, launch.prompt(), StandardCharsets.UTF_8);

            var command = expand(launch, sessionId, promptFile);
            var builder = new ProcessBuilder(command)
                    .directory(launch.workingDirectory().toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(logFile.toFile());
            Map<String, String> env = builder.environment();
            env.put("BRAID_SESSION_ID", sessionId);
            env.put("BRAID_PARENT_SESSION_ID", launch.parentSessionId());
            env.put("BRAID_TASK_ID", launch.taskId());
            env.put("BRAID_WORKTREE_ID", launch.worktreeId());
            if (launch.projectId() != null) {
                env.put("BRAID_PROJECT_ID", launch.projectId());
            }

            log.debug("Starting agent {} in {} ({} mode requested)", sessionId, launch.workingDirectory(),
                    launch.mode() == null ? "default" : launch.mode().value());
            Process process = builder.start();

            processes.put(sessionId, process);
            agents.put(sessionId, new RunningAgent(sessionId, runId, process.pid(), Instant.now()));
            depths.put(sessionId, depths.getOrDefault(launch.parentSessionId(), 0) + 1);
            process.onExit().thenRun(() -> {
                log.info("Agent {} exited with code {}", sessionId, process.exitValue());
                forget(sessionId);
            });

            return SpawnResult.started(sessionId, runId, process.pid());
        } catch (IOException e) {
            log.error("Failed to start agent for task {}", launch.taskId(), e);
            return SpawnResult.failed("Failed to start agent process: " + e.getMessage());
        }
    }

    @Override
    public Optional<RunningAgent> getRunning(String sessionId) {
        Process process = processes.get(sessionId);
        if (process == null || !process.isAlive()) {
            return Optional.empty();
        }
        return Optional.ofNullable(agents.get(sessionId));
    }

    private void forget(String sessionId) {
        processes.remove(sessionId);
        agents.remove(sessionId);
        depths.remove(sessionId);
    }

    /** Agents started by this runner that have not exited yet. */
    int trackedAgents() {
        return processes.size();
    }

    List<String> expand(AgentLaunch launch, String sessionId, Path promptFile) {
        var command = new ArrayList<String>(commandTemplate.size());
        for (String arg : commandTemplate) {
            command.add(arg
                    .replace("{provider}", nullToEmpty(launch.provider()))
                    .replace("{model}", nullToEmpty(launch.model()))
                    .replace("{prompt_file}", promptFile.toString())
                    .replace("{session_id}", sessionId)
                    .replace("{task_id}", nullToEmpty(launch.taskId()))
                    .replace("{workflow}", nullToEmpty(launch.workflow())));
        }
        return command;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
