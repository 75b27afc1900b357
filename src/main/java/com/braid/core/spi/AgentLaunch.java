package com.braid.core.spi;

import com.braid.core.model.ExecutionMode;

import java.nio.file.Path;

/**
 * Everything an {@link AgentRunner} needs to start a worker inside a worktree.
 *
 * @param parentSessionId  the orchestrating session
 * @param projectId        project the task belongs to
 * @param taskId           task the worker should complete
 * @param worktreeId       worktree the worker owns
 * @param workingDirectory the worktree path; the worker's cwd
 * @param prompt           initial instructions
 * @param provider         agent CLI / LLM provider, e.g. "claude"
 * @param model            model override (nullable)
 * @param mode             terminal, headless or embedded
 * @param terminal         terminal emulator for terminal mode ("auto" to detect)
 * @param workflow         workflow the worker session should activate (nullable)
 */
public record AgentLaunch(
    String parentSessionId,
    String projectId,
    String taskId,
    String worktreeId,
    Path workingDirectory,
    String prompt,
    String provider,
    String model,
    ExecutionMode mode,
    String terminal,
    String workflow
) {
}
