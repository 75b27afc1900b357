package com.braid.agent;

import com.braid.core.model.ExecutionMode;

/**
 * Launch settings shared by every agent of one orchestration pass.
 *
 * @param parentSessionId orchestrating session
 * @param projectId       project of the tasks (nullable)
 * @param provider        effective provider
 * @param model           effective model (nullable)
 * @param mode            execution mode
 * @param terminal        effective terminal, "auto" to detect
 * @param workflow        workflow the agents activate (nullable)
 */
public record SpawnRequest(
    String parentSessionId,
    String projectId,
    String provider,
    String model,
    ExecutionMode mode,
    String terminal,
    String workflow
) {
}
