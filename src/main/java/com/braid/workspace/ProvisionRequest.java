package com.braid.workspace;

/**
 * Per-pass inputs for provisioning a task's worktree.
 *
 * @param parentSessionId orchestrating session; serialises check-then-create
 * @param projectId       project the worktree record belongs to (nullable)
 * @param baseBranch      explicit base branch (nullable: detected default, then "main")
 * @param provider        provider whose integration hooks are installed (nullable)
 */
public record ProvisionRequest(String parentSessionId, String projectId, String baseBranch, String provider) {
}
