package com.braid.core.engine;

/**
 * Parameters of one {@link OrchestrationEngine#orchestrateReadyTasks} pass.
 * Null fields fall back to the configured {@code braid.orchestration.*} defaults.
 *
 * @param parentTaskId    root of the task tree to orchestrate
 * @param parentSessionId orchestrating session owning the state document
 * @param maxConcurrent   cap on simultaneously running agents
 * @param mode            terminal, headless or embedded
 * @param provider        default provider
 * @param model           default model
 * @param codingProvider  explicit provider override
 * @param codingModel     explicit model override
 * @param terminal        terminal for terminal mode; "auto" defers to the session
 * @param workflow        workflow activated in each agent session
 * @param projectId       project of the worktree records
 * @param baseBranch      branch new worktrees start from
 * @param dryRun          plan only, change nothing
 */
public record OrchestrationRequest(
    String parentTaskId,
    String parentSessionId,
    Integer maxConcurrent,
    String mode,
    String provider,
    String model,
    String codingProvider,
    String codingModel,
    String terminal,
    String workflow,
    String projectId,
    String baseBranch,
    boolean dryRun
) {

    public static Builder builder(String parentTaskId, String parentSessionId) {
        return new Builder(parentTaskId, parentSessionId);
    }

    public static final class Builder {
        private final String parentTaskId;
        private final String parentSessionId;
        private Integer maxConcurrent;
        private String mode;
        private String provider;
        private String model;
        private String codingProvider;
        private String codingModel;
        private String terminal = "auto";
        private String workflow;
        private String projectId;
        private String baseBranch;
        private boolean dryRun;

        private Builder(String parentTaskId, String parentSessionId) {
            this.parentTaskId = parentTaskId;
            this.parentSessionId = parentSessionId;
        }

        public Builder maxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; return this; }
        public Builder mode(String mode) { this.mode = mode; return this; }
        public Builder provider(String provider) { this.provider = provider; return this; }
        public Builder model(String model) { this.model = model; return this; }
        public Builder codingProvider(String codingProvider) { this.codingProvider = codingProvider; return this; }
        public Builder codingModel(String codingModel) { this.codingModel = codingModel; return this; }
        public Builder terminal(String terminal) { this.terminal = terminal; return this; }
        public Builder workflow(String workflow) { this.workflow = workflow; return this; }
        public Builder projectId(String projectId) { this.projectId = projectId; return this; }
        public Builder baseBranch(String baseBranch) { this.baseBranch = baseBranch; return this; }
        public Builder dryRun(boolean dryRun) { this.dryRun = dryRun; return this; }

        public OrchestrationRequest build() {
            return new OrchestrationRequest(parentTaskId, parentSessionId, maxConcurrent, mode, provider, model,
                    codingProvider, codingModel, terminal, workflow, projectId, baseBranch, dryRun);
        }
    }
}
