package com.braid.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "braid")
public class BraidProperties {

    private Orchestration orchestration = new Orchestration();
    private Worktree worktree = new Worktree();
    private Git git = new Git();
    private Merge merge = new Merge();
    private Agent agent = new Agent();
    private Wait wait = new Wait();
    private State state = new State();

    public Orchestration getOrchestration() { return orchestration; }
    public void setOrchestration(Orchestration orchestration) { this.orchestration = orchestration; }
    public Worktree getWorktree() { return worktree; }
    public void setWorktree(Worktree worktree) { this.worktree = worktree; }
    public Git getGit() { return git; }
    public void setGit(Git git) { this.git = git; }
    public Merge getMerge() { return merge; }
    public void setMerge(Merge merge) { this.merge = merge; }
    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }
    public Wait getWait() { return wait; }
    public void setWait(Wait wait) { this.wait = wait; }
    public State getState() { return state; }
    public void setState(State state) { this.state = state; }

    public static class Orchestration {
        private int maxConcurrent = 3;
        private String mode = "terminal";
        private String provider = "gemini";
        private String workflow = "auto-task";
        private int spawnParallelism = 4;

        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }
        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }
        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getWorkflow() { return workflow; }
        public void setWorkflow(String workflow) { this.workflow = workflow; }
        public int getSpawnParallelism() { return spawnParallelism; }
        public void setSpawnParallelism(int spawnParallelism) { this.spawnParallelism = spawnParallelism; }
    }

    public static class Worktree {
        /** Root directory for worktrees; empty means {@code <tmpdir>/braid-worktrees}. */
        private String baseDir = "";
        private String branchPrefix = "task/";
        private String projectConfigFile = ".braid/project.json";

        public String getBaseDir() { return baseDir; }
        public void setBaseDir(String baseDir) { this.baseDir = baseDir; }
        public String getBranchPrefix() { return branchPrefix; }
        public void setBranchPrefix(String branchPrefix) { this.branchPrefix = branchPrefix; }
        public String getProjectConfigFile() { return projectConfigFile; }
        public void setProjectConfigFile(String projectConfigFile) { this.projectConfigFile = projectConfigFile; }
    }

    public static class Git {
        /** Repository the worktrees are created from; empty means the working directory. */
        private String repoPath = "";
        private String remote = "origin";
        private int commandTimeoutSeconds = 120;

        public String getRepoPath() { return repoPath; }
        public void setRepoPath(String repoPath) { this.repoPath = repoPath; }
        public String getRemote() { return remote; }
        public void setRemote(String remote) { this.remote = remote; }
        public int getCommandTimeoutSeconds() { return commandTimeoutSeconds; }
        public void setCommandTimeoutSeconds(int commandTimeoutSeconds) { this.commandTimeoutSeconds = commandTimeoutSeconds; }
    }

    public static class Merge {
        private boolean push = true;
        private boolean deleteBranches = false;

        public boolean isPush() { return push; }
        public void setPush(boolean push) { this.push = push; }
        public boolean isDeleteBranches() { return deleteBranches; }
        public void setDeleteBranches(boolean deleteBranches) { this.deleteBranches = deleteBranches; }
    }

    public static class Agent {
        /**
         * Command used by the local process runner, one argument per entry.
         * Placeholders: {provider}, {model}, {prompt_file}, {session_id}, {task_id}, {workflow}.
         * Empty disables the local runner.
         */
        private List<String> command = new ArrayList<>();
        private int maxAgentDepth = 3;

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public int getMaxAgentDepth() { return maxAgentDepth; }
        public void setMaxAgentDepth(int maxAgentDepth) { this.maxAgentDepth = maxAgentDepth; }
    }

    public static class Wait {
        private int defaultTimeoutSeconds = 600;
        private int defaultPollIntervalSeconds = 10;

        public int getDefaultTimeoutSeconds() { return defaultTimeoutSeconds; }
        public void setDefaultTimeoutSeconds(int defaultTimeoutSeconds) { this.defaultTimeoutSeconds = defaultTimeoutSeconds; }
        public int getDefaultPollIntervalSeconds() { return defaultPollIntervalSeconds; }
        public void setDefaultPollIntervalSeconds(int defaultPollIntervalSeconds) { this.defaultPollIntervalSeconds = defaultPollIntervalSeconds; }
    }

    public static class State {
        /** "memory" or "jdbc"; jdbc also requires a DataSource. */
        private String store = "jdbc";

        public String getStore() { return store; }
        public void setStore(String store) { this.store = store; }
    }
}
