package com.braid.config;

import com.braid.agent.AgentSpawner;
import com.braid.agent.ProcessAgentRunner;
import com.braid.core.engine.MergeCoordinator;
import com.braid.core.engine.OrchestrationEngine;
import com.braid.core.engine.Sleeper;
import com.braid.core.engine.StatusReconciler;
import com.braid.core.engine.WaitCoordinator;
import com.braid.core.events.EventBus;
import com.braid.core.metrics.BraidMetrics;
import com.braid.core.scheduler.TaskGraphResolver;
import com.braid.core.spi.AgentRunner;
import com.braid.core.spi.GitOperations;
import com.braid.core.spi.SessionVariableStore;
import com.braid.core.spi.TaskStore;
import com.braid.core.spi.WorktreeStore;
import com.braid.core.state.OrchestrationStateStore;
import com.braid.core.state.SessionLockRegistry;
import com.braid.workspace.GitCliOperations;
import com.braid.workspace.WorkspaceInitializer;
import com.braid.workspace.WorktreeProvisioner;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Assembles the orchestration engine. A host imports this configuration and
 * supplies a {@link TaskStore}; every other collaborator has a reference
 * implementation that a host bean of the same type replaces.
 */
@Configuration
@EnableConfigurationProperties
@ComponentScan(basePackages = "com.braid")
public class BraidConfig {

    private static final Logger log = LoggerFactory.getLogger(BraidConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock braidClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return Sleeper.threadSleeper();
    }

    @Bean
    public SessionLockRegistry sessionLockRegistry() {
        return new SessionLockRegistry();
    }

    @Bean
    public OrchestrationStateStore orchestrationStateStore(SessionVariableStore variableStore,
                                                           SessionLockRegistry locks) {
        return new OrchestrationStateStore(variableStore, locks);
    }

    @Bean
    @ConditionalOnMissingBean
    public GitOperations gitOperations(BraidProperties properties) {
        String repoPath = properties.getGit().getRepoPath();
        Path repo = repoPath == null || repoPath.isBlank() ? Path.of("").toAbsolutePath() : Path.of(repoPath);
        log.info("Using git repository at {}", repo);
        return new GitCliOperations(repo, properties.getGit().getRemote(),
                properties.getGit().getCommandTimeoutSeconds());
    }

    @Bean
    public WorkspaceInitializer workspaceInitializer(GitOperations git, BraidProperties properties,
                                                     ObjectProvider<ObjectMapper> objectMapper) {
        return new WorkspaceInitializer(git.repoPath(), properties.getWorktree().getProjectConfigFile(),
                objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    public WorktreeProvisioner worktreeProvisioner(WorktreeStore worktreeStore, GitOperations git,
                                                   WorkspaceInitializer initializer, SessionLockRegistry locks,
                                                   BraidMetrics metrics, BraidProperties properties, Clock clock) {
        String baseDir = properties.getWorktree().getBaseDir();
        Path base = baseDir == null || baseDir.isBlank()
                ? Path.of(System.getProperty("java.io.tmpdir"), "braid-worktrees")
                : Path.of(baseDir);
        return new WorktreeProvisioner(worktreeStore, git, initializer, locks, metrics, base,
                properties.getWorktree().getBranchPrefix(), clock);
    }

    /**
     * Uses the host's {@link AgentRunner} when there is one, else a local process
     * runner when {@code braid.agent.command} is set. Without either, orchestration
     * calls fail with a configuration error.
     */
    @Bean
    public AgentSpawner agentSpawner(ObjectProvider<AgentRunner> agentRunner, BraidProperties properties,
                                     BraidMetrics metrics) {
        AgentRunner runner = agentRunner.getIfAvailable(() -> {
            var agent = properties.getAgent();
            if (agent.getCommand() == null || agent.getCommand().isEmpty()) {
                log.warn("No agent runner configured; set braid.agent.command or provide an AgentRunner bean");
                return null;
            }
            return new ProcessAgentRunner(agent.getCommand(), agent.getMaxAgentDepth(),
                    Path.of(System.getProperty("java.io.tmpdir"), "braid-agents"));
        });
        return new AgentSpawner(runner, metrics);
    }

    @Bean
    public StatusReconciler statusReconciler(TaskStore taskStore, WorktreeStore worktreeStore,
                                             AgentSpawner spawner, Clock clock) {
        return new StatusReconciler(taskStore, worktreeStore, spawner.runner(), clock);
    }

    @Bean
    public MergeCoordinator mergeCoordinator(OrchestrationStateStore stateStore, WorktreeStore worktreeStore,
                                             WorktreeProvisioner provisioner, GitOperations git, EventBus eventBus,
                                             BraidMetrics metrics, BraidProperties properties, Clock clock) {
        return new MergeCoordinator(stateStore, worktreeStore, provisioner, git, eventBus, metrics,
                properties.getGit().getRemote(), clock);
    }

    @Bean
    public WaitCoordinator waitCoordinator(TaskStore taskStore, Sleeper sleeper, Clock clock) {
        return new WaitCoordinator(taskStore, sleeper, clock);
    }

    @Bean
    public OrchestrationEngine orchestrationEngine(BraidProperties properties, TaskStore taskStore,
                                                   WorktreeStore worktreeStore, TaskGraphResolver resolver,
                                                   WorktreeProvisioner provisioner, AgentSpawner spawner,
                                                   OrchestrationStateStore stateStore, StatusReconciler reconciler,
                                                   MergeCoordinator mergeCoordinator, WaitCoordinator waitCoordinator,
                                                   EventBus eventBus, BraidMetrics metrics, Clock clock) {
        return new OrchestrationEngine(properties, taskStore, worktreeStore, resolver, provisioner, spawner,
                stateStore, reconciler, mergeCoordinator, waitCoordinator, eventBus, metrics, clock);
    }
}
