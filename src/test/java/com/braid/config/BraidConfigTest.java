package com.braid.config;

import com.braid.agent.AgentSpawner;
import com.braid.agent.ProcessAgentRunner;
import com.braid.core.engine.OrchestrationEngine;
import com.braid.core.persistence.InMemorySessionVariableStore;
import com.braid.core.persistence.InMemoryWorktreeStore;
import com.braid.core.spi.SessionVariableStore;
import com.braid.core.spi.TaskStore;
import com.braid.core.spi.WorktreeStore;
import com.braid.support.InMemoryTaskStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.*;

class BraidConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(BraidConfig.class)
            .withBean(TaskStore.class, InMemoryTaskStore::new);

    @Test
    @DisplayName("Without a DataSource the engine is wired with in-memory stores")
    void inMemoryWiring() {
        contextRunner
                .withPropertyValues("braid.agent.command[0]=echo", "braid.agent.command[1]={task_id}")
                .run(context -> {
                    assertNull(context.getStartupFailure());
                    assertNotNull(context.getBean(OrchestrationEngine.class));
                    assertInstanceOf(InMemorySessionVariableStore.class, context.getBean(SessionVariableStore.class));
                    assertInstanceOf(InMemoryWorktreeStore.class, context.getBean(WorktreeStore.class));
                    assertInstanceOf(ProcessAgentRunner.class, context.getBean(AgentSpawner.class).runner());
                });
    }

    @Test
    @DisplayName("Without an agent command or runner the spawner is unconfigured")
    void noRunner() {
        contextRunner.run(context -> assertFalse(context.getBean(AgentSpawner.class).isConfigured()));
    }

    @Test
    @DisplayName("Properties bind from braid.*")
    void binding() {
        contextRunner
                .withPropertyValues("braid.orchestration.max-concurrent=7", "braid.merge.push=false")
                .run(context -> {
                    BraidProperties props = context.getBean(BraidProperties.class);
                    assertEquals(7, props.getOrchestration().getMaxConcurrent());
                    assertFalse(props.getMerge().isPush());
                });
    }
}
