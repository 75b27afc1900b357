package com.braid.core.persistence;

import com.braid.core.spi.SessionVariableStore;
import com.braid.core.spi.WorktreeStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;

/**
 * Spring {@link Configuration} that provides the worktree and session-variable stores.
 * <p>
 * When a {@link DataSource} is available and {@code braid.state.store} is not
 * {@code memory}, JDBC stores are created and their tables ensured. Otherwise
 * in-memory stores are used as a fallback, suitable for development and testing
 * but not durable across restarts.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    @Primary
    @ConditionalOnBean(DataSource.class)
    @ConditionalOnProperty(prefix = "braid.state", name = "store", havingValue = "jdbc", matchIfMissing = true)
    public SessionVariableStore jdbcSessionVariableStore(DataSource dataSource,
                                                         ObjectProvider<ObjectMapper> objectMapper) throws Exception {
        log.info("Configuring JDBC session variable store");
        var store = new JdbcSessionVariableStore(dataSource, objectMapper.getIfAvailable(ObjectMapper::new));
        store.createTables();
        return store;
    }

    @Bean
    @Primary
    @ConditionalOnBean(DataSource.class)
    @ConditionalOnProperty(prefix = "braid.state", name = "store", havingValue = "jdbc", matchIfMissing = true)
    public WorktreeStore jdbcWorktreeStore(DataSource dataSource) throws Exception {
        log.info("Configuring JDBC worktree store");
        var store = new JdbcWorktreeStore(dataSource);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(SessionVariableStore.class)
    public SessionVariableStore memorySessionVariableStore() {
        log.info("Using in-memory session variable store (state will not persist across restarts)");
        return new InMemorySessionVariableStore();
    }

    @Bean
    @ConditionalOnMissingBean(WorktreeStore.class)
    public WorktreeStore memoryWorktreeStore() {
        log.info("Using in-memory worktree store (records will not persist across restarts)");
        return new InMemoryWorktreeStore();
    }
}
