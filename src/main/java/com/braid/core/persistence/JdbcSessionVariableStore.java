package com.braid.core.persistence;

import com.braid.core.spi.SessionVariableStore;
import com.braid.core.spi.SessionVariables;
import com.braid.core.state.ConcurrentStateModificationException;
import com.braid.core.state.StateStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link SessionVariableStore}.
 * <p>
 * Each session's variables are stored as one JSON document row keyed by
 * {@code session_id}. Writes are optimistic: an update only succeeds while the
 * row still carries the version that was read, otherwise a
 * {@link ConcurrentStateModificationException} is raised.
 * <p>
 * The table {@code braid_session_variables} is created by {@link #createTables()}.
 */
public class JdbcSessionVariableStore implements SessionVariableStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSessionVariableStore.class);

    private static final String TABLE_NAME = "braid_session_variables";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                session_id VARCHAR(255) NOT NULL PRIMARY KEY,
                version    BIGINT NOT NULL,
                variables  TEXT NOT NULL,
                updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """.formatted(TABLE_NAME);

    private static final String SELECT_SQL = """
            SELECT session_id, version, variables FROM %s WHERE session_id = ?
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (session_id, version, variables) VALUES (?, 1, ?)
            """.formatted(TABLE_NAME);

    private static final String UPDATE_SQL = """
            UPDATE %s
            SET variables = ?, version = version + 1, updated_at = CURRENT_TIMESTAMP
            WHERE session_id = ? AND version = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcSessionVariableStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper must not be null");
    }

    /**
     * Creates the variables table if it does not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Session variable table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Optional<SessionVariables> get(String sessionId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, sessionId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new SessionVariables(
                            rs.getString("session_id"),
                            rs.getLong("version"),
                            deserialize(rs.getString("variables"))));
                }
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to read variables for session " + sessionId, e);
        }
        return Optional.empty();
    }

    @Override
    public SessionVariables save(SessionVariables variables) {
        String json = serialize(variables.variables());
        try (Connection conn = dataSource.getConnection()) {
            if (variables.version() == 0L) {
                insert(conn, variables.sessionId(), json);
            } else {
                update(conn, variables.sessionId(), variables.version(), json);
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to save variables for session " + variables.sessionId(), e);
        }
        log.debug("Saved variables for session '{}' at version {}", variables.sessionId(), variables.version() + 1);
        return new SessionVariables(variables.sessionId(), variables.version() + 1, variables.variables());
    }

    private void insert(Connection conn, String sessionId, String json) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, sessionId);
            stmt.setString(2, json);
            stmt.executeUpdate();
        } catch (SQLException e) {
            // 23xxx: integrity constraint violation, another writer inserted first
            if (e.getSQLState() != null && e.getSQLState().startsWith("23")) {
                throw new ConcurrentStateModificationException(sessionId, 0L);
            }
            throw e;
        }
    }

    private void update(Connection conn, String sessionId, long expectedVersion, String json) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
            stmt.setString(1, json);
            stmt.setString(2, sessionId);
            stmt.setLong(3, expectedVersion);
            if (stmt.executeUpdate() == 0) {
                throw new ConcurrentStateModificationException(sessionId, expectedVersion);
            }
        }
    }

    private String serialize(Map<String, Object> variables) {
        try {
            return objectMapper.writeValueAsString(variables);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Failed to serialize session variables", e);
        }
    }

    private Map<String, Object> deserialize(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Failed to deserialize session variables", e);
        }
    }
}
