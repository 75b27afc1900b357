package com.braid.core.persistence;

import com.braid.core.model.Worktree;
import com.braid.core.model.WorktreeStatus;
import com.braid.core.spi.WorktreeStore;
import com.braid.core.state.StateStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link WorktreeStore}.
 * <p>
 * One row per worktree in {@code braid_worktrees}, created by {@link #createTables()}.
 * Status is stored as the enum name.
 */
public class JdbcWorktreeStore implements WorktreeStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorktreeStore.class);

    private static final String TABLE_NAME = "braid_worktrees";

    private static final String COLUMNS =
            "id, project_id, branch_name, worktree_path, base_branch, task_id, agent_session_id, status, created_at, updated_at";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id               VARCHAR(64)  NOT NULL PRIMARY KEY,
                project_id       VARCHAR(255),
                branch_name      VARCHAR(255) NOT NULL,
                worktree_path    VARCHAR(1024) NOT NULL,
                base_branch      VARCHAR(255),
                task_id          VARCHAR(255),
                agent_session_id VARCHAR(255),
                status           VARCHAR(32)  NOT NULL,
                created_at       TIMESTAMP    NOT NULL,
                updated_at       TIMESTAMP    NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (%s) VALUES (?, ?, ?, ?, ?, ?, NULL, ?, ?, ?)
            """.formatted(TABLE_NAME, COLUMNS);

    private static final String SELECT_BY_ID_SQL = """
            SELECT %s FROM %s WHERE id = ?
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_BY_TASK_SQL = """
            SELECT %s FROM %s
            WHERE task_id = ? AND status <> 'MERGED'
            ORDER BY created_at DESC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_BY_BRANCH_SQL = """
            SELECT %s FROM %s
            WHERE branch_name = ? AND status <> 'MERGED'
            ORDER BY created_at DESC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_BY_PROJECT_BRANCH_SQL = """
            SELECT %s FROM %s
            WHERE project_id = ? AND branch_name = ? AND status <> 'MERGED'
            ORDER BY created_at DESC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_ALL_SQL = """
            SELECT %s FROM %s ORDER BY created_at ASC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_BY_PROJECT_SQL = """
            SELECT %s FROM %s WHERE project_id = ? ORDER BY created_at ASC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String UPDATE_OWNER_SQL = """
            UPDATE %s SET agent_session_id = ?, status = ?, updated_at = ? WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String UPDATE_STATUS_SQL = """
            UPDATE %s SET status = ?, updated_at = ? WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String UPDATE_TASK_SQL = """
            UPDATE %s SET task_id = ?, updated_at = ? WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final Clock clock;

    public JdbcWorktreeStore(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    public JdbcWorktreeStore(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Creates the worktree table if it does not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Worktree table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Worktree create(String projectId, String branchName, String worktreePath, String baseBranch, String taskId) {
        String id = WorktreeIds.next();
        Instant now = clock.instant();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, id);
            stmt.setString(2, projectId);
            stmt.setString(3, branchName);
            stmt.setString(4, worktreePath);
            stmt.setString(5, baseBranch);
            stmt.setString(6, taskId);
            stmt.setString(7, WorktreeStatus.ACTIVE.name());
            stmt.setTimestamp(8, Timestamp.from(now));
            stmt.setTimestamp(9, Timestamp.from(now));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StateStoreException("Failed to create worktree record for branch " + branchName, e);
        }
        log.debug("Created worktree record {} for branch {}", id, branchName);
        return new Worktree(id, projectId, branchName, worktreePath, baseBranch, taskId, null,
                WorktreeStatus.ACTIVE, now, now);
    }

    @Override
    public Optional<Worktree> get(String worktreeId) {
        return queryFirst(SELECT_BY_ID_SQL, worktreeId);
    }

    @Override
    public Optional<Worktree> getByTask(String taskId) {
        return queryFirst(SELECT_BY_TASK_SQL, taskId);
    }

    @Override
    public Optional<Worktree> getByBranch(String projectId, String branchName) {
        return projectId == null
                ? queryFirst(SELECT_BY_BRANCH_SQL, branchName)
                : queryFirst(SELECT_BY_PROJECT_BRANCH_SQL, projectId, branchName);
    }

    @Override
    public List<Worktree> list(String projectId) {
        return projectId == null ? query(SELECT_ALL_SQL) : query(SELECT_BY_PROJECT_SQL, projectId);
    }

    @Override
    public Optional<Worktree> claim(String worktreeId, String agentSessionId) {
        updateOwner(worktreeId, agentSessionId, WorktreeStatus.ACTIVE);
        return get(worktreeId);
    }

    @Override
    public Optional<Worktree> release(String worktreeId) {
        updateOwner(worktreeId, null, WorktreeStatus.RELEASED);
        return get(worktreeId);
    }

    @Override
    public Optional<Worktree> markMerged(String worktreeId) {
        updateOwner(worktreeId, null, WorktreeStatus.MERGED);
        return get(worktreeId);
    }

    @Override
    public Optional<Worktree> markStale(String worktreeId) {
        execute(UPDATE_STATUS_SQL, WorktreeStatus.STALE.name(), Timestamp.from(clock.instant()), worktreeId);
        return get(worktreeId);
    }

    @Override
    public Optional<Worktree> updateTask(String worktreeId, String taskId) {
        execute(UPDATE_TASK_SQL, taskId, Timestamp.from(clock.instant()), worktreeId);
        return get(worktreeId);
    }

    @Override
    public boolean delete(String worktreeId) {
        int deleted = execute(DELETE_SQL, worktreeId);
        log.debug("Deleted {} worktree record(s) for id {}", deleted, worktreeId);
        return deleted > 0;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private void updateOwner(String worktreeId, String sessionId, WorktreeStatus status) {
        execute(UPDATE_OWNER_SQL, sessionId, status.name(), Timestamp.from(clock.instant()), worktreeId);
    }

    private int execute(String sql, Object... params) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, params);
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StateStoreException("Worktree store update failed", e);
        }
    }

    private Optional<Worktree> queryFirst(String sql, Object... params) {
        List<Worktree> rows = query(sql, params);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private List<Worktree> query(String sql, Object... params) {
        List<Worktree> rows = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, params);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new StateStoreException("Worktree store query failed", e);
        }
        return rows;
    }

    private static void bind(PreparedStatement stmt, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            Object param = params[i];
            if (param == null) {
                stmt.setNull(i + 1, java.sql.Types.VARCHAR);
            } else if (param instanceof Timestamp ts) {
                stmt.setTimestamp(i + 1, ts);
            } else {
                stmt.setString(i + 1, param.toString());
            }
        }
    }

    private static Worktree fromResultSet(ResultSet rs) throws SQLException {
        return new Worktree(
                rs.getString("id"),
                rs.getString("project_id"),
                rs.getString("branch_name"),
                rs.getString("worktree_path"),
                rs.getString("base_branch"),
                rs.getString("task_id"),
                rs.getString("agent_session_id"),
                WorktreeStatus.valueOf(rs.getString("status")),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant());
    }
}
