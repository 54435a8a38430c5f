package com.hivestate.core.persistence;

import com.hivestate.core.model.Agent;
import com.hivestate.core.model.AgentStateUpdate;
import com.hivestate.core.model.AgentStatus;
import com.hivestate.core.model.AgentUpdate;
import com.hivestate.core.model.Checkpoint;
import com.hivestate.core.model.SystemSnapshot;
import com.hivestate.core.model.Task;
import com.hivestate.core.model.TaskDraft;
import com.hivestate.core.model.TaskStatus;
import com.hivestate.core.store.ErrorKind;
import com.hivestate.core.store.JsonCodec;
import com.hivestate.core.store.StoreResult;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link PersistentStore} over a pooled JDBC {@link DataSource}.
 * <p>
 * The SQL targets PostgreSQL 15+ (JSONB columns, {@code MERGE}, {@code FILTER} aggregates)
 * and stays within the subset H2 also accepts. Timestamps come from the injected
 * {@link Clock}, never from the database, so ordering follows the caller's clock.
 * <p>
 * Every statement carries the configured query timeout. Errors are logged once here and
 * returned as failed {@link StoreResult}s.
 */
public class JdbcPersistentStore implements PersistentStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcPersistentStore.class);

    private static final String UNIQUE_VIOLATION = "23505";
    private static final DateTimeFormatter CHECKPOINT_NAME_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private static final List<String> SCHEMA_SQL = List.of(
            """
            CREATE TABLE IF NOT EXISTS agents (
                agent_id            VARCHAR(255) PRIMARY KEY,
                status              VARCHAR(50) NOT NULL DEFAULT 'idle',
                current_task_id     VARCHAR(64),
                context_usage       NUMERIC(5,4) NOT NULL DEFAULT 0,
                last_activity       TIMESTAMP WITH TIME ZONE NOT NULL,
                capabilities        JSONB,
                performance_metrics JSONB,
                created_at          TIMESTAMP WITH TIME ZONE NOT NULL,
                updated_at          TIMESTAMP WITH TIME ZONE NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS tasks (
                task_id      VARCHAR(64) PRIMARY KEY,
                status       VARCHAR(50) NOT NULL DEFAULT 'pending',
                agent_id     VARCHAR(255) REFERENCES agents(agent_id) ON DELETE SET NULL,
                priority     INTEGER NOT NULL DEFAULT 5,
                created_at   TIMESTAMP WITH TIME ZONE NOT NULL,
                started_at   TIMESTAMP WITH TIME ZONE,
                completed_at TIMESTAMP WITH TIME ZONE,
                metadata     JSONB,
                result       JSONB,
                updated_at   TIMESTAMP WITH TIME ZONE NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS system_snapshots (
                id                    BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                timestamp             TIMESTAMP WITH TIME ZONE NOT NULL,
                total_agents          INTEGER NOT NULL DEFAULT 0,
                active_agents         INTEGER NOT NULL DEFAULT 0,
                total_tasks           INTEGER NOT NULL DEFAULT 0,
                completed_tasks       INTEGER NOT NULL DEFAULT 0,
                failed_tasks          INTEGER NOT NULL DEFAULT 0,
                average_context_usage NUMERIC(5,4) NOT NULL DEFAULT 0,
                quality_score         NUMERIC(5,4) NOT NULL DEFAULT 0,
                metadata              JSONB
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS checkpoints (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                checkpoint_name VARCHAR(255) NOT NULL,
                timestamp       TIMESTAMP WITH TIME ZONE NOT NULL,
                data            JSONB NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_agents_status ON agents(status)",
            "CREATE INDEX IF NOT EXISTS idx_agents_last_activity ON agents(last_activity)",
            "CREATE INDEX IF NOT EXISTS idx_tasks_status ON tasks(status)",
            "CREATE INDEX IF NOT EXISTS idx_tasks_priority ON tasks(priority DESC)",
            "CREATE INDEX IF NOT EXISTS idx_tasks_agent_id ON tasks(agent_id)",
            "CREATE INDEX IF NOT EXISTS idx_tasks_created_at ON tasks(created_at)",
            "CREATE INDEX IF NOT EXISTS idx_snapshots_timestamp ON system_snapshots(timestamp)",
            "CREATE INDEX IF NOT EXISTS idx_checkpoints_name ON checkpoints(checkpoint_name)",
            "CREATE INDEX IF NOT EXISTS idx_checkpoints_timestamp ON checkpoints(timestamp)"
    );

    private static final String AGENT_COLUMNS =
            "agent_id, status, current_task_id, context_usage, last_activity, capabilities, performance_metrics";

    private static final String TASK_COLUMNS =
            "task_id, status, agent_id, priority, created_at, started_at, completed_at, metadata, result";

    private static final String SNAPSHOT_COLUMNS = """
            id, timestamp, total_agents, active_agents, total_tasks, completed_tasks, failed_tasks,
            average_context_usage, quality_score, metadata""";

    private static final String UPSERT_AGENT_SQL = """
            MERGE INTO agents AS a
            USING (SELECT CAST(? AS VARCHAR(255)) AS agent_id,
                          CAST(? AS JSONB) AS capabilities,
                          CAST(? AS TIMESTAMP WITH TIME ZONE) AS seen_at) AS s
            ON (a.agent_id = s.agent_id)
            WHEN MATCHED THEN
                UPDATE SET capabilities = s.capabilities,
                           last_activity = s.seen_at,
                           updated_at = s.seen_at
            WHEN NOT MATCHED THEN
                INSERT (agent_id, status, context_usage, last_activity, capabilities,
                        performance_metrics, created_at, updated_at)
                VALUES (s.agent_id, 'idle', 0, s.seen_at, s.capabilities, CAST('{}' AS JSONB),
                        s.seen_at, s.seen_at)
            """;

    private static final String SELECT_AGENT_SQL =
            "SELECT " + AGENT_COLUMNS + " FROM agents WHERE agent_id = ?";

    private static final String UPDATE_AGENT_SQL = """
            UPDATE agents
            SET status = COALESCE(?, status),
                current_task_id = COALESCE(?, current_task_id),
                context_usage = COALESCE(?, context_usage),
                performance_metrics = COALESCE(CAST(? AS JSONB), performance_metrics),
                last_activity = ?,
                updated_at = ?
            WHERE agent_id = ?
            """;

    private static final String SELECT_ACTIVE_AGENTS_SQL = """
            SELECT %s FROM agents
            WHERE status IN ('idle', 'busy') AND last_activity > ?
            ORDER BY last_activity DESC
            """.formatted(AGENT_COLUMNS);

    private static final String BATCH_UPDATE_AGENT_SQL = """
            UPDATE agents
            SET status = COALESCE(?, status),
                context_usage = COALESCE(?, context_usage),
                last_activity = ?,
                updated_at = ?
            WHERE agent_id = ?
            """;

    private static final String INSERT_TASK_SQL = """
            INSERT INTO tasks (task_id, status, agent_id, priority, created_at, started_at,
                               completed_at, metadata, result, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, CAST(? AS JSONB), CAST(? AS JSONB), ?)
            """;

    private static final String SELECT_TASK_SQL =
            "SELECT " + TASK_COLUMNS + " FROM tasks WHERE task_id = ?";

    // Tasks created in the same instant fall back to task id order.
    private static final String SELECT_PENDING_TASKS_SQL = """
            SELECT %s FROM tasks
            WHERE status = 'pending'
            ORDER BY priority DESC, created_at ASC, task_id ASC
            LIMIT ?
            """.formatted(TASK_COLUMNS);

    private static final String ASSIGN_TASK_SQL = """
            UPDATE tasks
            SET agent_id = ?, status = 'assigned', started_at = ?, updated_at = ?
            WHERE task_id = ? AND status = 'pending'
            """;

    private static final String START_TASK_SQL = """
            UPDATE tasks
            SET status = 'in_progress', updated_at = ?
            WHERE task_id = ? AND status = 'assigned'
            """;

    private static final String COMPLETE_TASK_SQL = """
            UPDATE tasks
            SET status = ?, completed_at = ?, result = CAST(? AS JSONB), updated_at = ?
            WHERE task_id = ? AND status IN ('assigned', 'in_progress')
            """;

    private static final String RELEASE_AGENT_SQL = """
            UPDATE agents
            SET current_task_id = NULL,
                status = CASE WHEN status = 'busy' THEN 'idle' ELSE status END,
                last_activity = ?,
                updated_at = ?
            WHERE current_task_id = ?
            """;

    private static final String TASK_STATUS_SQL = "SELECT status FROM tasks WHERE task_id = ?";

    private static final String CREATE_SNAPSHOT_SQL = """
            INSERT INTO system_snapshots (timestamp, total_agents, active_agents, total_tasks,
                                          completed_tasks, failed_tasks, average_context_usage,
                                          quality_score, metadata)
            SELECT CAST(? AS TIMESTAMP WITH TIME ZONE), a.total_agents, a.active_agents, t.total_tasks, t.completed_tasks, t.failed_tasks,
                   COALESCE(a.avg_context_usage, 0),
                   CASE WHEN t.completed_tasks + t.failed_tasks = 0 THEN 0
                        ELSE CAST(t.completed_tasks AS DOUBLE PRECISION) / (t.completed_tasks + t.failed_tasks)
                   END,
                   CAST('{}' AS JSONB)
            FROM (SELECT COUNT(*) AS total_agents,
                         COUNT(*) FILTER (WHERE status IN ('idle', 'busy')) AS active_agents,
                         AVG(context_usage) AS avg_context_usage
                  FROM agents) a
            CROSS JOIN (SELECT COUNT(*) AS total_tasks,
                               COUNT(*) FILTER (WHERE status = 'completed') AS completed_tasks,
                               COUNT(*) FILTER (WHERE status = 'failed') AS failed_tasks
                        FROM tasks) t
            """;

    private static final String IMPORT_SNAPSHOT_SQL = """
            INSERT INTO system_snapshots (timestamp, total_agents, active_agents, total_tasks,
                                          completed_tasks, failed_tasks, average_context_usage,
                                          quality_score, metadata)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS JSONB))
            """;

    private static final String SELECT_SNAPSHOTS_SQL = """
            SELECT %s FROM system_snapshots
            ORDER BY timestamp DESC, id DESC
            LIMIT ?
            """.formatted(SNAPSHOT_COLUMNS);

    private static final String INSERT_CHECKPOINT_SQL = """
            INSERT INTO checkpoints (checkpoint_name, timestamp, data)
            VALUES (?, ?, CAST(? AS JSONB))
            """;

    private static final String DELETE_AGENT_SQL = "DELETE FROM agents WHERE agent_id = ?";

    private static final String COUNT_AGENTS_SQL = "SELECT COUNT(*) FROM agents";
    private static final String COUNT_TASKS_SQL = "SELECT COUNT(*) FROM tasks";
    private static final String HEALTH_QUERY_SQL = "SELECT 1";

    private final DataSource dataSource;
    private final JsonCodec json;
    private final Clock clock;
    private final PersistenceProperties properties;

    public JdbcPersistentStore(DataSource dataSource, JsonCodec json, Clock clock,
                               PersistenceProperties properties) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.json = Objects.requireNonNull(json, "JsonCodec must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.properties = Objects.requireNonNull(properties, "PersistenceProperties must not be null");
    }

    @Override
    public boolean initialize() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.setQueryTimeout(properties.getQueryTimeoutSeconds());
            for (String sql : SCHEMA_SQL) {
                stmt.execute(sql);
            }
            log.info("Persistent schema ensured ({} statements)", SCHEMA_SQL.size());
            return true;
        } catch (SQLException e) {
            log.error("Failed to initialize persistent schema", e);
            return false;
        }
    }

    // ── Agents ───────────────────────────────────────────────────────────

    @Override
    public StoreResult<Boolean> registerAgent(String agentId, List<String> capabilities) {
        String capabilitiesJson = json.write(capabilities == null ? List.of() : capabilities);
        OffsetDateTime now = now();
        try {
            upsertAgent(agentId, capabilitiesJson, now);
        } catch (SQLException e) {
            if (!UNIQUE_VIOLATION.equals(e.getSQLState())) {
                return failure("register agent " + agentId, e);
            }
            // Concurrent first registration; the retry takes the matched branch.
            log.debug("Agent '{}' registered concurrently, retrying upsert", agentId);
            try {
                upsertAgent(agentId, capabilitiesJson, now);
            } catch (SQLException retryError) {
                return failure("register agent " + agentId, retryError);
            }
        }
        log.debug("Registered agent '{}' with {} capabilities", agentId,
                capabilities == null ? 0 : capabilities.size());
        return StoreResult.done();
    }

    private void upsertAgent(String agentId, String capabilitiesJson, OffsetDateTime now) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, UPSERT_AGENT_SQL)) {
            stmt.setString(1, agentId);
            stmt.setString(2, capabilitiesJson);
            stmt.setObject(3, now);
            stmt.executeUpdate();
        }
    }

    @Override
    public StoreResult<Optional<Agent>> getAgentState(String agentId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, SELECT_AGENT_SQL)) {
            stmt.setString(1, agentId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return StoreResult.success(Optional.of(agentFromResultSet(rs)));
                }
            }
            return StoreResult.success(Optional.empty());
        } catch (SQLException e) {
            return failure("get agent " + agentId, e);
        } catch (IllegalArgumentException e) {
            return corrupt("agent " + agentId, e);
        }
    }

    @Override
    public StoreResult<Boolean> updateAgentState(String agentId, AgentStateUpdate update) {
        OffsetDateTime now = now();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, UPDATE_AGENT_SQL)) {
            setNullableString(stmt, 1, update.status() == null ? null : update.status().wireValue());
            setNullableString(stmt, 2, update.currentTaskId());
            setNullableDouble(stmt, 3, update.contextUsage());
            setNullableString(stmt, 4, json.writeNullable(update.performanceMetrics()));
            stmt.setObject(5, now);
            stmt.setObject(6, now);
            stmt.setString(7, agentId);
            if (stmt.executeUpdate() == 0) {
                return StoreResult.notFound("Agent not found: " + agentId);
            }
            return StoreResult.done();
        } catch (SQLException e) {
            return failure("update agent " + agentId, e);
        }
    }

    @Override
    public StoreResult<List<Agent>> getActiveAgents() {
        OffsetDateTime cutoff = now().minus(properties.getActiveWindow());
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, SELECT_ACTIVE_AGENTS_SQL)) {
            stmt.setObject(1, cutoff);
            List<Agent> agents = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    agents.add(agentFromResultSet(rs));
                }
            }
            return StoreResult.success(agents);
        } catch (SQLException e) {
            return failure("list active agents", e);
        } catch (IllegalArgumentException e) {
            return corrupt("active agents", e);
        }
    }

    @Override
    public StoreResult<Integer> batchUpdateAgents(List<AgentUpdate> updates) {
        if (updates.isEmpty()) {
            return StoreResult.success(0);
        }
        OffsetDateTime now = now();
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement stmt = prepare(conn, BATCH_UPDATE_AGENT_SQL)) {
                int changed = 0;
                for (AgentUpdate update : updates) {
                    setNullableString(stmt, 1, update.status() == null ? null : update.status().wireValue());
                    setNullableDouble(stmt, 2, update.contextUsage());
                    stmt.setObject(3, now);
                    stmt.setObject(4, now);
                    stmt.setString(5, update.agentId());
                    changed += stmt.executeUpdate();
                }
                conn.commit();
                log.debug("Batch updated {} of {} agents", changed, updates.size());
                return StoreResult.success(changed);
            } catch (SQLException e) {
                rollbackQuietly(conn);
                return failure("batch update " + updates.size() + " agents", e);
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            return failure("batch update " + updates.size() + " agents", e);
        }
    }

    @Override
    public StoreResult<Boolean> deleteAgent(String agentId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, DELETE_AGENT_SQL)) {
            stmt.setString(1, agentId);
            if (stmt.executeUpdate() == 0) {
                return StoreResult.notFound("Agent not found: " + agentId);
            }
            log.debug("Deleted agent '{}'", agentId);
            return StoreResult.done();
        } catch (SQLException e) {
            return failure("delete agent " + agentId, e);
        }
    }

    @Override
    public StoreResult<Long> countAgents() {
        return count(COUNT_AGENTS_SQL, "agents");
    }

    // ── Tasks ────────────────────────────────────────────────────────────

    @Override
    public StoreResult<String> createTask(TaskDraft draft) {
        String taskId = draft.taskId() != null ? draft.taskId() : UUID.randomUUID().toString();
        OffsetDateTime now = now();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, INSERT_TASK_SQL)) {
            stmt.setString(1, taskId);
            stmt.setString(2, draft.statusOrDefault().wireValue());
            setNullableString(stmt, 3, draft.agentId());
            stmt.setInt(4, draft.priorityOrDefault());
            stmt.setObject(5, draft.createdAt() != null ? toOffset(draft.createdAt()) : now);
            setNullableTimestamp(stmt, 6, draft.startedAt());
            setNullableTimestamp(stmt, 7, draft.completedAt());
            stmt.setString(8, json.write(draft.metadata()));
            setNullableString(stmt, 9, json.writeNullable(draft.result()));
            stmt.setObject(10, now);
            stmt.executeUpdate();
            log.debug("Created task '{}' with priority {}", taskId, draft.priorityOrDefault());
            return StoreResult.success(taskId);
        } catch (SQLException e) {
            return failure("create task " + taskId, e);
        }
    }

    @Override
    public StoreResult<Optional<Task>> getTask(String taskId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, SELECT_TASK_SQL)) {
            stmt.setString(1, taskId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return StoreResult.success(Optional.of(taskFromResultSet(rs)));
                }
            }
            return StoreResult.success(Optional.empty());
        } catch (SQLException e) {
            return failure("get task " + taskId, e);
        } catch (IllegalArgumentException e) {
            return corrupt("task " + taskId, e);
        }
    }

    @Override
    public StoreResult<List<Task>> getPendingTasks(int limit) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, SELECT_PENDING_TASKS_SQL)) {
            stmt.setInt(1, Math.max(0, limit));
            List<Task> tasks = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    tasks.add(taskFromResultSet(rs));
                }
            }
            return StoreResult.success(tasks);
        } catch (SQLException e) {
            return failure("list pending tasks", e);
        } catch (IllegalArgumentException e) {
            return corrupt("pending tasks", e);
        }
    }

    @Override
    public StoreResult<Boolean> assignTask(String taskId, String agentId) {
        OffsetDateTime now = now();
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement stmt = prepare(conn, ASSIGN_TASK_SQL)) {
                stmt.setString(1, agentId);
                stmt.setObject(2, now);
                stmt.setObject(3, now);
                stmt.setString(4, taskId);
                if (stmt.executeUpdate() == 1) {
                    log.debug("Assigned task '{}' to agent '{}'", taskId, agentId);
                    return StoreResult.done();
                }
            }
            return notApplied(conn, taskId, "is no longer pending");
        } catch (SQLException e) {
            return failure("assign task " + taskId, e);
        }
    }

    @Override
    public StoreResult<Boolean> startTask(String taskId) {
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement stmt = prepare(conn, START_TASK_SQL)) {
                stmt.setObject(1, now());
                stmt.setString(2, taskId);
                if (stmt.executeUpdate() == 1) {
                    return StoreResult.done();
                }
            }
            return notApplied(conn, taskId, "is not assigned");
        } catch (SQLException e) {
            return failure("start task " + taskId, e);
        }
    }

    @Override
    public StoreResult<Boolean> completeTask(String taskId, boolean succeeded, Object result) {
        OffsetDateTime now = now();
        TaskStatus finalStatus = succeeded ? TaskStatus.COMPLETED : TaskStatus.FAILED;
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                int updated;
                try (PreparedStatement stmt = prepare(conn, COMPLETE_TASK_SQL)) {
                    stmt.setString(1, finalStatus.wireValue());
                    stmt.setObject(2, now);
                    setNullableString(stmt, 3, json.writeNullable(result));
                    stmt.setObject(4, now);
                    stmt.setString(5, taskId);
                    updated = stmt.executeUpdate();
                }
                if (updated == 0) {
                    conn.rollback();
                    return notApplied(conn, taskId, "is not running");
                }
                try (PreparedStatement stmt = prepare(conn, RELEASE_AGENT_SQL)) {
                    stmt.setObject(1, now);
                    stmt.setObject(2, now);
                    stmt.setString(3, taskId);
                    stmt.executeUpdate();
                }
                conn.commit();
                log.debug("Task '{}' finished as {}", taskId, finalStatus.wireValue());
                return StoreResult.done();
            } catch (SQLException e) {
                rollbackQuietly(conn);
                return failure("complete task " + taskId, e);
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            return failure("complete task " + taskId, e);
        }
    }

    @Override
    public StoreResult<Long> countTasks() {
        return count(COUNT_TASKS_SQL, "tasks");
    }

    /**
     * Distinguishes an unknown task from one whose status did not allow the transition.
     */
    private StoreResult<Boolean> notApplied(Connection conn, String taskId, String reason) throws SQLException {
        try (PreparedStatement stmt = prepare(conn, TASK_STATUS_SQL)) {
            stmt.setString(1, taskId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return StoreResult.notFound("Task not found: " + taskId);
                }
                return StoreResult.conflict("Task " + taskId + " " + reason + " (status " + rs.getString(1) + ")");
            }
        }
    }

    // ── Snapshots and checkpoints ────────────────────────────────────────

    @Override
    public StoreResult<Boolean> createSystemSnapshot() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, CREATE_SNAPSHOT_SQL)) {
            stmt.setObject(1, now());
            stmt.executeUpdate();
            log.debug("Created system snapshot");
            return StoreResult.done();
        } catch (SQLException e) {
            return failure("create system snapshot", e);
        }
    }

    @Override
    public StoreResult<Long> importSystemSnapshot(SystemSnapshot snapshot) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, IMPORT_SNAPSHOT_SQL, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setObject(1, toOffset(snapshot.timestamp() != null ? snapshot.timestamp() : clock.instant()));
            stmt.setInt(2, snapshot.totalAgents());
            stmt.setInt(3, snapshot.activeAgents());
            stmt.setInt(4, snapshot.totalTasks());
            stmt.setInt(5, snapshot.completedTasks());
            stmt.setInt(6, snapshot.failedTasks());
            stmt.setDouble(7, snapshot.averageContextUsage());
            stmt.setDouble(8, snapshot.qualityScore());
            stmt.setString(9, json.write(snapshot.metadata()));
            stmt.executeUpdate();
            return StoreResult.success(generatedId(stmt));
        } catch (SQLException e) {
            return failure("import system snapshot", e);
        }
    }

    @Override
    public StoreResult<List<SystemSnapshot>> getRecentSnapshots(int limit) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, SELECT_SNAPSHOTS_SQL)) {
            stmt.setInt(1, Math.max(0, limit));
            List<SystemSnapshot> snapshots = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    snapshots.add(new SystemSnapshot(
                            rs.getLong("id"),
                            readInstant(rs, "timestamp"),
                            rs.getInt("total_agents"),
                            rs.getInt("active_agents"),
                            rs.getInt("total_tasks"),
                            rs.getInt("completed_tasks"),
                            rs.getInt("failed_tasks"),
                            rs.getDouble("average_context_usage"),
                            rs.getDouble("quality_score"),
                            json.readMap(rs.getString("metadata"))));
                }
            }
            return StoreResult.success(snapshots);
        } catch (SQLException e) {
            return failure("list system snapshots", e);
        } catch (IllegalArgumentException e) {
            return corrupt("system snapshots", e);
        }
    }

    @Override
    public StoreResult<Long> createCheckpoint(String name, Map<String, Object> data) {
        Instant now = clock.instant();
        String checkpointName = name != null && !name.isBlank()
                ? name
                : "checkpoint_" + CHECKPOINT_NAME_FORMAT.format(now);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, INSERT_CHECKPOINT_SQL, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setString(1, checkpointName);
            stmt.setObject(2, toOffset(now));
            stmt.setString(3, json.write(data == null ? Map.of() : data));
            stmt.executeUpdate();
            long id = generatedId(stmt);
            log.info("Created checkpoint '{}' (id {})", checkpointName, id);
            return StoreResult.success(id);
        } catch (SQLException e) {
            return failure("create checkpoint " + checkpointName, e);
        }
    }

    @Override
    public StoreResult<List<Checkpoint>> getCheckpoints(String name, Instant from, Instant to, int limit) {
        StringBuilder sql = new StringBuilder("SELECT id, checkpoint_name, timestamp, data FROM checkpoints WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (name != null) {
            sql.append(" AND checkpoint_name = ?");
            params.add(name);
        }
        if (from != null) {
            sql.append(" AND timestamp >= ?");
            params.add(toOffset(from));
        }
        if (to != null) {
            sql.append(" AND timestamp <= ?");
            params.add(toOffset(to));
        }
        sql.append(" ORDER BY timestamp DESC, id DESC LIMIT ?");
        params.add(Math.max(0, limit));

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                stmt.setObject(i + 1, params.get(i));
            }
            List<Checkpoint> checkpoints = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    checkpoints.add(new Checkpoint(
                            rs.getLong("id"),
                            rs.getString("checkpoint_name"),
                            readInstant(rs, "timestamp"),
                            json.readMap(rs.getString("data"))));
                }
            }
            return StoreResult.success(checkpoints);
        } catch (SQLException e) {
            return failure("list checkpoints", e);
        } catch (IllegalArgumentException e) {
            return corrupt("checkpoints", e);
        }
    }

    // ── Health ───────────────────────────────────────────────────────────

    @Override
    public PersistentStoreHealth healthCheck() {
        Instant timestamp = clock.instant();
        long acquireStart = System.nanoTime();
        try (Connection conn = dataSource.getConnection()) {
            double acquireMs = elapsedMs(acquireStart);
            long queryStart = System.nanoTime();
            try (PreparedStatement stmt = prepare(conn, HEALTH_QUERY_SQL);
                 ResultSet rs = stmt.executeQuery()) {
                rs.next();
            }
            double queryMs = elapsedMs(queryStart);
            return new PersistentStoreHealth(timestamp, true, poolStats(), acquireMs, queryMs, null);
        } catch (SQLException e) {
            log.warn("Persistent store health check failed: {}", e.getMessage());
            return PersistentStoreHealth.down(timestamp, e.getMessage());
        }
    }

    private PersistentStoreHealth.PoolStats poolStats() {
        if (dataSource instanceof HikariDataSource hikari) {
            HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
            if (pool != null) {
                return new PersistentStoreHealth.PoolStats(
                        pool.getTotalConnections(),
                        pool.getActiveConnections(),
                        pool.getIdleConnections(),
                        pool.getThreadsAwaitingConnection(),
                        hikari.getMinimumIdle(),
                        hikari.getMaximumPoolSize());
            }
        }
        return null;
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private StoreResult<Long> count(String sql, String what) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, sql);
             ResultSet rs = stmt.executeQuery()) {
            rs.next();
            return StoreResult.success(rs.getLong(1));
        } catch (SQLException e) {
            return failure("count " + what, e);
        }
    }

    private PreparedStatement prepare(Connection conn, String sql) throws SQLException {
        PreparedStatement stmt = conn.prepareStatement(sql);
        stmt.setQueryTimeout(properties.getQueryTimeoutSeconds());
        return stmt;
    }

    private PreparedStatement prepare(Connection conn, String sql, int autoGeneratedKeys) throws SQLException {
        PreparedStatement stmt = conn.prepareStatement(sql, autoGeneratedKeys);
        stmt.setQueryTimeout(properties.getQueryTimeoutSeconds());
        return stmt;
    }

    private static long generatedId(PreparedStatement stmt) throws SQLException {
        try (ResultSet keys = stmt.getGeneratedKeys()) {
            if (keys.next()) {
                return keys.getLong(1);
            }
        }
        throw new SQLException("No generated key returned");
    }

    private Agent agentFromResultSet(ResultSet rs) throws SQLException {
        return new Agent(
                rs.getString("agent_id"),
                parseAgentStatus(rs.getString("status")),
                rs.getString("current_task_id"),
                rs.getDouble("context_usage"),
                readInstant(rs, "last_activity"),
                json.readStringList(rs.getString("capabilities")),
                json.readNumberMap(rs.getString("performance_metrics")));
    }

    private Task taskFromResultSet(ResultSet rs) throws SQLException {
        return new Task(
                rs.getString("task_id"),
                TaskStatus.fromWire(rs.getString("status")),
                rs.getString("agent_id"),
                rs.getInt("priority"),
                readInstant(rs, "created_at"),
                readInstant(rs, "started_at"),
                readInstant(rs, "completed_at"),
                json.readMap(rs.getString("metadata")),
                json.readValue(rs.getString("result")));
    }

    private static AgentStatus parseAgentStatus(String value) {
        AgentStatus status = AgentStatus.fromLegacy(value);
        return status != null ? status : AgentStatus.OFFLINE;
    }

    private static Instant readInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    private static void setNullableString(PreparedStatement stmt, int index, String value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.VARCHAR);
        } else {
            stmt.setString(index, value);
        }
    }

    private static void setNullableDouble(PreparedStatement stmt, int index, Double value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.DOUBLE);
        } else {
            stmt.setDouble(index, value);
        }
    }

    private static void setNullableTimestamp(PreparedStatement stmt, int index, Instant value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            stmt.setObject(index, toOffset(value));
        }
    }

    private OffsetDateTime now() {
        return toOffset(clock.instant());
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private static void rollbackQuietly(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed: {}", e.getMessage());
        }
    }

    private static <T> StoreResult<T> failure(String operation, SQLException e) {
        ErrorKind kind = classify(e);
        log.error("Failed to {} ({})", operation, kind, e);
        return StoreResult.failure(kind, e.getMessage());
    }

    private static <T> StoreResult<T> corrupt(String what, IllegalArgumentException e) {
        log.error("Stored {} could not be decoded", what, e);
        return StoreResult.failure(ErrorKind.INTEGRITY, e.getMessage());
    }

    static ErrorKind classify(SQLException e) {
        if (e instanceof SQLTimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        if (e instanceof SQLIntegrityConstraintViolationException) {
            return ErrorKind.INTEGRITY;
        }
        String state = e.getSQLState();
        if (state != null) {
            if (state.startsWith("23") || state.startsWith("22")) {
                return ErrorKind.INTEGRITY;
            }
            if ("57014".equals(state)) {
                return ErrorKind.TIMEOUT;
            }
        }
        return ErrorKind.CONNECTIVITY;
    }
}
