package com.hivestate.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only access to the legacy embedded SQLite state database.
 * <p>
 * A single connection is held for the lifetime of the instance. Paginated reads are ordered
 * by {@code rowid} so consecutive pages never overlap.
 */
public class LegacyDatabase implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LegacyDatabase.class);

    public static final String AGENTS = "agents";
    public static final String TASKS = "tasks";
    public static final String SYSTEM_SNAPSHOTS = "system_snapshots";
    public static final String CHECKPOINTS = "checkpoints";

    /** Tables the migration reads; a source missing any of them is rejected. */
    public static final List<String> REQUIRED_TABLES = List.of(AGENTS, TASKS, SYSTEM_SNAPSHOTS, CHECKPOINTS);

    private static final String SELECT_AGENTS_SQL = """
            SELECT agent_id, status, current_task_id, context_usage, last_activity,
                   capabilities, performance_metrics
            FROM agents ORDER BY rowid LIMIT ? OFFSET ?
            """;

    private static final String SELECT_TASKS_SQL = """
            SELECT task_id, status, agent_id, priority, created_at, started_at, completed_at, metadata
            FROM tasks ORDER BY rowid LIMIT ? OFFSET ?
            """;

    // Legacy timestamps come in several spellings, so the cutoff is applied after parsing.
    private static final String SELECT_SNAPSHOTS_SQL = """
            SELECT timestamp, total_agents, active_agents, total_tasks, completed_tasks,
                   failed_tasks, average_context_usage, quality_score
            FROM system_snapshots ORDER BY rowid
            """;

    private static final String SELECT_CHECKPOINTS_SQL = """
            SELECT checkpoint_name, timestamp, data
            FROM checkpoints ORDER BY timestamp DESC LIMIT ?
            """;

    private final Path path;
    private final Connection connection;

    private LegacyDatabase(Path path, Connection connection) {
        this.path = path;
        this.connection = connection;
    }

    /**
     * Opens the database read-only.
     *
     * @throws SQLException when the file is missing or not a SQLite database
     */
    public static LegacyDatabase open(Path path) throws SQLException {
        if (!Files.isRegularFile(path)) {
            throw new SQLException("Legacy database not found: " + path);
        }
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        Connection connection = DriverManager.getConnection("jdbc:sqlite:" + path, config.toProperties());
        log.info("Opened legacy database {} (read-only)", path);
        return new LegacyDatabase(path, connection);
    }

    public Path path() {
        return path;
    }

    public Set<String> tables() throws SQLException {
        Set<String> tables = new TreeSet<>();
        DatabaseMetaData meta = connection.getMetaData();
        try (ResultSet rs = meta.getTables(null, null, "%", new String[]{"TABLE"})) {
            while (rs.next()) {
                tables.add(rs.getString("TABLE_NAME").toLowerCase(Locale.ROOT));
            }
        }
        return tables;
    }

    public List<String> missingTables() throws SQLException {
        Set<String> present = tables();
        return REQUIRED_TABLES.stream().filter(t -> !present.contains(t)).toList();
    }

    public long count(String table) throws SQLException {
        if (!REQUIRED_TABLES.contains(table)) {
            throw new IllegalArgumentException("Unknown legacy table: " + table);
        }
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    public List<LegacyAgentRow> readAgents(int limit, long offset) throws SQLException {
        List<LegacyAgentRow> rows = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(SELECT_AGENTS_SQL)) {
            stmt.setInt(1, limit);
            stmt.setLong(2, offset);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(new LegacyAgentRow(
                            rs.getString("agent_id"),
                            rs.getString("status"),
                            rs.getString("current_task_id"),
                            nullableDouble(rs, "context_usage"),
                            rs.getString("last_activity"),
                            rs.getString("capabilities"),
                            rs.getString("performance_metrics")));
                }
            }
        }
        return rows;
    }

    public List<LegacyTaskRow> readTasks(int limit, long offset) throws SQLException {
        List<LegacyTaskRow> rows = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(SELECT_TASKS_SQL)) {
            stmt.setInt(1, limit);
            stmt.setLong(2, offset);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    int priority = rs.getInt("priority");
                    rows.add(new LegacyTaskRow(
                            rs.getString("task_id"),
                            rs.getString("status"),
                            rs.getString("agent_id"),
                            rs.wasNull() ? null : priority,
                            rs.getString("created_at"),
                            rs.getString("started_at"),
                            rs.getString("completed_at"),
                            rs.getString("metadata")));
                }
            }
        }
        return rows;
    }

    /**
     * Snapshots taken at or after {@code cutoff} in table order. Rows whose timestamp cannot
     * be parsed are returned too, with a null {@link LegacySnapshotRow#timestamp()}, so the
     * caller can report them.
     */
    public List<LegacySnapshotRow> readSnapshotsSince(Instant cutoff) throws SQLException {
        List<LegacySnapshotRow> rows = new ArrayList<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(SELECT_SNAPSHOTS_SQL)) {
            while (rs.next()) {
                String rawTimestamp = rs.getString("timestamp");
                Instant timestamp = parseTimestamp(rawTimestamp);
                if (timestamp != null && timestamp.isBefore(cutoff)) {
                    continue;
                }
                rows.add(new LegacySnapshotRow(
                        timestamp,
                        rawTimestamp,
                        rs.getInt("total_agents"),
                        rs.getInt("active_agents"),
                        rs.getInt("total_tasks"),
                        rs.getInt("completed_tasks"),
                        rs.getInt("failed_tasks"),
                        rs.getDouble("average_context_usage"),
                        rs.getDouble("quality_score")));
            }
        }
        return rows;
    }

    /**
     * The {@code limit} most recent checkpoints, newest first.
     */
    public List<LegacyCheckpointRow> readRecentCheckpoints(int limit) throws SQLException {
        List<LegacyCheckpointRow> rows = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(SELECT_CHECKPOINTS_SQL)) {
            stmt.setInt(1, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(new LegacyCheckpointRow(
                            rs.getString("checkpoint_name"),
                            rs.getString("timestamp"),
                            rs.getString("data")));
                }
            }
        }
        return rows;
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }

    /**
     * Parses the timestamp spellings the legacy database contains: ISO-8601 instants or
     * offsets, and SQLite's {@code CURRENT_TIMESTAMP} form ({@code yyyy-MM-dd HH:mm:ss},
     * taken as UTC).
     *
     * @return the instant, or null when the text is blank or not recognised
     */
    public static Instant parseTimestamp(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.trim().replace(' ', 'T');
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value,
                    OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offset) {
                return offset.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.debug("Unrecognised legacy timestamp '{}'", text);
            return null;
        }
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
