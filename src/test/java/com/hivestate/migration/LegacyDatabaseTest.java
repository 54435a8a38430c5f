package com.hivestate.migration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class LegacyDatabaseTest {

    @TempDir
    Path tempDir;

    private Path path;

    @BeforeEach
    void setUp() throws SQLException {
        path = tempDir.resolve("state.db");
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + path);
             Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE agents (agent_id TEXT PRIMARY KEY, status TEXT, current_task_id TEXT, "
                    + "context_usage REAL, last_activity TEXT, capabilities TEXT, performance_metrics TEXT)");
            stmt.execute("CREATE TABLE tasks (task_id TEXT PRIMARY KEY, status TEXT, agent_id TEXT, priority INTEGER, "
                    + "created_at TEXT, started_at TEXT, completed_at TEXT, metadata TEXT)");
            stmt.execute("CREATE TABLE checkpoints (id INTEGER PRIMARY KEY, checkpoint_name TEXT, timestamp TEXT, "
                    + "data TEXT)");
            for (int i = 1; i <= 5; i++) {
                stmt.execute("INSERT INTO agents VALUES ('agent-" + i + "', 'idle', NULL, NULL, NULL, '[]', '{}')");
            }
            stmt.execute("INSERT INTO tasks VALUES ('t1', 'pending', NULL, NULL, NULL, NULL, NULL, NULL)");
            stmt.execute("INSERT INTO checkpoints (checkpoint_name, timestamp, data) VALUES "
                    + "('old', '2025-01-01 00:00:00', '{}'), ('new', '2025-02-01 00:00:00', '{}'), "
                    + "('mid', '2025-01-15 00:00:00', '{}')");
        }
    }

    @Test
    @DisplayName("reports the required tables that are absent")
    void missingTables() throws SQLException {
        try (LegacyDatabase db = LegacyDatabase.open(path)) {
            assertTrue(db.tables().containsAll(List.of("agents", "tasks", "checkpoints")));
            assertEquals(List.of(LegacyDatabase.SYSTEM_SNAPSHOTS), db.missingTables());
        }
    }

    @Test
    @DisplayName("pages through agents without overlap")
    void pagination() throws SQLException {
        try (LegacyDatabase db = LegacyDatabase.open(path)) {
            List<String> first = db.readAgents(2, 0).stream().map(LegacyAgentRow::agentId).toList();
            List<String> second = db.readAgents(2, 2).stream().map(LegacyAgentRow::agentId).toList();
            List<String> third = db.readAgents(2, 4).stream().map(LegacyAgentRow::agentId).toList();

            assertEquals(List.of("agent-1", "agent-2"), first);
            assertEquals(List.of("agent-3", "agent-4"), second);
            assertEquals(List.of("agent-5"), third);
            assertTrue(db.readAgents(2, 6).isEmpty());
            assertEquals(5, db.count(LegacyDatabase.AGENTS));
        }
    }

    @Test
    @DisplayName("null numeric columns stay null")
    void nullColumns() throws SQLException {
        try (LegacyDatabase db = LegacyDatabase.open(path)) {
            assertNull(db.readAgents(1, 0).get(0).contextUsage());
            assertNull(db.readTasks(1, 0).get(0).priority());
        }
    }

    @Test
    @DisplayName("recent checkpoints come newest first")
    void recentCheckpoints() throws SQLException {
        try (LegacyDatabase db = LegacyDatabase.open(path)) {
            List<String> names = db.readRecentCheckpoints(2).stream().map(LegacyCheckpointRow::name).toList();
            assertEquals(List.of("new", "mid"), names);
        }
    }

    @Test
    @DisplayName("only known tables can be counted")
    void countRejectsUnknownTable() throws SQLException {
        try (LegacyDatabase db = LegacyDatabase.open(path)) {
            assertThrows(IllegalArgumentException.class, () -> db.count("sqlite_master; DROP TABLE agents"));
        }
    }

    @Test
    @DisplayName("a missing file is rejected before any connection is made")
    void missingFile() {
        SQLException e = assertThrows(SQLException.class, () -> LegacyDatabase.open(tempDir.resolve("nope.db")));
        assertTrue(e.getMessage().contains("nope.db"));
    }

    @Test
    @DisplayName("timestamps in SQLite, ISO local and ISO offset form parse to UTC instants")
    void parseTimestamps() {
        Instant expected = Instant.parse("2025-02-28T09:05:00Z");
        Stream.of("2025-02-28 09:05:00", "2025-02-28T09:05:00", "2025-02-28T09:05:00Z", "2025-02-28T11:05:00+02:00")
                .forEach(text -> assertEquals(expected, LegacyDatabase.parseTimestamp(text), text));
        assertEquals(Instant.parse("2025-02-28T09:05:00.123Z"),
                LegacyDatabase.parseTimestamp("2025-02-28 09:05:00.123"));
    }

    @Test
    @DisplayName("blank or unrecognised timestamps parse to null")
    void unparseableTimestamps() {
        assertNull(LegacyDatabase.parseTimestamp(null));
        assertNull(LegacyDatabase.parseTimestamp("  "));
        assertNull(LegacyDatabase.parseTimestamp("yesterday"));
        assertNull(LegacyDatabase.parseTimestamp("2025-02-28"));
    }
}
