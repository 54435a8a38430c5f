package com.hivestate.migration;

import com.hivestate.core.cache.EphemeralStore;
import com.hivestate.core.cache.EphemeralStoreHealth;
import com.hivestate.core.events.StateEvent;
import com.hivestate.core.health.HealthStatus;
import com.hivestate.core.logging.MdcContext;
import com.hivestate.core.metrics.StateMetrics;
import com.hivestate.core.model.Agent;
import com.hivestate.core.model.AgentStateUpdate;
import com.hivestate.core.model.AgentStatus;
import com.hivestate.core.model.SystemSnapshot;
import com.hivestate.core.model.Task;
import com.hivestate.core.model.TaskDraft;
import com.hivestate.core.model.TaskStatus;
import com.hivestate.core.orchestration.HybridHealth;
import com.hivestate.core.orchestration.StateManager;
import com.hivestate.core.orchestration.StateUnavailableException;
import com.hivestate.core.persistence.PersistentStore;
import com.hivestate.core.persistence.PersistentStoreHealth;
import com.hivestate.core.store.ErrorKind;
import com.hivestate.core.store.JsonCodec;
import com.hivestate.core.store.StoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Moves the legacy SQLite state into the hybrid layer in six strictly sequential phases.
 * <p>
 * Source validation and infrastructure setup halt the run on failure. The data phases
 * collect per-row errors and carry on; with {@code failFast} the first row error ends the
 * phase and the run. A dry run performs every read, conversion and comparison but no
 * target-side write, so its record counts equal those of a real run.
 * <p>
 * One instance performs one run.
 */
public class LegacyStateMigrator {

    private static final Logger log = LoggerFactory.getLogger(LegacyStateMigrator.class);

    static final String PRE_MIGRATION_CHECKPOINT = "pre_migration";
    static final String SMOKE_TEST_PREFIX = "test_migration_";
    private static final int PROGRESS_EVERY_BATCHES = 10;

    private final MigrationSettings settings;
    private final PersistentStore persistent;
    private final EphemeralStore ephemeral;
    private final StateManager stateManager;
    private final JsonCodec json;
    private final StateMetrics metrics;
    private final Clock clock;

    private boolean targetsReachable;

    public LegacyStateMigrator(MigrationSettings settings, PersistentStore persistent, EphemeralStore ephemeral,
                               StateManager stateManager, JsonCodec json, StateMetrics metrics, Clock clock) {
        this.settings = settings;
        this.persistent = persistent;
        this.ephemeral = ephemeral;
        this.stateManager = stateManager;
        this.json = json;
        this.metrics = metrics;
        this.clock = clock;
    }

    public MigrationReport run() {
        long started = System.nanoTime();
        List<PhaseResult> results = new ArrayList<>();
        log.info("Starting {}migration from {}", settings.dryRun() ? "dry-run " : "", settings.legacyDatabase());

        PhaseTracker source = begin(MigrationPhase.SOURCE_VALIDATION);
        LegacyDatabase legacy = null;
        try {
            legacy = LegacyDatabase.open(settings.legacyDatabase());
            validateSource(legacy, source);
        } catch (SQLException e) {
            source.error("Cannot read legacy database: " + e.getMessage());
        }
        PhaseResult sourceResult = finish(source);
        results.add(sourceResult);
        if (!sourceResult.success()) {
            closeQuietly(legacy);
            return report(results, false, started);
        }

        boolean validationPassed = false;
        try (LegacyDatabase db = legacy) {
            PhaseResult infrastructure = finish(setUpInfrastructure());
            results.add(infrastructure);
            if (!infrastructure.success()) {
                return report(results, false, started);
            }

            PhaseResult agents = finish(migrateAgents(db));
            results.add(agents);
            if (halts(agents)) {
                return report(results, false, started);
            }

            PhaseResult tasks = finish(migrateTasks(db));
            results.add(tasks);
            if (halts(tasks)) {
                return report(results, false, started);
            }

            PhaseResult systemData = finish(migrateSystemData(db));
            results.add(systemData);
            if (halts(systemData)) {
                return report(results, false, started);
            }

            PhaseResult validation = finish(validate(db, agents.recordsMigrated()));
            results.add(validation);
            validationPassed = validation.success();
        } catch (SQLException e) {
            log.warn("Failed to close legacy database: {}", e.getMessage());
        }

        MigrationReport report = report(results, validationPassed, started);
        if (report.success() && !settings.dryRun()) {
            publishCompletion(report);
        }
        return report;
    }

    // ── Phase 1: source validation ──────────────────────────────────────

    private void validateSource(LegacyDatabase legacy, PhaseTracker tracker) throws SQLException {
        List<String> missing = legacy.missingTables();
        if (!missing.isEmpty()) {
            tracker.error("Legacy database is missing tables: " + String.join(", ", missing));
            return;
        }
        for (String table : LegacyDatabase.REQUIRED_TABLES) {
            long rows = legacy.count(table);
            log.info("Legacy table '{}' holds {} rows", table, rows);
            if (rows == 0) {
                tracker.warn("Legacy table '" + table + "' is empty");
            }
        }
    }

    // ── Phase 2: infrastructure setup ───────────────────────────────────

    private PhaseTracker setUpInfrastructure() {
        PhaseTracker tracker = begin(MigrationPhase.INFRASTRUCTURE_SETUP);

        PersistentStoreHealth persistentHealth = persistent.healthCheck();
        if (!persistentHealth.connected()) {
            tracker.error("Persistent store unreachable: " + persistentHealth.error());
        }
        EphemeralStoreHealth ephemeralHealth = ephemeral.healthCheck();
        if (ephemeral.isEnabled() && !ephemeralHealth.connected()) {
            tracker.error("Ephemeral store unreachable: " + ephemeralHealth.error());
        } else if (!ephemeral.isEnabled()) {
            tracker.warn("Ephemeral store disabled; migrated state will not be cached");
        }
        HybridHealth hybrid = stateManager.healthCheck();
        if (hybrid.status() == HealthStatus.Status.DOWN) {
            tracker.error("State orchestrator reports DOWN");
        }
        if (tracker.hasErrors()) {
            return tracker;
        }

        if (settings.dryRun()) {
            tracker.warn("Dry run: schema and stream initialization skipped");
        } else {
            if (!persistent.initialize()) {
                tracker.error("Failed to initialize persistent schema");
                return tracker;
            }
            if (ephemeral.isEnabled() && !ephemeral.initialize()) {
                tracker.error("Failed to initialize ephemeral streams");
                return tracker;
            }
        }
        targetsReachable = true;
        return tracker;
    }

    // ── Phase 3: agents ─────────────────────────────────────────────────

    private PhaseTracker migrateAgents(LegacyDatabase legacy) {
        PhaseTracker tracker = begin(MigrationPhase.AGENT_MIGRATION);
        try {
            if (!settings.dryRun()) {
                writePreMigrationCheckpoint(legacy, tracker);
            }
            long offset = 0;
            int batches = 0;
            List<LegacyAgentRow> rows;
            while (!(rows = legacy.readAgents(settings.batchSize(), offset)).isEmpty()) {
                List<Agent> toCache = new ArrayList<>(rows.size());
                for (LegacyAgentRow row : rows) {
                    migrateAgent(row, tracker).ifPresent(toCache::add);
                    if (tracker.shouldStop()) {
                        return tracker;
                    }
                }
                if (!settings.dryRun() && !toCache.isEmpty()) {
                    cacheAgents(toCache, tracker);
                }
                offset += rows.size();
                if (++batches % PROGRESS_EVERY_BATCHES == 0) {
                    log.info("Agent migration progress: {} rows read, {} migrated", offset, tracker.records());
                }
            }
        } catch (SQLException e) {
            tracker.error("Failed to read legacy agents: " + e.getMessage());
        }
        return tracker;
    }

    private Optional<Agent> migrateAgent(LegacyAgentRow row, PhaseTracker tracker) {
        if (row.agentId() == null || row.agentId().isBlank()) {
            tracker.error("Legacy agent row without agent_id");
            return Optional.empty();
        }
        Agent agent = toAgent(row, tracker);
        if (settings.dryRun()) {
            tracker.migrated();
            return Optional.of(agent);
        }

        StoreResult<Boolean> registered = persistent.registerAgent(agent.agentId(), agent.capabilities());
        if (registered.failed()) {
            tracker.error("Agent " + agent.agentId() + ": " + registered.message());
            return Optional.empty();
        }
        if (hasNonDefaultState(agent)) {
            AgentStateUpdate update = new AgentStateUpdate(
                    agent.status(),
                    agent.currentTaskId(),
                    agent.contextUsage(),
                    agent.performanceMetrics().isEmpty() ? null : agent.performanceMetrics());
            StoreResult<Boolean> updated = persistent.updateAgentState(agent.agentId(), update);
            if (updated.failed()) {
                tracker.error("Agent " + agent.agentId() + " state: " + updated.message());
                return Optional.empty();
            }
        }
        tracker.migrated();
        return Optional.of(agent);
    }

    private Agent toAgent(LegacyAgentRow row, PhaseTracker tracker) {
        AgentStatus status = AgentStatus.fromLegacy(row.status());
        if (status == null) {
            tracker.warn("Agent " + row.agentId() + ": unknown status '" + row.status() + "' mapped to offline");
            status = AgentStatus.OFFLINE;
        }
        List<String> capabilities;
        try {
            capabilities = json.readStringList(row.capabilities());
        } catch (IllegalArgumentException e) {
            tracker.warn("Agent " + row.agentId() + ": unreadable capabilities dropped");
            capabilities = List.of();
        }
        Map<String, Number> performance;
        try {
            performance = json.readNumberMap(row.performanceMetrics());
        } catch (IllegalArgumentException e) {
            tracker.warn("Agent " + row.agentId() + ": unreadable performance metrics dropped");
            performance = Map.of();
        }
        long emptyCapabilities = capabilities.stream().filter(Objects::isNull).count();
        if (emptyCapabilities > 0) {
            tracker.warn("Agent " + row.agentId() + ": " + emptyCapabilities + " null capabilities dropped");
        }
        List<String> emptyMetrics = performance.entrySet().stream()
                .filter(e -> e.getValue() == null)
                .map(Map.Entry::getKey)
                .toList();
        if (!emptyMetrics.isEmpty()) {
            tracker.warn("Agent " + row.agentId() + ": performance metrics without a value dropped " + emptyMetrics);
        }
        double contextUsage = row.contextUsage() == null ? 0.0 : row.contextUsage();
        return new Agent(row.agentId(), status, row.currentTaskId(), contextUsage, clock.instant(),
                capabilities, performance);
    }

    private static boolean hasNonDefaultState(Agent agent) {
        return agent.status() != AgentStatus.IDLE
                || agent.currentTaskId() != null
                || agent.contextUsage() != 0.0
                || !agent.performanceMetrics().isEmpty();
    }

    private void cacheAgents(List<Agent> agents, PhaseTracker tracker) {
        StoreResult<Integer> cached = ephemeral.batchCacheAgents(agents, null);
        if (cached.failed() && !cached.is(ErrorKind.UNAVAILABLE)) {
            tracker.warn("Failed to cache " + agents.size() + " agents: " + cached.message());
        }
    }

    private void writePreMigrationCheckpoint(LegacyDatabase legacy, PhaseTracker tracker) throws SQLException {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("legacy_database", settings.legacyDatabase().toString());
        data.put("started_at", clock.instant().toString());
        data.put("agents", legacy.count(LegacyDatabase.AGENTS));
        data.put("tasks", legacy.count(LegacyDatabase.TASKS));
        data.put("system_snapshots", legacy.count(LegacyDatabase.SYSTEM_SNAPSHOTS));
        data.put("checkpoints", legacy.count(LegacyDatabase.CHECKPOINTS));
        StoreResult<Long> checkpoint = persistent.createCheckpoint(PRE_MIGRATION_CHECKPOINT, data);
        if (checkpoint.failed()) {
            tracker.warn("Failed to write pre-migration checkpoint: " + checkpoint.message());
        }
    }

    // ── Phase 4: tasks ──────────────────────────────────────────────────

    private PhaseTracker migrateTasks(LegacyDatabase legacy) {
        PhaseTracker tracker = begin(MigrationPhase.TASK_MIGRATION);
        try {
            long offset = 0;
            int batches = 0;
            List<LegacyTaskRow> rows;
            while (!(rows = legacy.readTasks(settings.batchSize(), offset)).isEmpty()) {
                for (LegacyTaskRow row : rows) {
                    migrateTask(row, tracker);
                    if (tracker.shouldStop()) {
                        return tracker;
                    }
                }
                offset += rows.size();
                if (++batches % PROGRESS_EVERY_BATCHES == 0) {
                    log.info("Task migration progress: {} rows read, {} migrated", offset, tracker.records());
                }
            }
        } catch (SQLException e) {
            tracker.error("Failed to read legacy tasks: " + e.getMessage());
        }
        return tracker;
    }

    private void migrateTask(LegacyTaskRow row, PhaseTracker tracker) {
        if (row.taskId() == null || row.taskId().isBlank()) {
            tracker.error("Legacy task row without task_id");
            return;
        }
        TaskDraft draft = toDraft(row, tracker);
        if (settings.dryRun()) {
            tracker.migrated();
            return;
        }

        StoreResult<String> created = persistent.createTask(draft);
        if (created.failed()) {
            tracker.error("Task " + row.taskId() + ": " + created.message());
            return;
        }
        tracker.migrated();
        if (draft.statusOrDefault() == TaskStatus.PENDING) {
            Task task = new Task(draft.taskId(), TaskStatus.PENDING, draft.agentId(), draft.priorityOrDefault(),
                    draft.createdAt() != null ? draft.createdAt() : clock.instant(), draft.startedAt(),
                    draft.completedAt(), draft.metadata(), null);
            StoreResult<Boolean> cached = ephemeral.cacheTask(task, null);
            if (cached.failed() && !cached.is(ErrorKind.UNAVAILABLE)) {
                tracker.warn("Failed to cache pending task " + row.taskId() + ": " + cached.message());
            }
        }
    }

    private TaskDraft toDraft(LegacyTaskRow row, PhaseTracker tracker) {
        TaskStatus status = TaskStatus.fromLegacy(row.status());
        if (status == null) {
            tracker.warn("Task " + row.taskId() + ": unknown status '" + row.status() + "' mapped to failed");
            status = TaskStatus.FAILED;
        }
        Map<String, Object> metadata;
        try {
            metadata = json.readMap(row.metadata());
        } catch (IllegalArgumentException e) {
            tracker.warn("Task " + row.taskId() + ": non-JSON metadata kept as text");
            metadata = Map.of("legacy_metadata", row.metadata());
        }
        return new TaskDraft(
                row.taskId(),
                status,
                row.agentId(),
                row.priority(),
                metadata,
                LegacyDatabase.parseTimestamp(row.createdAt()),
                LegacyDatabase.parseTimestamp(row.startedAt()),
                LegacyDatabase.parseTimestamp(row.completedAt()),
                null);
    }

    // ── Phase 5: snapshots and checkpoints ──────────────────────────────

    private PhaseTracker migrateSystemData(LegacyDatabase legacy) {
        PhaseTracker tracker = begin(MigrationPhase.SYSTEM_DATA_MIGRATION);
        try {
            Instant cutoff = clock.instant().minus(settings.snapshotRetention());
            for (LegacySnapshotRow row : legacy.readSnapshotsSince(cutoff)) {
                migrateSnapshot(row, tracker);
                if (tracker.shouldStop()) {
                    return tracker;
                }
            }
            for (LegacyCheckpointRow row : legacy.readRecentCheckpoints(settings.checkpointLimit())) {
                migrateCheckpoint(row, tracker);
                if (tracker.shouldStop()) {
                    return tracker;
                }
            }
        } catch (SQLException e) {
            tracker.error("Failed to read legacy system data: " + e.getMessage());
        }
        return tracker;
    }

    private void migrateSnapshot(LegacySnapshotRow row, PhaseTracker tracker) {
        if (row.timestamp() == null) {
            tracker.warn("Snapshot with unreadable timestamp '" + row.rawTimestamp() + "' skipped");
            return;
        }
        if (settings.dryRun()) {
            tracker.migrated();
            return;
        }
        SystemSnapshot snapshot = new SystemSnapshot(0L, row.timestamp(), row.totalAgents(), row.activeAgents(),
                row.totalTasks(), row.completedTasks(), row.failedTasks(), row.averageContextUsage(),
                row.qualityScore(), Map.of("migrated_from_legacy", true));
        StoreResult<Long> imported = persistent.importSystemSnapshot(snapshot);
        if (imported.failed()) {
            tracker.error("Snapshot " + row.timestamp() + ": " + imported.message());
            return;
        }
        tracker.migrated();
    }

    private void migrateCheckpoint(LegacyCheckpointRow row, PhaseTracker tracker) {
        if (settings.dryRun()) {
            tracker.migrated();
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        Object original = json.readLenient(row.data());
        data.put("data", original != null ? original : Map.of());
        data.put("migrated_from_legacy", true);
        data.put("original_timestamp", row.timestamp());
        StoreResult<Long> created = persistent.createCheckpoint(row.name(), data);
        if (created.failed()) {
            tracker.error("Checkpoint " + row.name() + ": " + created.message());
            return;
        }
        tracker.migrated();
    }

    // ── Phase 6: validation ─────────────────────────────────────────────

    private PhaseTracker validate(LegacyDatabase legacy, int agentsMigrated) {
        PhaseTracker tracker = begin(MigrationPhase.VALIDATION);
        try {
            long sourceAgents = legacy.count(LegacyDatabase.AGENTS);
            if (settings.dryRun()) {
                if (sourceAgents != agentsMigrated) {
                    tracker.error("Agent count mismatch: legacy=" + sourceAgents + ", would migrate=" + agentsMigrated);
                }
                tracker.warn("Dry run: sample check and smoke test skipped");
                return tracker;
            }

            StoreResult<Long> targetAgents = persistent.countAgents();
            if (targetAgents.failed()) {
                tracker.error("Cannot count target agents: " + targetAgents.message());
            } else if (targetAgents.value() != sourceAgents) {
                tracker.error("Agent count mismatch: legacy=" + sourceAgents + ", target=" + targetAgents.value());
            }
            checkSample(legacy, tracker);
            smokeTest(tracker);
        } catch (SQLException e) {
            tracker.error("Failed to read legacy database during validation: " + e.getMessage());
        }
        return tracker;
    }

    private void checkSample(LegacyDatabase legacy, PhaseTracker tracker) throws SQLException {
        for (LegacyAgentRow row : legacy.readAgents(settings.validationSampleSize(), 0)) {
            if (row.agentId() == null || row.agentId().isBlank()) {
                continue;
            }
            AgentStatus expected = AgentStatus.fromLegacy(row.status());
            if (expected == null) {
                expected = AgentStatus.OFFLINE;
            }
            // Compare against the database row, not the cache.
            StoreResult<Optional<Agent>> migrated = persistent.getAgentState(row.agentId());
            if (migrated.failed()) {
                tracker.error("Sampled agent " + row.agentId() + " unreadable: " + migrated.message());
            } else if (migrated.value().isEmpty()) {
                tracker.error("Sampled agent " + row.agentId() + " missing from target");
            } else if (migrated.value().get().status() != expected) {
                tracker.error("Sampled agent " + row.agentId() + " status mismatch: expected "
                        + expected.wireValue() + ", found " + migrated.value().get().status().wireValue());
            }
        }
    }

    private void smokeTest(PhaseTracker tracker) {
        String agentId = SMOKE_TEST_PREFIX + UUID.randomUUID();
        try {
            if (!stateManager.registerAgent(agentId, List.of("migration_test"))) {
                tracker.error("Smoke test: registration failed");
                return;
            }
            Optional<Agent> readBack = stateManager.getAgentState(agentId);
            if (readBack.isEmpty() || !readBack.get().hasCapability("migration_test")) {
                tracker.error("Smoke test: registered agent not readable");
            }
        } catch (StateUnavailableException e) {
            tracker.error("Smoke test: " + e.getMessage());
        } finally {
            StoreResult<Boolean> deleted = persistent.deleteAgent(agentId);
            if (deleted.failed() && !deleted.is(ErrorKind.NOT_FOUND)) {
                tracker.warn("Smoke test agent " + agentId + " not removed: " + deleted.message());
            }
            ephemeral.deleteAgentState(agentId);
        }
    }

    // ── Helpers ─────────────────────────────────────────────────────────

    private void publishCompletion(MigrationReport report) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("records_migrated", report.totalRecordsMigrated());
        payload.put("duration_ms", report.duration().toMillis());
        payload.put("legacy_database", settings.legacyDatabase().toString());
        stateManager.publishEvent(new StateEvent(StateEvent.MIGRATION_COMPLETED, null, null, payload, clock.instant()));
    }

    private boolean halts(PhaseResult result) {
        return settings.failFast() && !result.success();
    }

    private PhaseTracker begin(MigrationPhase phase) {
        MdcContext.setMigrationPhase(phase.key());
        log.info("Phase {} started", phase.key());
        return new PhaseTracker(phase, settings.failFast());
    }

    private PhaseResult finish(PhaseTracker tracker) {
        PhaseResult result = tracker.toResult(targetsReachable);
        metrics.recordMigrationPhase(result.phase().key(), result.success(), result.duration().toMillis());
        metrics.recordMigratedRecords(result.phase().key(), result.recordsMigrated());
        if (result.success()) {
            log.info("Phase {} completed: {} records in {} ms ({} warnings)", result.phase().key(),
                    result.recordsMigrated(), result.duration().toMillis(), result.warnings().size());
        } else {
            log.error("Phase {} failed with {} errors: {}", result.phase().key(), result.errors().size(),
                    result.errors().get(0));
        }
        MdcContext.clear();
        return result;
    }

    private MigrationReport report(List<PhaseResult> results, boolean validationPassed, long startedNanos) {
        MigrationReport report = new MigrationReport(settings.dryRun(), results, validationPassed,
                Duration.ofNanos(System.nanoTime() - startedNanos));
        log.info("Migration {} after {} phases: {} records, {} errors", report.success() ? "succeeded" : "failed",
                results.size(), report.totalRecordsMigrated(), report.allErrors().size());
        return report;
    }

    private static void closeQuietly(LegacyDatabase legacy) {
        if (legacy == null) {
            return;
        }
        try {
            legacy.close();
        } catch (SQLException e) {
            log.warn("Failed to close legacy database: {}", e.getMessage());
        }
    }

    /**
     * Mutable accumulator for one phase.
     */
    private static final class PhaseTracker {

        private final MigrationPhase phase;
        private final boolean failFast;
        private final long startedNanos = System.nanoTime();
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private int records;

        PhaseTracker(MigrationPhase phase, boolean failFast) {
            this.phase = phase;
            this.failFast = failFast;
        }

        void migrated() {
            records++;
        }

        int records() {
            return records;
        }

        void error(String message) {
            log.warn("[{}] {}", phase.key(), message);
            errors.add(message);
        }

        void warn(String message) {
            log.debug("[{}] {}", phase.key(), message);
            warnings.add(message);
        }

        boolean hasErrors() {
            return !errors.isEmpty();
        }

        boolean shouldStop() {
            return failFast && hasErrors();
        }

        PhaseResult toResult(boolean rollbackAvailable) {
            return new PhaseResult(phase, errors.isEmpty(), records, errors, warnings,
                    Duration.ofNanos(System.nanoTime() - startedNanos), rollbackAvailable);
        }
    }
}
