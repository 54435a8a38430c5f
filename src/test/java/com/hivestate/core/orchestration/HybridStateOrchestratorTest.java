package com.hivestate.core.orchestration;

import com.hivestate.core.cache.CacheKeys;
import com.hivestate.core.cache.EphemeralStore;
import com.hivestate.core.cache.EphemeralStoreProperties;
import com.hivestate.core.cache.UnavailableEphemeralStore;
import com.hivestate.core.events.StateEvent;
import com.hivestate.core.health.HealthStatus;
import com.hivestate.core.metrics.StateMetrics;
import com.hivestate.core.model.Agent;
import com.hivestate.core.model.AgentStateUpdate;
import com.hivestate.core.model.AgentStatus;
import com.hivestate.core.model.AgentUpdate;
import com.hivestate.core.model.StreamMessage;
import com.hivestate.core.model.Task;
import com.hivestate.core.model.TaskDraft;
import com.hivestate.core.model.TaskStatus;
import com.hivestate.core.persistence.JdbcPersistentStore;
import com.hivestate.core.persistence.PersistenceProperties;
import com.hivestate.core.policy.StateDistributionPolicy;
import com.hivestate.core.store.JsonCodec;
import com.hivestate.testing.H2Databases;
import com.hivestate.testing.InMemoryEphemeralStore;
import com.hivestate.testing.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HybridStateOrchestratorTest {

    private MutableClock clock;
    private JdbcPersistentStore persistent;
    private InMemoryEphemeralStore cache;
    private SimpleMeterRegistry registry;
    private EphemeralStoreProperties cacheProperties;
    private HybridStateOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-01T10:00:00Z");
        persistent = new JdbcPersistentStore(H2Databases.create(), new JsonCodec(), clock, new PersistenceProperties());
        cache = new InMemoryEphemeralStore();
        registry = new SimpleMeterRegistry();
        cacheProperties = new EphemeralStoreProperties();
        orchestrator = orchestrator(persistent, cache);
        assertTrue(orchestrator.initialize());
    }

    private HybridStateOrchestrator orchestrator(JdbcPersistentStore store, EphemeralStore ephemeral) {
        return orchestrator(store, ephemeral, new OrchestratorProperties());
    }

    private HybridStateOrchestrator orchestrator(JdbcPersistentStore store, EphemeralStore ephemeral,
                                                 OrchestratorProperties properties) {
        return new HybridStateOrchestrator(store, ephemeral, StateDistributionPolicy.from(cacheProperties),
                properties, new PersistenceProperties(), new StateMetrics(registry), clock);
    }

    private String pendingTask(int priority) {
        String taskId = orchestrator.createTask(TaskDraft.of(priority, Map.of("kind", "build"))).orElseThrow();
        clock.advance(Duration.ofMillis(5));
        return taskId;
    }

    private static List<String> eventTypes(List<StreamMessage> messages) {
        return messages.stream().map(m -> String.valueOf(m.fields().get("event_type"))).toList();
    }

    @Nested
    @DisplayName("Write-through freshness")
    class Freshness {

        @Test
        @DisplayName("registration caches the stored agent with the agent TTL")
        void registerCaches() {
            assertTrue(orchestrator.registerAgent("agent-1", List.of("python")));

            assertTrue(cache.holdsAgent("agent-1"));
            assertEquals(cacheProperties.getDefaultTtl(), cache.ttlOf(CacheKeys.agentState("agent-1")));
        }

        @Test
        @DisplayName("reads after an update return the new state from the cache")
        void updateThenRead() {
            orchestrator.registerAgent("agent-1", List.of("python"));
            assertTrue(orchestrator.updateAgentState("agent-1",
                    AgentStateUpdate.status(AgentStatus.BUSY).withCurrentTask("task-9")));

            for (int i = 0; i < 20; i++) {
                Agent agent = orchestrator.getAgentState("agent-1").orElseThrow();
                assertEquals(AgentStatus.BUSY, agent.status());
                assertEquals("task-9", agent.currentTaskId());
            }
            PerformanceStats stats = orchestrator.getPerformanceStats();
            assertEquals(20, stats.cacheHits());
            assertEquals(0, stats.cacheMisses());
            assertTrue(stats.performanceOk());
        }

        @Test
        @DisplayName("hit ratio converges above target once the cache is warm")
        void hitRatioConverges() {
            for (int i = 0; i < 5; i++) {
                orchestrator.registerAgent("agent-" + i, List.of());
            }
            // One cold miss per agent after an eviction, then hits.
            for (int i = 0; i < 5; i++) {
                cache.deleteAgentState("agent-" + i);
            }
            for (int round = 0; round < 30; round++) {
                for (int i = 0; i < 5; i++) {
                    assertTrue(orchestrator.getAgentState("agent-" + i).isPresent());
                }
            }
            PerformanceStats stats = orchestrator.getPerformanceStats();
            assertEquals(5, stats.cacheMisses());
            assertEquals(145, stats.cacheHits());
            assertTrue(stats.cacheHitRatio() >= 0.95);
            assertTrue(stats.performanceOk());
        }

        @Test
        @DisplayName("update of an unknown agent fails without touching the cache")
        void updateUnknown() {
            int before = cache.writes();
            assertFalse(orchestrator.updateAgentState("ghost", AgentStateUpdate.contextUsage(0.5)));
            assertEquals(before, cache.writes());
        }

        @Test
        @DisplayName("batch update evicts every touched agent")
        void batchUpdateEvicts() {
            orchestrator.registerAgent("a", List.of());
            orchestrator.registerAgent("b", List.of());

            int changed = orchestrator.batchUpdateAgents(List.of(
                    new AgentUpdate("a", AgentStatus.BUSY, 0.2),
                    new AgentUpdate("b", AgentStatus.OFFLINE, 0.0)));

            assertEquals(2, changed);
            assertFalse(cache.holdsAgent("a"));
            assertFalse(cache.holdsAgent("b"));
            assertEquals(AgentStatus.OFFLINE, orchestrator.getAgentState("b").orElseThrow().status());
        }

        @Test
        @DisplayName("active agents always come from the persistent store")
        void activeAgentsFromDatabase() {
            orchestrator.registerAgent("a", List.of());
            cache.goOffline();
            assertEquals(1, orchestrator.getActiveAgents().size());
        }
    }

    @Nested
    @DisplayName("Tasks")
    class Tasks {

        @Test
        @DisplayName("created tasks are cached and readable")
        void createCaches() {
            String taskId = pendingTask(5);

            assertTrue(cache.holdsTask(taskId));
            Task task = orchestrator.getTask(taskId).orElseThrow();
            assertEquals(TaskStatus.PENDING, task.status());
            assertEquals("build", task.metadata().get("kind"));
        }

        @Test
        @DisplayName("pending tasks come back by priority then age")
        void pendingOrder() {
            String low = pendingTask(1);
            String high = pendingTask(9);

            List<String> ids = orchestrator.getPendingTasks(10).stream().map(Task::taskId).toList();
            assertEquals(List.of(high, low), ids);
        }

        @Test
        @DisplayName("assignment invalidates the cached task and publishes an event")
        void assignInvalidates() {
            orchestrator.registerAgent("agent-1", List.of());
            String taskId = pendingTask(5);

            assertTrue(orchestrator.assignTask(taskId, "agent-1"));

            assertFalse(cache.holdsTask(taskId));
            Task task = orchestrator.getTask(taskId).orElseThrow();
            assertEquals(TaskStatus.ASSIGNED, task.status());
            assertEquals("agent-1", task.agentId());
            assertTrue(eventTypes(cache.stream(CacheKeys.EVENT_STREAM)).contains(StateEvent.TASK_ASSIGNED));
        }

        @Test
        @DisplayName("losing an assignment race is a counted conflict, not an error")
        void assignConflict() {
            orchestrator.registerAgent("agent-1", List.of());
            orchestrator.registerAgent("agent-2", List.of());
            String taskId = pendingTask(5);

            assertTrue(orchestrator.assignTask(taskId, "agent-1"));
            assertFalse(orchestrator.assignTask(taskId, "agent-2"));

            assertEquals(1.0, registry.get("hivestate.assignment.conflicts").counter().count());
            assertEquals("agent-1", orchestrator.getTask(taskId).orElseThrow().agentId());
        }

        @Test
        @DisplayName("completion releases the agent and drops both cache entries")
        void completeEvicts() {
            orchestrator.registerAgent("agent-1", List.of());
            String taskId = pendingTask(5);
            orchestrator.assignTask(taskId, "agent-1");
            orchestrator.updateAgentState("agent-1", AgentStateUpdate.status(AgentStatus.BUSY).withCurrentTask(taskId));
            assertTrue(orchestrator.startTask(taskId));
            orchestrator.cacheTask(taskId);
            assertTrue(cache.holdsAgent("agent-1"));
            assertTrue(cache.holdsTask(taskId));

            assertTrue(orchestrator.completeTask(taskId, true, Map.of("lines", 42)));

            assertFalse(cache.holdsTask(taskId));
            assertFalse(cache.holdsAgent("agent-1"));
            Agent agent = orchestrator.getAgentState("agent-1").orElseThrow();
            assertEquals(AgentStatus.IDLE, agent.status());
            assertNull(agent.currentTaskId());
            Task task = orchestrator.getTask(taskId).orElseThrow();
            assertEquals(TaskStatus.COMPLETED, task.status());
            assertNotNull(task.completedAt());
            assertTrue(eventTypes(cache.stream(CacheKeys.EVENT_STREAM)).contains(StateEvent.TASK_COMPLETED));
        }

        @Test
        @DisplayName("a pending task cannot be completed")
        void completePending() {
            String taskId = pendingTask(5);
            assertFalse(orchestrator.completeTask(taskId, true, null));
            assertEquals(TaskStatus.PENDING, orchestrator.getTask(taskId).orElseThrow().status());
        }

        @Test
        @DisplayName("cacheTask of an unknown task reports false")
        void cacheUnknownTask() {
            assertFalse(orchestrator.cacheTask("missing"));
        }
    }

    @Nested
    @DisplayName("Caching switches")
    class CachingSwitches {

        @Test
        @DisplayName("with agent caching off, register, update and read never cache the agent")
        void agentCachingOff() {
            OrchestratorProperties properties = new OrchestratorProperties();
            properties.setCacheAgentState(false);
            HybridStateOrchestrator uncached = orchestrator(persistent, cache, properties);

            assertTrue(uncached.registerAgent("agent-1", List.of()));
            assertTrue(uncached.updateAgentState("agent-1", AgentStateUpdate.status(AgentStatus.BUSY)));
            assertEquals(AgentStatus.BUSY, uncached.getAgentState("agent-1").orElseThrow().status());

            assertFalse(cache.holdsAgent("agent-1"));
            assertEquals(0, uncached.getPerformanceStats().cacheLookups());
        }

        @Test
        @DisplayName("with task caching off, tasks are read from the database only")
        void taskCachingOff() {
            OrchestratorProperties properties = new OrchestratorProperties();
            properties.setCacheTaskData(false);
            HybridStateOrchestrator uncached = orchestrator(persistent, cache, properties);

            String taskId = uncached.createTask(TaskDraft.of(3, Map.of())).orElseThrow();
            assertEquals(3, uncached.getTask(taskId).orElseThrow().priority());

            assertFalse(cache.holdsTask(taskId));
            assertEquals(0, uncached.getPerformanceStats().cacheLookups());
        }

        @Test
        @DisplayName("eviction still applies to entries cached before the switch was turned off")
        void evictionIgnoresSwitch() {
            orchestrator.registerAgent("agent-1", List.of());
            assertTrue(cache.holdsAgent("agent-1"));
            OrchestratorProperties properties = new OrchestratorProperties();
            properties.setCacheAgentState(false);

            orchestrator(persistent, cache, properties).batchUpdateAgents(
                    List.of(new AgentUpdate("agent-1", AgentStatus.OFFLINE, 0.0)));

            assertFalse(cache.holdsAgent("agent-1"));
        }
    }

    @Nested
    @DisplayName("Degraded operation")
    class Degraded {

        @Test
        @DisplayName("writes and reads keep working with the cache offline")
        void cacheOffline() {
            cache.goOffline();

            assertTrue(orchestrator.registerAgent("agent-1", List.of("go")));
            assertEquals(List.of("go"), orchestrator.getAgentState("agent-1").orElseThrow().capabilities());
            assertTrue(pendingTask(3).length() > 0);
            assertTrue(registry.get("hivestate.cache.refresh_failures").counters().size() > 0);
        }

        @Test
        @DisplayName("health is degraded when only the cache is down")
        void healthDegraded() {
            cache.goOffline();

            HybridHealth health = orchestrator.healthCheck();
            assertEquals(HealthStatus.Status.DEGRADED, health.status());
            assertFalse(health.healthy());
            assertTrue(health.persistent().connected());
        }

        @Test
        @DisplayName("health is up with both stores reachable")
        void healthUp() {
            assertTrue(orchestrator.healthCheck().healthy());
        }

        @Test
        @DisplayName("a disabled cache serves everything from the database without refresh failures")
        void cacheDisabled() {
            HybridStateOrchestrator dbOnly = orchestrator(persistent, new UnavailableEphemeralStore(clock));
            assertTrue(dbOnly.registerAgent("agent-1", List.of()));
            assertTrue(dbOnly.getAgentState("agent-1").isPresent());
            assertTrue(dbOnly.getCoordinationState("op-1").isEmpty());
            assertEquals(0L, dbOnly.getMetric("jobs"));
            assertTrue(registry.find("hivestate.cache.refresh_failures").counters().isEmpty());
        }

        @Test
        @DisplayName("a read that misses the cache with the database down throws")
        void databaseDown() throws SQLException {
            DataSource broken = mock(DataSource.class);
            when(broken.getConnection()).thenThrow(new SQLTransientConnectionException("refused", "08001"));
            JdbcPersistentStore down = new JdbcPersistentStore(broken, new JsonCodec(), clock, new PersistenceProperties());
            HybridStateOrchestrator failing = orchestrator(down, cache);

            StateUnavailableException e = assertThrows(StateUnavailableException.class,
                    () -> failing.getAgentState("agent-1"));
            assertTrue(e.getErrorKind().isInfrastructure());
            assertThrows(StateUnavailableException.class, () -> failing.getPendingTasks(5));
            assertFalse(failing.registerAgent("agent-1", List.of()));
            assertEquals(HealthStatus.Status.DOWN, failing.healthCheck().status());
        }

        @Test
        @DisplayName("a cached agent is still served while the database is down")
        void cachedDuringOutage() throws SQLException {
            orchestrator.registerAgent("agent-1", List.of());
            DataSource broken = mock(DataSource.class);
            when(broken.getConnection()).thenThrow(new SQLTransientConnectionException("refused", "08001"));
            JdbcPersistentStore down = new JdbcPersistentStore(broken, new JsonCodec(), clock, new PersistenceProperties());

            assertTrue(orchestrator(down, cache).getAgentState("agent-1").isPresent());
        }

        @Test
        @DisplayName("initialization fails only when the database cannot be prepared")
        void initializeWithoutDatabase() throws SQLException {
            DataSource broken = mock(DataSource.class);
            when(broken.getConnection()).thenThrow(new SQLTransientConnectionException("refused", "08001"));
            JdbcPersistentStore down = new JdbcPersistentStore(broken, new JsonCodec(), clock, new PersistenceProperties());

            assertFalse(orchestrator(down, cache).initialize());
            cache.goOffline();
            assertTrue(orchestrator.initialize());
        }
    }

    @Nested
    @DisplayName("Ephemeral state and streams")
    class EphemeralState {

        @Test
        @DisplayName("coordination state uses the coordination TTL")
        void coordination() {
            assertTrue(orchestrator.setCoordinationState("op-1", Map.of("step", 2)));
            assertEquals(2, orchestrator.getCoordinationState("op-1").orElseThrow().get("step"));
            assertTrue(orchestrator.getCoordinationState("op-2").isEmpty());
        }

        @Test
        @DisplayName("sessions can be created, read and extended")
        void sessions() {
            assertTrue(orchestrator.createSession("s-1", Map.of("user", "ops")));
            assertEquals(cacheProperties.getSessionTtl(), cache.ttlOf(CacheKeys.session("s-1")));
            assertEquals("ops", orchestrator.getSession("s-1").orElseThrow().get("user"));
            assertTrue(orchestrator.extendSession("s-1"));
            assertFalse(orchestrator.extendSession("s-2"));
        }

        @Test
        @DisplayName("queued tasks are consumed once per group")
        void taskStream() {
            String id = orchestrator.queueTask(Map.of("task_id", "t-1")).orElseThrow();

            List<StreamMessage> first = orchestrator.consumeTasks(CacheKeys.TASK_PROCESSORS_GROUP, "w-1", 10);
            assertEquals(1, first.size());
            assertEquals(id, first.get(0).messageId());
            assertTrue(orchestrator.consumeTasks(CacheKeys.TASK_PROCESSORS_GROUP, "w-2", 10).isEmpty());
            assertTrue(orchestrator.acknowledgeTask(CacheKeys.TASK_PROCESSORS_GROUP, id));
        }

        @Test
        @DisplayName("published events carry their type")
        void events() {
            orchestrator.publishEvent(new StateEvent("agent.heartbeat", "agent-1", null, Map.of(), clock.instant()));

            List<StreamMessage> events = orchestrator.consumeEvents(CacheKeys.MONITORING_GROUP, "m-1", 10);
            assertEquals(List.of("agent.heartbeat"), eventTypes(events));
        }

        @Test
        @DisplayName("metrics accumulate and read as zero when the cache is gone")
        void counters() {
            assertEquals(3L, orchestrator.incrementMetric("jobs", 3));
            assertEquals(5L, orchestrator.incrementMetric("jobs", 2));
            assertEquals(5L, orchestrator.getMetric("jobs"));
            cache.goOffline();
            assertEquals(0L, orchestrator.getMetric("jobs"));
        }
    }

    @Test
    @DisplayName("snapshots and checkpoints go to the persistent store")
    void snapshotsAndCheckpoints() {
        orchestrator.registerAgent("agent-1", List.of());
        assertTrue(orchestrator.createSystemSnapshot());

        long id = orchestrator.createCheckpoint("nightly", Map.of("agents", 1)).orElseThrow();
        assertTrue(id > 0);
        assertEquals(1, orchestrator.getCheckpoints("nightly", null, null, 10).size());
    }
}
