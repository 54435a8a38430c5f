package com.hivestate.core.orchestration;

import com.hivestate.core.cache.CacheKeys;
import com.hivestate.core.cache.EphemeralStore;
import com.hivestate.core.cache.EphemeralStoreHealth;
import com.hivestate.core.events.StateEvent;
import com.hivestate.core.logging.MdcContext;
import com.hivestate.core.metrics.StateMetrics;
import com.hivestate.core.model.Agent;
import com.hivestate.core.model.AgentStateUpdate;
import com.hivestate.core.model.AgentUpdate;
import com.hivestate.core.model.Checkpoint;
import com.hivestate.core.model.StreamMessage;
import com.hivestate.core.model.Task;
import com.hivestate.core.model.TaskDraft;
import com.hivestate.core.persistence.PersistenceProperties;
import com.hivestate.core.persistence.PersistentStore;
import com.hivestate.core.persistence.PersistentStoreHealth;
import com.hivestate.core.policy.CacheStrategy;
import com.hivestate.core.policy.PolicyEntry;
import com.hivestate.core.policy.StateDistributionPolicy;
import com.hivestate.core.policy.StateOperation;
import com.hivestate.core.store.ErrorKind;
import com.hivestate.core.store.StoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link StateManager} that routes every call between the persistent and ephemeral stores
 * according to the {@link StateDistributionPolicy}.
 * <p>
 * Strong operations decide against the persistent store alone. The cache is touched only
 * after the authoritative write succeeded, and a failed cache refresh never fails the
 * operation. Agent and task reads are cache-aside. With the ephemeral store unavailable
 * every read is a miss served by the persistent store.
 * <p>
 * Thread-safe; the running counters are the only mutable state.
 */
public class HybridStateOrchestrator implements StateManager {

    private static final Logger log = LoggerFactory.getLogger(HybridStateOrchestrator.class);

    private final PersistentStore persistent;
    private final EphemeralStore ephemeral;
    private final StateDistributionPolicy policy;
    private final OrchestratorProperties properties;
    private final PersistenceProperties persistenceProperties;
    private final StateMetrics metrics;
    private final Clock clock;

    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong readOperations = new AtomicLong();
    private final AtomicLong writeOperations = new AtomicLong();
    private final Object latencyLock = new Object();
    private double averageLatencyMs;
    private boolean latencySeeded;

    public HybridStateOrchestrator(PersistentStore persistent, EphemeralStore ephemeral,
                                   StateDistributionPolicy policy, OrchestratorProperties properties,
                                   PersistenceProperties persistenceProperties, StateMetrics metrics,
                                   Clock clock) {
        this.persistent = persistent;
        this.ephemeral = ephemeral;
        this.policy = policy;
        this.properties = properties;
        this.persistenceProperties = persistenceProperties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Creates the persistent schema (when enabled) and the streams. A missing cache only
     * degrades the layer; a missing persistent store fails initialization.
     */
    @Override
    public boolean initialize() {
        boolean persistentReady = !persistenceProperties.isInitializeSchema() || persistent.initialize();
        if (!persistentReady) {
            log.error("Persistent store could not be initialized");
            return false;
        }
        if (ephemeral.isEnabled() && !ephemeral.initialize()) {
            log.warn("Ephemeral store unavailable; serving all state from the persistent store");
        }
        log.info("Hybrid state layer initialized (cache {})", ephemeral.isEnabled() ? "enabled" : "disabled");
        return true;
    }

    // ── Agents ───────────────────────────────────────────────────────────

    @Override
    public boolean registerAgent(String agentId, List<String> capabilities) {
        long start = System.nanoTime();
        writeOperations.incrementAndGet();
        StoreResult<Boolean> result = persistent.registerAgent(agentId, capabilities);
        if (result.ok() && refreshesCache(StateOperation.REGISTER_AGENT)) {
            refreshAgentCache(StateOperation.REGISTER_AGENT, agentId);
        }
        finish(StateOperation.REGISTER_AGENT, start, result.ok());
        return result.ok();
    }

    @Override
    public Optional<Agent> getAgentState(String agentId) {
        long start = System.nanoTime();
        readOperations.incrementAndGet();
        PolicyEntry entry = policy.entry(StateOperation.GET_AGENT_STATE);

        if (readsCache(StateOperation.GET_AGENT_STATE)) {
            Optional<Agent> cached = ephemeral.getAgentState(agentId).orElse(Optional.empty());
            if (cached.isPresent()) {
                recordLookup("agent", true);
                finish(StateOperation.GET_AGENT_STATE, start, true);
                return cached;
            }
            recordLookup("agent", false);
        }

        Optional<Agent> stored = requireRead(persistent.getAgentState(agentId), "agent " + agentId);
        if (stored.isPresent() && refreshesCache(StateOperation.GET_AGENT_STATE)) {
            bestEffort(StateOperation.GET_AGENT_STATE, ephemeral.setAgentState(stored.get(), entry.ttl()));
        }
        finish(StateOperation.GET_AGENT_STATE, start, true);
        return stored;
    }

    /**
     * Writes the partial update, then overwrites the cache with the full fresh row.
     */
    @Override
    public boolean updateAgentState(String agentId, AgentStateUpdate update) {
        long start = System.nanoTime();
        writeOperations.incrementAndGet();
        StoreResult<Boolean> result = persistent.updateAgentState(agentId, update);
        if (result.ok() && refreshesCache(StateOperation.UPDATE_AGENT_STATE)) {
            refreshAgentCache(StateOperation.UPDATE_AGENT_STATE, agentId);
        } else if (result.is(ErrorKind.NOT_FOUND)) {
            log.debug("Update for unknown agent '{}' ignored", agentId);
        }
        finish(StateOperation.UPDATE_AGENT_STATE, start, result.ok());
        return result.ok();
    }

    @Override
    public List<Agent> getActiveAgents() {
        long start = System.nanoTime();
        readOperations.incrementAndGet();
        List<Agent> agents = requireRead(persistent.getActiveAgents(), "active agents");
        finish(StateOperation.GET_ACTIVE_AGENTS, start, true);
        return agents;
    }

    @Override
    public int batchUpdateAgents(List<AgentUpdate> updates) {
        long start = System.nanoTime();
        writeOperations.incrementAndGet();
        StoreResult<Integer> result = persistent.batchUpdateAgents(updates);
        if (result.ok() && invalidatesCache(StateOperation.BATCH_UPDATE_AGENTS)) {
            for (AgentUpdate update : updates) {
                bestEffort(StateOperation.BATCH_UPDATE_AGENTS, ephemeral.deleteAgentState(update.agentId()));
            }
        }
        finish(StateOperation.BATCH_UPDATE_AGENTS, start, result.ok());
        return result.orElse(0);
    }

    private void refreshAgentCache(StateOperation operation, String agentId) {
        StoreResult<Optional<Agent>> fresh = persistent.getAgentState(agentId);
        if (fresh.ok() && fresh.value().isPresent()) {
            bestEffort(operation, ephemeral.setAgentState(fresh.value().get(), policy.ttl(operation)));
        } else {
            // Could not read back; drop the entry rather than leave a stale copy.
            bestEffort(operation, ephemeral.deleteAgentState(agentId));
        }
    }

    // ── Tasks ────────────────────────────────────────────────────────────

    @Override
    public Optional<String> createTask(TaskDraft draft) {
        long start = System.nanoTime();
        writeOperations.incrementAndGet();
        StoreResult<String> result = persistent.createTask(draft);
        if (result.ok() && refreshesCache(StateOperation.CREATE_TASK)) {
            refreshTaskCache(StateOperation.CREATE_TASK, result.value());
        }
        finish(StateOperation.CREATE_TASK, start, result.ok());
        return result.toOptional();
    }

    @Override
    public Optional<Task> getTask(String taskId) {
        long start = System.nanoTime();
        readOperations.incrementAndGet();

        if (readsCache(StateOperation.GET_TASK)) {
            Optional<Task> cached = ephemeral.getCachedTask(taskId).orElse(Optional.empty());
            if (cached.isPresent()) {
                recordLookup("task", true);
                finish(StateOperation.GET_TASK, start, true);
                return cached;
            }
            recordLookup("task", false);
        }

        Optional<Task> stored = requireRead(persistent.getTask(taskId), "task " + taskId);
        if (stored.isPresent() && refreshesCache(StateOperation.GET_TASK)) {
            bestEffort(StateOperation.GET_TASK, ephemeral.cacheTask(stored.get(), policy.ttl(StateOperation.GET_TASK)));
        }
        finish(StateOperation.GET_TASK, start, true);
        return stored;
    }

    @Override
    public List<Task> getPendingTasks(int limit) {
        long start = System.nanoTime();
        readOperations.incrementAndGet();
        List<Task> tasks = requireRead(persistent.getPendingTasks(limit), "pending tasks");
        finish(StateOperation.GET_PENDING_TASKS, start, true);
        return tasks;
    }

    /**
     * Compare-and-set assignment against the persistent store. On success the cached task
     * is invalidated, never updated.
     */
    @Override
    public boolean assignTask(String taskId, String agentId) {
        long start = System.nanoTime();
        writeOperations.incrementAndGet();
        MdcContext.setTask(taskId, agentId);
        try {
            StoreResult<Boolean> result = persistent.assignTask(taskId, agentId);
            if (result.ok()) {
                if (invalidatesCache(StateOperation.ASSIGN_TASK)) {
                    bestEffort(StateOperation.ASSIGN_TASK, ephemeral.deleteCachedTask(taskId));
                }
                publishBestEffort(new StateEvent(StateEvent.TASK_ASSIGNED, agentId, taskId, Map.of(), clock.instant()));
                log.info("Task '{}' assigned to agent '{}'", taskId, agentId);
            } else if (result.is(ErrorKind.CONFLICT)) {
                metrics.recordAssignmentConflict();
                log.debug("Task '{}' already taken: {}", taskId, result.message());
            }
            finish(StateOperation.ASSIGN_TASK, start, result.ok());
            return result.ok();
        } finally {
            MdcContext.clear();
        }
    }

    @Override
    public boolean startTask(String taskId) {
        long start = System.nanoTime();
        writeOperations.incrementAndGet();
        StoreResult<Boolean> result = persistent.startTask(taskId);
        if (result.ok() && invalidatesCache(StateOperation.START_TASK)) {
            bestEffort(StateOperation.START_TASK, ephemeral.deleteCachedTask(taskId));
        }
        finish(StateOperation.START_TASK, start, result.ok());
        return result.ok();
    }

    /**
     * Finishes the task and releases its agent in one persistent transaction, then drops
     * both cached copies.
     */
    @Override
    public boolean completeTask(String taskId, boolean succeeded, Object result) {
        long start = System.nanoTime();
        writeOperations.incrementAndGet();
        String agentId = persistent.getTask(taskId).orElse(Optional.empty())
                .map(Task::agentId)
                .orElse(null);
        MdcContext.setTask(taskId, agentId);
        try {
            StoreResult<Boolean> outcome = persistent.completeTask(taskId, succeeded, result);
            if (outcome.ok()) {
                if (invalidatesCache(StateOperation.COMPLETE_TASK)) {
                    bestEffort(StateOperation.COMPLETE_TASK, ephemeral.deleteCachedTask(taskId));
                    if (agentId != null) {
                        bestEffort(StateOperation.COMPLETE_TASK, ephemeral.deleteAgentState(agentId));
                    }
                }
                publishBestEffort(new StateEvent(StateEvent.TASK_COMPLETED, agentId, taskId,
                        Map.of("succeeded", succeeded), clock.instant()));
            }
            finish(StateOperation.COMPLETE_TASK, start, outcome.ok());
            return outcome.ok();
        } finally {
            MdcContext.clear();
        }
    }

    @Override
    public boolean cacheTask(String taskId) {
        long start = System.nanoTime();
        writeOperations.incrementAndGet();
        boolean cached = refreshTaskCache(StateOperation.CACHE_TASK, taskId);
        finish(StateOperation.CACHE_TASK, start, cached);
        return cached;
    }

    private boolean refreshTaskCache(StateOperation operation, String taskId) {
        StoreResult<Optional<Task>> fresh = persistent.getTask(taskId);
        if (fresh.failed() || fresh.value().isEmpty()) {
            return false;
        }
        return bestEffort(operation, ephemeral.cacheTask(fresh.value().get(), policy.ttl(operation)));
    }

    // ── Snapshots and checkpoints ────────────────────────────────────────

    @Override
    public boolean createSystemSnapshot() {
        long start = System.nanoTime();
        writeOperations.incrementAndGet();
        StoreResult<Boolean> result = persistent.createSystemSnapshot();
        finish(StateOperation.CREATE_SYSTEM_SNAPSHOT, start, result.ok());
        return result.ok();
    }

    @Override
    public Optional<Long> createCheckpoint(String name, Map<String, Object> data) {
        long start = System.nanoTime();
        writeOperations.incrementAndGet();
        StoreResult<Long> result = persistent.createCheckpoint(name, data);
        finish(StateOperation.CREATE_CHECKPOINT, start, result.ok());
        return result.toOptional();
    }

    @Override
    public List<Checkpoint> getCheckpoints(String name, Instant from, Instant to, int limit) {
        long start = System.nanoTime();
        readOperations.incrementAndGet();
        List<Checkpoint> checkpoints = requireRead(persistent.getCheckpoints(name, from, to, limit), "checkpoints");
        finish(StateOperation.GET_CHECKPOINTS, start, true);
        return checkpoints;
    }

    // ── Streams ──────────────────────────────────────────────────────────

    @Override
    public Optional<String> queueTask(Map<String, Object> task) {
        writeOperations.incrementAndGet();
        return ephemeral.queueTask(task).toOptional();
    }

    @Override
    public List<StreamMessage> consumeTasks(String group, String consumer, int count) {
        readOperations.incrementAndGet();
        return ephemeral.consumeTasks(group, consumer, count).orElse(List.of());
    }

    @Override
    public boolean acknowledgeTask(String group, String messageId) {
        return ephemeral.acknowledgeTask(group, messageId).orElse(false);
    }

    @Override
    public Optional<String> publishEvent(StateEvent event) {
        writeOperations.incrementAndGet();
        return ephemeral.publishEvent(event.toFields()).toOptional();
    }

    @Override
    public List<StreamMessage> consumeEvents(String group, String consumer, int count) {
        readOperations.incrementAndGet();
        return ephemeral.consumeEvents(group, consumer, count).orElse(List.of());
    }

    @Override
    public boolean acknowledgeEvent(String group, String messageId) {
        return ephemeral.acknowledgeEvent(group, messageId).orElse(false);
    }

    private void publishBestEffort(StateEvent event) {
        StoreResult<String> result = ephemeral.publishEvent(event.toFields());
        if (result.failed()) {
            log.debug("Event '{}' not published: {}", event.eventType(), result.message());
        }
    }

    // ── Ephemeral state ──────────────────────────────────────────────────

    @Override
    public boolean setCoordinationState(String operationId, Map<String, Object> state) {
        writeOperations.incrementAndGet();
        return ephemeral.setCoordinationState(operationId, state,
                policy.ttl(StateOperation.SET_COORDINATION_STATE)).orElse(false);
    }

    /**
     * An expired or unavailable entry reads as "no prior state".
     */
    @Override
    public Optional<Map<String, Object>> getCoordinationState(String operationId) {
        readOperations.incrementAndGet();
        return ephemeral.getCoordinationState(operationId).orElse(Optional.empty());
    }

    @Override
    public boolean createSession(String sessionId, Map<String, Object> data) {
        writeOperations.incrementAndGet();
        return ephemeral.createSession(sessionId, data, policy.ttl(StateOperation.SESSION)).orElse(false);
    }

    @Override
    public Optional<Map<String, Object>> getSession(String sessionId) {
        readOperations.incrementAndGet();
        return ephemeral.getSession(sessionId).orElse(Optional.empty());
    }

    @Override
    public boolean extendSession(String sessionId) {
        return ephemeral.extendSession(sessionId, policy.ttl(StateOperation.SESSION)).orElse(false);
    }

    @Override
    public long incrementMetric(String name, long delta) {
        writeOperations.incrementAndGet();
        return ephemeral.incrementMetric(name, delta).orElse(0L);
    }

    @Override
    public long getMetric(String name) {
        readOperations.incrementAndGet();
        return ephemeral.getMetric(name).orElse(0L);
    }

    // ── Observability ────────────────────────────────────────────────────

    @Override
    public PerformanceStats getPerformanceStats() {
        long hits = cacheHits.get();
        long misses = cacheMisses.get();
        long lookups = hits + misses;
        double ratio = lookups == 0 ? 0.0 : (double) hits / lookups;
        double target = properties.getCacheHitRatioTarget();
        double latency;
        synchronized (latencyLock) {
            latency = averageLatencyMs;
        }
        return new PerformanceStats(hits, misses, readOperations.get(), writeOperations.get(),
                latency, ratio, target, lookups == 0 || ratio >= target);
    }

    @Override
    public HybridHealth healthCheck() {
        PersistentStoreHealth persistentHealth = persistent.healthCheck();
        EphemeralStoreHealth ephemeralHealth = ephemeral.healthCheck();
        return HybridHealth.of(persistentHealth, ephemeralHealth, getPerformanceStats());
    }

    // ── Routing ──────────────────────────────────────────────────────────

    /**
     * Whether a read may be answered from the cache: the policy says cache-aside, the
     * operation is not strong, and caching of its entity is switched on.
     */
    private boolean readsCache(StateOperation operation) {
        PolicyEntry entry = policy.entry(operation);
        return policy.strategy(operation) == CacheStrategy.CACHE_ASIDE
                && policy.usesCache(operation)
                && cachesEntity(entry);
    }

    /**
     * Whether a successful call re-caches the fresh value.
     */
    private boolean refreshesCache(StateOperation operation) {
        PolicyEntry entry = policy.entry(operation);
        return entry.refreshesCache() && cachesEntity(entry);
    }

    /**
     * Whether a successful call must drop cached copies. Eviction ignores the caching switches.
     */
    private boolean invalidatesCache(StateOperation operation) {
        PolicyEntry entry = policy.entry(operation);
        return entry.keyPattern() != null && !entry.refreshesCache();
    }

    private boolean cachesEntity(PolicyEntry entry) {
        String key = entry.keyPattern();
        if (key == null) {
            return false;
        }
        if (key.startsWith(CacheKeys.AGENT_STATE_PREFIX)) {
            return properties.isCacheAgentState();
        }
        if (key.startsWith(CacheKeys.TASK_CACHE_PREFIX)) {
            return properties.isCacheTaskData();
        }
        return true;
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private <T> T requireRead(StoreResult<T> result, String what) {
        if (result.ok()) {
            return result.value();
        }
        String reason = result.errorKind().isInfrastructure() ? "Persistent store unavailable" : "Unreadable state";
        throw new StateUnavailableException(reason + " reading " + what + ": " + result.message(), result.errorKind());
    }

    private boolean bestEffort(StateOperation operation, StoreResult<Boolean> result) {
        if (result.failed() && result.errorKind() != ErrorKind.UNAVAILABLE) {
            metrics.recordCacheRefreshFailure(operation.key());
            log.debug("Cache side effect of {} skipped: {}", operation.key(), result.message());
        }
        return result.ok() && Boolean.TRUE.equals(result.value());
    }

    private void recordLookup(String entity, boolean hit) {
        if (hit) {
            cacheHits.incrementAndGet();
        } else {
            cacheMisses.incrementAndGet();
        }
        metrics.recordCacheLookup(entity, hit);
    }

    private void finish(StateOperation operation, long startNanos, boolean success) {
        long elapsed = System.nanoTime() - startNanos;
        double ms = elapsed / 1_000_000.0;
        double alpha = properties.getLatencySmoothing();
        synchronized (latencyLock) {
            if (latencySeeded) {
                averageLatencyMs = (1 - alpha) * averageLatencyMs + alpha * ms;
            } else {
                averageLatencyMs = ms;
                latencySeeded = true;
            }
        }
        metrics.recordOperation(operation.key(), elapsed, success);
    }
}
