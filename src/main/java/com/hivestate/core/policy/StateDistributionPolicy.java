package com.hivestate.core.policy;

import com.hivestate.core.cache.CacheKeys;
import com.hivestate.core.cache.EphemeralStoreProperties;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static com.hivestate.core.policy.CacheStrategy.CACHE_ASIDE;
import static com.hivestate.core.policy.CacheStrategy.CACHE_ONLY;
import static com.hivestate.core.policy.CacheStrategy.DB_ONLY;
import static com.hivestate.core.policy.CacheStrategy.STREAM_APPEND;
import static com.hivestate.core.policy.CacheStrategy.WRITE_THROUGH;
import static com.hivestate.core.policy.ConsistencyLevel.EVENTUAL;
import static com.hivestate.core.policy.ConsistencyLevel.SESSION;
import static com.hivestate.core.policy.ConsistencyLevel.STRONG;
import static com.hivestate.core.policy.StoreLayer.EPHEMERAL;
import static com.hivestate.core.policy.StoreLayer.PERSISTENT;
import static com.hivestate.core.policy.StoreLayer.STREAM;

/**
 * Fixed routing table from {@link StateOperation} to store, consistency level, cache
 * strategy, TTL and key pattern.
 * <p>
 * Strong operations go to the persistent store only. Eventual operations are
 * write-through. Agent and task reads are cache-aside. The table is immutable once built;
 * only the TTLs come from configuration.
 */
public final class StateDistributionPolicy {

    private static final String AGENT_KEY = CacheKeys.AGENT_STATE_PREFIX + "{agent_id}";
    private static final String TASK_KEY = CacheKeys.TASK_CACHE_PREFIX + "{task_id}";

    private final Map<StateOperation, PolicyEntry> entries;

    private StateDistributionPolicy(Map<StateOperation, PolicyEntry> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static StateDistributionPolicy from(EphemeralStoreProperties cache) {
        Duration agentTtl = cache.getDefaultTtl();
        Duration taskTtl = cache.getTaskTtl();
        Map<StateOperation, PolicyEntry> table = new EnumMap<>(StateOperation.class);

        strong(table, StateOperation.REGISTER_AGENT, agentTtl, AGENT_KEY, true);
        strong(table, StateOperation.CREATE_TASK, taskTtl, TASK_KEY, true);
        strong(table, StateOperation.ASSIGN_TASK, taskTtl, TASK_KEY, false);
        strong(table, StateOperation.CREATE_CHECKPOINT, null, null, false);
        strong(table, StateOperation.CREATE_SYSTEM_SNAPSHOT, null, null, false);
        strong(table, StateOperation.START_TASK, taskTtl, TASK_KEY, false);
        strong(table, StateOperation.COMPLETE_TASK, taskTtl, TASK_KEY, false);
        strong(table, StateOperation.BATCH_UPDATE_AGENTS, agentTtl, AGENT_KEY, false);
        strong(table, StateOperation.GET_ACTIVE_AGENTS, null, null, false);
        strong(table, StateOperation.GET_PENDING_TASKS, null, null, false);
        strong(table, StateOperation.GET_CHECKPOINTS, null, null, false);

        put(table, StateOperation.UPDATE_AGENT_STATE, PERSISTENT, EVENTUAL, WRITE_THROUGH, agentTtl, AGENT_KEY, true);
        put(table, StateOperation.CACHE_TASK, EPHEMERAL, EVENTUAL, WRITE_THROUGH, taskTtl, TASK_KEY, true);
        put(table, StateOperation.PUBLISH_EVENT, STREAM, EVENTUAL, WRITE_THROUGH, null, CacheKeys.EVENT_STREAM, false);
        put(table, StateOperation.INCREMENT_METRIC, EPHEMERAL, EVENTUAL, WRITE_THROUGH, cache.getMetricTtl(),
                CacheKeys.METRICS_PREFIX + "{name}", false);

        put(table, StateOperation.GET_AGENT_STATE, PERSISTENT, SESSION, CACHE_ASIDE, agentTtl, AGENT_KEY, true);
        put(table, StateOperation.GET_TASK, PERSISTENT, SESSION, CACHE_ASIDE, taskTtl, TASK_KEY, true);

        put(table, StateOperation.QUEUE_TASK, STREAM, EVENTUAL, STREAM_APPEND, null, CacheKeys.TASK_STREAM, false);
        put(table, StateOperation.CONSUME_TASKS, STREAM, EVENTUAL, STREAM_APPEND, null, CacheKeys.TASK_STREAM, false);
        put(table, StateOperation.ACKNOWLEDGE_TASK, STREAM, EVENTUAL, STREAM_APPEND, null, CacheKeys.TASK_STREAM, false);
        put(table, StateOperation.CONSUME_EVENTS, STREAM, EVENTUAL, STREAM_APPEND, null, CacheKeys.EVENT_STREAM, false);
        put(table, StateOperation.ACKNOWLEDGE_EVENT, STREAM, EVENTUAL, STREAM_APPEND, null, CacheKeys.EVENT_STREAM, false);

        put(table, StateOperation.SET_COORDINATION_STATE, EPHEMERAL, SESSION, CACHE_ONLY, cache.getCoordinationTtl(),
                CacheKeys.COORDINATION_PREFIX + "{operation_id}", false);
        put(table, StateOperation.GET_COORDINATION_STATE, EPHEMERAL, SESSION, CACHE_ONLY, cache.getCoordinationTtl(),
                CacheKeys.COORDINATION_PREFIX + "{operation_id}", false);
        put(table, StateOperation.SESSION, EPHEMERAL, SESSION, CACHE_ONLY, cache.getSessionTtl(),
                CacheKeys.SESSION_PREFIX + "{session_id}", false);
        put(table, StateOperation.GET_METRIC, EPHEMERAL, EVENTUAL, CACHE_ONLY, cache.getMetricTtl(),
                CacheKeys.METRICS_PREFIX + "{name}", false);

        if (table.size() != StateOperation.values().length) {
            throw new IllegalStateException("Distribution table does not cover every operation");
        }
        return new StateDistributionPolicy(table);
    }

    private static void strong(Map<StateOperation, PolicyEntry> table, StateOperation operation,
                               Duration ttl, String keyPattern, boolean refreshesCache) {
        put(table, operation, PERSISTENT, STRONG, DB_ONLY, ttl, keyPattern, refreshesCache);
    }

    private static void put(Map<StateOperation, PolicyEntry> table, StateOperation operation, StoreLayer layer,
                            ConsistencyLevel consistency, CacheStrategy strategy, Duration ttl,
                            String keyPattern, boolean refreshesCache) {
        table.put(operation, new PolicyEntry(operation, layer, consistency, strategy, ttl, keyPattern, refreshesCache));
    }

    public PolicyEntry entry(StateOperation operation) {
        return entries.get(operation);
    }

    public ConsistencyLevel consistency(StateOperation operation) {
        return entry(operation).consistency();
    }

    public CacheStrategy strategy(StateOperation operation) {
        return entry(operation).strategy();
    }

    public Duration ttl(StateOperation operation) {
        return entry(operation).ttl();
    }

    /**
     * Whether the operation may consult the cache before the persistent store.
     */
    public boolean usesCache(StateOperation operation) {
        return !entry(operation).isStrong();
    }

    public Collection<PolicyEntry> entries() {
        return entries.values();
    }
}
