package com.hivestate.core.cache;

import com.hivestate.core.model.Agent;
import com.hivestate.core.model.StreamMessage;
import com.hivestate.core.model.Task;
import com.hivestate.core.store.StoreResult;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Low-latency cache, session and coordination storage plus the task and event streams.
 * <p>
 * A miss is a successful result holding {@link Optional#empty()}. Any call may fail with
 * an infrastructure {@link com.hivestate.core.store.ErrorKind}; callers treat the store
 * as optional and never rely on it as the system of record. Null TTL arguments mean the
 * configured default for that key family.
 */
public interface EphemeralStore {

    /**
     * Verifies connectivity and creates the streams and their consumer groups.
     */
    boolean initialize();

    boolean isEnabled();

    // agent:state:{id}

    StoreResult<Boolean> setAgentState(Agent agent, Duration ttl);

    StoreResult<Optional<Agent>> getAgentState(String agentId);

    StoreResult<Boolean> deleteAgentState(String agentId);

    /**
     * Writes all agents in one pipelined round trip.
     *
     * @return number of entries written
     */
    StoreResult<Integer> batchCacheAgents(Collection<Agent> agents, Duration ttl);

    // task:cache:{id}

    StoreResult<Boolean> cacheTask(Task task, Duration ttl);

    StoreResult<Optional<Task>> getCachedTask(String taskId);

    StoreResult<Boolean> deleteCachedTask(String taskId);

    // session:{id}

    StoreResult<Boolean> createSession(String sessionId, Map<String, Object> data, Duration ttl);

    StoreResult<Optional<Map<String, Object>>> getSession(String sessionId);

    /**
     * @return false when the session has already expired
     */
    StoreResult<Boolean> extendSession(String sessionId, Duration ttl);

    // coord:{operationId}

    StoreResult<Boolean> setCoordinationState(String operationId, Map<String, Object> state, Duration ttl);

    /**
     * An expired entry reads as empty: "no prior state".
     */
    StoreResult<Optional<Map<String, Object>>> getCoordinationState(String operationId);

    // streams

    /**
     * Appends to {@code tasks:pending}, adding {@code queued_at} and a {@code queue_id}
     * correlation id. The stream is trimmed to the configured maximum length.
     *
     * @return the stream message id
     */
    StoreResult<String> queueTask(Map<String, Object> task);

    /**
     * Reads messages never delivered to {@code group}, blocking up to the configured timeout.
     */
    StoreResult<List<StreamMessage>> consumeTasks(String group, String consumer, int count);

    StoreResult<Boolean> acknowledgeTask(String group, String messageId);

    /**
     * Appends to {@code events:system}, adding {@code published_at} and {@code event_id}.
     */
    StoreResult<String> publishEvent(Map<String, Object> event);

    StoreResult<List<StreamMessage>> consumeEvents(String group, String consumer, int count);

    StoreResult<Boolean> acknowledgeEvent(String group, String messageId);

    // metrics:{name}

    /**
     * Atomic increment; the counter's 24h expiry is refreshed on every call.
     *
     * @return the counter value after the increment
     */
    StoreResult<Long> incrementMetric(String name, long delta);

    /**
     * @return the counter value, 0 when absent or expired
     */
    StoreResult<Long> getMetric(String name);

    EphemeralStoreHealth healthCheck();
}
