package com.hivestate.testing;

import com.hivestate.core.cache.CacheKeys;
import com.hivestate.core.cache.EphemeralStore;
import com.hivestate.core.cache.EphemeralStoreHealth;
import com.hivestate.core.model.Agent;
import com.hivestate.core.model.StreamMessage;
import com.hivestate.core.model.Task;
import com.hivestate.core.store.ErrorKind;
import com.hivestate.core.store.StoreResult;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-backed {@link EphemeralStore} for tests. TTLs are recorded but never expire entries.
 * Calling {@link #goOffline()} makes every call fail with CONNECTIVITY.
 */
public class InMemoryEphemeralStore implements EphemeralStore {

    private final Map<String, Agent> agents = new ConcurrentHashMap<>();
    private final Map<String, Task> tasks = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Object>> documents = new ConcurrentHashMap<>();
    private final Map<String, Duration> ttls = new ConcurrentHashMap<>();
    private final Map<String, Long> counters = new ConcurrentHashMap<>();
    private final Map<String, List<StreamMessage>> streams = new ConcurrentHashMap<>();
    private final Map<String, Integer> groupOffsets = new HashMap<>();
    private final AtomicInteger sequence = new AtomicInteger();
    private final AtomicInteger writes = new AtomicInteger();
    private volatile boolean online = true;

    public void goOffline() {
        online = false;
    }

    public void goOnline() {
        online = true;
    }

    /** Number of successful mutating calls. */
    public int writes() {
        return writes.get();
    }

    public boolean holdsAgent(String agentId) {
        return agents.containsKey(agentId);
    }

    public boolean holdsTask(String taskId) {
        return tasks.containsKey(taskId);
    }

    public void putAgent(Agent agent) {
        agents.put(agent.agentId(), agent);
    }

    public Duration ttlOf(String key) {
        return ttls.get(key);
    }

    public List<StreamMessage> stream(String key) {
        return List.copyOf(streams.getOrDefault(key, List.of()));
    }

    @Override
    public boolean initialize() {
        return online;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public StoreResult<Boolean> setAgentState(Agent agent, Duration ttl) {
        if (!online) return offline();
        agents.put(agent.agentId(), agent);
        ttls.put(CacheKeys.agentState(agent.agentId()), ttl == null ? Duration.ZERO : ttl);
        return written();
    }

    @Override
    public StoreResult<Optional<Agent>> getAgentState(String agentId) {
        if (!online) return offline();
        return StoreResult.success(Optional.ofNullable(agents.get(agentId)));
    }

    @Override
    public StoreResult<Boolean> deleteAgentState(String agentId) {
        if (!online) return offline();
        agents.remove(agentId);
        return written();
    }

    @Override
    public StoreResult<Integer> batchCacheAgents(Collection<Agent> batch, Duration ttl) {
        if (!online) return offline();
        batch.forEach(agent -> agents.put(agent.agentId(), agent));
        writes.incrementAndGet();
        return StoreResult.success(batch.size());
    }

    @Override
    public StoreResult<Boolean> cacheTask(Task task, Duration ttl) {
        if (!online) return offline();
        tasks.put(task.taskId(), task);
        return written();
    }

    @Override
    public StoreResult<Optional<Task>> getCachedTask(String taskId) {
        if (!online) return offline();
        return StoreResult.success(Optional.ofNullable(tasks.get(taskId)));
    }

    @Override
    public StoreResult<Boolean> deleteCachedTask(String taskId) {
        if (!online) return offline();
        tasks.remove(taskId);
        return written();
    }

    @Override
    public StoreResult<Boolean> createSession(String sessionId, Map<String, Object> data, Duration ttl) {
        if (!online) return offline();
        documents.put(CacheKeys.session(sessionId), new LinkedHashMap<>(data));
        ttls.put(CacheKeys.session(sessionId), ttl == null ? Duration.ZERO : ttl);
        return written();
    }

    @Override
    public StoreResult<Optional<Map<String, Object>>> getSession(String sessionId) {
        if (!online) return offline();
        return StoreResult.success(Optional.ofNullable(documents.get(CacheKeys.session(sessionId))));
    }

    @Override
    public StoreResult<Boolean> extendSession(String sessionId, Duration ttl) {
        if (!online) return offline();
        String key = CacheKeys.session(sessionId);
        if (!documents.containsKey(key)) {
            return StoreResult.success(Boolean.FALSE);
        }
        ttls.put(key, ttl == null ? Duration.ZERO : ttl);
        return written();
    }

    @Override
    public StoreResult<Boolean> setCoordinationState(String operationId, Map<String, Object> state, Duration ttl) {
        if (!online) return offline();
        documents.put(CacheKeys.coordination(operationId), new LinkedHashMap<>(state));
        return written();
    }

    @Override
    public StoreResult<Optional<Map<String, Object>>> getCoordinationState(String operationId) {
        if (!online) return offline();
        return StoreResult.success(Optional.ofNullable(documents.get(CacheKeys.coordination(operationId))));
    }

    @Override
    public StoreResult<String> queueTask(Map<String, Object> task) {
        return append(CacheKeys.TASK_STREAM, task);
    }

    @Override
    public StoreResult<List<StreamMessage>> consumeTasks(String group, String consumer, int count) {
        return read(CacheKeys.TASK_STREAM, group, count);
    }

    @Override
    public StoreResult<Boolean> acknowledgeTask(String group, String messageId) {
        if (!online) return offline();
        return StoreResult.done();
    }

    @Override
    public StoreResult<String> publishEvent(Map<String, Object> event) {
        return append(CacheKeys.EVENT_STREAM, event);
    }

    @Override
    public StoreResult<List<StreamMessage>> consumeEvents(String group, String consumer, int count) {
        return read(CacheKeys.EVENT_STREAM, group, count);
    }

    @Override
    public StoreResult<Boolean> acknowledgeEvent(String group, String messageId) {
        if (!online) return offline();
        return StoreResult.done();
    }

    @Override
    public StoreResult<Long> incrementMetric(String name, long delta) {
        if (!online) return offline();
        writes.incrementAndGet();
        return StoreResult.success(counters.merge(name, delta, Long::sum));
    }

    @Override
    public StoreResult<Long> getMetric(String name) {
        if (!online) return offline();
        return StoreResult.success(counters.getOrDefault(name, 0L));
    }

    @Override
    public EphemeralStoreHealth healthCheck() {
        if (!online) {
            return EphemeralStoreHealth.down(Instant.EPOCH, true, "offline");
        }
        return new EphemeralStoreHealth(Instant.EPOCH, true, true, 0.1, Map.of(), null);
    }

    private synchronized StoreResult<String> append(String stream, Map<String, Object> fields) {
        if (!online) return offline();
        String id = sequence.incrementAndGet() + "-0";
        streams.computeIfAbsent(stream, k -> new ArrayList<>())
                .add(new StreamMessage(stream, id, new LinkedHashMap<>(fields)));
        writes.incrementAndGet();
        return StoreResult.success(id);
    }

    private synchronized StoreResult<List<StreamMessage>> read(String stream, String group, int count) {
        if (!online) return offline();
        List<StreamMessage> messages = streams.getOrDefault(stream, List.of());
        String offsetKey = stream + "/" + group;
        int from = groupOffsets.getOrDefault(offsetKey, 0);
        int to = Math.min(messages.size(), from + count);
        groupOffsets.put(offsetKey, to);
        return StoreResult.success(List.copyOf(messages.subList(from, to)));
    }

    private StoreResult<Boolean> written() {
        writes.incrementAndGet();
        return StoreResult.done();
    }

    private static <T> StoreResult<T> offline() {
        return StoreResult.failure(ErrorKind.CONNECTIVITY, "offline");
    }
}
