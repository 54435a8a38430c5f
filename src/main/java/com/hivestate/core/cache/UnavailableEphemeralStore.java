package com.hivestate.core.cache;

import com.hivestate.core.model.Agent;
import com.hivestate.core.model.StreamMessage;
import com.hivestate.core.model.Task;
import com.hivestate.core.store.ErrorKind;
import com.hivestate.core.store.StoreResult;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stand-in used when no Redis is configured or the cache is switched off. Every call fails
 * with {@link ErrorKind#UNAVAILABLE}, so the orchestrator serves everything from the
 * persistent store.
 */
public class UnavailableEphemeralStore implements EphemeralStore {

    private static final String REASON = "Ephemeral store disabled";

    private final Clock clock;

    public UnavailableEphemeralStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean initialize() {
        return false;
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public StoreResult<Boolean> setAgentState(Agent agent, Duration ttl) {
        return unavailable();
    }

    @Override
    public StoreResult<Optional<Agent>> getAgentState(String agentId) {
        return unavailable();
    }

    @Override
    public StoreResult<Boolean> deleteAgentState(String agentId) {
        return unavailable();
    }

    @Override
    public StoreResult<Integer> batchCacheAgents(Collection<Agent> agents, Duration ttl) {
        return unavailable();
    }

    @Override
    public StoreResult<Boolean> cacheTask(Task task, Duration ttl) {
        return unavailable();
    }

    @Override
    public StoreResult<Optional<Task>> getCachedTask(String taskId) {
        return unavailable();
    }

    @Override
    public StoreResult<Boolean> deleteCachedTask(String taskId) {
        return unavailable();
    }

    @Override
    public StoreResult<Boolean> createSession(String sessionId, Map<String, Object> data, Duration ttl) {
        return unavailable();
    }

    @Override
    public StoreResult<Optional<Map<String, Object>>> getSession(String sessionId) {
        return unavailable();
    }

    @Override
    public StoreResult<Boolean> extendSession(String sessionId, Duration ttl) {
        return unavailable();
    }

    @Override
    public StoreResult<Boolean> setCoordinationState(String operationId, Map<String, Object> state, Duration ttl) {
        return unavailable();
    }

    @Override
    public StoreResult<Optional<Map<String, Object>>> getCoordinationState(String operationId) {
        return unavailable();
    }

    @Override
    public StoreResult<String> queueTask(Map<String, Object> task) {
        return unavailable();
    }

    @Override
    public StoreResult<List<StreamMessage>> consumeTasks(String group, String consumer, int count) {
        return unavailable();
    }

    @Override
    public StoreResult<Boolean> acknowledgeTask(String group, String messageId) {
        return unavailable();
    }

    @Override
    public StoreResult<String> publishEvent(Map<String, Object> event) {
        return unavailable();
    }

    @Override
    public StoreResult<List<StreamMessage>> consumeEvents(String group, String consumer, int count) {
        return unavailable();
    }

    @Override
    public StoreResult<Boolean> acknowledgeEvent(String group, String messageId) {
        return unavailable();
    }

    @Override
    public StoreResult<Long> incrementMetric(String name, long delta) {
        return unavailable();
    }

    @Override
    public StoreResult<Long> getMetric(String name) {
        return unavailable();
    }

    @Override
    public EphemeralStoreHealth healthCheck() {
        return EphemeralStoreHealth.down(clock.instant(), false, REASON);
    }

    private static <T> StoreResult<T> unavailable() {
        return StoreResult.failure(ErrorKind.UNAVAILABLE, REASON);
    }
}
