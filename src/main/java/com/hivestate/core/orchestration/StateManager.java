package com.hivestate.core.orchestration;

import com.hivestate.core.events.StateEvent;
import com.hivestate.core.model.Agent;
import com.hivestate.core.model.AgentStateUpdate;
import com.hivestate.core.model.AgentUpdate;
import com.hivestate.core.model.Checkpoint;
import com.hivestate.core.model.StreamMessage;
import com.hivestate.core.model.Task;
import com.hivestate.core.model.TaskDraft;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The unified state API used by the rest of the system.
 * <p>
 * Writes report success as a boolean or an optional id; {@code false} on
 * {@link #assignTask} means another caller won and the task should be skipped. Reads
 * return {@link Optional#empty()} for missing entities and throw
 * {@link StateUnavailableException} only when the persistent store cannot be reached.
 */
public interface StateManager {

    boolean initialize();

    // ── Agents ──

    boolean registerAgent(String agentId, List<String> capabilities);

    Optional<Agent> getAgentState(String agentId);

    boolean updateAgentState(String agentId, AgentStateUpdate update);

    List<Agent> getActiveAgents();

    /**
     * @return rows changed, 0 when the batch was rolled back
     */
    int batchUpdateAgents(List<AgentUpdate> updates);

    // ── Tasks ──

    Optional<String> createTask(TaskDraft draft);

    Optional<Task> getTask(String taskId);

    List<Task> getPendingTasks(int limit);

    boolean assignTask(String taskId, String agentId);

    boolean startTask(String taskId);

    boolean completeTask(String taskId, boolean succeeded, Object result);

    /**
     * Re-reads the task from the persistent store and overwrites its cache entry.
     */
    boolean cacheTask(String taskId);

    // ── Snapshots and checkpoints ──

    boolean createSystemSnapshot();

    Optional<Long> createCheckpoint(String name, Map<String, Object> data);

    List<Checkpoint> getCheckpoints(String name, Instant from, Instant to, int limit);

    // ── Streams ──

    Optional<String> queueTask(Map<String, Object> task);

    List<StreamMessage> consumeTasks(String group, String consumer, int count);

    boolean acknowledgeTask(String group, String messageId);

    Optional<String> publishEvent(StateEvent event);

    List<StreamMessage> consumeEvents(String group, String consumer, int count);

    boolean acknowledgeEvent(String group, String messageId);

    // ── Ephemeral state ──

    boolean setCoordinationState(String operationId, Map<String, Object> state);

    Optional<Map<String, Object>> getCoordinationState(String operationId);

    boolean createSession(String sessionId, Map<String, Object> data);

    Optional<Map<String, Object>> getSession(String sessionId);

    boolean extendSession(String sessionId);

    long incrementMetric(String name, long delta);

    long getMetric(String name);

    // ── Observability ──

    PerformanceStats getPerformanceStats();

    HybridHealth healthCheck();
}
