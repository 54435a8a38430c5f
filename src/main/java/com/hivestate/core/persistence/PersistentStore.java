package com.hivestate.core.persistence;

import com.hivestate.core.model.Agent;
import com.hivestate.core.model.AgentStateUpdate;
import com.hivestate.core.model.AgentUpdate;
import com.hivestate.core.model.Checkpoint;
import com.hivestate.core.model.SystemSnapshot;
import com.hivestate.core.model.Task;
import com.hivestate.core.model.TaskDraft;
import com.hivestate.core.store.StoreResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable, strongly-consistent storage for agents, tasks, snapshots and checkpoints.
 * <p>
 * Implementations never throw across this boundary. Connectivity problems, timeouts and
 * constraint violations come back as failed {@link StoreResult}s; an absent row is a
 * successful result holding {@link Optional#empty()}.
 */
public interface PersistentStore {

    /**
     * Creates tables and indexes if they are missing.
     *
     * @return false when the store could not be reached
     */
    boolean initialize();

    /**
     * Idempotent upsert. Re-registration refreshes capabilities and activity time.
     */
    StoreResult<Boolean> registerAgent(String agentId, List<String> capabilities);

    StoreResult<Optional<Agent>> getAgentState(String agentId);

    /**
     * Partial update; null fields keep their stored value. NOT_FOUND for an unknown agent.
     */
    StoreResult<Boolean> updateAgentState(String agentId, AgentStateUpdate update);

    /**
     * Idle or busy agents active within the configured window, most recent first.
     */
    StoreResult<List<Agent>> getActiveAgents();

    /**
     * @return the new task id
     */
    StoreResult<String> createTask(TaskDraft draft);

    StoreResult<Optional<Task>> getTask(String taskId);

    /**
     * Pending tasks ordered by priority descending, then creation time ascending.
     */
    StoreResult<List<Task>> getPendingTasks(int limit);

    /**
     * Compare-and-set assignment: applies only while the task is pending.
     * A lost race is a CONFLICT result, an unknown task NOT_FOUND.
     */
    StoreResult<Boolean> assignTask(String taskId, String agentId);

    /**
     * Moves an assigned task to in_progress.
     */
    StoreResult<Boolean> startTask(String taskId);

    /**
     * Finishes an assigned or in-progress task and releases the agent bound to it,
     * both in one transaction.
     */
    StoreResult<Boolean> completeTask(String taskId, boolean succeeded, Object result);

    /**
     * Aggregates current agent and task rows into a new snapshot row in one statement.
     */
    StoreResult<Boolean> createSystemSnapshot();

    /**
     * Inserts a snapshot with externally computed values (legacy import).
     */
    StoreResult<Long> importSystemSnapshot(SystemSnapshot snapshot);

    StoreResult<List<SystemSnapshot>> getRecentSnapshots(int limit);

    /**
     * @param name checkpoint name, or null for a generated one
     * @return the new checkpoint id
     */
    StoreResult<Long> createCheckpoint(String name, Map<String, Object> data);

    /**
     * Checkpoints filtered by name and/or time range, newest first. Null filters are ignored.
     */
    StoreResult<List<Checkpoint>> getCheckpoints(String name, Instant from, Instant to, int limit);

    /**
     * Applies all updates in one transaction.
     *
     * @return number of rows actually changed; unknown ids contribute zero
     */
    StoreResult<Integer> batchUpdateAgents(List<AgentUpdate> updates);

    /**
     * Removes an agent row; tasks bound to it keep their history with the owner cleared.
     */
    StoreResult<Boolean> deleteAgent(String agentId);

    StoreResult<Long> countAgents();

    StoreResult<Long> countTasks();

    PersistentStoreHealth healthCheck();
}
