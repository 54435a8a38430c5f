package com.hivestate.core.policy;

import java.util.Locale;

/**
 * Every operation the orchestrator routes.
 */
public enum StateOperation {
    REGISTER_AGENT,
    CREATE_TASK,
    ASSIGN_TASK,
    CREATE_CHECKPOINT,
    CREATE_SYSTEM_SNAPSHOT,
    START_TASK,
    COMPLETE_TASK,
    BATCH_UPDATE_AGENTS,

    UPDATE_AGENT_STATE,
    CACHE_TASK,
    PUBLISH_EVENT,
    INCREMENT_METRIC,

    GET_AGENT_STATE,
    GET_TASK,
    GET_ACTIVE_AGENTS,
    GET_PENDING_TASKS,
    GET_CHECKPOINTS,

    QUEUE_TASK,
    CONSUME_TASKS,
    ACKNOWLEDGE_TASK,
    CONSUME_EVENTS,
    ACKNOWLEDGE_EVENT,

    SET_COORDINATION_STATE,
    GET_COORDINATION_STATE,
    SESSION,
    GET_METRIC;

    /**
     * Lower-case name used in logs, metrics tags and events.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
