package com.hivestate.core.cache;

/**
 * Key and stream names shared with every collaborator that reads the cache directly.
 */
public final class CacheKeys {

    public static final String AGENT_STATE_PREFIX = "agent:state:";
    public static final String TASK_CACHE_PREFIX = "task:cache:";
    public static final String COORDINATION_PREFIX = "coord:";
    public static final String SESSION_PREFIX = "session:";
    public static final String METRICS_PREFIX = "metrics:";

    public static final String TASK_STREAM = "tasks:pending";
    public static final String EVENT_STREAM = "events:system";

    public static final String TASK_PROCESSORS_GROUP = "task_processors";
    public static final String PRIORITY_PROCESSORS_GROUP = "priority_processors";
    public static final String MONITORING_GROUP = "monitoring";
    public static final String ANALYTICS_GROUP = "analytics";

    private CacheKeys() {}

    public static String agentState(String agentId) {
        return AGENT_STATE_PREFIX + agentId;
    }

    public static String task(String taskId) {
        return TASK_CACHE_PREFIX + taskId;
    }

    public static String coordination(String operationId) {
        return COORDINATION_PREFIX + operationId;
    }

    public static String session(String sessionId) {
        return SESSION_PREFIX + sessionId;
    }

    public static String metric(String name) {
        return METRICS_PREFIX + name;
    }
}
