package com.hivestate.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing state-layer MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String AGENT_ID = "agentId";
    public static final String TASK_ID = "taskId";
    public static final String MIGRATION_PHASE = "migrationPhase";

    private MdcContext() {}

    public static void setAgent(String agentId) {
        MDC.put(AGENT_ID, agentId);
    }

    public static void setTask(String taskId, String agentId) {
        MDC.put(TASK_ID, taskId);
        if (agentId != null) {
            MDC.put(AGENT_ID, agentId);
        }
    }

    public static void setMigrationPhase(String phase) {
        MDC.put(MIGRATION_PHASE, phase);
    }

    public static void clear() {
        MDC.remove(AGENT_ID);
        MDC.remove(TASK_ID);
        MDC.remove(MIGRATION_PHASE);
    }
}
