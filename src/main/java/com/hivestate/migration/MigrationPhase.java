package com.hivestate.migration;

import java.util.Locale;

/**
 * Migration phases, run strictly in declaration order.
 */
public enum MigrationPhase {
    SOURCE_VALIDATION,
    INFRASTRUCTURE_SETUP,
    AGENT_MIGRATION,
    TASK_MIGRATION,
    SYSTEM_DATA_MIGRATION,
    VALIDATION;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
