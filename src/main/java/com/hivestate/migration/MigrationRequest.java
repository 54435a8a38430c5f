package com.hivestate.migration;

import java.nio.file.Path;

/**
 * One migration invocation. Null overrides fall back to {@link MigrationProperties}.
 */
public record MigrationRequest(
    Path legacyDatabase,
    TargetConnection target,
    boolean dryRun,
    Integer batchSize,
    Boolean failFast
) {
}
