package com.hivestate.migration;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Immutable settings of a single migration run.
 *
 * @param legacyDatabase       path of the legacy SQLite file
 * @param dryRun               read and compare everything, write nothing
 * @param batchSize            rows per legacy page
 * @param validationSampleSize agents checked end to end during validation
 * @param snapshotRetention    snapshots older than this are not migrated
 * @param checkpointLimit      number of most recent checkpoints migrated
 * @param failFast             stop a phase at its first row error instead of collecting
 */
public record MigrationSettings(
    Path legacyDatabase,
    boolean dryRun,
    int batchSize,
    int validationSampleSize,
    Duration snapshotRetention,
    int checkpointLimit,
    boolean failFast
) {

    public MigrationSettings {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
    }

    public static MigrationSettings from(MigrationProperties properties, Path legacyDatabase, boolean dryRun) {
        return new MigrationSettings(legacyDatabase, dryRun, properties.getBatchSize(),
                properties.getValidationSampleSize(), properties.getSnapshotRetention(),
                properties.getCheckpointLimit(), properties.isFailFast());
    }

    public MigrationSettings withBatchSize(int size) {
        return new MigrationSettings(legacyDatabase, dryRun, size, validationSampleSize, snapshotRetention,
                checkpointLimit, failFast);
    }

    public MigrationSettings withFailFast(boolean value) {
        return new MigrationSettings(legacyDatabase, dryRun, batchSize, validationSampleSize, snapshotRetention,
                checkpointLimit, value);
    }
}
