package com.hivestate.migration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Defaults for migration runs; command-line flags override them per run.
 */
@Component
@ConfigurationProperties(prefix = "hivestate.migration")
public class MigrationProperties {

    private int batchSize = 1000;
    private int validationSampleSize = 100;
    private Duration snapshotRetention = Duration.ofDays(30);
    private int checkpointLimit = 100;
    private boolean failFast = false;

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getValidationSampleSize() {
        return validationSampleSize;
    }

    public void setValidationSampleSize(int validationSampleSize) {
        this.validationSampleSize = validationSampleSize;
    }

    public Duration getSnapshotRetention() {
        return snapshotRetention;
    }

    public void setSnapshotRetention(Duration snapshotRetention) {
        this.snapshotRetention = snapshotRetention;
    }

    public int getCheckpointLimit() {
        return checkpointLimit;
    }

    public void setCheckpointLimit(int checkpointLimit) {
        this.checkpointLimit = checkpointLimit;
    }

    public boolean isFailFast() {
        return failFast;
    }

    public void setFailFast(boolean failFast) {
        this.failFast = failFast;
    }
}
