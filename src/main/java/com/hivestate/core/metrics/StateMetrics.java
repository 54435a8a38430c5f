package com.hivestate.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the hybrid state layer.
 */
@Service
public class StateMetrics {

    private final MeterRegistry registry;

    public StateMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCacheLookup(String entity, boolean hit) {
        Counter.builder("hivestate.cache.lookups")
                .tag("entity", entity)
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void recordOperation(String operation, long nanos, boolean success) {
        Timer.builder("hivestate.operation.duration")
                .tag("operation", operation)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofNanos(nanos));
    }

    /**
     * Counts assignments that lost the compare-and-set race. These are expected under
     * contention and are not failures.
     */
    public void recordAssignmentConflict() {
        Counter.builder("hivestate.assignment.conflicts")
                .description("Task assignments that lost to a concurrent assignment")
                .register(registry)
                .increment();
    }

    public void recordCacheRefreshFailure(String operation) {
        Counter.builder("hivestate.cache.refresh_failures")
                .description("Best-effort cache refreshes that failed after a successful write")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void recordMigrationPhase(String phase, boolean success, long ms) {
        Timer.builder("hivestate.migration.phase.duration")
                .tag("phase", phase)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordMigratedRecords(String phase, int records) {
        DistributionSummary.builder("hivestate.migration.records")
                .tag("phase", phase)
                .register(registry)
                .record(records);
    }
}
