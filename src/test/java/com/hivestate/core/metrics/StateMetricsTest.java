package com.hivestate.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class StateMetricsTest {

    private SimpleMeterRegistry registry;
    private StateMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new StateMetrics(registry);
    }

    @Test
    @DisplayName("recordCacheLookup counts hits and misses per entity")
    void recordCacheLookup() {
        metrics.recordCacheLookup("agent", true);
        metrics.recordCacheLookup("agent", true);
        metrics.recordCacheLookup("agent", false);
        metrics.recordCacheLookup("task", false);

        var agentHits = registry.find("hivestate.cache.lookups")
                .tag("entity", "agent").tag("result", "hit").counter();
        var agentMisses = registry.find("hivestate.cache.lookups")
                .tag("entity", "agent").tag("result", "miss").counter();
        var taskMisses = registry.find("hivestate.cache.lookups")
                .tag("entity", "task").tag("result", "miss").counter();

        assertNotNull(agentHits);
        assertEquals(2.0, agentHits.count());
        assertEquals(1.0, agentMisses.count());
        assertEquals(1.0, taskMisses.count());
    }

    @Test
    @DisplayName("recordOperation times by operation and outcome")
    void recordOperation() {
        metrics.recordOperation("assign_task", TimeUnit.MILLISECONDS.toNanos(12), true);
        metrics.recordOperation("assign_task", TimeUnit.MILLISECONDS.toNanos(8), false);

        var ok = registry.find("hivestate.operation.duration")
                .tag("operation", "assign_task").tag("success", "true").timer();
        var failed = registry.find("hivestate.operation.duration")
                .tag("operation", "assign_task").tag("success", "false").timer();

        assertNotNull(ok);
        assertEquals(1, ok.count());
        assertEquals(12.0, ok.totalTime(TimeUnit.MILLISECONDS), 0.001);
        assertEquals(1, failed.count());
    }

    @Test
    @DisplayName("assignment conflicts and refresh failures are counters")
    void counters() {
        metrics.recordAssignmentConflict();
        metrics.recordAssignmentConflict();
        metrics.recordCacheRefreshFailure("register_agent");

        assertEquals(2.0, registry.find("hivestate.assignment.conflicts").counter().count());
        assertEquals(1.0, registry.find("hivestate.cache.refresh_failures")
                .tag("operation", "register_agent").counter().count());
    }

    @Test
    @DisplayName("migration phases record duration and migrated records")
    void migration() {
        metrics.recordMigrationPhase("agent_migration", true, 250);
        metrics.recordMigratedRecords("agent_migration", 40);
        metrics.recordMigratedRecords("agent_migration", 2);

        var timer = registry.find("hivestate.migration.phase.duration")
                .tag("phase", "agent_migration").timer();
        var records = registry.find("hivestate.migration.records")
                .tag("phase", "agent_migration").summary();

        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertNotNull(records);
        assertEquals(2, records.count());
        assertEquals(42.0, records.totalAmount());
    }
}
