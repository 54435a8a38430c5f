package com.hivestate.migration;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of a whole migration run. Phases after a halting failure are absent.
 */
public record MigrationReport(
    boolean dryRun,
    List<PhaseResult> phases,
    boolean validationPassed,
    Duration duration
) {

    public MigrationReport {
        phases = List.copyOf(phases);
    }

    /**
     * All six phases ran, none failed, and validation passed.
     */
    public boolean success() {
        return validationPassed
                && phases.size() == MigrationPhase.values().length
                && phases.stream().allMatch(PhaseResult::success);
    }

    public int totalRecordsMigrated() {
        return phases.stream().mapToInt(PhaseResult::recordsMigrated).sum();
    }

    public List<String> allErrors() {
        return phases.stream().flatMap(p -> p.errors().stream()).toList();
    }

    public Optional<PhaseResult> phase(MigrationPhase phase) {
        return phases.stream().filter(p -> p.phase() == phase).findFirst();
    }
}
