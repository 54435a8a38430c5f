package com.hivestate.migration;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one migration phase.
 *
 * @param phase             the phase
 * @param success           true when the phase finished without errors
 * @param recordsMigrated   rows written, or rows that would be written in a dry run
 * @param errors            per-row failures and integrity findings
 * @param warnings          non-fatal findings (unmapped legacy values, skipped steps)
 * @param duration          wall time of the phase
 * @param rollbackAvailable whether the targets were confirmed reachable, so a manual
 *                          rollback is possible
 */
public record PhaseResult(
    MigrationPhase phase,
    boolean success,
    int recordsMigrated,
    List<String> errors,
    List<String> warnings,
    Duration duration,
    boolean rollbackAvailable
) {

    public PhaseResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
