package com.hivestate.dispatch.cli;

import com.hivestate.core.orchestration.PerformanceStats;
import com.hivestate.migration.MigrationReport;
import com.hivestate.migration.PhaseResult;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the HiveState CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) HIVESTATE v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void rule() {
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [HIVESTATE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void phase(PhaseResult result) {
        String status = result.success() ? "@|fg(green) OK  |@" : "@|fg(red) FAIL|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [PHASE]|@ " + status + " " + result.phase().key() +
                " (" + result.recordsMigrated() + " records, " + formatDuration(result.duration().toMillis()) + ")"));
        for (String error : result.errors()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(red) -|@ " + error));
        }
        for (String warning : result.warnings()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(yellow) ~|@ " + warning));
        }
    }

    public static void migrationSummary(MigrationReport report) {
        rule();
        String mode = report.dryRun() ? "Dry run" : "Migration";
        if (report.success()) {
            success(mode + " completed: " + report.totalRecordsMigrated() + " records in " +
                    formatDuration(report.duration().toMillis()));
        } else {
            error(mode + " failed after " + report.phases().size() + " phases with " +
                    report.allErrors().size() + " errors");
        }
    }

    public static void performance(PerformanceStats stats) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Orchestrator Statistics|@"));
        System.out.println("  Reads: " + stats.readOperations() + ", writes: " + stats.writeOperations());
        System.out.println("  Cache: " + stats.cacheHits() + " hits, " + stats.cacheMisses() + " misses");
        String ratio = String.format(Locale.ROOT, "%.1f%% (target %.1f%%)",
                stats.cacheHitRatio() * 100, stats.hitRatioTarget() * 100);
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  Hit ratio: " +
                (stats.performanceOk() ? "@|fg(green) " + ratio + "|@" : "@|fg(red) " + ratio + "|@")));
        System.out.println(String.format(Locale.ROOT, "  Average latency: %.2f ms", stats.averageLatencyMs()));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
