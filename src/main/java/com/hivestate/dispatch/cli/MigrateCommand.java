package com.hivestate.dispatch.cli;

import com.hivestate.migration.MigrationReport;
import com.hivestate.migration.MigrationRequest;
import com.hivestate.migration.MigrationService;
import com.hivestate.migration.PhaseResult;
import com.hivestate.migration.TargetConnection;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: hivestate migrate --legacy-db &lt;path&gt; [target options]
 * <p>
 * Migrates a legacy SQLite state database into PostgreSQL and Redis. Exits 0 only when
 * every phase succeeded and validation passed.
 */
@Command(name = "migrate", mixinStandardHelpOptions = true,
        description = "Migrate legacy SQLite state into PostgreSQL and Redis")
@Component
public class MigrateCommand implements Callable<Integer> {

    @Option(names = "--legacy-db", required = true, description = "Path of the legacy SQLite database")
    private Path legacyDb;

    @Option(names = "--pg-host", defaultValue = "localhost", description = "PostgreSQL host (default: ${DEFAULT-VALUE})")
    private String pgHost;

    @Option(names = "--pg-port", defaultValue = "5432", description = "PostgreSQL port (default: ${DEFAULT-VALUE})")
    private int pgPort;

    @Option(names = "--pg-db", defaultValue = "hivestate", description = "PostgreSQL database (default: ${DEFAULT-VALUE})")
    private String pgDatabase;

    @Option(names = "--pg-user", defaultValue = "hivestate", description = "PostgreSQL user (default: ${DEFAULT-VALUE})")
    private String pgUser;

    @Option(names = "--pg-password", defaultValue = "${env:HIVESTATE_PG_PASSWORD}",
            description = "PostgreSQL password (default: $HIVESTATE_PG_PASSWORD)")
    private String pgPassword;

    @Option(names = "--redis-host", defaultValue = "localhost", description = "Redis host (default: ${DEFAULT-VALUE})")
    private String redisHost;

    @Option(names = "--redis-port", defaultValue = "6379", description = "Redis port (default: ${DEFAULT-VALUE})")
    private int redisPort;

    @Option(names = "--dry-run", description = "Read and compare everything without writing to the targets")
    private boolean dryRun;

    @Option(names = "--batch-size", description = "Legacy rows per batch (default: hivestate.migration.batch-size)")
    private Integer batchSize;

    @Option(names = "--fail-fast", description = "Stop at the first row error instead of collecting errors")
    private Boolean failFast;

    private final MigrationService migrationService;

    public MigrateCommand(MigrationService migrationService) {
        this.migrationService = migrationService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (batchSize != null && batchSize <= 0) {
            ConsoleOutput.error("--batch-size must be positive");
            return 1;
        }
        TargetConnection target = new TargetConnection(pgHost, pgPort, pgDatabase, pgUser,
                pgPassword == null ? "" : pgPassword, redisHost, redisPort);
        ConsoleOutput.info((dryRun ? "Dry run: " : "Migrating ") + legacyDb + " -> " + target);

        MigrationReport report = migrationService.migrate(
                new MigrationRequest(legacyDb, target, dryRun, batchSize, failFast));
        for (PhaseResult phase : report.phases()) {
            ConsoleOutput.phase(phase);
        }
        ConsoleOutput.migrationSummary(report);
        return report.success() ? 0 : 1;
    }
}
