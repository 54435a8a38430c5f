package com.hivestate.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root of the {@code hivestate} command line. {@code migrate} imports a legacy SQLite
 * database, {@code health} checks PostgreSQL and Redis, and {@code stats} prints cache
 * performance. Without a subcommand only the banner and usage are printed.
 */
@Command(
        name = "hivestate",
        mixinStandardHelpOptions = true,
        version = "HiveState 0.1.0",
        description = "Hybrid PostgreSQL and Redis state layer for agent coordination",
        subcommands = {
                MigrateCommand.class,
                HealthCommand.class,
                StatsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class HiveStateCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
