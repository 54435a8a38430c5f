package com.hivestate.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Executes one {@code hivestate} invocation ({@code migrate}, {@code health} or {@code stats})
 * after the state layer has been initialized. The picocli exit code becomes the process exit
 * code through {@code SpringApplication.exit}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final HiveStateCommand rootCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(HiveStateCommand rootCommand, IFactory factory) {
        this.rootCommand = rootCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        CommandLine commandLine = new CommandLine(rootCommand, factory);
        exitCode = commandLine.execute(args);
        if (exitCode != CommandLine.ExitCode.OK) {
            log.debug("hivestate {} exited with code {}", String.join(" ", args), exitCode);
        }
    }

    /** Zero until {@link #run} has completed. */
    @Override
    public int getExitCode() {
        return exitCode;
    }
}
