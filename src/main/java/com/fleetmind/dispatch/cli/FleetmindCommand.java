package com.fleetmind.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Fleetmind.
 * Routes to subcommands: run, runs, status, stats, cleanup.
 */
@Command(
        name = "fleetmind",
        mixinStandardHelpOptions = true,
        version = "Fleetmind 0.1.0",
        description = "Supervises coding-agent workers and drives plan/build/verify pipelines",
        subcommands = {
                RunCommand.class,
                RunsCommand.class,
                StatusCommand.class,
                StatsCommand.class,
                CleanupCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FleetmindCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // No subcommand given
        spec.commandLine().usage(System.out);
    }
}
