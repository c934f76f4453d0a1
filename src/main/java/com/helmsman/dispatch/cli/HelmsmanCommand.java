package com.helmsman.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Helmsman.
 * Routes to subcommands: process, catalog, health.
 */
@Command(
        name = "helmsman",
        mixinStandardHelpOptions = true,
        version = "Helmsman 1.0.0",
        description = "Maritime document triage: classifies maintenance records, sensor alerts and incident reports",
        subcommands = {
                ProcessCommand.class,
                CatalogCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class HelmsmanCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // no subcommand given; reuse the factory-built command line for usage help
        spec.commandLine().usage(System.out);
    }
}
