package com.helmsman.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree once the Spring context is up and keeps the
 * resulting exit code for {@link com.helmsman.HelmsmanApplication}.
 * <p>
 * Unexpected exceptions from a command are logged and reported as a one-line
 * error with exit code {@value #EXIT_FAILURE}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int EXIT_FAILURE = 1;

    private final HelmsmanCommand helmsmanCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(HelmsmanCommand helmsmanCommand, IFactory factory) {
        this.helmsmanCommand = helmsmanCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        CommandLine commandLine = new CommandLine(helmsmanCommand, factory)
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    log.error("Command '{}' failed", cmd.getCommandName(), ex);
                    ConsoleOutput.error(cmd.getCommandName() + " failed: " + ex.getMessage());
                    return EXIT_FAILURE;
                });
        exitCode = commandLine.execute(args);
        log.debug("CLI finished with exit code {}", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
