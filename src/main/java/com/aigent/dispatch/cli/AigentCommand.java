package com.aigent.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Aigent.
 * Routes to subcommands: run, validate, assign.
 */
@Command(
        name = "aigent",
        mixinStandardHelpOptions = true,
        version = "Aigent 0.1.0",
        description = "Agent selection and multi-step workflow orchestration",
        subcommands = {
                RunCommand.class,
                ValidateCommand.class,
                AssignCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AigentCommand implements Runnable {

    static final int EXIT_OK = 0;
    static final int EXIT_WORKFLOW_FAILED = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // No subcommand given
        new CommandLine(this).usage(System.out);
    }
}
