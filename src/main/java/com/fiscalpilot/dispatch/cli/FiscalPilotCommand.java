package com.fiscalpilot.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for FiscalPilot.
 * Routes to subcommands: policy, review, run.
 */
@Command(
        name = "fiscalpilot",
        mixinStandardHelpOptions = true,
        version = "FiscalPilot 0.4.0",
        description = "Approval and execution pipeline for proposed financial actions",
        subcommands = {
                PolicyCommand.class,
                ReviewCommand.class,
                RunCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FiscalPilotCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
