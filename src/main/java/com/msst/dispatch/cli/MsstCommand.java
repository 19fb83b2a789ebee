package com.msst.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for msst.
 * Routes to subcommands: run, validate.
 */
@Command(
        name = "msst",
        mixinStandardHelpOptions = true,
        version = "msst 1.0.0",
        description = "S3 compatibility test harness",
        subcommands = {
                RunCommand.class,
                ValidateCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class MsstCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
