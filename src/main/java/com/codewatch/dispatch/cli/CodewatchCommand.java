package com.codewatch.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Codewatch.
 * Routes to subcommands: review, capabilities, serve.
 */
@Command(
        name = "codewatch",
        mixinStandardHelpOptions = true,
        version = "Codewatch 0.1.0",
        description = "Multi-agent code review with parallel analysis and fix verification",
        subcommands = {
                ReviewCommand.class,
                CapabilitiesCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CodewatchCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
