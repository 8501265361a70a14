package com.storyline.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Storyline.
 * Routes to subcommands: resolve, parse, state.
 */
@Command(
        name = "storyline",
        mixinStandardHelpOptions = true,
        version = "Storyline 0.1.0",
        description = "Resolves narrative text with embedded conditional and sequence directives",
        subcommands = {
                ResolveCommand.class,
                ParseCommand.class,
                StateCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class StorylineCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
