package com.filetree.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for filetree.
 * Routes to subcommands: browse, generate, config.
 */
@Command(
        name = "filetree",
        mixinStandardHelpOptions = true,
        version = "filetree 0.1.0",
        description = "Select parts of a directory tree and export them as one Markdown document",
        subcommands = {
                BrowseCommand.class,
                GenerateCommand.class,
                ConfigCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FiletreeCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
