package com.filetree.dispatch.cli;

import com.filetree.config.RootDirectoryNotFoundException;
import com.filetree.core.session.FiletreeSession;
import com.filetree.core.session.FiletreeSessionFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

/**
 * CLI command: filetree browse
 * <p>
 * Opens the line-oriented browser on standard input: expand directories,
 * toggle entries, then generate the export after a confirmation question.
 */
@Command(name = "browse", mixinStandardHelpOptions = true, description = "Select entries interactively, then export")
@Component
public class BrowseCommand implements Callable<Integer> {

    @Option(names = {"--root", "-r"}, description = "Root directory (default: filetree.root-dir)")
    private String root;

    private final FiletreeSessionFactory sessionFactory;

    public BrowseCommand(FiletreeSessionFactory sessionFactory) {
        this.sessionFactory = sessionFactory;
    }

    @Override
    public Integer call() {
        FiletreeSession session;
        try {
            session = sessionFactory.open(root);
        } catch (RootDirectoryNotFoundException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.CONFIGURATION;
        }

        ConsoleOutput.printBanner();
        var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try {
            return new BrowseSession(session, in).run();
        } catch (IOException e) {
            ConsoleOutput.error("Input failed: " + e.getMessage());
            return ExitCodes.FAILURE;
        }
    }
}
