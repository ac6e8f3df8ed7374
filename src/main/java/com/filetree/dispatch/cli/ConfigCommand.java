package com.filetree.dispatch.cli;

import com.filetree.config.ExportSettings;
import com.filetree.config.RootDirectoryNotFoundException;
import com.filetree.core.session.FiletreeSessionFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: filetree config
 * <p>
 * Prints the resolved settings, including patterns read from the ignore file.
 */
@Command(name = "config", mixinStandardHelpOptions = true, description = "Show the effective configuration")
@Component
public class ConfigCommand implements Callable<Integer> {

    @Option(names = {"--root", "-r"}, description = "Root directory (default: filetree.root-dir)")
    private String root;

    private final FiletreeSessionFactory sessionFactory;

    public ConfigCommand(FiletreeSessionFactory sessionFactory) {
        this.sessionFactory = sessionFactory;
    }

    @Override
    public Integer call() {
        ExportSettings settings;
        try {
            settings = sessionFactory.resolve(root);
        } catch (RootDirectoryNotFoundException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.CONFIGURATION;
        }

        ConsoleOutput.printBanner();
        System.out.println("Root:           " + settings.root());
        System.out.println("Output:         " + settings.outputPath());
        System.out.println("Include hidden: " + settings.includeHidden());
        System.out.println("Max bytes:      " + settings.maxBytesPerFile());
        System.out.println("Embed binary:   " + settings.embedBinary());
        System.out.println("Excludes:");
        for (String pattern : settings.excludes()) {
            System.out.println("  - " + pattern);
        }
        return ExitCodes.OK;
    }
}
