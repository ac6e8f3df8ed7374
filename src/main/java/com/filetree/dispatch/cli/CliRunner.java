package com.filetree.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final FiletreeCommand filetreeCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(FiletreeCommand filetreeCommand, IFactory factory) {
        this.filetreeCommand = filetreeCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        exitCode = new CommandLine(filetreeCommand, factory).execute(commandArgs(args));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Drops {@code --filetree.*}, {@code --spring.*} and {@code --logging.*}
     * arguments; Spring Boot has already bound them as properties.
     */
    static String[] commandArgs(String... args) {
        return Arrays.stream(args)
                .filter(arg -> !(arg.startsWith("--filetree.")
                        || arg.startsWith("--spring.")
                        || arg.startsWith("--logging.")))
                .toArray(String[]::new);
    }
}
