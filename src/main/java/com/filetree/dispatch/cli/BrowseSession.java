package com.filetree.dispatch.cli;

import com.filetree.core.export.ExportResult;
import com.filetree.core.session.FiletreeSession;
import com.filetree.core.tree.TreeModel;
import com.filetree.core.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Line-oriented browser over a {@link FiletreeSession}. Each input line is one
 * intent (expand/list, toggle, select all/none, refresh, generate); the loop
 * ends on {@code quit}, end of input, or after a successful export.
 */
public class BrowseSession {

    private static final Logger log = LoggerFactory.getLogger(BrowseSession.class);

    static final String QUESTION =
            "Should unselected files/folders be visible in the file tree? [y]es/[n]o/[c]ancel";

    private final FiletreeSession session;
    private final TreeModel model;
    private final BufferedReader in;
    private int changes;

    public BrowseSession(FiletreeSession session, BufferedReader in) {
        this.session = session;
        this.model = session.model();
        this.in = in;
        model.addListener(change -> changes++);
    }

    /**
     * Runs the loop until the operator quits or an export is written.
     *
     * @return the process exit code
     * @throws IOException if reading the input fails
     */
    public int run() throws IOException {
        ConsoleOutput.info("Root: " + model.root().path());
        list(model.root());
        printHelp();

        while (true) {
            ConsoleOutput.prompt(">");
            String line = in.readLine();
            if (line == null) {
                return ExitCodes.OK;
            }
            String[] parts = line.strip().split("\\s+", 2);
            String command = parts[0].toLowerCase(Locale.ROOT);
            String argument = parts.length > 1 ? parts[1] : "";

            switch (command) {
                case "" -> { }
                case "ls", "expand", "e" -> expand(argument);
                case "toggle", "t" -> toggle(argument);
                case "all", "a" -> {
                    model.selectAll();
                    ConsoleOutput.success("Selected everything");
                }
                case "none", "n" -> {
                    model.selectNone();
                    ConsoleOutput.success("Deselected everything");
                }
                case "refresh", "r" -> {
                    model.refresh();
                    ConsoleOutput.success("Reloaded " + model.root().path());
                    list(model.root());
                }
                case "generate", "g" -> {
                    if (generate()) {
                        return ExitCodes.OK;
                    }
                }
                case "help", "?" -> printHelp();
                case "quit", "q", "exit" -> {
                    return ExitCodes.OK;
                }
                default -> ConsoleOutput.error("Unknown command: " + command + " (try help)");
            }
        }
    }

    private void expand(String argument) {
        Optional<TreeNode> node = model.expand(Path.of(argument));
        if (node.isEmpty()) {
            ConsoleOutput.error("Not found or excluded: " + argument);
            return;
        }
        if (!node.get().isDirectory()) {
            ConsoleOutput.error("Not a directory: " + argument);
            return;
        }
        list(node.get());
    }

    private void toggle(String argument) {
        if (argument.isEmpty()) {
            ConsoleOutput.error("Usage: toggle <path>");
            return;
        }
        Optional<TreeNode> node = model.expand(Path.of(argument));
        if (node.isEmpty()) {
            ConsoleOutput.error("Not found or excluded: " + argument);
            return;
        }
        changes = 0;
        model.toggle(node.get());
        ConsoleOutput.entry(0, node.get().state(), relative(node.get()), node.get().isDirectory(),
                session.settings().glyphs());
        ConsoleOutput.info(changes + " entr" + (changes == 1 ? "y" : "ies") + " changed");
    }

    /** Returns {@code true} if the document was written. */
    private boolean generate() throws IOException {
        ConfirmationChoice choice = confirm();
        if (choice == ConfirmationChoice.CANCEL) {
            ConsoleOutput.info("Export cancelled");
            return false;
        }
        try {
            ExportResult result = session.exporter().export(choice == ConfirmationChoice.YES);
            ConsoleOutput.success(result.outputPath() + " generated (" + result.fileCount() + " files)");
            return true;
        } catch (UncheckedIOException e) {
            log.warn("Export failed", e);
            ConsoleOutput.error("Error: " + e.getMessage());
            return false;
        }
    }

    private ConfirmationChoice confirm() throws IOException {
        while (true) {
            ConsoleOutput.prompt(QUESTION);
            String answer = in.readLine();
            if (answer == null) {
                return ConfirmationChoice.CANCEL;
            }
            Optional<ConfirmationChoice> choice = ConfirmationChoice.parse(answer);
            if (choice.isPresent()) {
                return choice.get();
            }
            ConsoleOutput.error("Please answer y, n or c");
        }
    }

    private void list(TreeNode directory) {
        var glyphs = session.settings().glyphs();
        ConsoleOutput.entry(0, directory.state(), relative(directory), true, glyphs);
        for (TreeNode child : directory.children()) {
            ConsoleOutput.entry(1, child.state(), child.name(), child.isDirectory(), glyphs);
        }
    }

    private String relative(TreeNode node) {
        Path root = model.root().path();
        if (node.path().equals(root)) {
            return node.name();
        }
        return root.relativize(node.path()).toString().replace('\\', '/');
    }

    private static void printHelp() {
        System.out.println("Commands:");
        System.out.println("  ls [path]      expand and list a directory (root if omitted)");
        System.out.println("  toggle <path>  flip selection of an entry and everything below it");
        System.out.println("  all | none     select or deselect everything");
        System.out.println("  refresh        reload the tree from disk");
        System.out.println("  generate       write the Markdown export");
        System.out.println("  quit           leave without writing");
    }
}
