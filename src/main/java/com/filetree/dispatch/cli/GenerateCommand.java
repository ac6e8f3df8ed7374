package com.filetree.dispatch.cli;

import com.filetree.config.RootDirectoryNotFoundException;
import com.filetree.core.export.ExportResult;
import com.filetree.core.session.FiletreeSession;
import com.filetree.core.session.FiletreeSessionFactory;
import com.filetree.core.tree.TreeModel;
import com.filetree.core.tree.TreeNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: filetree generate [--none] [--deselect PATH]... [--select PATH]...
 * <p>
 * Writes the export without the interactive browser. Everything starts
 * selected; {@code --none} clears the selection first, then every
 * {@code --deselect} and finally every {@code --select} path is toggled the
 * same way the browser would.
 */
@Command(name = "generate", mixinStandardHelpOptions = true, description = "Write the Markdown export")
@Component
public class GenerateCommand implements Callable<Integer> {

    @Option(names = {"--root", "-r"}, description = "Root directory (default: filetree.root-dir)")
    private String root;

    @Option(names = {"--include-unselected", "-u"},
            description = "Show unselected entries in the tree section")
    private boolean includeUnselected;

    @Option(names = "--none", description = "Start with nothing selected")
    private boolean startEmpty;

    @Option(names = "--select", paramLabel = "PATH", description = "Root-relative path to select")
    private List<String> select = new ArrayList<>();

    @Option(names = "--deselect", paramLabel = "PATH", description = "Root-relative path to deselect")
    private List<String> deselect = new ArrayList<>();

    @Option(names = "--stdout", description = "Print the document instead of writing the output file")
    private boolean stdout;

    private final FiletreeSessionFactory sessionFactory;

    public GenerateCommand(FiletreeSessionFactory sessionFactory) {
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

        TreeModel model = session.model();
        if (startEmpty) {
            model.selectNone();
        }
        for (String path : deselect) {
            apply(model, path, false);
        }
        for (String path : select) {
            apply(model, path, true);
        }

        if (stdout) {
            // the document is UTF-8 whatever the platform charset
            var out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
            out.println(session.builder().build(includeUnselected));
            out.flush();
            return ExitCodes.OK;
        }

        ConsoleOutput.printBanner();
        try {
            ExportResult result = session.exporter().export(includeUnselected);
            ConsoleOutput.success("Wrote " + result.outputPath() + " (" + result.fileCount() + " files, "
                    + result.bytesWritten() + " bytes)");
            return ExitCodes.OK;
        } catch (UncheckedIOException e) {
            ConsoleOutput.error(e.getMessage() + ": " + e.getCause().getMessage());
            return ExitCodes.FAILURE;
        }
    }

    private static void apply(TreeModel model, String path, boolean selected) {
        Optional<TreeNode> node = model.expand(Path.of(path));
        if (node.isEmpty()) {
            ConsoleOutput.error("Not found or excluded: " + path);
            return;
        }
        model.setSelected(node.get(), selected);
        model.propagateUp(node.get());
    }
}
