package com.filetree.dispatch.cli;

import com.filetree.config.FiletreeProperties;
import com.filetree.core.session.FiletreeSessionFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the filetree CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * validating command parsing, help output, and execution behavior.
 */
class CliTest {

    @TempDir
    Path root;

    private record CliResult(int exitCode, String output) {}

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(root.resolve("src"));
        Files.writeString(root.resolve("src/a.go"), "fmt.Println(1)\n");
        Files.writeString(root.resolve("src/b.go"), "fmt.Println(2)\n");
        Files.writeString(root.resolve("README.md"), "# demo\n");
        Files.writeString(root.resolve(".filetreeignore"), "# extra\n*.tmp\n");
    }

    /**
     * Custom picocli IFactory that wires commands to a session factory on the temp root.
     */
    private CommandLine.IFactory createFactory(FiletreeSessionFactory sessionFactory) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == GenerateCommand.class) {
                    return (K) new GenerateCommand(sessionFactory);
                }
                if (cls == BrowseCommand.class) {
                    return (K) new BrowseCommand(sessionFactory);
                }
                if (cls == ConfigCommand.class) {
                    return (K) new ConfigCommand(sessionFactory);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        var props = new FiletreeProperties();
        props.setRootDir(root.toString());
        return execute(props, args);
    }

    private CliResult execute(FiletreeProperties props, String... args) {
        return execute(props, StandardCharsets.UTF_8, args);
    }

    /** Runs with {@code System.out} encoding as {@code consoleCharset}; the capture is decoded as UTF-8. */
    private CliResult execute(FiletreeProperties props, Charset consoleCharset, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true, consoleCharset);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            var factory = createFactory(new FiletreeSessionFactory(props));
            CommandLine commandLine = new CommandLine(new FiletreeCommand(), factory);
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    // ── Help ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("help")
    class HelpTests {

        @Test
        @DisplayName("--help lists the subcommands")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("browse"));
            assertTrue(result.output().contains("generate"));
            assertTrue(result.output().contains("config"));
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("filetree 0.1.0"));
        }

        @Test
        @DisplayName("no subcommand prints banner and usage")
        void noSubcommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("FILETREE"));
            assertTrue(result.output().contains("Usage: filetree"));
        }

        @Test
        @DisplayName("generate --help documents its options")
        void generateHelp() {
            CliResult result = execute("generate", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--include-unselected"));
            assertTrue(result.output().contains("--select"));
        }
    }

    // ── Generate ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("generate")
    class GenerateTests {

        @Test
        @DisplayName("writes the export under the root")
        void writesExport() throws IOException {
            CliResult result = execute("generate");

            assertEquals(0, result.exitCode(), result.output());
            Path output = root.toRealPath().resolve("FILETREE.md");
            assertTrue(result.output().contains("Wrote " + output));
            String doc = Files.readString(output);
            assertTrue(doc.contains("### `src/a.go`"));
            assertTrue(doc.contains("### `README.md`"));
        }

        @Test
        @DisplayName("--stdout prints instead of writing")
        void stdout() {
            CliResult result = execute("generate", "--stdout");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("# File Tree for `"));
            assertFalse(Files.exists(root.resolve("FILETREE.md")));
        }

        @Test
        @DisplayName("--stdout writes UTF-8 even when the console charset is not")
        void stdoutIsUtf8() throws IOException {
            Files.writeString(root.resolve("src/a.go"), "// café\n");
            var props = new FiletreeProperties();
            props.setRootDir(root.toString());

            CliResult result = execute(props, StandardCharsets.US_ASCII, "generate", "--stdout");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("◉ a.go"), result.output());
            assertTrue(result.output().contains("// café"), result.output());
        }

        @Test
        @DisplayName("--none with --select exports only the chosen file")
        void selectAfterNone() {
            CliResult result = execute("generate", "--stdout", "--none", "--select", "src/a.go");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("### `src/a.go`"));
            assertFalse(result.output().contains("### `src/b.go`"));
            assertFalse(result.output().contains("### `README.md`"));
        }

        @Test
        @DisplayName("--deselect drops a subtree and -u keeps it in the tree")
        void deselectWithUnselected() {
            CliResult result = execute("generate", "--stdout", "-u", "--deselect", "src");

            assertTrue(result.output().contains("◯ src"), result.output());
            assertFalse(result.output().contains("### `src/a.go`"));
            assertTrue(result.output().contains("### `README.md`"));
        }

        @Test
        @DisplayName("unknown selection paths are reported and skipped")
        void unknownPath() {
            CliResult result = execute("generate", "--stdout", "--deselect", "nope.txt");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Not found or excluded: nope.txt"));
        }

        @Test
        @DisplayName("missing root exits with status 2 before any traversal")
        void missingRoot() {
            CliResult result = execute("generate", "--root", root.resolve("missing").toString());

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Root directory does not exist"));
        }
    }

    // ── Config ───────────────────────────────────────────────────────

    @Test
    @DisplayName("config shows ignore-file patterns")
    void configShowsPatterns() {
        CliResult result = execute("config");

        assertEquals(0, result.exitCode());
        assertTrue(result.output().contains("  - node_modules"));
        assertTrue(result.output().contains("  - *.tmp"));
    }

    @Test
    @DisplayName("Spring property arguments are not passed to picocli")
    void springArgumentsFiltered() {
        String[] args = CliRunner.commandArgs("generate", "--filetree.max-bytes=10", "--stdout",
                "--spring.main.banner-mode=off", "--logging.level.root=DEBUG");
        assertArrayEquals(new String[]{"generate", "--stdout"}, args);
    }
}
