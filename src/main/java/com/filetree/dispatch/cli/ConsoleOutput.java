package com.filetree.dispatch.cli;

import com.filetree.config.ExportSettings;
import com.filetree.core.tree.SelectionState;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the filetree CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(green) FILETREE v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FILETREE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void prompt(String message) {
        System.out.print(CommandLine.Help.Ansi.AUTO.string(
                "@|bold " + message + "|@ "));
        System.out.flush();
    }

    /** One listing line: indentation, colored glyph, then the name (with a slash for directories). */
    public static void entry(int depth, SelectionState state, String name, boolean directory,
                             ExportSettings.Glyphs glyphs) {
        String glyph = switch (state) {
            case SELECTED -> "@|bold,fg(green) " + glyphs.selected() + "|@";
            case UNSELECTED -> "@|faint " + glyphs.unselected() + "|@";
            case MIXED -> "@|fg(yellow) " + glyphs.mixed() + "|@";
        };
        String label = directory ? name + "/" : name;
        if (state == SelectionState.SELECTED) {
            label = "@|bold,fg(green) " + label + "|@";
        } else if (state == SelectionState.UNSELECTED) {
            label = "@|faint " + label + "|@";
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  ".repeat(depth) + glyph + " " + label));
    }
}
