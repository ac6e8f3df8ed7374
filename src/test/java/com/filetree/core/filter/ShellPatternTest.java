package com.filetree.core.filter;

import org.junit.jupiter.api.Test;

import java.util.regex.PatternSyntaxException;

import static org.junit.jupiter.api.Assertions.*;

class ShellPatternTest {

    @Test
    void wildcards() {
        assertTrue(ShellPattern.compile("*.log").matches("a/b/server.log"));
        assertTrue(ShellPattern.compile("?.txt").matches("a.txt"));
        assertFalse(ShellPattern.compile("?.txt").matches("ab.txt"));
        assertTrue(ShellPattern.compile("*").matches(""));
    }

    @Test
    void wholeStringOnly() {
        assertFalse(ShellPattern.compile("build").matches("build2"));
        assertFalse(ShellPattern.compile("build").matches("my-build"));
    }

    @Test
    void regexCharactersAreLiteral() {
        assertTrue(ShellPattern.compile("a.b+c(1)$").matches("a.b+c(1)$"));
        assertFalse(ShellPattern.compile("a.b").matches("axb"));
        assertTrue(ShellPattern.compile("back\\slash").matches("back\\slash"));
    }

    @Test
    void bracketEdgeCases() {
        assertTrue(ShellPattern.compile("[]]").matches("]"));
        assertTrue(ShellPattern.compile("[!]]").matches("x"));
        assertFalse(ShellPattern.compile("[!]]").matches("]"));
        assertTrue(ShellPattern.compile("[^a]").matches("^"));
        assertTrue(ShellPattern.compile("[[]").matches("["));
        assertTrue(ShellPattern.compile("x[").matches("x["));
    }

    @Test
    void nonAsciiIsLiteral() {
        assertTrue(ShellPattern.compile("café*").matches("café-menu.md"));
    }

    @Test
    void reversedRangeIsRejected() {
        assertThrows(PatternSyntaxException.class, () -> ShellPattern.compile("[z-a]"));
    }
}
