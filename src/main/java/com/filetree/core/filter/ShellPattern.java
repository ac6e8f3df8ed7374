package com.filetree.core.filter;

import java.util.regex.Pattern;

/**
 * Shell-style wildcard pattern matched against a whole string, case-sensitively.
 * <p>
 * {@code *} matches any run of characters including {@code /}, {@code ?} one
 * character, {@code [abc]} / {@code [a-z]} a class and {@code [!abc]} its
 * complement. A {@code [} without a closing {@code ]} is literal, as are
 * {@code {}}, {@code \} and every other character.
 */
public final class ShellPattern {

    private final String source;
    private final Pattern regex;

    private ShellPattern(String source, Pattern regex) {
        this.source = source;
        this.regex = regex;
    }

    /**
     * @throws java.util.regex.PatternSyntaxException if a character class has an invalid range
     */
    public static ShellPattern compile(String pattern) {
        return new ShellPattern(pattern, Pattern.compile(toRegex(pattern), Pattern.DOTALL));
    }

    public boolean matches(String text) {
        return regex.matcher(text).matches();
    }

    static String toRegex(String pattern) {
        StringBuilder out = new StringBuilder();
        int n = pattern.length();
        int i = 0;
        while (i < n) {
            char c = pattern.charAt(i++);
            if (c == '*') {
                out.append(".*");
            } else if (c == '?') {
                out.append('.');
            } else if (c == '[') {
                int j = i;
                if (j < n && pattern.charAt(j) == '!') j++;
                if (j < n && pattern.charAt(j) == ']') j++;
                while (j < n && pattern.charAt(j) != ']') j++;
                if (j >= n) {
                    out.append("\\[");
                } else {
                    appendClass(pattern.substring(i, j), out);
                    i = j + 1;
                }
            } else {
                appendLiteral(c, out);
            }
        }
        return out.toString();
    }

    private static void appendClass(String body, StringBuilder out) {
        out.append('[');
        int start = 0;
        if (body.startsWith("!")) {
            out.append('^');
            start = 1;
        } else if (body.startsWith("^")) {
            out.append("\\^");
            start = 1;
        }
        for (int k = start; k < body.length(); k++) {
            char c = body.charAt(k);
            // '-' keeps its range meaning; everything else is a plain member
            if (c == '\\' || c == '[' || c == ']' || c == '&' || c == '^') {
                out.append('\\');
            }
            out.append(c);
        }
        out.append(']');
    }

    private static void appendLiteral(char c, StringBuilder out) {
        if (c < 128 && !Character.isLetterOrDigit(c)) {
            out.append('\\');
        }
        out.append(c);
    }

    @Override
    public String toString() {
        return source;
    }
}
