package com.filetree.core.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads extra exclude patterns from an ignore file, one pattern per line.
 * Blank lines and lines starting with {@code #} are skipped.
 */
public final class IgnoreFile {

    private static final Logger log = LoggerFactory.getLogger(IgnoreFile.class);

    private IgnoreFile() {}

    /**
     * Returns the patterns in {@code file}, or an empty list if the file is
     * absent or cannot be read.
     */
    public static List<String> load(Path file) {
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        var decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        try (var reader = new BufferedReader(new InputStreamReader(Files.newInputStream(file), decoder))) {
            return parse(reader.lines().toList());
        } catch (IOException | UncheckedIOException e) {
            log.warn("Could not read ignore file {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    static List<String> parse(List<String> lines) {
        List<String> patterns = new ArrayList<>();
        for (String line : lines) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            patterns.add(trimmed);
        }
        return patterns;
    }
}
