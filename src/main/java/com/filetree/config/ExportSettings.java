package com.filetree.config;

import com.filetree.core.filter.IgnoreFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolved, immutable configuration for one export session.
 * Constructed once and passed to every component that needs it.
 *
 * @param root            absolute, normalized root directory
 * @param outputFileName  name of the document written under {@code root}
 * @param excludes        effective exclude patterns (configured + ignore file)
 * @param includeHidden   whether dot-entries are shown
 * @param maxBytesPerFile upper bound of embedded bytes per file
 * @param embedBinary     whether binary files are embedded anyway
 * @param glyphs          selection markers used in listings and the document
 */
public record ExportSettings(
        Path root,
        String outputFileName,
        List<String> excludes,
        boolean includeHidden,
        int maxBytesPerFile,
        boolean embedBinary,
        Glyphs glyphs
) {

    public ExportSettings {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(outputFileName, "outputFileName must not be null");
        if (outputFileName.isBlank()) {
            throw new IllegalArgumentException("outputFileName must not be blank");
        }
        if (maxBytesPerFile < 0) {
            throw new IllegalArgumentException("maxBytesPerFile must be >= 0, was " + maxBytesPerFile);
        }
        excludes = excludes == null ? List.of() : List.copyOf(excludes);
        glyphs = glyphs == null ? Glyphs.DEFAULT : glyphs;
    }

    /** Settings with default glyphs, output name, hidden files and no binary embedding. */
    public static ExportSettings of(Path root, List<String> excludes, int maxBytesPerFile) {
        return new ExportSettings(root, "FILETREE.md", excludes, true, maxBytesPerFile, false, Glyphs.DEFAULT);
    }

    /**
     * Resolves bound properties against the filesystem.
     *
     * @throws RootDirectoryNotFoundException if the root does not exist or is not a directory
     */
    public static ExportSettings resolve(FiletreeProperties properties) {
        return resolve(properties, null);
    }

    /**
     * Same as {@link #resolve(FiletreeProperties)} with the root directory
     * replaced by {@code rootOverride} when it is not {@code null}.
     */
    public static ExportSettings resolve(FiletreeProperties properties, String rootOverride) {
        String rootDir = rootOverride != null ? rootOverride : properties.getRootDir();
        Path root = Path.of(rootDir).toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new RootDirectoryNotFoundException(root);
        }
        try {
            root = root.toRealPath();
        } catch (IOException e) {
            throw new RootDirectoryNotFoundException(root, e);
        }

        if (properties.getMaxBytes() < 0 || properties.getMaxBytes() >= Integer.MAX_VALUE) {
            throw new IllegalArgumentException("filetree.max-bytes out of range: " + properties.getMaxBytes());
        }

        List<String> excludes = new ArrayList<>();
        if (properties.getExcludes() != null) {
            properties.getExcludes().stream()
                    .map(String::trim)
                    .filter(p -> !p.isEmpty())
                    .forEach(excludes::add);
        }
        if (properties.getIgnoreFile() != null && !properties.getIgnoreFile().isBlank()) {
            excludes.addAll(IgnoreFile.load(root.resolve(properties.getIgnoreFile())));
        }

        FiletreeProperties.Icons icons = properties.getIcons();
        return new ExportSettings(
                root,
                properties.getOutput(),
                excludes,
                properties.isIncludeHidden(),
                (int) properties.getMaxBytes(),
                properties.isReadBinary(),
                new Glyphs(icons.getSelected(), icons.getUnselected(), icons.getMixed())
        );
    }

    public Path outputPath() {
        return root.resolve(outputFileName);
    }

    /** Markers printed in front of entry names. */
    public record Glyphs(String selected, String unselected, String mixed) {

        public static final Glyphs DEFAULT = new Glyphs("◉", "◯", "◐");
    }
}
