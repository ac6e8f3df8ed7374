package com.filetree.core.export;

import com.filetree.config.ExportSettings;
import com.filetree.core.content.BinaryContentInspector;
import com.filetree.core.content.LanguageTags;
import com.filetree.core.tree.SelectionState;
import com.filetree.core.tree.TreeModel;
import com.filetree.core.tree.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Renders the Markdown export: an ASCII tree of the root followed by the
 * fenced contents of every selected file.
 * <p>
 * The tree is walked straight from the filesystem, so entries below an
 * unexpanded or deselected directory are still visited and take their
 * selection from {@link TreeModel#effectiveSelection(Path)}. A file that
 * cannot be read gets an inline notice and the walk goes on.
 */
public class DocumentBuilder {

    private static final Logger log = LoggerFactory.getLogger(DocumentBuilder.class);

    static final String BRANCH = "├── ";
    static final String LAST_BRANCH = "└── ";
    static final String PIPE_INDENT = "│   ";
    static final String SPACE_INDENT = "    ";
    static final String BINARY_NOTICE = "_Binary file — content not embedded._";

    private final ExportSettings settings;
    private final TreeWalker walker;
    private final TreeModel model;

    public DocumentBuilder(ExportSettings settings, TreeWalker walker, TreeModel model) {
        this.settings = settings;
        this.walker = walker;
        this.model = model;
    }

    /** Builds the document for the configured root, size limit and binary policy. */
    public String build(boolean includeUnselected) {
        return build(settings.root(), includeUnselected, settings.maxBytesPerFile(), settings.embedBinary());
    }

    /**
     * @throws IllegalArgumentException if {@code maxBytesPerFile} is negative
     */
    public String build(Path root, boolean includeUnselected, int maxBytesPerFile, boolean embedBinary) {
        return render(root, includeUnselected, maxBytesPerFile, embedBinary).text();
    }

    Document render(Path root, boolean includeUnselected, int maxBytesPerFile, boolean embedBinary) {
        if (maxBytesPerFile < 0) {
            throw new IllegalArgumentException("maxBytesPerFile must be >= 0, was " + maxBytesPerFile);
        }
        String rootName = root.getFileName() == null ? root.toString() : root.getFileName().toString();
        List<String> lines = new ArrayList<>();
        lines.add("# File Tree for `" + rootName + "`\n");
        lines.add(rootName);
        appendTree(root, includeUnselected, lines);

        lines.add("\n---\n");
        lines.add("## Selected files\n");
        int embedded = 0;
        for (Path file : walker.files(root)) {
            if (!model.effectiveSelection(file)) {
                continue;
            }
            String relative = root.relativize(file).toString().replace('\\', '/');
            lines.add("\n### `" + relative + "`\n");
            appendContent(file, maxBytesPerFile, embedBinary, lines);
            embedded++;
        }
        log.debug("Rendered {} with {} selected files", root, embedded);
        return new Document(String.join("\n", lines), embedded);
    }

    private void appendTree(Path root, boolean includeUnselected, List<String> lines) {
        ExportSettings.Glyphs glyphs = settings.glyphs();
        walker.walk(root, (entry, ancestorsLast, last) -> {
            boolean selected = model.effectiveSelection(entry.path());
            if (!includeUnselected && !selected) {
                return;
            }
            StringBuilder line = new StringBuilder();
            for (boolean ancestorLast : ancestorsLast) {
                line.append(ancestorLast ? SPACE_INDENT : PIPE_INDENT);
            }
            line.append(last ? LAST_BRANCH : BRANCH)
                .append(glyph(model.stateOf(entry.path()), glyphs))
                .append(' ')
                .append(entry.name());
            lines.add(line.toString());
        });
    }

    private void appendContent(Path file, int maxBytes, boolean embedBinary, List<String> lines) {
        // one byte past the limit tells a truncated file from one of exactly maxBytes
        int readLimit = maxBytes == Integer.MAX_VALUE ? maxBytes : maxBytes + 1;
        byte[] content;
        try (InputStream in = Files.newInputStream(file)) {
            content = in.readNBytes(readLimit);
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", file, e.toString());
            lines.add("_Error reading file: " + e.getMessage() + "_");
            return;
        }

        if (BinaryContentInspector.sniff(content, content.length) && !embedBinary) {
            lines.add(BINARY_NOTICE);
            return;
        }

        boolean truncated = content.length > maxBytes;
        if (truncated) {
            content = Arrays.copyOf(content, maxBytes);
        }
        // malformed UTF-8 decodes to U+FFFD
        String text = new String(content, StandardCharsets.UTF_8);

        String tag = LanguageTags.forPath(file);
        lines.add("```" + tag);
        lines.add(stripTrailingNewlines(text));
        lines.add("```");
        if (truncated) {
            lines.add("_...truncated at " + maxBytes + " bytes_");
        }
    }

    private static String glyph(SelectionState state, ExportSettings.Glyphs glyphs) {
        return switch (state) {
            case SELECTED -> glyphs.selected();
            case UNSELECTED -> glyphs.unselected();
            case MIXED -> glyphs.mixed();
        };
    }

    private static String stripTrailingNewlines(String text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '\n') {
            end--;
        }
        return text.substring(0, end);
    }

    /** Rendered text plus the number of file sections it contains. */
    record Document(String text, int fileCount) {}
}
