package com.filetree.core.export;

import com.filetree.config.ExportSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds the document and writes it to {@code root/outputFileName}, replacing
 * any previous export.
 */
public class DocumentExporter {

    private static final Logger log = LoggerFactory.getLogger(DocumentExporter.class);

    private final ExportSettings settings;
    private final DocumentBuilder builder;

    public DocumentExporter(ExportSettings settings, DocumentBuilder builder) {
        this.settings = settings;
        this.builder = builder;
    }

    /**
     * @throws UncheckedIOException if the document cannot be written
     */
    public ExportResult export(boolean includeUnselected) {
        var document = builder.render(settings.root(), includeUnselected,
                settings.maxBytesPerFile(), settings.embedBinary());
        byte[] bytes = document.text().getBytes(StandardCharsets.UTF_8);
        Path output = settings.outputPath();
        try {
            Files.write(output, bytes);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + output, e);
        }
        log.info("Wrote {} ({} files, {} bytes)", output, document.fileCount(), bytes.length);
        return new ExportResult(output, document.fileCount(), bytes.length);
    }
}
