package com.filetree.core.export;

import java.nio.file.Path;

/**
 * Outcome of a written export.
 *
 * @param outputPath   the written document
 * @param fileCount    number of file sections in the document
 * @param bytesWritten size of the document in bytes
 */
public record ExportResult(Path outputPath, int fileCount, long bytesWritten) {}
