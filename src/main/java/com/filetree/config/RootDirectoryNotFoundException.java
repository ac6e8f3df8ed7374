package com.filetree.config;

import java.nio.file.Path;

/**
 * Thrown when the configured root directory does not exist or is not a directory.
 */
public class RootDirectoryNotFoundException extends RuntimeException {

    private final Path root;

    public RootDirectoryNotFoundException(Path root) {
        super("Root directory does not exist: " + root);
        this.root = root;
    }

    public RootDirectoryNotFoundException(Path root, Throwable cause) {
        super("Root directory does not exist: " + root, cause);
        this.root = root;
    }

    public Path getRoot() {
        return root;
    }
}
