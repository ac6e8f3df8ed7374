package com.filetree.core.tree;

import java.nio.file.Path;

/**
 * One listed filesystem entry.
 */
public record TreeEntry(Path path, String name, boolean directory) {

    static TreeEntry of(Path path, boolean directory) {
        Path fileName = path.getFileName();
        return new TreeEntry(path, fileName == null ? path.toString() : fileName.toString(), directory);
    }
}
