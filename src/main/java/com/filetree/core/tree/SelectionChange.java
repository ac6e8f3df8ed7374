package com.filetree.core.tree;

import java.nio.file.Path;

/**
 * Emitted by {@link TreeModel} whenever a node's selection state changes.
 */
public record SelectionChange(Path path, SelectionState state) {}
