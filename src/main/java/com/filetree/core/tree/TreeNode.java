package com.filetree.core.tree;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A materialized filesystem entry in the {@link TreeModel}.
 * <p>
 * Children stay empty until the node is populated; once created they persist
 * until the model is refreshed. Mutation goes through {@link TreeModel} only.
 */
public final class TreeNode {

    private final Path path;
    private final boolean directory;
    private final TreeNode parent;
    private final List<TreeNode> children = new ArrayList<>();
    private boolean selected;
    private boolean mixed;
    private boolean populated;

    TreeNode(Path path, boolean directory, TreeNode parent, boolean selected) {
        this.path = path;
        this.directory = directory;
        this.parent = parent;
        this.selected = selected;
    }

    public Path path() {
        return path;
    }

    public String name() {
        Path fileName = path.getFileName();
        return fileName == null ? path.toString() : fileName.toString();
    }

    public boolean isDirectory() {
        return directory;
    }

    /** Parent node, or {@code null} for the root. */
    public TreeNode parent() {
        return parent;
    }

    public List<TreeNode> children() {
        return Collections.unmodifiableList(children);
    }

    /** The node's own selection flag; inherited by unmaterialized descendants. */
    public boolean isSelected() {
        return selected;
    }

    public boolean isMixed() {
        return mixed;
    }

    public boolean isPopulated() {
        return populated;
    }

    public SelectionState state() {
        if (mixed) return SelectionState.MIXED;
        return selected ? SelectionState.SELECTED : SelectionState.UNSELECTED;
    }

    /** Returns {@code true} if the state changed. */
    boolean update(boolean selected, boolean mixed) {
        if (this.selected == selected && this.mixed == mixed) {
            return false;
        }
        this.selected = selected;
        this.mixed = mixed;
        return true;
    }

    void addChild(TreeNode child) {
        children.add(child);
    }

    void clearChildren() {
        children.clear();
        populated = false;
    }

    void markPopulated() {
        populated = true;
    }

    @Override
    public String toString() {
        return "TreeNode[" + path + ", " + state() + "]";
    }
}
