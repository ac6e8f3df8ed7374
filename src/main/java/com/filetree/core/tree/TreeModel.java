package com.filetree.core.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Lazily populated mirror of the filesystem below the root, carrying a
 * selection flag per node.
 * <p>
 * Nodes are created when their parent is populated and inherit the parent's
 * selection at that moment. Paths without a node take the selection of their
 * nearest materialized ancestor, so a whole unexpanded subtree follows its
 * top directory.
 * <p>
 * Not thread-safe: {@link #populate}, {@link #setSelected} and
 * {@link #propagateUp} must be called from a single owner.
 */
public class TreeModel {

    private static final Logger log = LoggerFactory.getLogger(TreeModel.class);

    private final TreeWalker walker;
    private final TreeNode root;
    private final Map<Path, TreeNode> index = new HashMap<>();
    private final List<Consumer<SelectionChange>> listeners = new CopyOnWriteArrayList<>();

    public TreeModel(TreeWalker walker) {
        this.walker = walker;
        this.root = new TreeNode(walker.filter().root(), true, null, true);
        index.put(root.path(), root);
    }

    public TreeNode root() {
        return root;
    }

    // ── Population ───────────────────────────────────────────────────

    /**
     * Lists {@code node}'s directory once and creates its children. Does
     * nothing for files and already populated directories. A directory that
     * cannot be listed is left without children.
     */
    public void populate(TreeNode node) {
        if (!node.isDirectory() || node.isPopulated()) {
            return;
        }
        List<TreeEntry> entries;
        try {
            entries = walker.list(node.path());
        } catch (IOException e) {
            log.warn("Cannot list {}: {}", node.path(), e.toString());
            return;
        }
        for (TreeEntry entry : entries) {
            TreeNode child = new TreeNode(entry.path(), entry.directory(), node, node.isSelected());
            node.addChild(child);
            index.put(child.path(), child);
        }
        node.markPopulated();
        log.debug("Populated {} with {} entries", node.path(), entries.size());
    }

    /**
     * Materializes {@code path} by populating every directory from the root
     * down to it, then the node itself.
     *
     * @param path absolute, or relative to the root
     * @return the node, or empty if the path is outside the root, missing, or filtered out
     */
    public Optional<TreeNode> expand(Path path) {
        Path target = resolve(path);
        if (!target.startsWith(root.path())) {
            return Optional.empty();
        }
        TreeNode current = root;
        if (!target.equals(root.path())) {
            for (Path segment : root.path().relativize(target)) {
                populate(current);
                current = index.get(current.path().resolve(segment.toString()));
                if (current == null) {
                    return Optional.empty();
                }
            }
        }
        populate(current);
        return Optional.of(current);
    }

    public Optional<TreeNode> find(Path path) {
        return Optional.ofNullable(index.get(resolve(path)));
    }

    /** Drops every node but the root, keeping its selection, and re-lists the root. */
    public void refresh() {
        for (TreeNode child : root.children()) {
            unindex(child);
        }
        root.clearChildren();
        if (root.update(root.isSelected(), false)) {
            fire(root);
        }
        populate(root);
    }

    // ── Selection ────────────────────────────────────────────────────

    /** Sets {@code value} on {@code node} and on every materialized descendant. */
    public void setSelected(TreeNode node, boolean value) {
        if (node.update(value, false)) {
            fire(node);
        }
        for (TreeNode child : node.children()) {
            setSelected(child, value);
        }
    }

    /**
     * Walks up from {@code node}: while a parent's materialized children all
     * share one {@code selected} value, the parent takes it and the walk goes
     * on. The parent is mixed when some child is mixed. The first parent
     * whose children disagree keeps its own flag and is marked mixed, as is
     * every ancestor above it.
     */
    public void propagateUp(TreeNode node) {
        TreeNode current = node;
        while (current.parent() != null) {
            TreeNode parent = current.parent();
            Boolean shared = sharedSelection(parent.children());
            if (shared == null) {
                markMixed(parent);
                return;
            }
            boolean mixed = parent.children().stream().anyMatch(TreeNode::isMixed);
            if (parent.update(shared, mixed)) {
                fire(parent);
            }
            current = parent;
        }
    }

    /** Flips the node's selection for its whole subtree and updates its ancestors. */
    public void toggle(TreeNode node) {
        setSelected(node, !node.isSelected());
        propagateUp(node);
    }

    public void selectAll() {
        setSelected(root, true);
    }

    public void selectNone() {
        setSelected(root, false);
    }

    /**
     * Selection of {@code path}: its node's flag if materialized, otherwise the
     * flag of the nearest materialized ancestor. Paths outside the root are
     * selected.
     */
    public boolean effectiveSelection(Path path) {
        Path current = resolve(path);
        while (current != null && current.startsWith(root.path())) {
            TreeNode node = index.get(current);
            if (node != null) {
                return node.isSelected();
            }
            current = current.getParent();
        }
        return true;
    }

    /** Display state of {@code path}, {@link SelectionState#MIXED} only for materialized nodes. */
    public SelectionState stateOf(Path path) {
        TreeNode node = index.get(resolve(path));
        if (node != null) {
            return node.state();
        }
        return effectiveSelection(path) ? SelectionState.SELECTED : SelectionState.UNSELECTED;
    }

    // ── Listeners ────────────────────────────────────────────────────

    public void addListener(Consumer<SelectionChange> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<SelectionChange> listener) {
        listeners.remove(listener);
    }

    // ── Internals ────────────────────────────────────────────────────

    /** The children's common flag, or {@code null} if they disagree or there are none. */
    private static Boolean sharedSelection(List<TreeNode> children) {
        Boolean shared = null;
        for (TreeNode child : children) {
            if (shared == null) {
                shared = child.isSelected();
            } else if (shared != child.isSelected()) {
                return null;
            }
        }
        return shared;
    }

    private void markMixed(TreeNode from) {
        for (TreeNode node = from; node != null; node = node.parent()) {
            if (node.update(node.isSelected(), true)) {
                fire(node);
            }
        }
    }

    private void unindex(TreeNode node) {
        index.remove(node.path());
        for (TreeNode child : node.children()) {
            unindex(child);
        }
    }

    private Path resolve(Path path) {
        Path absolute = path.isAbsolute() ? path : root.path().resolve(path);
        return absolute.normalize();
    }

    private void fire(TreeNode node) {
        if (listeners.isEmpty()) {
            return;
        }
        var change = new SelectionChange(node.path(), node.state());
        for (Consumer<SelectionChange> listener : listeners) {
            try {
                listener.accept(change);
            } catch (Exception e) {
                log.warn("Selection listener failed for {}: {}", node.path(), e.getMessage(), e);
            }
        }
    }
}
