package com.filetree.core.tree;

import java.util.List;

/**
 * Callback for {@link TreeWalker#walk(java.nio.file.Path, TreeVisitor)}.
 */
@FunctionalInterface
public interface TreeVisitor {

    /**
     * @param entry         the visited entry
     * @param ancestorsLast for each ancestor level below the walk start, whether
     *                      that ancestor was the last entry of its directory
     * @param last          whether {@code entry} is the last entry of its directory
     */
    void visit(TreeEntry entry, List<Boolean> ancestorsLast, boolean last);
}
