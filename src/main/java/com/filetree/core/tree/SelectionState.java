package com.filetree.core.tree;

/**
 * Display state of a tree node.
 */
public enum SelectionState {
    SELECTED,
    UNSELECTED,
    MIXED       // materialized children diverge
}
