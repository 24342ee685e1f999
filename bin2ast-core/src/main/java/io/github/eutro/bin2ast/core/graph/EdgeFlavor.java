package io.github.eutro.bin2ast.core.graph;

/**
 * The classification of an edge by a depth-first traversal.
 */
public enum EdgeFlavor {
    /**
     * The edge discovered its target.
     */
    TREE,
    /**
     * The target was still open when the edge was seen; it is an ancestor of the source.
     */
    BACK,
    /**
     * The target was finished, and discovered after the source; it is a descendant of the source.
     */
    FORWARD,
    /**
     * Any other edge.
     */
    CROSS,
}
