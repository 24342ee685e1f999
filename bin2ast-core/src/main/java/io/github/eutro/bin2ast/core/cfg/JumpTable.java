package io.github.eutro.bin2ast.core.cfg;

import io.github.eutro.bin2ast.core.graph.NodeId;

import java.util.SortedSet;

/**
 * The table a multi-way branch indexes into.
 */
public interface JumpTable {
    /**
     * Get whether any index of the table leads to the target.
     *
     * @param target The target.
     * @return Whether the target is in the table.
     */
    boolean hasTarget(NodeId target);

    /**
     * Get the indices of the table that lead to the target.
     *
     * @param target The target.
     * @return The indices, which are empty if the target is not in the table.
     */
    SortedSet<Integer> getTarget(NodeId target);
}
