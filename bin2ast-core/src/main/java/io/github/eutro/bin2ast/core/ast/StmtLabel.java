package io.github.eutro.bin2ast.core.ast;

import io.github.eutro.bin2ast.core.graph.NodeId;

/**
 * A named label, the target of {@link GotoStmt}s.
 */
public final class StmtLabel extends Label {
    private final String name;
    private final NodeId target;

    StmtLabel(String name, NodeId target) {
        this.name = name;
        this.target = target;
    }

    public String name() {
        return name;
    }

    /**
     * Get the node whose lowering this label marks.
     *
     * @return The node.
     */
    public NodeId target() {
        return target;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof StmtLabel && ((StmtLabel) o).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
