package io.github.eutro.bin2ast.core.ast;

import io.github.eutro.bin2ast.core.graph.NodeId;

/**
 * A jump to a {@link StmtLabel labelled} block.
 */
public final class GotoStmt extends Stmt {
    private final StmtLabel label;
    private final boolean wrapped;

    GotoStmt(int id, StmtLabel label, boolean wrapped) {
        super(id);
        this.label = label;
        this.wrapped = wrapped;
    }

    public StmtLabel label() {
        return label;
    }

    public NodeId target() {
        return label.target();
    }

    /**
     * Get whether this goto terminates a block that was emitted on its own, rather than
     * one placed by structuring.
     *
     * @return Whether the goto is wrapped.
     */
    public boolean isWrapped() {
        return wrapped;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitGoto(this);
    }
}
