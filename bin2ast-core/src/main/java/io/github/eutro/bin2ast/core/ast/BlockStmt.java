package io.github.eutro.bin2ast.core.ast;

import java.util.Collections;
import java.util.List;

/**
 * A sequence of statements, optionally labelled so that it can be the target of a {@link GotoStmt}.
 */
public final class BlockStmt extends Stmt {
    private final List<StmtLabel> labels;
    private final List<Stmt> stmts;

    BlockStmt(int id, List<StmtLabel> labels, List<Stmt> stmts) {
        super(id);
        this.labels = Collections.unmodifiableList(labels);
        this.stmts = Collections.unmodifiableList(stmts);
    }

    public List<StmtLabel> labels() {
        return labels;
    }

    public List<Stmt> stmts() {
        return stmts;
    }

    /**
     * Get whether this block has no statements and no labels.
     *
     * @return Whether the block is empty.
     */
    public boolean isEmpty() {
        return stmts.isEmpty() && labels.isEmpty();
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
