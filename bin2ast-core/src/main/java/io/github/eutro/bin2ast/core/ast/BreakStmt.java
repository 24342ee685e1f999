package io.github.eutro.bin2ast.core.ast;

/**
 * Leaves the innermost enclosing loop or switch.
 */
public final class BreakStmt extends Stmt {
    BreakStmt(int id) {
        super(id);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitBreak(this);
    }
}
