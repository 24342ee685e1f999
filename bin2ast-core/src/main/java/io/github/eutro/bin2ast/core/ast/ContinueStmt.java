package io.github.eutro.bin2ast.core.ast;

/**
 * Starts the next iteration of the innermost enclosing loop.
 */
public final class ContinueStmt extends Stmt {
    ContinueStmt(int id) {
        super(id);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitContinue(this);
    }
}
