package io.github.eutro.bin2ast.core.ast;

import org.jetbrains.annotations.Nullable;

/**
 * Returns from the function, with an optional value.
 */
public final class ReturnStmt extends Stmt {
    private final @Nullable Expr value;

    ReturnStmt(int id, @Nullable Expr value) {
        super(id);
        this.value = value;
    }

    public @Nullable Expr value() {
        return value;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }
}
