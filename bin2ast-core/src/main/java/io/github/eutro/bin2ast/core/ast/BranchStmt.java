package io.github.eutro.bin2ast.core.ast;

import io.github.eutro.bin2ast.core.graph.NodeId;
import org.jetbrains.annotations.Nullable;

/**
 * An if/else statement.
 */
public final class BranchStmt extends Stmt {
    private final Expr condition;
    private final BlockStmt thenBranch;
    private final BlockStmt elseBranch;
    private final @Nullable NodeId mergeNode;

    BranchStmt(int id, Expr condition, BlockStmt thenBranch, BlockStmt elseBranch, @Nullable NodeId mergeNode) {
        super(id);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
        this.mergeNode = mergeNode;
    }

    public Expr condition() {
        return condition;
    }

    public BlockStmt thenBranch() {
        return thenBranch;
    }

    public BlockStmt elseBranch() {
        return elseBranch;
    }

    /**
     * Get the node control reaches after both arms, if it is known.
     *
     * @return The merge node.
     */
    public @Nullable NodeId mergeNode() {
        return mergeNode;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitBranch(this);
    }
}
