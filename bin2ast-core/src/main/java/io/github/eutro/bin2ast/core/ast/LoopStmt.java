package io.github.eutro.bin2ast.core.ast;

import io.github.eutro.bin2ast.core.graph.NodeId;
import org.jetbrains.annotations.Nullable;

/**
 * An infinite loop, left by {@link BreakStmt break}, {@link GotoStmt goto} or {@link ReturnStmt return}.
 * <p>
 * Reaching the end of the body starts the next iteration.
 */
public final class LoopStmt extends Stmt {
    private final BlockStmt body;
    private final @Nullable NodeId mergeNode;
    private final @Nullable NodeId continueNode;

    LoopStmt(int id, BlockStmt body, @Nullable NodeId mergeNode, @Nullable NodeId continueNode) {
        super(id);
        this.body = body;
        this.mergeNode = mergeNode;
        this.continueNode = continueNode;
    }

    public BlockStmt body() {
        return body;
    }

    /**
     * Get the node a {@code break} out of this loop reaches, if it follows the loop.
     *
     * @return The merge node.
     */
    public @Nullable NodeId mergeNode() {
        return mergeNode;
    }

    /**
     * Get the loop header, which a {@code continue} reaches.
     *
     * @return The continue node.
     */
    public @Nullable NodeId continueNode() {
        return continueNode;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitLoop(this);
    }
}
