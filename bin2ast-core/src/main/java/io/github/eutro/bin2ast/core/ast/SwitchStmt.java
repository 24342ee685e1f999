package io.github.eutro.bin2ast.core.ast;

import io.github.eutro.bin2ast.core.graph.NodeId;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * A C-like switch statement. Control falls through from one case into the next.
 */
public final class SwitchStmt extends Stmt {
    private final Expr selector;
    private final List<SwitchCase> cases;
    private final @Nullable NodeId mergeNode;

    SwitchStmt(int id, Expr selector, List<SwitchCase> cases, @Nullable NodeId mergeNode) {
        super(id);
        this.selector = selector;
        this.cases = Collections.unmodifiableList(cases);
        this.mergeNode = mergeNode;
    }

    public Expr selector() {
        return selector;
    }

    public List<SwitchCase> cases() {
        return cases;
    }

    public @Nullable NodeId mergeNode() {
        return mergeNode;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitSwitch(this);
    }
}
