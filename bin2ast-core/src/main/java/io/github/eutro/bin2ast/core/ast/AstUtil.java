package io.github.eutro.bin2ast.core.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Queries over statement trees.
 */
public final class AstUtil {
    private AstUtil() {
    }

    /**
     * Collect every statement of the given kind in a tree, in pre-order.
     *
     * @param root The root of the tree.
     * @param type The kind of statement.
     * @param <T>  The kind of statement.
     * @return The statements.
     */
    public static <T extends Stmt> List<T> collect(Stmt root, Class<T> type) {
        List<T> found = new ArrayList<>();
        for (Stmt stmt : preOrder(root)) {
            if (type.isInstance(stmt)) found.add(type.cast(stmt));
        }
        return found;
    }

    /**
     * Count the gotos in a tree.
     *
     * @param root The root of the tree.
     * @return The number of gotos.
     */
    public static int countGotos(Stmt root) {
        return collect(root, GotoStmt.class).size();
    }

    /**
     * Collect the labels of every labelled block in a tree.
     *
     * @param root The root of the tree.
     * @return The labels, in pre-order.
     */
    public static List<StmtLabel> labels(Stmt root) {
        List<StmtLabel> labels = new ArrayList<>();
        for (BlockStmt block : collect(root, BlockStmt.class)) {
            labels.addAll(block.labels());
        }
        return labels;
    }

    /**
     * List every statement of a tree in pre-order.
     *
     * @param root The root of the tree.
     * @return The statements.
     */
    public static List<Stmt> preOrder(Stmt root) {
        List<Stmt> out = new ArrayList<>();
        root.accept(new StmtVisitor<Void>() {
            private Void block(BlockStmt stmt) {
                out.add(stmt);
                for (Stmt child : stmt.stmts()) {
                    child.accept(this);
                }
                return null;
            }

            @Override
            public Void visitBlock(BlockStmt stmt) {
                return block(stmt);
            }

            @Override
            public Void visitInstrSequence(InstrSequenceStmt stmt) {
                out.add(stmt);
                return null;
            }

            @Override
            public Void visitBranch(BranchStmt stmt) {
                out.add(stmt);
                block(stmt.thenBranch());
                return block(stmt.elseBranch());
            }

            @Override
            public Void visitLoop(LoopStmt stmt) {
                out.add(stmt);
                return block(stmt.body());
            }

            @Override
            public Void visitSwitch(SwitchStmt stmt) {
                out.add(stmt);
                for (SwitchCase section : stmt.cases()) {
                    block(section.body());
                }
                return null;
            }

            @Override
            public Void visitGoto(GotoStmt stmt) {
                out.add(stmt);
                return null;
            }

            @Override
            public Void visitBreak(BreakStmt stmt) {
                out.add(stmt);
                return null;
            }

            @Override
            public Void visitContinue(ContinueStmt stmt) {
                out.add(stmt);
                return null;
            }

            @Override
            public Void visitReturn(ReturnStmt stmt) {
                out.add(stmt);
                return null;
            }
        });
        return out;
    }
}
