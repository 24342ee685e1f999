package io.github.eutro.bin2ast.core.ast;

/**
 * A visitor over the kinds of {@link Stmt}.
 *
 * @param <R> The result type.
 */
public interface StmtVisitor<R> {
    R visitBlock(BlockStmt stmt);

    R visitInstrSequence(InstrSequenceStmt stmt);

    R visitBranch(BranchStmt stmt);

    R visitLoop(LoopStmt stmt);

    R visitSwitch(SwitchStmt stmt);

    R visitGoto(GotoStmt stmt);

    R visitBreak(BreakStmt stmt);

    R visitContinue(ContinueStmt stmt);

    R visitReturn(ReturnStmt stmt);
}
