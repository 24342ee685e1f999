package io.github.eutro.bin2ast.core.ast;

import io.github.eutro.bin2ast.core.cfg.Instruction;

import java.util.List;

/**
 * Renders statements as C-like source, for debugging and tests.
 */
public final class AstPrinter implements StmtVisitor<Void> {
    private final StringBuilder sb = new StringBuilder();
    private int depth = 0;

    private AstPrinter() {
    }

    /**
     * Render a statement.
     *
     * @param stmt The statement.
     * @return The rendered source, one statement per line.
     */
    public static String print(Stmt stmt) {
        AstPrinter printer = new AstPrinter();
        stmt.accept(printer);
        return printer.sb.toString();
    }

    private void line(String s) {
        for (int i = 0; i < depth; i++) sb.append("  ");
        sb.append(s).append('\n');
    }

    private void body(BlockStmt block) {
        depth++;
        for (Stmt stmt : block.stmts()) {
            stmt.accept(this);
        }
        depth--;
    }

    private void all(List<Stmt> stmts) {
        for (Stmt stmt : stmts) {
            stmt.accept(this);
        }
    }

    @Override
    public Void visitBlock(BlockStmt stmt) {
        if (stmt.labels().isEmpty()) {
            all(stmt.stmts());
            return null;
        }
        for (StmtLabel label : stmt.labels()) {
            line(label.name() + ":");
        }
        line("{");
        body(stmt);
        line("}");
        return null;
    }

    @Override
    public Void visitInstrSequence(InstrSequenceStmt stmt) {
        for (Instruction insn : stmt.instructions()) {
            String operands = insn.operandString();
            line(insn.mnemonic() + (operands.isEmpty() ? "" : " " + operands) + ";");
        }
        return null;
    }

    @Override
    public Void visitBranch(BranchStmt stmt) {
        line("if (" + stmt.condition() + ") {");
        body(stmt.thenBranch());
        if (stmt.elseBranch().stmts().isEmpty()) {
            line("}");
        } else {
            line("} else {");
            body(stmt.elseBranch());
            line("}");
        }
        return null;
    }

    @Override
    public Void visitLoop(LoopStmt stmt) {
        line("while (true) {");
        body(stmt.body());
        line("}");
        return null;
    }

    @Override
    public Void visitSwitch(SwitchStmt stmt) {
        line("switch (" + stmt.selector() + ") {");
        for (SwitchCase section : stmt.cases()) {
            for (Label label : section.labels()) {
                line(label + ":");
            }
            body(section.body());
        }
        line("}");
        return null;
    }

    @Override
    public Void visitGoto(GotoStmt stmt) {
        line("goto " + stmt.label().name() + ";");
        return null;
    }

    @Override
    public Void visitBreak(BreakStmt stmt) {
        line("break;");
        return null;
    }

    @Override
    public Void visitContinue(ContinueStmt stmt) {
        line("continue;");
        return null;
    }

    @Override
    public Void visitReturn(ReturnStmt stmt) {
        line(stmt.value() == null ? "return;" : "return " + stmt.value() + ";");
        return null;
    }
}
