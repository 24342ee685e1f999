package io.github.eutro.bin2ast.core.ast;

import io.github.eutro.bin2ast.core.cfg.Instruction;

import java.util.Collections;
import java.util.List;

/**
 * A straight-line run of instructions, emitted as they are.
 */
public final class InstrSequenceStmt extends Stmt {
    private final List<Instruction> instructions;

    InstrSequenceStmt(int id, List<Instruction> instructions) {
        super(id);
        this.instructions = Collections.unmodifiableList(instructions);
    }

    public List<Instruction> instructions() {
        return instructions;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitInstrSequence(this);
    }
}
