package io.github.eutro.bin2ast.api;

import io.github.eutro.bin2ast.core.ast.Expr;
import io.github.eutro.bin2ast.core.ast.NamedExpr;
import io.github.eutro.bin2ast.core.cfg.Instruction;
import org.jetbrains.annotations.Nullable;

class Insn implements Instruction {
    final long address;
    final String mnemonic;

    Insn(long address, String mnemonic) {
        this.address = address;
        this.mnemonic = mnemonic;
    }

    @Override
    public long address() {
        return address;
    }

    @Override
    public int byteSize() {
        return 4;
    }

    @Override
    public String mnemonic() {
        return mnemonic;
    }

    @Override
    public String operandString() {
        return "0x" + Long.toHexString(address);
    }

    @Override
    public boolean hasControlFlow() {
        return false;
    }

    @Override
    public @Nullable Object conditionSetter() {
        return null;
    }

    @Override
    public @Nullable String conditionCode() {
        return null;
    }

    @Override
    public boolean isBranchInstruction() {
        return mnemonic.startsWith("b");
    }

    @Override
    public boolean isCallInstruction() {
        return false;
    }

    @Override
    public boolean isReturnInstruction() {
        return mnemonic.equals("ret");
    }

    @Override
    public boolean isConditionalReturnInstruction() {
        return false;
    }

    @Override
    public Expr condition(boolean reverse) {
        Expr expr = new NamedExpr("c" + Long.toHexString(address));
        return reverse ? expr.negate() : expr;
    }
}
