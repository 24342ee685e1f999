package io.github.eutro.bin2ast.core.ast;

import io.github.eutro.bin2ast.core.cfg.Instruction;

/**
 * The range of bytes in the binary that a statement was lowered from.
 */
public final class AstSpan {
    private final long address;
    private final int byteSize;

    /**
     * Construct a span.
     *
     * @param address  The address of the first byte.
     * @param byteSize The number of bytes.
     */
    public AstSpan(long address, int byteSize) {
        this.address = address;
        this.byteSize = byteSize;
    }

    /**
     * Get the span of an instruction.
     *
     * @param insn The instruction.
     * @return Its span.
     */
    public static AstSpan of(Instruction insn) {
        return new AstSpan(insn.address(), insn.byteSize());
    }

    public long address() {
        return address;
    }

    public int byteSize() {
        return byteSize;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AstSpan)) return false;
        AstSpan that = (AstSpan) o;
        return address == that.address && byteSize == that.byteSize;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(address) + byteSize;
    }

    @Override
    public String toString() {
        return "0x" + Long.toHexString(address) + "+" + byteSize;
    }
}
