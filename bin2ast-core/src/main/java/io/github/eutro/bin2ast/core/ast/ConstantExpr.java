package io.github.eutro.bin2ast.core.ast;

/**
 * An integer constant.
 */
public final class ConstantExpr extends Expr {
    private final long value;

    /**
     * Construct a constant.
     *
     * @param value The value.
     */
    public ConstantExpr(long value) {
        this.value = value;
    }

    /**
     * Get the value of the constant.
     *
     * @return The value.
     */
    public long value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof ConstantExpr && ((ConstantExpr) o).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return value >= 0 && value < 10 ? Long.toString(value) : "0x" + Long.toHexString(value);
    }
}
