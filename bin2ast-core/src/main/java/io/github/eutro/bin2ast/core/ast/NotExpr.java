package io.github.eutro.bin2ast.core.ast;

/**
 * The logical negation of an expression.
 */
public final class NotExpr extends Expr {
    private final Expr operand;

    /**
     * Construct a negation.
     *
     * @param operand The negated expression.
     */
    public NotExpr(Expr operand) {
        this.operand = operand;
    }

    /**
     * Get the negated expression.
     *
     * @return The operand.
     */
    public Expr operand() {
        return operand;
    }

    @Override
    public Expr negate() {
        return operand;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof NotExpr && ((NotExpr) o).operand.equals(operand);
    }

    @Override
    public int hashCode() {
        return ~operand.hashCode();
    }

    @Override
    public String toString() {
        return operand instanceof BinaryExpr ? "!(" + operand + ")" : "!" + operand;
    }
}
