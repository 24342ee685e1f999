package io.github.eutro.bin2ast.core.ast;

import java.util.Objects;

/**
 * A binary operator applied to two expressions.
 */
public final class BinaryExpr extends Expr {
    /**
     * Logical or.
     */
    public static final String OR = "||";
    /**
     * Logical and.
     */
    public static final String AND = "&&";

    private final String op;
    private final Expr left;
    private final Expr right;

    /**
     * Construct a binary expression.
     *
     * @param op    The operator, as it is printed.
     * @param left  The left operand.
     * @param right The right operand.
     */
    public BinaryExpr(String op, Expr left, Expr right) {
        this.op = op;
        this.left = left;
        this.right = right;
    }

    /**
     * Get the operator.
     *
     * @return The operator.
     */
    public String op() {
        return op;
    }

    /**
     * Get the left operand.
     *
     * @return The left operand.
     */
    public Expr left() {
        return left;
    }

    /**
     * Get the right operand.
     *
     * @return The right operand.
     */
    public Expr right() {
        return right;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryExpr)) return false;
        BinaryExpr that = (BinaryExpr) o;
        return op.equals(that.op) && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, left, right);
    }

    @Override
    public String toString() {
        return paren(left) + " " + op + " " + paren(right);
    }

    private String paren(Expr e) {
        return e instanceof BinaryExpr && !((BinaryExpr) e).op.equals(op) ? "(" + e + ")" : e.toString();
    }
}
