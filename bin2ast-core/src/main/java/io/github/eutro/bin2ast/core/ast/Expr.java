package io.github.eutro.bin2ast.core.ast;

/**
 * An expression, as produced by instructions for branch conditions, switch selectors and return values.
 * <p>
 * Expressions are opaque to control-flow structuring: they are built by instructions,
 * combined with {@link BinaryExpr} and {@link NotExpr}, and printed.
 */
public abstract class Expr {
    /**
     * Get the logical negation of this expression.
     * <p>
     * No simplification is done beyond removing a double negation.
     *
     * @return The negated expression.
     */
    public Expr negate() {
        return new NotExpr(this);
    }

    /**
     * Render this expression as C-like source.
     *
     * @return The rendered expression.
     */
    @Override
    public abstract String toString();
}
