package io.github.eutro.bin2ast.core.ast;

import java.util.Objects;

/**
 * An expression that is only known by name, such as a register, a variable or a condition code.
 */
public final class NamedExpr extends Expr {
    private final String name;

    /**
     * Construct a named expression.
     *
     * @param name The name.
     */
    public NamedExpr(String name) {
        this.name = Objects.requireNonNull(name);
    }

    /**
     * Get the name.
     *
     * @return The name.
     */
    public String name() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof NamedExpr && ((NamedExpr) o).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
