package io.github.eutro.bin2ast.core.ast;

/**
 * A {@code case} label of a switch section.
 */
public final class CaseLabel extends Label {
    private final ConstantExpr value;

    CaseLabel(ConstantExpr value) {
        this.value = value;
    }

    public ConstantExpr value() {
        return value;
    }

    @Override
    public String toString() {
        return "case " + value;
    }
}
