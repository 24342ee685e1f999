package io.github.eutro.bin2ast.core.ast;

/**
 * The {@code default} label of a switch section.
 */
public final class DefaultLabel extends Label {
    static final DefaultLabel INSTANCE = new DefaultLabel();

    private DefaultLabel() {
    }

    @Override
    public String toString() {
        return "default";
    }
}
