package io.github.eutro.bin2ast.core.ast;

/**
 * A label on a statement or switch section.
 */
public abstract class Label {
    Label() {
    }
}
