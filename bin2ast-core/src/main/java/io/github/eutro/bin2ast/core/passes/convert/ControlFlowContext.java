package io.github.eutro.bin2ast.core.passes.convert;

import io.github.eutro.bin2ast.core.graph.NodeId;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Where control goes when a structured statement is left by {@code break}, by {@code continue},
 * or by running off its end.
 * <p>
 * Contexts are immutable; each derivation returns a new one.
 */
public final class ControlFlowContext {
    /**
     * The context of a function body, which has no enclosing statement.
     */
    public static final ControlFlowContext ROOT = new ControlFlowContext(null, null, null);

    private final @Nullable NodeId breakTo;
    private final @Nullable NodeId continueTo;
    private final @Nullable NodeId fallthrough;

    private ControlFlowContext(@Nullable NodeId breakTo, @Nullable NodeId continueTo, @Nullable NodeId fallthrough) {
        this.breakTo = breakTo;
        this.continueTo = continueTo;
        this.fallthrough = fallthrough;
    }

    public @Nullable NodeId breakTo() {
        return breakTo;
    }

    public @Nullable NodeId continueTo() {
        return continueTo;
    }

    public @Nullable NodeId fallthrough() {
        return fallthrough;
    }

    /**
     * Derive the context of a loop body. Running off the end of the body goes back to the header.
     *
     * @param header  The loop header.
     * @param breakTo Where control goes after the loop.
     * @return The context of the body.
     */
    public ControlFlowContext inLoop(NodeId header, @Nullable NodeId breakTo) {
        return new ControlFlowContext(breakTo, header, header);
    }

    /**
     * Derive the context of a switch case. Running off the end of a case goes into the next one.
     *
     * @param breakTo  Where control goes after the switch.
     * @param nextCase The target of the next case.
     * @return The context of the case.
     */
    public ControlFlowContext inSwitch(@Nullable NodeId breakTo, @Nullable NodeId nextCase) {
        return new ControlFlowContext(breakTo, continueTo, nextCase);
    }

    /**
     * Derive the context of code that is followed by the given node.
     * <p>
     * If that node is where {@code break} goes, the code is the last thing in its loop,
     * so running off its end goes back to the loop header instead.
     *
     * @param fallthrough The node that follows.
     * @return The derived context.
     */
    public ControlFlowContext withFallthrough(@Nullable NodeId fallthrough) {
        NodeId next = fallthrough != null && fallthrough.equals(breakTo) ? continueTo : fallthrough;
        return new ControlFlowContext(breakTo, continueTo, next);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ControlFlowContext that = (ControlFlowContext) o;
        return Objects.equals(breakTo, that.breakTo)
                && Objects.equals(continueTo, that.continueTo)
                && Objects.equals(fallthrough, that.fallthrough);
    }

    @Override
    public int hashCode() {
        return Objects.hash(breakTo, continueTo, fallthrough);
    }

    @Override
    public String toString() {
        return "ControlFlowContext(break=" + breakTo + ", continue=" + continueTo + ", fallthrough=" + fallthrough + ")";
    }
}
