package io.github.eutro.bin2ast.core.passes;

import io.github.eutro.bin2ast.core.cfg.Cfg;
import io.github.eutro.bin2ast.core.graph.FlowGraph;
import io.github.eutro.bin2ast.core.passes.misc.ChainedPass;

/**
 * A pass to run on some representation of a function (e.g. {@link FlowGraph}, {@link Cfg}),
 * which may annotate it, or convert it to a different form.
 * <p>
 * A pass may be <i>in-place</i>, in which case it must have the same
 * input and result types, and should return true for {@link #isInPlace()}.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The IR to run it on.
     * @return The result.
     */
    B run(A a);

    /**
     * Get whether this pass is in-place.
     *
     * @return Whether this pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * Compose this pass with another.
     *
     * @param next The pass to run after this.
     * @return The composed pass.
     * @param <C> The result type.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
