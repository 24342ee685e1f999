package io.github.eutro.bin2ast.api.events;

import io.github.eutro.bin2ast.api.FunctionDecompilation;
import io.github.eutro.bin2ast.core.passes.convert.LoweredFunction;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when the statements of a function should be emitted.
 *
 * @see FunctionDecompilation
 */
public class EmitAstEvent implements FunctionDecompileEvent, CancellableEvent {
    /**
     * The lowered function.
     */
    @NotNull
    public LoweredFunction function;
    private boolean cancelled = false;

    /**
     * Construct a new emit event.
     *
     * @param function The lowered function.
     */
    public EmitAstEvent(@NotNull LoweredFunction function) {
        this.function = function;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public void cancel() {
        cancelled = true;
    }
}
