package io.github.eutro.bin2ast.api.events;

import io.github.eutro.bin2ast.api.Decompiler;
import io.github.eutro.bin2ast.api.FunctionDecompilation;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a function decompilation is started.
 *
 * @see Decompiler
 * @see FunctionDecompilation
 */
public class RunFunctionDecompilationEvent implements DecompilerEvent {
    /**
     * The function decompilation.
     */
    @NotNull
    public FunctionDecompilation decompilation;

    /**
     * Construct a new run-function-decompilation event.
     *
     * @param decompilation The decompilation.
     */
    public RunFunctionDecompilationEvent(@NotNull FunctionDecompilation decompilation) {
        this.decompilation = decompilation;
    }
}
