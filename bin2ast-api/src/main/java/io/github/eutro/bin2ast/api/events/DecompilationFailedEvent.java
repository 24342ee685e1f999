package io.github.eutro.bin2ast.api.events;

import io.github.eutro.bin2ast.api.FunctionDecompilation;
import io.github.eutro.bin2ast.api.FunctionDiagnostic;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when the decompilation of a function fails.
 *
 * @see FunctionDecompilation
 */
public class DecompilationFailedEvent implements FunctionDecompileEvent {
    /**
     * What went wrong.
     */
    @NotNull
    public FunctionDiagnostic diagnostic;

    /**
     * Construct a new failure event.
     *
     * @param diagnostic The diagnostic.
     */
    public DecompilationFailedEvent(@NotNull FunctionDiagnostic diagnostic) {
        this.diagnostic = diagnostic;
    }
}
