package io.github.eutro.bin2ast.api.events;

import io.github.eutro.bin2ast.api.FunctionDecompilation;
import io.github.eutro.bin2ast.core.passes.convert.LoweringOptions;
import org.jetbrains.annotations.NotNull;

/**
 * An event fired when constructing the {@link LoweringOptions} of a function decompilation.
 *
 * @see FunctionDecompilation
 * @see LoweringOptions.Builder
 */
public class ModifyOptionsEvent implements FunctionDecompileEvent {
    /**
     * The options builder.
     */
    @NotNull
    public LoweringOptions.Builder optionsBuilder;

    /**
     * Construct a new modify-options event with the given options builder.
     *
     * @param optionsBuilder The builder.
     */
    public ModifyOptionsEvent(@NotNull LoweringOptions.Builder optionsBuilder) {
        this.optionsBuilder = optionsBuilder;
    }
}
