package io.github.eutro.bin2ast.api.events;

import io.github.eutro.bin2ast.api.FunctionDecompilation;

/**
 * An event fired during the decompilation of a single function.
 *
 * @see FunctionDecompilation
 */
public interface FunctionDecompileEvent {
}
