/**
 * A configurable driver over the lower-level core bin2ast API.
 * <p>
 * The main entrypoint to this API is the
 * {@link io.github.eutro.bin2ast.api.Decompiler},
 * to which the control flow graphs of functions can be submitted for decompilation.
 * <p>
 * Decompilation can be configured using the {@link io.github.eutro.bin2ast.api.events
 * events API}.
 */
package io.github.eutro.bin2ast.api;
