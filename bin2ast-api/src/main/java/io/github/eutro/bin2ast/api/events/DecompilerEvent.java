package io.github.eutro.bin2ast.api.events;

import io.github.eutro.bin2ast.api.Decompiler;

/**
 * An event fired on a {@link Decompiler}.
 */
public interface DecompilerEvent {
}
