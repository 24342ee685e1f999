/**
 * Events that occur during a decompilation.
 * <p>
 * These can be used to configure lowering, to run extra passes over control flow graphs,
 * to collect the resulting statements, and to observe failures.
 * <p>
 * The API revolves around {@link io.github.eutro.bin2ast.api.events.EventSupplier}s,
 * which can dispatch (or have dispatched on them) events that subclass a specific type.
 */
package io.github.eutro.bin2ast.api.events;
