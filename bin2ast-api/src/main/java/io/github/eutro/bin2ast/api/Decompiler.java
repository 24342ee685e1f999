package io.github.eutro.bin2ast.api;

import io.github.eutro.bin2ast.api.events.*;
import io.github.eutro.bin2ast.core.cfg.Cfg;
import io.github.eutro.bin2ast.core.passes.convert.LoweredFunction;
import io.github.eutro.bin2ast.core.passes.convert.LoweringOptions;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * Turns the control flow graphs of functions into statements.
 * <p>
 * Submitting a graph gives a {@link FunctionDecompilation}, which does the work when it is run.
 * Failures are kept as {@link #diagnostics() diagnostics}.
 */
public class Decompiler extends EventSupplier<DecompilerEvent> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Decompiler.class);

    private LoweringOptions options = LoweringOptions.defaults();
    private final List<FunctionDiagnostic> diagnostics = new ArrayList<>();

    /**
     * Get the options each decompilation starts from, before {@link ModifyOptionsEvent}.
     *
     * @return The options.
     */
    public LoweringOptions getOptions() {
        return options;
    }

    /**
     * Set the options each decompilation starts from.
     *
     * @param options The options.
     * @return This, for convenience.
     */
    public Decompiler setOptions(@NotNull LoweringOptions options) {
        this.options = options;
        return this;
    }

    @Contract(pure = true)
    @NotNull
    public FunctionDecompilation submit(Cfg cfg) {
        return new FunctionDecompilation(this, cfg);
    }

    /**
     * Decompile every function, carrying on past the ones that fail.
     *
     * @param cfgs The control flow graphs of the functions.
     * @return The functions that were decompiled, in order.
     */
    public List<LoweredFunction> decompileAll(Iterable<Cfg> cfgs) {
        List<LoweredFunction> out = new ArrayList<>();
        int failed = 0;
        for (Cfg cfg : cfgs) {
            LoweredFunction lowered = submit(cfg).run();
            if (lowered == null) {
                failed++;
            } else {
                out.add(lowered);
            }
        }
        if (failed != 0) {
            LOGGER.warn("{} of {} functions failed to decompile", failed, failed + out.size());
        }
        return out;
    }

    void addDiagnostic(FunctionDiagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    /**
     * Get the failures of every decompilation run so far.
     *
     * @return The diagnostics, in the order the failures happened.
     */
    public List<FunctionDiagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Get a dispatcher that listens to events on every function decompilation
     * that is run after the listener is added.
     *
     * @return The dispatcher.
     */
    public EventDispatcher<FunctionDecompileEvent> lift() {
        return new EventDispatcher<FunctionDecompileEvent>() {
            @Override
            public <T extends FunctionDecompileEvent> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
                Decompiler.this.listen(RunFunctionDecompilationEvent.class, evt ->
                        evt.decompilation.listen(eventClass, listener));
            }
        };
    }

    /**
     * Collect every emitted function into a queue.
     *
     * @return The queue.
     */
    public BlockingQueue<LoweredFunction> outputsAsQueue() {
        BlockingQueue<LoweredFunction> queue = new LinkedBlockingQueue<>();
        lift().listen(EmitAstEvent.class, evt -> queue.add(evt.function));
        return queue;
    }
}
