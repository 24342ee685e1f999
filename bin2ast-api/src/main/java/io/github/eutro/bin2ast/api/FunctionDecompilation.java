package io.github.eutro.bin2ast.api;

import io.github.eutro.bin2ast.api.events.*;
import io.github.eutro.bin2ast.core.cfg.Cfg;
import io.github.eutro.bin2ast.core.passes.Passes;
import io.github.eutro.bin2ast.core.passes.convert.LowerCfg;
import io.github.eutro.bin2ast.core.passes.convert.LoweredFunction;
import io.github.eutro.bin2ast.core.passes.convert.LoweringOptions;
import io.github.eutro.bin2ast.core.passes.convert.LoweringStrategy;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Represents the decompilation of a single function, given as its control flow graph.
 * <p>
 * Decompilation, performed when {@link #run()} is called, takes place as follows:
 * <ol>
 *     <li>{@link RunFunctionDecompilationEvent} is fired on the {@link Decompiler decompiler}.</li>
 *     <li>{@link ModifyOptionsEvent} is fired.</li>
 *     <li>The analyses of the graph are {@link Passes#CFG_META computed}.</li>
 *     <li>{@link CfgPassesEvent} is fired.</li>
 *     <li>The graph is {@link LowerCfg lowered} to statements.</li>
 *     <li>{@link EmitAstEvent} is fired.</li>
 * </ol>
 * If any of these throws, the failure is logged, recorded on the decompiler, and
 * {@link DecompilationFailedEvent} is fired instead.
 */
public class FunctionDecompilation extends EventSupplier<FunctionDecompileEvent> {
    private static final Logger LOGGER = LoggerFactory.getLogger(FunctionDecompilation.class);

    private final Decompiler dc;

    /**
     * The control flow graph of the function being decompiled.
     */
    @NotNull
    public Cfg cfg;

    FunctionDecompilation(Decompiler dc, @NotNull Cfg cfg) {
        this.dc = dc;
        this.cfg = cfg;
    }

    /**
     * Run the decompilation.
     * <p>
     * See the documentation of this class for details.
     *
     * @return The lowered function, or null if decompilation failed.
     */
    public @Nullable LoweredFunction run() {
        try {
            dc.dispatch(RunFunctionDecompilationEvent.class, new RunFunctionDecompilationEvent(this));
            LoweringOptions options = dispatch(ModifyOptionsEvent.class,
                    new ModifyOptionsEvent(dc.getOptions().toBuilder()))
                    .optionsBuilder
                    .build();

            Cfg analysed = Passes.CFG_META.run(cfg);
            analysed = dispatch(CfgPassesEvent.class, new CfgPassesEvent(analysed)).cfg;

            LoweredFunction lowered = new LowerCfg(options).run(analysed);
            return dispatch(EmitAstEvent.class, new EmitAstEvent(lowered)).function;
        } catch (RuntimeException e) {
            LOGGER.error("Failed to decompile function {}", cfg.faddr(), e);
            FunctionDiagnostic diagnostic = new FunctionDiagnostic(cfg.faddr(), e);
            dc.addDiagnostic(diagnostic);
            dispatch(DecompilationFailedEvent.class, new DecompilationFailedEvent(diagnostic));
            return null;
        }
    }

    /**
     * Set the lowering strategy of this decompilation, by
     * {@link ModifyOptionsEvent modifying the options}.
     *
     * @param strategy The strategy.
     * @return This, for convenience.
     * @see LoweringOptions.Builder#setStrategy(LoweringStrategy)
     */
    public FunctionDecompilation setStrategy(LoweringStrategy strategy) {
        listen(ModifyOptionsEvent.class, moe -> moe.optionsBuilder.setStrategy(strategy));
        return this;
    }
}
