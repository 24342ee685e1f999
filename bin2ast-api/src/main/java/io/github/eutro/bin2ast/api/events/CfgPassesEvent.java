package io.github.eutro.bin2ast.api.events;

import io.github.eutro.bin2ast.api.FunctionDecompilation;
import io.github.eutro.bin2ast.core.cfg.Cfg;
import org.jetbrains.annotations.NotNull;

/**
 * An event fired just before a control flow graph is lowered, after its analyses have been run.
 * <p>
 * Listeners may replace the graph, or {@link Cfg#modifyEdges(java.util.Map) change its edges};
 * stale analyses are recomputed when lowering needs them.
 *
 * @see FunctionDecompilation
 */
public class CfgPassesEvent implements FunctionDecompileEvent {
    /**
     * The control flow graph.
     */
    @NotNull
    public Cfg cfg;

    /**
     * Construct a new CfgPassesEvent over the given graph.
     *
     * @param cfg The control flow graph.
     */
    public CfgPassesEvent(@NotNull Cfg cfg) {
        this.cfg = cfg;
    }
}
