package io.github.eutro.bin2ast.core.passes;

import io.github.eutro.bin2ast.core.cfg.Cfg;
import io.github.eutro.bin2ast.core.graph.FlowGraph;
import io.github.eutro.bin2ast.core.passes.meta.*;

/**
 * Some pre-composed passes. This should not be considered stable.
 */
public class Passes {
    /**
     * Compute every analysis of a flow graph that structuring reads, replacing any that were stale.
     */
    public static final IRPass<FlowGraph, FlowGraph> FLOW_GRAPH_META =
            ComputePreds.INSTANCE
                    .then(ComputeRpo.INSTANCE)
                    .then(ComputeDoms.INSTANCE)
                    .then(ComputeDomTree.INSTANCE)
                    .then(ComputeLoops.INSTANCE);

    /**
     * Run {@link #FLOW_GRAPH_META} on the flow graph of a control flow graph.
     */
    public static final InPlaceIRPass<Cfg> CFG_META = cfg -> FLOW_GRAPH_META.run(cfg.flowGraph());
}
