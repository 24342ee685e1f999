package io.github.eutro.bin2ast.core.passes.meta;

import io.github.eutro.bin2ast.core.ext.GraphExts;
import io.github.eutro.bin2ast.core.ext.MetadataState;
import io.github.eutro.bin2ast.core.graph.DominatorTree;
import io.github.eutro.bin2ast.core.graph.FlowGraph;
import io.github.eutro.bin2ast.core.passes.InPlaceIRPass;

/**
 * Computes {@link GraphExts#DOM_TREE} for a graph.
 */
public class ComputeDomTree implements InPlaceIRPass<FlowGraph> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeDomTree INSTANCE = new ComputeDomTree();

    @Override
    public void runInPlace(FlowGraph graph) {
        MetadataState ms = graph.getExtOrThrow(GraphExts.METADATA_STATE);
        ms.ensureValid(graph, MetadataState.DOMS);

        graph.attachExt(GraphExts.DOM_TREE, new DominatorTree(
                graph.startNode(),
                graph.getExtOrThrow(GraphExts.IDOM),
                graph.getExtOrThrow(GraphExts.RPO_INDEX)));

        ms.validate(MetadataState.DOM_TREE);
    }
}
