package io.github.eutro.bin2ast.core.passes.meta;

import io.github.eutro.bin2ast.core.ext.GraphExts;
import io.github.eutro.bin2ast.core.ext.MetadataState;
import io.github.eutro.bin2ast.core.graph.Edge;
import io.github.eutro.bin2ast.core.graph.EdgeFlavor;
import io.github.eutro.bin2ast.core.graph.FlowGraph;
import io.github.eutro.bin2ast.core.graph.NodeId;
import io.github.eutro.bin2ast.core.passes.InPlaceIRPass;
import io.github.eutro.bin2ast.core.util.GraphWalker;

import java.util.*;

/**
 * Computes {@link GraphExts#LOOPS} for a graph.
 * <p>
 * Every target of a back edge is a loop header. Its loop is found by walking predecessors
 * backwards from the sources of its back edges, stopping at the header.
 */
public class ComputeLoops implements InPlaceIRPass<FlowGraph> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeLoops INSTANCE = new ComputeLoops();

    @Override
    public void runInPlace(FlowGraph graph) {
        MetadataState ms = graph.getExtOrThrow(GraphExts.METADATA_STATE);
        ms.ensureValid(graph, MetadataState.RPO, MetadataState.PREDS);

        Map<NodeId, List<NodeId>> preds = graph.getExtOrThrow(GraphExts.PREDS);
        Map<NodeId, Integer> rpoIndex = graph.getExtOrThrow(GraphExts.RPO_INDEX);
        Map<NodeId, SortedSet<NodeId>> loops = new LinkedHashMap<>();
        for (Map.Entry<Edge, EdgeFlavor> entry : graph.getExtOrThrow(GraphExts.EDGE_FLAVORS).entrySet()) {
            if (entry.getValue() != EdgeFlavor.BACK) continue;
            NodeId header = entry.getKey().tgt;
            SortedSet<NodeId> loop = loops.computeIfAbsent(header, $ -> new TreeSet<>(Collections.singleton(header)));
            GraphWalker<NodeId> walker = new GraphWalker<>(entry.getKey().src, node -> {
                if (node.equals(header)) return Collections.emptyList();
                List<NodeId> reachablePreds = new ArrayList<>();
                for (NodeId pred : preds.get(node)) {
                    if (rpoIndex.containsKey(pred)) reachablePreds.add(pred);
                }
                return reachablePreds;
            });
            for (NodeId node : walker.preOrder()) {
                loop.add(node);
            }
        }
        for (Map.Entry<NodeId, SortedSet<NodeId>> entry : loops.entrySet()) {
            entry.setValue(Collections.unmodifiableSortedSet(entry.getValue()));
        }
        graph.attachExt(GraphExts.LOOPS, Collections.unmodifiableMap(loops));

        ms.validate(MetadataState.LOOPS);
    }
}
